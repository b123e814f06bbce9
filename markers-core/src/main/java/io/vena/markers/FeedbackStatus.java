package io.vena.markers;

import java.time.Instant;
import java.util.Optional;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Who last interacted with a marker, and when.
 */
@Value
public class FeedbackStatus {
	@Nullable Instant lastFeedbackTime;
	String lastClientId;

	public Optional<Instant> lastFeedback() {
		return Optional.ofNullable(lastFeedbackTime);
	}
}
