package io.vena.markers;

import java.time.Clock;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class MarkerServerSettings {
	/**
	 * Prefix of every channel the server uses.
	 *
	 * @see io.vena.markers.transport.MarkerTopics
	 */
	@NonNull String topicNamespace;

	/**
	 * Interval between calls to {@link MarkerServer#applyChanges()} made by a {@link PeriodicFlusher}.
	 */
	@Default long flushPeriodMS = 100;

	/**
	 * Source of the timestamps recorded when feedback arrives.
	 */
	@Default @NonNull Clock clock = Clock.systemUTC();
}
