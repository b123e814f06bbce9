package io.vena.markers;

import io.vena.markers.msg.FeedbackType;
import io.vena.markers.msg.InteractiveMarker;
import java.time.Instant;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * The committed state of one marker: what observers have been told about it,
 * plus the handlers that receive its feedback.
 *
 * <p>
 * Immutable, so it can be handed out of the registry lock without copying.
 */
@Value
@With
class MarkerContext {
	@NonNull InteractiveMarker marker;
	@Nullable Instant lastFeedback;
	@NonNull String lastClientId;
	@Nullable FeedbackHandler defaultHandler;
	@NonNull PMap<FeedbackType, FeedbackHandler> handlers;

	static MarkerContext committedFrom(PendingUpdate update) {
		return new MarkerContext(update.marker(), null, "", update.defaultHandler(), update.handlers());
	}

	/**
	 * Type-specific handlers take priority over the default one.
	 */
	@Nullable FeedbackHandler handlerFor(FeedbackType type) {
		FeedbackHandler specific = handlers.get(type);
		return specific == null ? defaultHandler : specific;
	}

	FeedbackStatus status() {
		return new FeedbackStatus(lastFeedback, lastClientId);
	}

	static PMap<FeedbackType, FeedbackHandler> noHandlers() {
		return HashTreePMap.empty();
	}
}
