package io.vena.markers;

import io.vena.markers.msg.MarkerFeedback;

/**
 * Called when an observer reports an interaction with a marker.
 *
 * <p>
 * Handlers run synchronously on the thread delivering feedback, with no
 * {@link MarkerServer} locks held, so they may call back into the server.
 */
public interface FeedbackHandler {
	void onFeedback(MarkerFeedback feedback);
}
