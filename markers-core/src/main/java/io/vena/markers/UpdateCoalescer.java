package io.vena.markers;

import io.vena.markers.PendingUpdate.Kind;
import io.vena.markers.msg.FeedbackType;
import io.vena.markers.msg.Header;
import io.vena.markers.msg.InteractiveMarker;
import io.vena.markers.msg.Pose;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PMap;

/**
 * Rules for folding a new change to a marker into whatever change is already staged for it,
 * so the pending buffer never holds more than one entry per marker.
 *
 * <p>
 * In each case the most recent change wins, and anything it doesn't mention
 * is taken from the staged change.
 */
final class UpdateCoalescer {
	private UpdateCoalescer() {}

	/**
	 * A full definition supersedes anything staged before it, including staged handlers.
	 */
	static PendingUpdate insert(InteractiveMarker marker) {
		return PendingUpdate.fullReplace(marker);
	}

	/**
	 * A pose staged over a pending erasure of a committed marker cancels the erasure,
	 * leaving the marker in place with its new pose. If the erasure is cancelling
	 * an insertion that was never applied, there is nothing to move and the erasure stays.
	 *
	 * @param header if null, the marker keeps the header it would otherwise have had
	 * @return the update to stage, or null if the marker is neither committed nor staged
	 */
	static @Nullable PendingUpdate setPose(@Nullable PendingUpdate staged, @Nullable MarkerContext committed, Pose pose, @Nullable Header header) {
		if (staged == null || staged.kind() == Kind.ERASE) {
			if (committed == null) {
				return staged;
			}
			return PendingUpdate.poseOnly(header == null ? committed.marker().header() : header, pose);
		}
		Header newHeader = header == null ? staged.stagedHeader() : header;
		if (staged.kind() == Kind.FULL_REPLACE) {
			// Still a full replacement; it just lands somewhere else
			return staged.withMarker(staged.marker().movedTo(newHeader, pose));
		} else {
			return staged.withHeader(newHeader).withPose(pose);
		}
	}

	static PendingUpdate erase() {
		return PendingUpdate.erase();
	}

	/**
	 * @param type null for the default handler
	 * @param handler null to remove the registration
	 */
	static PendingUpdate withHandler(PendingUpdate staged, @Nullable FeedbackHandler handler, @Nullable FeedbackType type) {
		if (type == null) {
			return staged.withDefaultHandler(handler);
		} else {
			return staged.withHandlers(assign(staged.handlers(), type, handler));
		}
	}

	/**
	 * @see #withHandler(PendingUpdate, FeedbackHandler, FeedbackType)
	 */
	static MarkerContext withHandler(MarkerContext committed, @Nullable FeedbackHandler handler, @Nullable FeedbackType type) {
		if (type == null) {
			return committed.withDefaultHandler(handler);
		} else {
			return committed.withHandlers(assign(committed.handlers(), type, handler));
		}
	}

	/**
	 * Computes the committed state that results from applying <code>staged</code>.
	 *
	 * @return null if the marker no longer exists afterward
	 */
	static @Nullable MarkerContext commit(@Nullable MarkerContext committed, PendingUpdate staged) {
		switch (staged.kind()) {
			case FULL_REPLACE:
				if (committed == null) {
					return MarkerContext.committedFrom(staged);
				}
				return committed
					.withMarker(staged.marker())
					.withDefaultHandler(staged.defaultHandler())
					.withHandlers(staged.handlers());
			case POSE_ONLY:
				// Handlers stay as they are
				return committed == null ? null : committed.withMarker(staged.appliedTo(committed.marker()));
			default:
				return null;
		}
	}

	private static PMap<FeedbackType, FeedbackHandler> assign(PMap<FeedbackType, FeedbackHandler> handlers, FeedbackType type, @Nullable FeedbackHandler handler) {
		return handler == null ? handlers.minus(type) : handlers.plus(type, handler);
	}
}
