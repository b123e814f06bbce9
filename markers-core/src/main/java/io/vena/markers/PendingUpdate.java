package io.vena.markers;

import io.vena.markers.msg.FeedbackType;
import io.vena.markers.msg.Header;
import io.vena.markers.msg.InteractiveMarker;
import io.vena.markers.msg.Pose;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PMap;

import static io.vena.markers.MarkerContext.noHandlers;

/**
 * A change to one marker that has been staged but not yet applied.
 * At most one of these exists per marker name; see {@link UpdateCoalescer}.
 *
 * <p>
 * Handlers registered while the update is staged travel with it,
 * so a {@link Kind#FULL_REPLACE FULL_REPLACE} commits them along with the marker.
 */
@Value
@With(AccessLevel.PACKAGE)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
class PendingUpdate {
	@NonNull Kind kind;

	/**
	 * Present for {@link Kind#FULL_REPLACE FULL_REPLACE} only.
	 */
	@Nullable InteractiveMarker marker;

	/**
	 * Present for {@link Kind#POSE_ONLY POSE_ONLY} only.
	 */
	@Nullable Header header;
	@Nullable Pose pose;

	@Nullable FeedbackHandler defaultHandler;
	@NonNull PMap<FeedbackType, FeedbackHandler> handlers;

	enum Kind {
		FULL_REPLACE,
		POSE_ONLY,
		ERASE,
	}

	static PendingUpdate fullReplace(InteractiveMarker marker) {
		return new PendingUpdate(Kind.FULL_REPLACE, marker, null, null, null, noHandlers());
	}

	static PendingUpdate poseOnly(Header header, Pose pose) {
		return new PendingUpdate(Kind.POSE_ONLY, null, header, pose, null, noHandlers());
	}

	static PendingUpdate erase() {
		return new PendingUpdate(Kind.ERASE, null, null, null, null, noHandlers());
	}

	/**
	 * @return the header this update would leave the marker with.
	 * Not meaningful for {@link Kind#ERASE ERASE}.
	 */
	Header stagedHeader() {
		return kind == Kind.FULL_REPLACE ? marker.header() : header;
	}

	/**
	 * @return the definition of the marker once this update is applied to <code>committed</code>,
	 * or null if the marker would not exist.
	 */
	@Nullable InteractiveMarker appliedTo(@Nullable InteractiveMarker committed) {
		switch (kind) {
			case FULL_REPLACE:
				return marker;
			case POSE_ONLY:
				return committed == null ? null : committed.movedTo(header, pose);
			default:
				return null;
		}
	}
}
