package io.vena.markers.msg;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

/**
 * An interaction reported by an observer against one marker.
 */
@Value
@Builder(toBuilder = true)
public class MarkerFeedback {
	@Default @NonNull Header header = Header.frame("");
	@Default @NonNull String clientId = "";
	@NonNull String markerName;
	@Default @NonNull String controlName = "";
	@NonNull FeedbackType eventType;
	@Default @NonNull Pose pose = Pose.IDENTITY;
	int menuEntryId;
	@Default @NonNull Point mousePoint = Point.ORIGIN;
	boolean mousePointValid;
}
