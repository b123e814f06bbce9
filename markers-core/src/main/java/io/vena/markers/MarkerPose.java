package io.vena.markers;

import io.vena.markers.msg.Header;
import io.vena.markers.msg.Pose;
import lombok.NonNull;
import lombok.Value;

/**
 * A change to the pose of an existing marker that leaves the rest of its definition alone.
 */
@Value
public class MarkerPose {
	@NonNull String name;
	@NonNull Header header;
	@NonNull Pose pose;
}
