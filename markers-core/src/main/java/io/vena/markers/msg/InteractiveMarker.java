package io.vena.markers.msg;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

/**
 * The complete definition of one marker: its identity, its pose, and the
 * controls an observer uses to display and manipulate it.
 *
 * <p>
 * {@link #name()} is the key under which the marker is registered,
 * and must be unique within one server.
 */
@Value
@With
@Builder(toBuilder = true)
public class InteractiveMarker {
	@NonNull String name;
	@Default @NonNull Header header = Header.frame("");
	@Default @NonNull Pose pose = Pose.IDENTITY;
	@Default @NonNull String description = "";
	@Default float scale = 1;
	@Singular List<MarkerControl> controls;

	/**
	 * @return a copy of this marker placed at <code>newPose</code> in the frame given by <code>newHeader</code>.
	 */
	public InteractiveMarker movedTo(Header newHeader, Pose newPose) {
		return this.withHeader(newHeader).withPose(newPose);
	}
}
