package io.vena.markers;

import io.vena.markers.msg.InteractiveMarker;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * One diff emitted by {@link MarkerServer#applyChanges()}.
 *
 * <p>
 * Each marker name appears in at most one of the three lists.
 * Observers apply updates in {@link #sequenceNumber()} order;
 * a gap means an update was missed and the observer should fetch a {@link MarkerSnapshot}.
 */
@Value
public class MarkerUpdate {
	long sequenceNumber;
	@NonNull List<InteractiveMarker> markers;
	@NonNull List<MarkerPose> poses;
	@NonNull List<String> erases;

	public boolean isEmpty() {
		return markers.isEmpty() && poses.isEmpty() && erases.isEmpty();
	}
}
