package io.vena.markers;

import io.vena.markers.msg.InteractiveMarker;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * The committed contents of a {@link MarkerServer} as of {@link #sequenceNumber()}.
 * Changes staged but not yet applied are not included.
 */
@Value
public class MarkerSnapshot {
	long sequenceNumber;
	@NonNull List<InteractiveMarker> markers;
}
