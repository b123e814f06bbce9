package io.vena.markers.msg;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

/**
 * A way for an observer to see and manipulate an {@link InteractiveMarker}.
 */
@Value
@With
@Builder(toBuilder = true)
public class MarkerControl {
	@Default @NonNull String name = "";
	@Default @NonNull Quaternion orientation = Quaternion.IDENTITY;
	@Default @NonNull OrientationMode orientationMode = OrientationMode.INHERIT;
	@Default @NonNull InteractionMode interactionMode = InteractionMode.NONE;
	boolean alwaysVisible;
	boolean independentMarkerOrientation;
	@Singular List<Marker> markers;

	public enum OrientationMode {
		INHERIT,
		FIXED,
		VIEW_FACING,
	}

	public enum InteractionMode {
		NONE,
		MENU,
		BUTTON,
		MOVE_AXIS,
		MOVE_PLANE,
		ROTATE_AXIS,
		MOVE_ROTATE,
		MOVE_3D,
		ROTATE_3D,
		MOVE_ROTATE_3D,
	}
}
