package io.vena.markers.msg;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * One visual primitive drawn as part of a {@link MarkerControl}.
 * Observers render these; the server treats them as opaque.
 */
@Value
@With
@Builder(toBuilder = true)
public class Marker {
	@NonNull Type type;
	@Default @NonNull Pose pose = Pose.IDENTITY;
	@Default @NonNull Vector3 scale = Vector3.uniform(1);
	@Default @NonNull ColorRGBA color = ColorRGBA.TRANSPARENT;
	@Default @NonNull String text = "";

	public enum Type {
		ARROW,
		CUBE,
		SPHERE,
		CYLINDER,
		LINE_STRIP,
		LINE_LIST,
		CUBE_LIST,
		SPHERE_LIST,
		POINTS,
		TEXT_VIEW_FACING,
		MESH_RESOURCE,
		TRIANGLE_LIST,
	}
}
