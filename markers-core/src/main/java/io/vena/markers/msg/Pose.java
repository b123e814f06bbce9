package io.vena.markers.msg;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

@Value
@With
public class Pose {
	@NonNull Point position;
	@NonNull Quaternion orientation;

	public static final Pose IDENTITY = new Pose(Point.ORIGIN, Quaternion.IDENTITY);

	public static Pose at(double x, double y, double z) {
		return new Pose(new Point(x, y, z), Quaternion.IDENTITY);
	}
}
