package io.vena.markers.msg;

import lombok.Value;
import lombok.With;

@Value
@With
public class Quaternion {
	double x;
	double y;
	double z;
	double w;

	public static final Quaternion IDENTITY = new Quaternion(0, 0, 0, 1);
}
