package io.vena.markers.msg;

import lombok.Value;

@Value
public class Vector3 {
	double x;
	double y;
	double z;

	public static Vector3 uniform(double value) {
		return new Vector3(value, value, value);
	}
}
