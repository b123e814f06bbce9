package io.vena.markers.msg;

import lombok.Value;
import lombok.With;

@Value
@With
public class Point {
	double x;
	double y;
	double z;

	public static final Point ORIGIN = new Point(0, 0, 0);
}
