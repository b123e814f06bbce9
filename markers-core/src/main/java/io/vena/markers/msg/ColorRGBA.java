package io.vena.markers.msg;

import lombok.Value;

/**
 * Components are in the range [0, 1].
 */
@Value
public class ColorRGBA {
	float r;
	float g;
	float b;
	float a;

	public static final ColorRGBA TRANSPARENT = new ColorRGBA(0, 0, 0, 0);
}
