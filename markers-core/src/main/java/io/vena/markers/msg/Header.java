package io.vena.markers.msg;

import java.time.Instant;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Names the coordinate frame a pose is expressed in, and when.
 */
@Value
@With
public class Header {
	@NonNull String frameId;
	@NonNull Instant stamp;

	public static Header frame(String frameId) {
		return new Header(frameId, Instant.EPOCH);
	}
}
