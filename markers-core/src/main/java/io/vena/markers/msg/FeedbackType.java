package io.vena.markers.msg;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The kind of interaction an observer reports in a {@link MarkerFeedback}.
 * The {@link #code() codes} are the values used on the wire.
 */
@RequiredArgsConstructor
public enum FeedbackType {
	KEEP_ALIVE(0),

	/**
	 * The observer moved the marker. The server adopts the reported pose.
	 */
	POSE_UPDATE(1),
	MENU_SELECT(2),
	BUTTON_CLICK(3),
	MOUSE_DOWN(4),
	MOUSE_UP(5),
	;

	@Getter private final int code;

	public static Optional<FeedbackType> fromCode(int code) {
		for (FeedbackType type: values()) {
			if (type.code == code) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
