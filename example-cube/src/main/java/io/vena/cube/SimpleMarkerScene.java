package io.vena.cube;

import io.vena.markers.MarkerServer;
import io.vena.markers.msg.ColorRGBA;
import io.vena.markers.msg.Header;
import io.vena.markers.msg.InteractiveMarker;
import io.vena.markers.msg.Marker;
import io.vena.markers.msg.MarkerControl;
import io.vena.markers.msg.MarkerFeedback;
import io.vena.markers.msg.Point;
import io.vena.markers.msg.Pose;
import io.vena.markers.msg.Vector3;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.markers.msg.MarkerControl.InteractionMode.MOVE_AXIS;

/**
 * A single grey box that can be dragged along the x axis.
 */
@RequiredArgsConstructor
public class SimpleMarkerScene {
	public static final String MARKER_NAME = "my_marker";
	static final Header BASE_LINK = Header.frame("base_link");

	private final MarkerServer server;

	public void populate() {
		Marker greyBox = Marker.builder()
			.type(Marker.Type.CUBE)
			.scale(Vector3.uniform(0.45))
			.color(new ColorRGBA(0.0f, 0.5f, 0.5f, 1.0f))
			.build();

		InteractiveMarker marker = InteractiveMarker.builder()
			.name(MARKER_NAME)
			.header(BASE_LINK)
			.description("Simple 1-DoF Control")
			.pose(Pose.IDENTITY)
			// Non-interactive control that draws the box
			.control(MarkerControl.builder()
				.alwaysVisible(true)
				.marker(greyBox)
				.build())
			.control(MarkerControl.builder()
				.name("move_x")
				.interactionMode(MOVE_AXIS)
				.build())
			.build();

		server.insert(marker, this::onFeedback);
		server.applyChanges();
	}

	void onFeedback(MarkerFeedback feedback) {
		Point p = feedback.pose().position();
		LOGGER.info("{} is now at {}, {}, {}", feedback.markerName(), p.x(), p.y(), p.z());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SimpleMarkerScene.class);
}
