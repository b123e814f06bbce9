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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.markers.msg.FeedbackType.POSE_UPDATE;
import static io.vena.markers.msg.MarkerControl.InteractionMode.MOVE_PLANE;
import static io.vena.markers.msg.MarkerControl.OrientationMode.VIEW_FACING;

/**
 * A cube of <code>sideLength</code>&sup3; small boxes named <code>"0"</code>, <code>"1"</code>, ...
 *
 * <p>
 * Dragging one box pulls its neighbours along, less so the farther away they are.
 * The handler only records where each box should be; {@link #stagePositions()}
 * hands those positions to the server.
 */
public class CubeScene {
	static final Header BASE_LINK = Header.frame("base_link");

	private final MarkerServer server;
	private final int sideLength;

	/**
	 * Indexed by marker number. Guarded by <code>this</code>.
	 */
	private final double[][] positions;

	public CubeScene(MarkerServer server, int sideLength) {
		if (sideLength <= 0) {
			throw new IllegalArgumentException("sideLength must be positive: " + sideLength);
		}
		this.server = server;
		this.sideLength = sideLength;
		this.positions = new double[sideLength * sideLength * sideLength][];
	}

	public int numMarkers() {
		return positions.length;
	}

	public void populate() {
		double step = 1.0 / sideLength;
		int count = 0;
		for (int i = 0; i < sideLength; i++) {
			double x = -0.5 + step * i;
			for (int j = 0; j < sideLength; j++) {
				double y = -0.5 + step * j;
				for (int k = 0; k < sideLength; k++) {
					double z = step * k;
					synchronized (this) {
						positions[count] = new double[] { x, y, z };
					}
					server.insert(box(Integer.toString(count), step, x, y, z), this::onFeedback);
					count++;
				}
			}
		}
		server.applyChanges();
		LOGGER.info("Created {} markers", count);
	}

	static InteractiveMarker box(String name, double size, double x, double y, double z) {
		Marker cube = Marker.builder()
			.type(Marker.Type.CUBE)
			.scale(Vector3.uniform(size))
			.color(new ColorRGBA(
				(float) (0.65 + 0.7 * x),
				(float) (0.65 + 0.7 * y),
				(float) (0.65 + 0.7 * z),
				1.0f))
			.build();
		return InteractiveMarker.builder()
			.name(name)
			.header(BASE_LINK)
			.scale((float) size)
			.pose(Pose.at(x, y, z))
			.control(MarkerControl.builder()
				.alwaysVisible(true)
				.orientationMode(VIEW_FACING)
				.interactionMode(MOVE_PLANE)
				.independentMarkerOrientation(true)
				.marker(cube)
				.build())
			.build();
	}

	void onFeedback(MarkerFeedback feedback) {
		if (feedback.eventType() != POSE_UPDATE) {
			return;
		}
		int index;
		try {
			index = Integer.parseInt(feedback.markerName());
		} catch (NumberFormatException e) {
			LOGGER.warn("Ignoring feedback for unexpected marker \"{}\"", feedback.markerName());
			return;
		}
		if (index < 0 || index >= positions.length) {
			LOGGER.warn("Ignoring feedback for out-of-range marker {}", index);
			return;
		}
		Point target = feedback.pose().position();
		synchronized (this) {
			double dx = target.x() - positions[index][0];
			double dy = target.y() - positions[index][1];
			double dz = target.z() - positions[index][2];
			for (int i = 0; i < positions.length; i++) {
				double[] p = positions[i];
				if (i == index) {
					p[0] = target.x();
					p[1] = target.y();
					p[2] = target.z();
				} else {
					double d = Math.sqrt(square(target.x() - p[0]) + square(target.y() - p[1]) + square(target.z() - p[2]));
					double t = Math.max(0.0, 1.0 / (d * 5.0 + 1.0) - 0.2);
					p[0] += t * dx;
					p[1] += t * dy;
					p[2] += t * dz;
				}
			}
		}
		LOGGER.debug("Marker {} dragged to ({}, {}, {})", index, target.x(), target.y(), target.z());
	}

	/**
	 * Stages the latest recorded position of every box.
	 * Call {@link MarkerServer#applyChanges()} afterward, or let a flusher do it.
	 */
	public void stagePositions() {
		Pose[] poses = new Pose[positions.length];
		synchronized (this) {
			for (int i = 0; i < positions.length; i++) {
				double[] p = positions[i];
				poses[i] = Pose.at(p[0], p[1], p[2]);
			}
		}
		for (int i = 0; i < poses.length; i++) {
			server.setPose(Integer.toString(i), poses[i]);
		}
	}

	public synchronized Point position(int index) {
		double[] p = positions[index];
		return new Point(p[0], p[1], p[2]);
	}

	private static double square(double value) {
		return value * value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CubeScene.class);
}
