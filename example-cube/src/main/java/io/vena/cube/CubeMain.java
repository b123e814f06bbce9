package io.vena.cube;

import io.vena.markers.MarkerServer;
import io.vena.markers.MarkerServerSettings;
import io.vena.markers.PeriodicFlusher;
import io.vena.markers.transport.InProcessTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@link CubeScene}, or the {@link SimpleMarkerScene} if the first argument is <code>simple</code>,
 * publishing over an {@link InProcessTransport} until interrupted.
 *
 * <p>
 * Usage: <code>CubeMain [simple | sideLength]</code>
 */
public class CubeMain {
	static final long TICK_MS = 100;

	public static void main(String[] args) throws InterruptedException {
		InProcessTransport transport = new InProcessTransport();
		transport.subscribeUpdates(update -> LOGGER.debug("Update {}: {} full, {} pose, {} erase",
			update.sequenceNumber(), update.markers().size(), update.poses().size(), update.erases().size()));

		if (args.length >= 1 && "simple".equals(args[0])) {
			MarkerServer server = new MarkerServer(
				MarkerServerSettings.builder().topicNamespace("simple_marker").build(),
				transport.factory());
			new SimpleMarkerScene(server).populate();
			LOGGER.info("Started {}", server);
			Thread.currentThread().join();
			return;
		}

		int sideLength = args.length >= 1 ? Integer.parseInt(args[0]) : 10;
		MarkerServer server = new MarkerServer(
			MarkerServerSettings.builder()
				.topicNamespace("cube")
				.flushPeriodMS(TICK_MS)
				.build(),
			transport.factory());
		CubeScene scene = new CubeScene(server, sideLength);
		scene.populate();
		LOGGER.info("Started {}", server);

		try (PeriodicFlusher flusher = new PeriodicFlusher(server)) {
			while (!Thread.currentThread().isInterrupted()) {
				scene.stagePositions();
				Thread.sleep(TICK_MS);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CubeMain.class);
}
