package io.vena.markers;

import io.vena.markers.msg.FeedbackType;
import io.vena.markers.msg.MarkerFeedback;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Many threads staging, flushing and sending feedback at once.
 */
public class ConcurrencyTest extends AbstractMarkerServerTest {
	static final int NUM_THREADS = 8;
	static final int ITERATIONS = 200;

	ExecutorService executor;
	List<MarkerUpdate> received;

	@BeforeEach
	void setUpExecutor() {
		executor = Executors.newFixedThreadPool(NUM_THREADS);
		received = new CopyOnWriteArrayList<>();
		transport.subscribeUpdates(received::add);
	}

	@AfterEach
	void tearDownExecutor() {
		executor.shutdownNow();
	}

	@Test
	void concurrentWriters_updatesInSequenceOrder() throws Exception {
		List<Future<?>> futures = new ArrayList<>();
		for (int t = 0; t < NUM_THREADS; t++) {
			String name = "m" + t;
			futures.add(executor.submit(() -> {
				server.insert(marker(name));
				for (int i = 0; i < ITERATIONS; i++) {
					server.setPose(name, pose(i));
					server.applyChanges();
				}
			}));
		}
		for (Future<?> f: futures) {
			f.get(30, SECONDS);
		}
		server.applyChanges();

		assertEquals(NUM_THREADS, server.size());
		for (int i = 0; i < received.size(); i++) {
			assertEquals(i + 1, received.get(i).sequenceNumber(), "Updates must arrive in sequence order with no gaps");
		}
		assertEquals(received.size(), server.sequenceNumber());
		for (int t = 0; t < NUM_THREADS; t++) {
			assertEquals(pose(ITERATIONS - 1), server.get("m" + t).get().pose());
		}
	}

	@Test
	void handlersCallingBackIn_noDeadlock() throws Exception {
		for (int t = 0; t < NUM_THREADS; t++) {
			String name = "m" + t;
			server.insert(marker(name), f -> {
				server.setPose(f.markerName(), f.pose());
				server.get(f.markerName());
				server.clear();
				server.insert(marker(f.markerName()));
				server.applyChanges();
			});
		}
		server.applyChanges();

		List<Future<?>> futures = new ArrayList<>();
		for (int t = 0; t < NUM_THREADS; t++) {
			String name = "m" + t;
			futures.add(executor.submit(() -> {
				for (int i = 0; i < ITERATIONS; i++) {
					transport.sendFeedback(MarkerFeedback.builder()
						.markerName(name)
						.eventType(FeedbackType.BUTTON_CLICK)
						.pose(pose(i))
						.build());
					server.erase(name);
					server.insert(marker(name));
					server.applyChanges();
				}
			}));
		}
		for (Future<?> f: futures) {
			f.get(30, SECONDS);
		}
		server.applyChanges();
		for (int i = 0; i < received.size(); i++) {
			assertEquals(i + 1, received.get(i).sequenceNumber());
		}
	}
}
