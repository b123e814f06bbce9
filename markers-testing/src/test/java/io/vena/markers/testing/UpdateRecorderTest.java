package io.vena.markers.testing;

import io.vena.markers.MarkerServer;
import io.vena.markers.MarkerServerSettings;
import io.vena.markers.MarkerUpdate;
import io.vena.markers.transport.InProcessTransport;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

import static io.vena.markers.testing.TestMarkers.button;
import static io.vena.markers.testing.TestMarkers.staticBox;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UpdateRecorderTest {

	@Test
	void reportingTransport_reportsBeforeDelivery() {
		InProcessTransport transport = new InProcessTransport();
		UpdateRecorder reported = new UpdateRecorder();
		UpdateRecorder delivered = new UpdateRecorder();
		transport.subscribeUpdates(u -> {
			assertEquals(delivered.size() + 1, reported.size(), "Listener should hear about each update first");
			delivered.accept(u);
		});
		MarkerServer server = new MarkerServer(
			MarkerServerSettings.builder().topicNamespace("reporting").build(),
			ReportingTransport.factory(transport.factory(), reported));

		server.insert(staticBox("a"));
		server.applyChanges();
		server.insert(button("b"));
		server.applyChanges();

		assertEquals(reported.updates(), delivered.updates());
		assertEquals(List.of(button("b")), reported.last().markers());
		reported.assertNoGaps();
	}

	@Test
	void awaitSequenceNumber_otherThread() throws Exception {
		InProcessTransport transport = new InProcessTransport();
		UpdateRecorder recorder = new UpdateRecorder();
		transport.subscribeUpdates(recorder);
		MarkerServer server = new MarkerServer(
			MarkerServerSettings.builder().topicNamespace("await").build(),
			transport.factory());

		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			executor.submit(() -> {
				server.insert(staticBox("a"));
				server.applyChanges();
			});
			MarkerUpdate update = recorder.awaitSequenceNumber(1, 10_000);
			assertEquals(List.of(staticBox("a")), update.markers());
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void awaitSequenceNumber_timesOut() {
		UpdateRecorder recorder = new UpdateRecorder();
		assertThrows(AssertionError.class, () -> recorder.awaitSequenceNumber(1, 10));
	}

	@Test
	void gap_detected() {
		UpdateRecorder recorder = new UpdateRecorder();
		recorder.accept(new MarkerUpdate(1, List.of(), List.of(), List.of("a")));
		recorder.accept(new MarkerUpdate(3, List.of(), List.of(), List.of("b")));
		assertThrows(AssertionError.class, recorder::assertNoGaps);

		recorder.restart();
		assertEquals(0, recorder.size());
		recorder.assertNoGaps();
	}
}
