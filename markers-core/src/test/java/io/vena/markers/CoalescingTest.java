package io.vena.markers;

import io.vena.markers.msg.InteractiveMarker;
import io.vena.markers.msg.MarkerFeedback;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static io.vena.markers.msg.FeedbackType.BUTTON_CLICK;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Several changes to the same marker between flushes must reach observers as one.
 */
public class CoalescingTest extends AbstractMarkerServerTest {
	static final InteractiveMarker ORIGINAL = marker("a");
	static final InteractiveMarker REPLACEMENT = marker("a").withDescription("replacement");

	@BeforeEach
	void commitOriginal() {
		server.insert(ORIGINAL);
		server.applyChanges();
		updates.clear();
	}

	enum Op {
		INSERT, POSE_1, POSE_2, ERASE;

		void applyTo(MarkerServer server) {
			switch (this) {
				case INSERT: server.insert(REPLACEMENT); break;
				case POSE_1: server.setPose("a", pose(1)); break;
				case POSE_2: server.setPose("a", pose(2)); break;
				case ERASE: server.erase("a"); break;
			}
		}
	}

	static Stream<Arguments> sequences() {
		return Stream.of(
			Arguments.of(List.of(Op.POSE_1, Op.POSE_2), new MarkerUpdate(2, emptyList(), singletonList(new MarkerPose("a", BASE_LINK, pose(2))), emptyList())),
			Arguments.of(List.of(Op.POSE_1, Op.INSERT), new MarkerUpdate(2, singletonList(REPLACEMENT), emptyList(), emptyList())),
			Arguments.of(List.of(Op.INSERT, Op.POSE_2), new MarkerUpdate(2, singletonList(REPLACEMENT.withPose(pose(2))), emptyList(), emptyList())),
			Arguments.of(List.of(Op.POSE_1, Op.ERASE), new MarkerUpdate(2, emptyList(), emptyList(), singletonList("a"))),
			Arguments.of(List.of(Op.INSERT, Op.ERASE), new MarkerUpdate(2, emptyList(), emptyList(), singletonList("a"))),
			Arguments.of(List.of(Op.ERASE, Op.INSERT), new MarkerUpdate(2, singletonList(REPLACEMENT), emptyList(), emptyList())),
			Arguments.of(List.of(Op.ERASE, Op.POSE_1), new MarkerUpdate(2, emptyList(), singletonList(new MarkerPose("a", BASE_LINK, pose(1))), emptyList())),
			Arguments.of(List.of(Op.INSERT, Op.ERASE, Op.POSE_1), new MarkerUpdate(2, emptyList(), singletonList(new MarkerPose("a", BASE_LINK, pose(1))), emptyList())),
			Arguments.of(List.of(Op.INSERT, Op.INSERT, Op.POSE_1, Op.POSE_2), new MarkerUpdate(2, singletonList(REPLACEMENT.withPose(pose(2))), emptyList(), emptyList()))
		);
	}

	@ParameterizedTest
	@MethodSource("sequences")
	void sequence_lastWriteWins(List<Op> ops, MarkerUpdate expected) {
		ops.forEach(op -> op.applyTo(server));
		server.applyChanges();
		assertEquals(singletonList(expected), updates);
	}

	@Test
	void poseAfterErase_cancelsErase() {
		FeedbackRecorder recorder = new FeedbackRecorder();
		server.setCallback("a", recorder.handlerNamed("a"));
		server.erase("a");
		assertTrue(server.setPose("a", pose(1), WORLD));
		assertEquals(Optional.of(ORIGINAL.movedTo(WORLD, pose(1))), server.get("a"));

		server.applyChanges();
		transport.sendFeedback(MarkerFeedback.builder().markerName("a").eventType(BUTTON_CLICK).build());
		assertEquals(singletonList(new FeedbackRecorder.Event("a", "a", BUTTON_CLICK)), recorder.events(),
			"Committed handlers survive a cancelled erasure");
	}

	@Test
	void poseAfterEraseOfUncommittedMarker_eraseKept() {
		server.insert(marker("b"));
		server.erase("b");
		assertTrue(server.setPose("b", pose(1)), "A staged change exists, so the marker is known");
		assertEquals(Optional.empty(), server.get("b"));
		server.applyChanges();
		assertEquals(singletonList("b"), lastUpdate().erases());
	}

	@Test
	void poseWithoutHeader_keepsStagedHeader() {
		server.setPose("a", pose(1), WORLD);
		server.setPose("a", pose(2));
		server.applyChanges();
		assertEquals(singletonList(new MarkerPose("a", WORLD, pose(2))), lastUpdate().poses());
	}

	@Test
	void poseOnStagedInsertion_staysFullReplacement() {
		server.insert(marker("b"));
		assertTrue(server.setPose("b", pose(4), WORLD));
		server.applyChanges();
		assertEquals(singletonList(marker("b").movedTo(WORLD, pose(4))), lastUpdate().markers());
		assertEquals(emptyList(), lastUpdate().poses());
	}

	@Test
	void poseOnStagedInsertion_keepsStagedHandlers() {
		FeedbackRecorder recorder = new FeedbackRecorder();
		server.insert(marker("b"), recorder.handlerNamed("b"));
		server.setPose("b", pose(4));
		server.applyChanges();

		transport.sendFeedback(MarkerFeedback.builder().markerName("b").eventType(BUTTON_CLICK).build());
		assertEquals(singletonList(new FeedbackRecorder.Event("b", "b", BUTTON_CLICK)), recorder.events());
	}

	@Test
	void insertAfterStagedHandler_handlerDropped() {
		FeedbackRecorder recorder = new FeedbackRecorder();
		server.insert(marker("b"), recorder.handlerNamed("dropped"));
		server.insert(marker("b"));
		server.applyChanges();

		transport.sendFeedback(MarkerFeedback.builder().markerName("b").eventType(BUTTON_CLICK).build());
		assertEquals(emptyList(), recorder.events());
	}

	@Test
	void reinsertCommittedMarker_handlersReplaced() {
		FeedbackRecorder recorder = new FeedbackRecorder();
		server.setCallback("a", recorder.handlerNamed("original"));
		server.insert(REPLACEMENT);
		server.applyChanges();

		transport.sendFeedback(MarkerFeedback.builder().markerName("a").eventType(BUTTON_CLICK).build());
		assertEquals(emptyList(), recorder.events());
	}
}
