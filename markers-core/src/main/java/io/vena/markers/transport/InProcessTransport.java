package io.vena.markers.transport;

import io.vena.markers.MarkerSnapshot;
import io.vena.markers.MarkerUpdate;
import io.vena.markers.exceptions.TransportFailureException;
import io.vena.markers.msg.MarkerFeedback;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarkerTransport} whose observers live in the same JVM.
 *
 * <p>
 * Every call is delivered synchronously on the calling thread,
 * so updates reach subscribers in the order they were published.
 * A subscriber that throws doesn't keep the update from the others.
 */
public class InProcessTransport implements MarkerTransport {
	private final List<Consumer<MarkerUpdate>> updateSubscribers = new CopyOnWriteArrayList<>();
	private final List<Consumer<MarkerFeedback>> feedbackSubscribers = new CopyOnWriteArrayList<>();
	private volatile @Nullable Supplier<MarkerSnapshot> snapshotResponder;
	private volatile @Nullable MarkerTopics topics;

	/**
	 * @return a factory that binds this transport to the topics of the server that builds it.
	 * A transport can be bound only once.
	 */
	public TransportFactory factory() {
		return newTopics -> {
			synchronized (this) {
				if (topics != null) {
					throw new IllegalStateException("Transport already bound to " + topics.namespace());
				}
				topics = newTopics;
			}
			LOGGER.debug("Bound to namespace {}", newTopics.namespace());
			return this;
		};
	}

	public @Nullable MarkerTopics topics() {
		return topics;
	}

	/**
	 * Observer side: receive every update published from now on.
	 */
	public void subscribeUpdates(Consumer<MarkerUpdate> subscriber) {
		updateSubscribers.add(subscriber);
	}

	/**
	 * Observer side: report an interaction to the server.
	 */
	public void sendFeedback(MarkerFeedback feedback) {
		LOGGER.trace("Feedback {} for {}", feedback.eventType(), feedback.markerName());
		feedbackSubscribers.forEach(s -> s.accept(feedback));
	}

	/**
	 * Observer side: ask the server for its committed state.
	 */
	public MarkerSnapshot requestSnapshot() throws TransportFailureException {
		Supplier<MarkerSnapshot> responder = snapshotResponder;
		if (responder == null) {
			throw new TransportFailureException("No snapshot service on " + describe());
		}
		return responder.get();
	}

	@Override
	public void publishUpdate(MarkerUpdate update) {
		LOGGER.trace("Publishing update {} to {} subscriber(s)", update.sequenceNumber(), updateSubscribers.size());
		for (Consumer<MarkerUpdate> subscriber: updateSubscribers) {
			try {
				subscriber.accept(update);
			} catch (RuntimeException e) {
				LOGGER.error("Update subscriber aborted on update {} due to exception: {}", update.sequenceNumber(), e.getMessage(), e);
			}
		}
	}

	@Override
	public void subscribeFeedback(Consumer<MarkerFeedback> listener) {
		feedbackSubscribers.add(listener);
	}

	@Override
	public synchronized void serveSnapshots(Supplier<MarkerSnapshot> responder) throws TransportFailureException {
		if (snapshotResponder != null) {
			throw new TransportFailureException("Snapshot service already registered on " + describe());
		}
		snapshotResponder = responder;
	}

	private String describe() {
		MarkerTopics t = topics;
		return t == null ? "unbound transport" : t.snapshotService();
	}

	@Override
	public String toString() {
		return "InProcessTransport{" + describe() + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InProcessTransport.class);
}
