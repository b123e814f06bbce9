package io.vena.markers.transport;

import io.vena.markers.MarkerSnapshot;
import io.vena.markers.MarkerUpdate;
import io.vena.markers.exceptions.TransportFailureException;
import io.vena.markers.msg.MarkerFeedback;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Carries a {@link io.vena.markers.MarkerServer MarkerServer}'s messages to and from its observers.
 *
 * <p>
 * Implementations must deliver updates to each observer in the order they were published.
 * Nothing else about delivery is assumed.
 */
public interface MarkerTransport {
	void publishUpdate(MarkerUpdate update) throws TransportFailureException;

	/**
	 * @param listener will be called once for each feedback event received, possibly from a transport thread
	 */
	void subscribeFeedback(Consumer<MarkerFeedback> listener) throws TransportFailureException;

	/**
	 * @param responder called to answer each snapshot request
	 */
	void serveSnapshots(Supplier<MarkerSnapshot> responder) throws TransportFailureException;
}
