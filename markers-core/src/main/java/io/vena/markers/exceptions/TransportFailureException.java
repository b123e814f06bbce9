package io.vena.markers.exceptions;

import io.vena.markers.transport.MarkerTransport;
import java.io.IOException;

/**
 * Indicates that a {@link MarkerTransport} was unable to publish, subscribe, or serve a request.
 *
 * <p>
 * Extends {@link IOException} because we expect that any code that already
 * handles that will do the right thing for this (eg. logging and carrying on).
 */
public class TransportFailureException extends IOException {
	public TransportFailureException(String message) { super(message); }
	public TransportFailureException(String message, Throwable cause) { super(message, cause); }
	public TransportFailureException(Throwable cause) { super(cause); }
}
