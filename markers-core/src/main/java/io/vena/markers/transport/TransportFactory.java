package io.vena.markers.transport;

public interface TransportFactory {
	MarkerTransport build(MarkerTopics topics);
}
