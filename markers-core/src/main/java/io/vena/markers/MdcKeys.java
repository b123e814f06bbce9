package io.vena.markers;

final class MdcKeys {
	static final String NAMESPACE = "markers.namespace";
	static final String MARKER    = "markers.marker";
}
