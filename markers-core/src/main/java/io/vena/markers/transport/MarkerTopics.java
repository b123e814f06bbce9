package io.vena.markers.transport;

import lombok.NonNull;
import lombok.Value;

/**
 * The channel names used by one server, all derived from its namespace.
 */
@Value
public class MarkerTopics {
	@NonNull String namespace;

	public static MarkerTopics under(String namespace) {
		return new MarkerTopics(namespace);
	}

	/**
	 * Outbound diffs.
	 */
	public String update() {
		return namespace + "/update";
	}

	/**
	 * Inbound observer interactions.
	 */
	public String feedback() {
		return namespace + "/feedback";
	}

	/**
	 * Request/response channel for full snapshots.
	 */
	public String snapshotService() {
		return namespace + "/get_interactive_markers";
	}
}
