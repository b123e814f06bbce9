package io.vena.markers;

import io.vena.markers.MappedDiagnosticContext.MDCScope;
import io.vena.markers.exceptions.TransportFailureException;
import io.vena.markers.msg.FeedbackType;
import io.vena.markers.msg.Header;
import io.vena.markers.msg.InteractiveMarker;
import io.vena.markers.msg.MarkerFeedback;
import io.vena.markers.msg.Pose;
import io.vena.markers.transport.MarkerTopics;
import io.vena.markers.transport.MarkerTransport;
import io.vena.markers.transport.TransportFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.markers.MappedDiagnosticContext.setupMDC;
import static io.vena.markers.msg.FeedbackType.POSE_UPDATE;
import static java.util.Collections.unmodifiableList;

/**
 * A registry of {@link InteractiveMarker}s shared with remote observers.
 *
 * <p>
 * Changes are made in two steps. First, calls like {@link #insert}, {@link #setPose}
 * and {@link #erase} stage a change in a pending buffer that holds at most one
 * change per marker: a later change to the same marker is merged into the earlier one
 * (see {@link UpdateCoalescer}). Then {@link #applyChanges()} commits the whole buffer
 * and publishes a single {@link MarkerUpdate} describing only what changed,
 * tagged with the next sequence number. Observers that miss an update, or join late,
 * ask for a {@link #snapshot()}.
 *
 * <p>
 * Feedback from observers arrives at {@link #processFeedback}, which records who sent it,
 * adopts any pose the observer dragged the marker to, and calls the marker's
 * {@link FeedbackHandler} for that {@link FeedbackType}, falling back to its default handler.
 *
 * <p>
 * All methods are thread-safe. The registry and the pending buffer are guarded by their
 * own monitors, always acquired in that order. Handlers are called with neither held,
 * so a handler may call any method of this class.
 *
 * @see PeriodicFlusher
 */
public class MarkerServer {
	@Getter private final String topicNamespace;
	@Getter private final MarkerServerSettings settings;
	private final MarkerTopics topics;
	private final MarkerTransport transport;

	/**
	 * Committed state. Its monitor is acquired before {@link #pending}'s.
	 */
	private final Map<String, MarkerContext> registry = new LinkedHashMap<>();
	private final Map<String, PendingUpdate> pending = new LinkedHashMap<>();

	/**
	 * Held across commit and publish so updates go out in sequence order.
	 */
	private final Object flushLock = new Object();

	// Written only while holding the registry monitor
	private volatile long sequenceNumber = 0;

	public MarkerServer(MarkerServerSettings settings, TransportFactory transportFactory) {
		this.settings = settings;
		this.topicNamespace = settings.topicNamespace();
		this.topics = MarkerTopics.under(topicNamespace);
		this.transport = transportFactory.build(topics);
		try (MDCScope __ = setupMDC(topicNamespace)) {
			try {
				transport.subscribeFeedback(this::processFeedback);
			} catch (TransportFailureException e) {
				LOGGER.error("Unable to subscribe to {}; feedback will be ignored", topics.feedback(), e);
			}
			try {
				transport.serveSnapshots(this::snapshot);
			} catch (TransportFailureException e) {
				LOGGER.error("Unable to serve {}; late-joining observers won't see existing markers", topics.snapshotService(), e);
			}
			LOGGER.debug("Started marker server on {}", transport);
		}
	}

	/**
	 * Stages <code>marker</code> to be added, or to replace the existing marker with the same
	 * {@link InteractiveMarker#name() name}. Anything already staged for that marker is discarded,
	 * including handlers registered since the last {@link #applyChanges()}; handlers that are
	 * already committed are replaced when this insertion is applied.
	 */
	public void insert(@NonNull InteractiveMarker marker) {
		String name = marker.name();
		synchronized (pending) {
			pending.put(name, UpdateCoalescer.insert(marker));
		}
		LOGGER.debug("Staged insertion of \"{}\"", name);
	}

	/**
	 * {@link #insert(InteractiveMarker) Insert} followed by
	 * {@link #setCallback(String, FeedbackHandler) setCallback}.
	 */
	public void insert(@NonNull InteractiveMarker marker, @Nullable FeedbackHandler defaultHandler) {
		insert(marker);
		setCallback(marker.name(), defaultHandler);
	}

	/**
	 * {@link #insert(InteractiveMarker) Insert} followed by
	 * {@link #setCallback(String, FeedbackHandler, FeedbackType) setCallback}.
	 */
	public void insert(@NonNull InteractiveMarker marker, @Nullable FeedbackHandler handler, @NonNull FeedbackType type) {
		insert(marker);
		setCallback(marker.name(), handler, type);
	}

	/**
	 * Registers the handler used for feedback that has no type-specific handler.
	 *
	 * @param handler null to remove the existing default handler
	 * @return false if there is no marker with the given <code>name</code>, committed or staged
	 */
	public boolean setCallback(@NonNull String name, @Nullable FeedbackHandler handler) {
		return installHandler(name, handler, null);
	}

	/**
	 * Registers the handler for feedback of the given <code>type</code>.
	 * The change takes effect immediately for committed markers, and is also carried
	 * by any staged change so that it survives {@link #applyChanges()}.
	 *
	 * @param handler null to remove the existing handler for <code>type</code>
	 * @return false if there is no marker with the given <code>name</code>, committed or staged
	 */
	public boolean setCallback(@NonNull String name, @Nullable FeedbackHandler handler, @NonNull FeedbackType type) {
		return installHandler(name, handler, type);
	}

	private boolean installHandler(String name, @Nullable FeedbackHandler handler, @Nullable FeedbackType type) {
		synchronized (registry) {
			synchronized (pending) {
				MarkerContext committed = registry.get(name);
				PendingUpdate staged = pending.get(name);
				if (committed == null && staged == null) {
					LOGGER.debug("Can't set {} handler; no marker \"{}\"", describe(type), name);
					return false;
				}
				if (committed != null) {
					registry.put(name, UpdateCoalescer.withHandler(committed, handler, type));
				}
				if (staged != null) {
					pending.put(name, UpdateCoalescer.withHandler(staged, handler, type));
				}
			}
		}
		LOGGER.debug("{} {} handler for \"{}\"", handler == null ? "Removed" : "Set", describe(type), name);
		return true;
	}

	/**
	 * Stages a move of the named marker, keeping its current header.
	 *
	 * @see #setPose(String, Pose, Header)
	 */
	public boolean setPose(@NonNull String name, @NonNull Pose pose) {
		return setPose(name, pose, null);
	}

	/**
	 * Stages a move of the named marker without changing the rest of its definition.
	 * If the marker is committed but staged for erasure, the move replaces the erasure;
	 * if it is staged for erasure and not committed, the erasure stays and the move is discarded.
	 * If a full definition is staged, the move is folded into it, and the next update
	 * carries the full definition rather than a pose record.
	 *
	 * @param header if null, the marker keeps the header it would otherwise have had
	 * @return false if there is no marker with the given <code>name</code>, committed or staged
	 */
	public boolean setPose(@NonNull String name, @NonNull Pose pose, @Nullable Header header) {
		synchronized (registry) {
			synchronized (pending) {
				PendingUpdate update = UpdateCoalescer.setPose(pending.get(name), registry.get(name), pose, header);
				if (update == null) {
					LOGGER.debug("Can't set pose; no marker \"{}\"", name);
					return false;
				}
				pending.put(name, update);
			}
		}
		LOGGER.trace("Staged pose for \"{}\"", name);
		return true;
	}

	/**
	 * Stages removal of the named marker, discarding anything else staged for it.
	 *
	 * @return false if there is no marker with the given <code>name</code>, committed or staged
	 */
	public boolean erase(@NonNull String name) {
		synchronized (registry) {
			synchronized (pending) {
				if (!registry.containsKey(name) && !pending.containsKey(name)) {
					LOGGER.debug("Can't erase; no marker \"{}\"", name);
					return false;
				}
				pending.put(name, UpdateCoalescer.erase());
			}
		}
		LOGGER.debug("Staged erasure of \"{}\"", name);
		return true;
	}

	/**
	 * Discards all staged changes and stages removal of every committed marker.
	 */
	public void clear() {
		synchronized (registry) {
			synchronized (pending) {
				pending.clear();
				registry.keySet().forEach(name -> pending.put(name, UpdateCoalescer.erase()));
				LOGGER.debug("Staged erasure of all {} markers", registry.size());
			}
		}
	}

	/**
	 * Commits every staged change and publishes one {@link MarkerUpdate} describing them.
	 * Does nothing if nothing is staged.
	 *
	 * <p>
	 * A failure to publish is logged; the changes remain committed, and observers
	 * will notice the gap in sequence numbers and resynchronize from a {@link #snapshot()}.
	 *
	 * @return true if the changes were committed and assigned a new sequence number
	 */
	public boolean applyChanges() {
		synchronized (flushLock) {
			try (MDCScope __ = setupMDC(topicNamespace)) {
				MarkerUpdate update = commitPending();
				if (update == null) {
					return false;
				}
				publish(update);
				return true;
			}
		}
	}

	private @Nullable MarkerUpdate commitPending() {
		synchronized (registry) {
			synchronized (pending) {
				if (pending.isEmpty()) {
					LOGGER.trace("No changes to apply");
					return null;
				}
				List<InteractiveMarker> markers = new ArrayList<>();
				List<MarkerPose> poses = new ArrayList<>();
				List<String> erases = new ArrayList<>();
				for (Map.Entry<String, PendingUpdate> entry: pending.entrySet()) {
					String name = entry.getKey();
					PendingUpdate staged = entry.getValue();
					MarkerContext existing = registry.get(name);
					MarkerContext result = UpdateCoalescer.commit(existing, staged);
					switch (staged.kind()) {
						case FULL_REPLACE:
							registry.put(name, result);
							markers.add(result.marker());
							break;
						case POSE_ONLY:
							if (result == null) {
								LOGGER.warn("Dropping pose update for nonexistent marker \"{}\"", name);
							} else {
								registry.put(name, result);
								poses.add(new MarkerPose(name, result.marker().header(), result.marker().pose()));
							}
							break;
						case ERASE:
							registry.remove(name);
							erases.add(name);
							break;
					}
				}
				pending.clear();
				MarkerUpdate update = new MarkerUpdate(sequenceNumber + 1, unmodifiableList(markers), unmodifiableList(poses), unmodifiableList(erases));
				if (update.isEmpty()) {
					LOGGER.warn("Staged changes produced an empty update; nothing to publish");
					return null;
				}
				sequenceNumber = update.sequenceNumber();
				LOGGER.debug("Update {}: {} full, {} pose, {} erase", sequenceNumber, markers.size(), poses.size(), erases.size());
				return update;
			}
		}
	}

	private void publish(MarkerUpdate update) {
		try {
			transport.publishUpdate(update);
		} catch (TransportFailureException e) {
			LOGGER.error("Unable to publish update {} on {}", update.sequenceNumber(), topics.update(), e);
		} catch (RuntimeException e) {
			LOGGER.error("Transport aborted publishing update {} on {} due to exception: {}", update.sequenceNumber(), topics.update(), e.getMessage(), e);
		}
	}

	/**
	 * Handles one interaction reported by an observer.
	 * Feedback for a marker that isn't committed is logged and ignored.
	 *
	 * <p>
	 * The handler, if any, runs on the calling thread before this method returns.
	 * Exceptions it throws are logged and not propagated.
	 */
	public void processFeedback(@NonNull MarkerFeedback feedback) {
		String name = feedback.markerName();
		try (MDCScope __ = setupMDC(topicNamespace, name)) {
			FeedbackHandler handler;
			synchronized (registry) {
				MarkerContext committed = registry.get(name);
				if (committed == null) {
					LOGGER.warn("Received {} feedback for unknown marker \"{}\"; ignoring", feedback.eventType(), name);
					return;
				}
				registry.put(name, committed
					.withLastFeedback(settings.clock().instant())
					.withLastClientId(feedback.clientId()));
				if (feedback.eventType() == POSE_UPDATE) {
					synchronized (pending) {
						PendingUpdate update = UpdateCoalescer.setPose(pending.get(name), committed, feedback.pose(), feedback.header());
						if (update == null) {
							LOGGER.debug("Ignoring pose from {} for \"{}\"", feedback.clientId(), name);
						} else {
							pending.put(name, update);
						}
					}
				}
				handler = committed.handlerFor(feedback.eventType());
			}

			if (handler == null) {
				LOGGER.trace("No handler for {} feedback", feedback.eventType());
				return;
			}
			try {
				handler.onFeedback(feedback);
			} catch (RuntimeException e) {
				LOGGER.error("Feedback handler for \"{}\" aborted due to exception: {}", name, e.getMessage(), e);
			}
		}
	}

	/**
	 * @return the marker as it will be once staged changes are applied,
	 * or empty if it won't exist
	 */
	public Optional<InteractiveMarker> get(@NonNull String name) {
		synchronized (registry) {
			synchronized (pending) {
				MarkerContext committed = registry.get(name);
				InteractiveMarker current = committed == null ? null : committed.marker();
				PendingUpdate staged = pending.get(name);
				if (staged == null) {
					return Optional.ofNullable(current);
				} else {
					return Optional.ofNullable(staged.appliedTo(current));
				}
			}
		}
	}

	/**
	 * @return the feedback bookkeeping for a committed marker
	 */
	public Optional<FeedbackStatus> feedbackStatus(@NonNull String name) {
		synchronized (registry) {
			return Optional.ofNullable(registry.get(name)).map(MarkerContext::status);
		}
	}

	/**
	 * @return the number of committed markers. Staged insertions don't count until applied.
	 */
	public int size() {
		synchronized (registry) {
			return registry.size();
		}
	}

	public boolean isEmpty() {
		synchronized (registry) {
			return registry.isEmpty();
		}
	}

	/**
	 * @return the sequence number of the most recent update, or zero if there hasn't been one
	 */
	public long sequenceNumber() {
		return sequenceNumber;
	}

	/**
	 * @return every committed marker, with the sequence number of the update that produced this state
	 */
	public MarkerSnapshot snapshot() {
		synchronized (registry) {
			List<InteractiveMarker> markers = new ArrayList<>(registry.size());
			registry.values().forEach(c -> markers.add(c.marker()));
			return new MarkerSnapshot(sequenceNumber, unmodifiableList(markers));
		}
	}

	private static String describe(@Nullable FeedbackType type) {
		return type == null ? "default" : type.toString();
	}

	@Override
	public String toString() {
		return "MarkerServer{" + topicNamespace + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MarkerServer.class);
}
