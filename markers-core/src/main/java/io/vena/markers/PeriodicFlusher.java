package io.vena.markers;

import io.vena.markers.MappedDiagnosticContext.MDCScope;
import java.io.Closeable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.markers.MappedDiagnosticContext.setupMDC;
import static java.lang.Thread.currentThread;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Houses a background thread that calls {@link MarkerServer#applyChanges()}
 * every {@link MarkerServerSettings#flushPeriodMS() flushPeriodMS} milliseconds,
 * for applications that stage changes from many places and don't want to
 * decide when to publish them.
 */
public class PeriodicFlusher implements Closeable {
	private final MarkerServer server;
	private final ScheduledExecutorService ex = Executors.newScheduledThreadPool(1);
	private volatile boolean isClosed = false;

	public PeriodicFlusher(MarkerServer server) {
		this.server = server;
		long periodMS = server.settings().flushPeriodMS();
		if (periodMS <= 0) {
			throw new IllegalArgumentException("flushPeriodMS must be positive: " + periodMS);
		}
		ex.scheduleWithFixedDelay(
			this::flushTick,
			periodMS,
			periodMS,
			MILLISECONDS
		);
	}

	public boolean isClosed() {
		return isClosed;
	}

	@Override
	public void close() {
		isClosed = true;
		ex.shutdownNow();
	}

	/**
	 * An exception escaping this method would cancel all future ticks, so we log it instead.
	 */
	private void flushTick() {
		String oldThreadName = currentThread().getName();
		currentThread().setName(getClass().getSimpleName() + " [" + server.topicNamespace() + "]");
		try (MDCScope __ = setupMDC(server.topicNamespace())) {
			if (isClosed) {
				LOGGER.debug("Flusher is closed; skipping tick");
				return;
			}
			try {
				server.applyChanges();
			} catch (RuntimeException e) {
				LOGGER.error("Periodic flush failed; will retry in {}ms", server.settings().flushPeriodMS(), e);
			}
		} finally {
			currentThread().setName(oldThreadName);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PeriodicFlusher.class);
}
