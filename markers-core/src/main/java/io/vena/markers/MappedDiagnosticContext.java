package io.vena.markers;

import org.slf4j.MDC;

import static io.vena.markers.MdcKeys.MARKER;
import static io.vena.markers.MdcKeys.NAMESPACE;

final class MappedDiagnosticContext {

	static MDCScope setupMDC(String namespace) {
		MDCScope result = new MDCScope();
		MDC.put(NAMESPACE, namespace);
		return result;
	}

	static MDCScope setupMDC(String namespace, String markerName) {
		MDCScope result = new MDCScope();
		MDC.put(NAMESPACE, namespace);
		MDC.put(MARKER, markerName);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these. A feedback handler that calls back into
	 * the server relies on this.
	 *
	 * <p>
	 * Use this in a try block with no catch or finally clause:
	 * those run after {@link #close()}, outside the diagnostic context.
	 */
	static final class MDCScope implements AutoCloseable {
		final String oldNamespace = MDC.get(NAMESPACE);
		final String oldMarker = MDC.get(MARKER);

		@Override public void close() {
			restore(NAMESPACE, oldNamespace);
			restore(MARKER, oldMarker);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}

}
