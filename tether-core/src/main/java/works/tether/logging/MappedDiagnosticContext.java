package works.tether.logging;

import org.slf4j.MDC;
import works.tether.ir.TypeId;

/**
 * Tags log lines with the type being generated, so interleaved output from a parallel run stays readable.
 */
public final class MappedDiagnosticContext {
	public static final String MDC_TYPE = "tether.type";

	private MappedDiagnosticContext() { }

	/**
	 * Restores the previous value on {@link MDCScope#close() close},
	 * so scopes may nest.
	 */
	public static MDCScope setupMDC(TypeId type) {
		MDCScope result = new MDCScope(MDC.get(MDC_TYPE));
		MDC.put(MDC_TYPE, type.value());
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final String previous;

		MDCScope(String previous) {
			this.previous = previous;
		}

		@Override
		public void close() {
			if (previous == null) {
				MDC.remove(MDC_TYPE);
			} else {
				MDC.put(MDC_TYPE, previous);
			}
		}
	}
}
