package works.tether.report;

import java.util.Comparator;
import org.jetbrains.annotations.Nullable;
import works.tether.exceptions.GenerationException;
import works.tether.ir.TypeId;

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;
import static java.util.Objects.requireNonNull;

/**
 * One error collected during a run.
 *
 * @param type the type being generated, or null for problems not tied to one type
 * @param method the method being generated, or null if the problem concerns the whole type
 */
public record Diagnostic(
	@Nullable TypeId type,
	@Nullable String method,
	ErrorKind kind,
	String message
) {
	public Diagnostic {
		requireNonNull(kind);
		requireNonNull(message);
	}

	public static Diagnostic of(TypeId type, @Nullable String method, GenerationException e) {
		return new Diagnostic(type, method, e.kind(), e.getMessage());
	}

	public static Diagnostic lowering(String message) {
		return new Diagnostic(null, null, ErrorKind.LOWERING_ERROR, message);
	}

	public String location() {
		if (type == null) {
			return "<registry>";
		} else if (method == null) {
			return type.toString();
		} else {
			return type + "." + method;
		}
	}

	@Override
	public String toString() {
		return location() + ": " + kind + ": " + message;
	}

	public static final Comparator<Diagnostic> ORDER =
		comparing(Diagnostic::type, nullsFirst(naturalOrder()))
			.thenComparing(Diagnostic::method, nullsFirst(naturalOrder()))
			.thenComparing(Diagnostic::kind)
			.thenComparing(Diagnostic::message);
}
