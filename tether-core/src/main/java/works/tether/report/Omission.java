package works.tether.report;

import java.util.Comparator;
import org.jetbrains.annotations.Nullable;
import works.tether.ir.TypeId;

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;

/**
 * Something left out of the output on purpose, because its attributes disable it.
 * Omissions are not errors and never affect {@link GenerationResult#isSuccess()}.
 *
 * @param method null if the whole type was omitted
 */
public record Omission(TypeId type, @Nullable String method, String reason) {
	@Override
	public String toString() {
		return (method == null ? type.toString() : type + "." + method) + " omitted: " + reason;
	}

	public static final Comparator<Omission> ORDER =
		comparing(Omission::type)
			.thenComparing(Omission::method, nullsFirst(naturalOrder()));
}
