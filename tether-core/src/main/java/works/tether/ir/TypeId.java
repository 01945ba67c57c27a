package works.tether.ir;

import org.jetbrains.annotations.NotNull;

/**
 * Stable identifier of one {@link TypeDef} within a {@link TypeRegistry}.
 * <p>
 * Identifiers are opaque: nothing should be inferred from their contents.
 * They do, however, have a total order, which the generator uses
 * to make its output independent of registration order.
 */
public record TypeId(@NotNull String value) implements Comparable<TypeId> {
	public TypeId {
		if (value.isBlank()) {
			throw new IllegalArgumentException("TypeId can't be blank");
		}
	}

	public static TypeId of(String value) {
		return new TypeId(value);
	}

	@Override
	public int compareTo(TypeId other) {
		return value.compareTo(other.value);
	}

	@Override
	public String toString() {
		return value;
	}
}
