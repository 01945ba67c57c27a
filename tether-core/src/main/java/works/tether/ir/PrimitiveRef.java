package works.tether.ir;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

public record PrimitiveRef(PrimitiveKind kind) implements TypeRef {
	public PrimitiveRef {
		requireNonNull(kind);
	}

	public static PrimitiveRef of(PrimitiveKind kind) {
		return INTERNED.get(kind);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitPrimitive(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of();
	}

	@Override
	public String toString() {
		return kind.irName();
	}

	private static final Map<PrimitiveKind, PrimitiveRef> INTERNED = new EnumMap<>(PrimitiveKind.class);

	static {
		for (PrimitiveKind kind: PrimitiveKind.values()) {
			INTERNED.put(kind, new PrimitiveRef(kind));
		}
	}
}
