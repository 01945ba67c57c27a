package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A named alias for a primitive, such as a handle or an identifier type.
 */
public record PrimitiveDef(
	TypeId id,
	String name,
	String docs,
	Attributes attributes,
	PrimitiveKind kind
) implements TypeDef {
	public PrimitiveDef {
		requireNonNull(id);
		requireNonNull(name);
		requireNonNull(docs);
		requireNonNull(attributes);
		requireNonNull(kind);
	}

	public static PrimitiveDef of(String name, PrimitiveKind kind) {
		return new PrimitiveDef(TypeId.of(name), name, "", Attributes.NONE, kind);
	}

	@Override
	public List<MethodDef> methods() {
		return List.of();
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitPrimitive(this);
	}
}
