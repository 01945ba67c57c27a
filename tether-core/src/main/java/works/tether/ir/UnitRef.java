package works.tether.ir;

import java.util.List;

/**
 * The absence of a value: a {@code void} return, or an empty {@link FallibleRef} payload.
 */
public record UnitRef() implements TypeRef {
	public static final UnitRef UNIT = new UnitRef();

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitUnit(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of();
	}

	@Override
	public String toString() {
		return "()";
	}
}
