package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @param byReference whether the struct is passed as a pointer to a caller-owned copy
 */
public record StructRef(TypeId target, boolean byReference) implements TypeRef {
	public StructRef {
		requireNonNull(target);
	}

	public static StructRef byValue(TypeId target) {
		return new StructRef(target, false);
	}

	public static StructRef byReference(TypeId target) {
		return new StructRef(target, true);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitStruct(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of(target);
	}

	@Override
	public String toString() {
		return (byReference ? "&" : "") + target;
	}
}
