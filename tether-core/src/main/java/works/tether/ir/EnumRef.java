package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record EnumRef(TypeId target) implements TypeRef {
	public EnumRef {
		requireNonNull(target);
	}

	public static EnumRef of(TypeId target) {
		return new EnumRef(target);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitEnum(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of(target);
	}

	@Override
	public String toString() {
		return target.toString();
	}
}
