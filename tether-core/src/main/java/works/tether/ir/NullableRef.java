package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record NullableRef(TypeRef inner) implements TypeRef {
	public NullableRef {
		requireNonNull(inner);
	}

	public static NullableRef of(TypeRef inner) {
		return new NullableRef(inner);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitNullable(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return inner.referencedTypes();
	}

	@Override
	public String toString() {
		return "Option<" + inner + ">";
	}
}
