package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A C-like enumeration. Each variant carries its native discriminant explicitly,
 * and the host representation must reproduce it exactly.
 */
public record EnumDef(
	TypeId id,
	String name,
	String docs,
	Attributes attributes,
	List<EnumVariant> variants
) implements TypeDef {
	public EnumDef {
		requireNonNull(id);
		requireNonNull(name);
		requireNonNull(docs);
		requireNonNull(attributes);
		variants = List.copyOf(variants);
	}

	public static EnumDef of(String name, EnumVariant... variants) {
		return new EnumDef(TypeId.of(name), name, "", Attributes.NONE, List.of(variants));
	}

	public EnumDef withAttributes(Attributes attributes) {
		return new EnumDef(id, name, docs, attributes, variants);
	}

	@Override
	public List<MethodDef> methods() {
		return List.of();
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitEnum(this);
	}
}
