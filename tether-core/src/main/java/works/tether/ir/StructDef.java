package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A plain aggregate that is copied by value across the boundary.
 */
public record StructDef(
	TypeId id,
	String name,
	String docs,
	Attributes attributes,
	List<FieldDef> fields,
	List<MethodDef> methods
) implements TypeDef {
	public StructDef {
		requireNonNull(id);
		requireNonNull(name);
		requireNonNull(docs);
		requireNonNull(attributes);
		fields = List.copyOf(fields);
		methods = List.copyOf(methods);
	}

	public static StructDef of(String name, List<FieldDef> fields, MethodDef... methods) {
		return new StructDef(TypeId.of(name), name, "", Attributes.NONE, fields, List.of(methods));
	}

	public StructDef withAttributes(Attributes attributes) {
		return new StructDef(id, name, docs, attributes, fields, methods);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitStruct(this);
	}
}
