package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A type whose representation is hidden, crossing the boundary only as a pointer.
 * Every opaque type gets a destructor entry point in addition to its methods.
 */
public record OpaqueDef(
	TypeId id,
	String name,
	String docs,
	Attributes attributes,
	List<MethodDef> methods
) implements TypeDef {
	public OpaqueDef {
		requireNonNull(id);
		requireNonNull(name);
		requireNonNull(docs);
		requireNonNull(attributes);
		methods = List.copyOf(methods);
	}

	public static OpaqueDef of(String name, MethodDef... methods) {
		return new OpaqueDef(TypeId.of(name), name, "", Attributes.NONE, List.of(methods));
	}

	public OpaqueDef withAttributes(Attributes attributes) {
		return new OpaqueDef(id, name, docs, attributes, methods);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitOpaque(this);
	}
}
