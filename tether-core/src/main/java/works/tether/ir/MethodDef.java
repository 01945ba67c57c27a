package works.tether.ir;

import java.util.List;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A method declared on an {@link OpaqueDef} or {@link StructDef}.
 *
 * @param self how the receiver is passed; {@link SelfKind#NONE} for static methods
 * @param returnType {@link UnitRef#UNIT} if nothing is returned
 */
public record MethodDef(
	String name,
	SelfKind self,
	List<ParamDef> params,
	TypeRef returnType,
	String docs,
	Attributes attributes
) {
	public MethodDef {
		requireNonNull(name);
		requireNonNull(self);
		params = List.copyOf(params);
		requireNonNull(returnType);
		requireNonNull(docs);
		requireNonNull(attributes);
	}

	public static MethodDef staticMethod(String name, TypeRef returnType, ParamDef... params) {
		return new MethodDef(name, SelfKind.NONE, List.of(params), returnType, "", Attributes.NONE);
	}

	public static MethodDef borrowing(String name, TypeRef returnType, ParamDef... params) {
		return new MethodDef(name, SelfKind.BORROWED, List.of(params), returnType, "", Attributes.NONE);
	}

	public static MethodDef consuming(String name, TypeRef returnType, ParamDef... params) {
		return new MethodDef(name, SelfKind.VALUE, List.of(params), returnType, "", Attributes.NONE);
	}

	public MethodDef withAttributes(Attributes attributes) {
		return new MethodDef(name, self, params, returnType, docs, attributes);
	}

	public MethodDef withDocs(String docs) {
		return new MethodDef(name, self, params, returnType, docs, attributes);
	}

	public boolean isStatic() {
		return self == SelfKind.NONE;
	}

	/**
	 * @return every type referenced by the parameters and the return type, in declaration order
	 */
	public List<TypeId> referencedTypes() {
		return Stream.concat(
				params.stream().map(ParamDef::type),
				Stream.of(returnType))
			.flatMap(t -> t.referencedTypes().stream())
			.toList();
	}
}
