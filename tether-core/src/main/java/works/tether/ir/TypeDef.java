package works.tether.ir;

import java.util.List;

/**
 * One exported declaration of the native library.
 * <p>
 * The set of variants is closed. Passes that need to handle every variant
 * should use {@link #accept} so that adding a variant breaks them at compile time.
 */
public sealed interface TypeDef permits OpaqueDef, StructDef, EnumDef, PrimitiveDef {
	TypeId id();

	/**
	 * @return the name used for native symbols and C declarations
	 */
	String name();

	String docs();

	Attributes attributes();

	/**
	 * @return declared methods; empty for variants that can't have any
	 */
	List<MethodDef> methods();

	<R> R accept(Visitor<R> visitor);

	default String kindName() {
		return accept(new Visitor<>() {
			@Override public String visitOpaque(OpaqueDef def) { return "opaque"; }
			@Override public String visitStruct(StructDef def) { return "struct"; }
			@Override public String visitEnum(EnumDef def) { return "enum"; }
			@Override public String visitPrimitive(PrimitiveDef def) { return "primitive"; }
		});
	}

	interface Visitor<R> {
		R visitOpaque(OpaqueDef def);
		R visitStruct(StructDef def);
		R visitEnum(EnumDef def);
		R visitPrimitive(PrimitiveDef def);
	}
}
