package works.tether.java;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import works.tether.abi.AbiSignature;
import works.tether.emit.EmissionContext;
import works.tether.emit.MethodPlan;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;
import works.tether.ownership.DestructorPlan;

/**
 * An opaque type becomes a final subclass of {@code NativeObject} whose
 * destructor is the type's {@code _destroy} entry point.
 * Its constructor is package-private: only generated code creates instances.
 */
final class OpaqueClassWriter extends UnitWriter {
	/**
	 * Members of {@code NativeObject} that methods must not hide.
	 */
	static final Set<String> INHERITED = Set.of(
		"pointer", "transferOwnership", "ownership", "isClosed", "close", "addressOf", "transferOf");

	OpaqueClassWriter(TypeUnit<JavaType> unit, EmissionContext context) {
		super(unit, context);
	}

	@Override
	void writeBody(SourceWriter out) {
		Set<String> reserved = new HashSet<>(INHERITED);
		reserved.addAll(JavaNames.OBJECT_METHODS);
		MethodWriter methods = new MethodWriter(unit, context.hostNames(), imports, reserved);
		DestructorPlan destructor = unit.destructor().orElseThrow();
		String host = unit.hostName();

		out.docComment(unit.def().docs());
		out.open("public final class " + host + " extends " + imports.use(MethodWriter.NATIVE_OBJECT));
		out.open(host + "(" + imports.use(JnaTypes.POINTER) + " pointer, "
			+ imports.use(MethodWriter.OWNERSHIP) + " ownership, Object... lifetimeEdges)");
		out.line("super(pointer, ownership, ABI::" + destructor.symbol() + ", lifetimeEdges);");
		out.close();
		methods.writeMethods(out);

		List<AbiSignature> signatures = new ArrayList<>();
		signatures.add(unit.destructorSignature().orElseThrow());
		unit.methods().stream().map(MethodPlan::signature).forEach(signatures::add);
		writeAbi(out, methods, signatures);
		out.close();
	}
}
