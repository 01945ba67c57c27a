package works.tether.java;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.tether.abi.AbiType;
import works.tether.emit.EmissionContext;
import works.tether.emit.FieldPlan;
import works.tether.emit.MethodPlan;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;
import works.tether.exceptions.NamingConflictException;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.EnumRef;
import works.tether.ir.FieldDef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeRef;

/**
 * A struct becomes a record, copied to and from a nested JNA {@code Layout}
 * whose fields mirror the C declaration in order.
 * <p>
 * Opaque fields only ever borrow, so the wrappers built from them never destroy anything.
 */
final class StructRecordWriter extends UnitWriter {
	/**
	 * Methods every generated record declares.
	 */
	static final Set<String> DECLARED = Set.of("toByValue", "toByReference", "fill", "fromLayout");

	StructRecordWriter(TypeUnit<JavaType> unit, EmissionContext context) {
		super(unit, context);
	}

	@Override
	void writeBody(SourceWriter out) {
		StructDef def = (StructDef) unit.def();
		if (unit.fields().isEmpty()) {
			throw new UnsupportedTypeException(StructRef.byValue(def.id()), "JNA can't represent a struct without fields");
		}
		Set<String> reserved = new HashSet<>(DECLARED);
		reserved.addAll(JavaNames.OBJECT_METHODS);
		List<String> names = componentNames(def, reserved);
		reserved.addAll(names);
		MethodWriter methods = new MethodWriter(unit, context.hostNames(), imports, reserved);
		String host = unit.hostName();

		List<String> components = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			JavaType type = unit.fields().get(i).host();
			imports.addAll(type.imports());
			components.add(type.declaration() + " " + names.get(i));
		}

		out.docComment(recordDocs(def, names));
		out.open("public record " + host + "(" + String.join(", ", components) + ")");
		out.open("public Layout.ByValue toByValue()");
		out.line("Layout.ByValue result = new Layout.ByValue();");
		out.line("fill(result);");
		out.line("return result;");
		out.close();
		out.line();
		out.open("public Layout.ByReference toByReference()");
		out.line("Layout.ByReference result = new Layout.ByReference();");
		out.line("fill(result);");
		out.line("return result;");
		out.close();
		out.line();
		out.open("void fill(Layout layout)");
		for (int i = 0; i < names.size(); i++) {
			out.line(fill(unit.fields().get(i), names.get(i)));
		}
		out.close();
		out.line();
		out.open("static " + host + " fromLayout(Layout layout)");
		out.line("return new " + host + "(");
		out.indent();
		for (int i = 0; i < names.size(); i++) {
			String terminator = (i == names.size() - 1) ? ");" : ",";
			out.line(fromLayout(unit.fields().get(i), names.get(i)) + terminator);
		}
		out.outdent();
		out.close();
		methods.writeMethods(out);

		writeLayout(out, methods.jnaTypes(), names);
		writeAbi(out, methods, unit.methods().stream().map(MethodPlan::signature).toList());
		out.close();
	}

	private void writeLayout(SourceWriter out, JnaTypes jna, List<String> names) {
		String structure = imports.use("com.sun.jna.Structure");
		out.line();
		List<String> quoted = names.stream().map(UnitWriter::stringLiteral).toList();
		out.line("@" + structure + ".FieldOrder({" + String.join(", ", quoted) + "})");
		out.open("public static class Layout extends " + structure);
		for (int i = 0; i < names.size(); i++) {
			AbiType abi = unit.fields().get(i).abi();
			String type = (abi instanceof AbiType.StructValue s) ? jna.layoutOf(s) : jna.render(abi);
			out.line("public " + type + " " + names.get(i) + ";");
		}
		out.line();
		out.open("public static class ByValue extends Layout implements " + structure + ".ByValue");
		out.close();
		out.line();
		out.open("public static class ByReference extends Layout implements " + structure + ".ByReference");
		out.close();
		out.close();
	}

	private String fill(FieldPlan<JavaType> field, String name) {
		TypeRef type = field.field().type();
		if (type instanceof PrimitiveRef p && p.kind() == PrimitiveKind.BOOL) {
			return "layout." + name + " = this." + name + " ? (byte) 1 : (byte) 0;";
		} else if (type instanceof EnumRef) {
			return "layout." + name + " = this." + name + ".value();";
		} else if (type instanceof StructRef) {
			return "this." + name + ".fill(layout." + name + ");";
		} else if (type instanceof OpaqueRef || type instanceof NullableRef) {
			return "layout." + name + " = " + imports.use(MethodWriter.NATIVE_OBJECT) + ".addressOf(this." + name + ");";
		}
		return "layout." + name + " = this." + name + ";";
	}

	private String fromLayout(FieldPlan<JavaType> field, String name) {
		TypeRef type = field.field().type();
		String value = "layout." + name;
		if (type instanceof PrimitiveRef p && p.kind() == PrimitiveKind.BOOL) {
			return value + " != 0";
		} else if (type instanceof EnumRef e) {
			return context.hostNames().nameOf(e.target()) + ".fromValue(" + value + ")";
		} else if (type instanceof StructRef s) {
			return context.hostNames().nameOf(s.target()) + ".fromLayout(" + value + ")";
		} else if (type instanceof OpaqueRef o) {
			return borrowed(o, value);
		} else if (type instanceof NullableRef n && n.inner() instanceof OpaqueRef o) {
			return value + " == null ? null : " + borrowed(o, value);
		}
		return value;
	}

	private String borrowed(OpaqueRef type, String pointer) {
		return "new " + context.hostNames().nameOf(type.target()) + "(" + pointer + ", "
			+ imports.use(MethodWriter.OWNERSHIP) + ".BORROWED)";
	}

	private static List<String> componentNames(StructDef def, Set<String> reserved) {
		Map<String, String> fieldByName = new HashMap<>();
		List<String> result = new ArrayList<>();
		for (FieldDef field: def.fields()) {
			String name = JavaNames.avoiding(JavaNames.camelCase(field.name()), reserved);
			String existing = fieldByName.putIfAbsent(name, field.name());
			if (existing != null) {
				throw new NamingConflictException(name, "Fields " + existing + " and " + field.name()
					+ " of " + def.name() + " would both be called " + name + " in Java");
			}
			result.add(name);
		}
		return result;
	}

	private static String recordDocs(StructDef def, List<String> names) {
		List<String> params = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			String docs = def.fields().get(i).docs().strip();
			if (!docs.isEmpty()) {
				params.add("@param " + names.get(i) + " " + docs);
			}
		}
		String description = def.docs().strip();
		if (params.isEmpty() || description.isEmpty()) {
			return description + String.join("\n", params);
		}
		return description + "\n\n" + String.join("\n", params);
	}
}
