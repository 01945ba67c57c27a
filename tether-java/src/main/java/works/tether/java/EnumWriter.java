package works.tether.java;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.tether.emit.EmissionContext;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;
import works.tether.exceptions.NamingConflictException;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumVariant;

/**
 * An enum becomes a Java enum whose constants carry their native discriminants.
 */
final class EnumWriter extends UnitWriter {
	EnumWriter(TypeUnit<JavaType> unit, EmissionContext context) {
		super(unit, context);
	}

	@Override
	void writeBody(SourceWriter out) {
		EnumDef def = (EnumDef) unit.def();
		String host = unit.hostName();
		List<String> constants = constantNames(def);

		out.docComment(def.docs());
		out.open("public enum " + host);
		List<EnumVariant> variants = def.variants();
		if (variants.isEmpty()) {
			out.line(";");
		}
		for (int i = 0; i < variants.size(); i++) {
			EnumVariant variant = variants.get(i);
			out.docComment(variant.docs());
			String terminator = (i == variants.size() - 1) ? ";" : ",";
			out.line(constants.get(i) + "(" + variant.discriminant() + ")" + terminator);
		}
		out.line();
		out.line("private final int value;");
		out.line();
		out.open(host + "(int value)");
		out.line("this.value = value;");
		out.close();
		out.line();
		out.docComment("@return the native discriminant");
		out.open("public int value()");
		out.line("return value;");
		out.close();
		out.line();
		out.docComment("@throws IllegalArgumentException if no constant has the native discriminant {@code value}");
		out.open("public static " + host + " fromValue(int value)");
		out.open("for (" + host + " candidate: values())");
		out.open("if (candidate.value == value)");
		out.line("return candidate;");
		out.close();
		out.close();
		out.line("throw new IllegalArgumentException(\"No " + host + " has native value \" + value);");
		out.close();
		out.close();
	}

	private static List<String> constantNames(EnumDef def) {
		Map<String, String> variantByConstant = new HashMap<>();
		List<String> result = new ArrayList<>();
		for (EnumVariant variant: def.variants()) {
			String constant = JavaNames.constantCase(variant.name());
			String existing = variantByConstant.putIfAbsent(constant, variant.name());
			if (existing != null) {
				throw new NamingConflictException(constant, "Variants " + existing + " and " + variant.name()
					+ " of " + def.name() + " would both be called " + constant + " in Java");
			}
			result.add(constant);
		}
		return result;
	}
}
