package works.tether.java;

import java.util.List;
import works.tether.abi.AbiSignature;
import works.tether.emit.EmissionContext;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;

/**
 * Writes one Java compilation unit.
 * The body is written first so that the imports it uses are known by the time the header is.
 */
abstract class UnitWriter {
	final TypeUnit<JavaType> unit;
	final EmissionContext context;
	final String packageName;
	final Imports imports;

	UnitWriter(TypeUnit<JavaType> unit, EmissionContext context) {
		this.unit = unit;
		this.context = context;
		this.packageName = context.config().hostPackage();
		this.imports = new Imports(packageName);
	}

	final String write() {
		SourceWriter body = new SourceWriter();
		writeBody(body);
		SourceWriter out = new SourceWriter()
			.line("// Generated by tether from " + unit.def().name() + ". Do not edit.")
			.line("package " + packageName + ";")
			.line();
		imports.writeTo(out);
		return out + body.toString();
	}

	abstract void writeBody(SourceWriter out);

	/**
	 * Writes the nested {@code Abi} interface and the {@code ABI} field that loads it.
	 * Units without native entry points get neither.
	 */
	void writeAbi(SourceWriter out, MethodWriter methods, List<AbiSignature> signatures) {
		if (signatures.isEmpty()) {
			return;
		}
		out.line();
		out.open("interface Abi extends " + imports.use("com.sun.jna.Library"));
		for (int i = 0; i < signatures.size(); i++) {
			if (i > 0) {
				out.line();
			}
			methods.writeAbiDeclaration(out, signatures.get(i));
		}
		out.close();
		out.line();
		out.line("private static final Abi ABI = " + imports.use(BINDINGS) + ".load("
			+ stringLiteral(context.config().libraryName()) + ", Abi.class);");
	}

	static String stringLiteral(String value) {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	static final String BINDINGS = "works.tether.runtime.Bindings";
}
