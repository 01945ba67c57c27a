package works.tether.java;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.tether.abi.AbiParam;
import works.tether.abi.AbiSignature;
import works.tether.emit.MethodPlan;
import works.tether.emit.ParamPlan;
import works.tether.emit.SourceWriter;
import works.tether.emit.TypeUnit;
import works.tether.exceptions.NamingConflictException;
import works.tether.ir.EnumRef;
import works.tether.ir.FallibleRef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceEncoding;
import works.tether.ir.SliceRef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeRef;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;
import works.tether.mapping.HostNames;
import works.tether.ownership.ReturnOwnership;
import works.tether.ownership.Transfer;

/**
 * Writes the Java side of each method of one unit:
 * a public method callers use, and its declaration in the unit's {@code Abi} interface.
 * <p>
 * The public method converts its arguments to native slots, allocates
 * whatever the return convention needs, calls the entry point once,
 * and converts the result back. Locals get a trailing underscore
 * so they don't shadow parameters.
 */
final class MethodWriter {
	private final TypeUnit<JavaType> unit;
	private final HostNames hostNames;
	private final Imports imports;
	private final JnaTypes jna;
	private final Map<MethodPlan<JavaType>, String> javaNames = new LinkedHashMap<>();

	/**
	 * @param reservedMembers names the unit already declares or inherits
	 * @throws NamingConflictException if two methods would get the same Java name
	 */
	MethodWriter(TypeUnit<JavaType> unit, HostNames hostNames, Imports imports, Set<String> reservedMembers) {
		this.unit = unit;
		this.hostNames = hostNames;
		this.imports = imports;
		this.jna = new JnaTypes(hostNames, imports);
		Map<String, String> irNameByJavaName = new HashMap<>();
		for (MethodPlan<JavaType> plan: unit.methods()) {
			String javaName = JavaNames.avoiding(JavaNames.camelCase(plan.name()), reservedMembers);
			String existing = irNameByJavaName.putIfAbsent(javaName, plan.name());
			if (existing != null) {
				throw new NamingConflictException(javaName, "Methods " + existing + " and " + plan.name()
					+ " of " + unit.def().name() + " would both be called " + javaName + " in Java");
			}
			javaNames.put(plan, javaName);
		}
	}

	JnaTypes jnaTypes() {
		return jna;
	}

	void writeMethods(SourceWriter out) {
		javaNames.forEach((plan, name) -> {
			out.line();
			new Call(plan, name).write(out);
		});
	}

	void writeAbiDeclaration(SourceWriter out, AbiSignature signature) {
		List<String> params = new ArrayList<>();
		for (AbiParam param: signature.params()) {
			params.add(jna.render(param.type()) + " " + JavaNames.escape(param.name()));
		}
		out.line(jna.render(signature.returnType()) + " " + signature.symbol() + "(" + String.join(", ", params) + ");");
	}

	/**
	 * The code generation state for one method.
	 */
	private final class Call {
		final MethodPlan<JavaType> plan;
		final String javaName;
		final Set<String> locals = new HashSet<>();
		final Map<String, String> paramNames = new HashMap<>();
		final List<String> statements = new ArrayList<>();
		final List<String> arguments = new ArrayList<>();

		Call(MethodPlan<JavaType> plan, String javaName) {
			this.plan = plan;
			this.javaName = javaName;
		}

		void write(SourceWriter out) {
			List<String> declarations = new ArrayList<>();
			for (ParamPlan<JavaType> param: plan.params()) {
				String name = claim(JavaNames.camelCase(param.name()));
				paramNames.put(param.name(), name);
				imports.addAll(param.mapping().host().imports());
				declarations.add(param.mapping().host().declaration() + " " + name);
			}
			JavaType returns = plan.returns().host();
			imports.addAll(returns.imports());

			if (!plan.method().isStatic()) {
				arguments.add(receiver());
			}
			for (ParamPlan<JavaType> param: plan.params()) {
				addArguments(param);
			}
			for (AbiParam hidden: plan.signature().hiddenParams()) {
				String local = claim(hiddenLocal(hidden));
				String type = jna.render(hidden.type());
				statements.add(type + " " + local + " = new " + type + "();");
				arguments.add(local);
			}

			out.docComment(plan.method().docs());
			String modifiers = plan.method().isStatic() ? "public static " : "public ";
			out.open(modifiers + returns.declaration() + " " + javaName + "(" + String.join(", ", declarations) + ")");
			statements.forEach(out::line);
			writeReturn(out, "ABI." + plan.signature().symbol() + "(" + String.join(", ", arguments) + ")");
			out.close();
		}

		private String claim(String name) {
			if (!locals.add(name)) {
				throw new NamingConflictException(name, "Method " + unit.def().name() + "." + plan.name()
					+ " would use the Java name " + name + " twice");
			}
			return name;
		}

		private String receiver() {
			if (unit.def() instanceof OpaqueDef) {
				return plan.ownership().consumesSelf() ? "transferOwnership()" : "pointer()";
			}
			return "toByValue()";
		}

		private String hiddenLocal(AbiParam hidden) {
			return switch (hidden.role()) {
				case OUT_VALUE -> "out_";
				case OUT_OK -> "okOut_";
				case OUT_ERR -> "errOut_";
				case RETURN_SINK -> "write_";
				default -> throw new IllegalStateException("Unexpected hidden slot " + hidden);
			};
		}

		private void addArguments(ParamPlan<JavaType> param) {
			String name = paramNames.get(param.name());
			TypeRef type = param.param().type();
			boolean nullable = type instanceof NullableRef;
			TypeRef inner = nullable ? ((NullableRef) type).inner() : type;
			String lengthOf = name;
			for (AbiParam slot: param.mapping().slots()) {
				switch (slot.role()) {
					case VALUE -> arguments.add(value(inner, name, nullable, param.transfer()));
					case SLICE_DATA -> {
						SliceRef slice = (SliceRef) inner;
						if (slice.encoding() == SliceEncoding.PRIMITIVE) {
							arguments.add(name);
						} else {
							String encoded = claim(name + "_");
							statements.add(encoding(slice) + " " + encoded + " = "
								+ imports.use(SLICES) + "." + encoder(slice) + "(" + name + ");");
							arguments.add(encoded);
							if (slice.encoding() != SliceEncoding.STRINGS) {
								lengthOf = encoded;
							}
						}
					}
					case SLICE_LENGTH -> arguments.add(imports.use(SLICES) + ".length(" + lengthOf + ")");
					case PRESENCE -> arguments.add(name + " == null ? (byte) 0 : (byte) 1");
					case WRITEABLE -> arguments.add(name);
					default -> throw new IllegalStateException("Unexpected slot " + slot + " for parameter " + param.name());
				}
			}
		}

		private String value(TypeRef type, String name, boolean nullable, Transfer transfer) {
			if (type instanceof PrimitiveRef p) {
				String converted = (p.kind() == PrimitiveKind.BOOL)
					? "(" + name + " ? (byte) 1 : (byte) 0)"
					: name;
				return nullable ? name + " == null ? " + zero(p.kind()) + " : " + converted : converted;
			} else if (type instanceof EnumRef) {
				return nullable ? name + " == null ? 0 : " + name + ".value()" : name + ".value()";
			} else if (type instanceof OpaqueRef) {
				if (transfer == Transfer.MOVE) {
					return nullable ? nativeObject() + ".transferOf(" + name + ")" : name + ".transferOwnership()";
				}
				return nullable ? nativeObject() + ".addressOf(" + name + ")" : name + ".pointer()";
			} else if (type instanceof StructRef s) {
				if (s.byReference()) {
					return name + ".toByReference()";
				}
				return nullable
					? name + " == null ? new " + hostNames.nameOf(s.target()) + ".Layout.ByValue() : " + name + ".toByValue()"
					: name + ".toByValue()";
			}
			throw new IllegalStateException("Unexpected value parameter type " + type);
		}

		private void writeReturn(SourceWriter out, String call) {
			TypeRef type = plan.method().returnType();
			switch (plan.signature().convention()) {
				case VOID -> out.line(call + ";");
				case DIRECT -> writeDirect(out, type, call);
				case OUT_PARAM -> {
					out.line(call + ";");
					if (type instanceof NullableRef n) {
						out.line("return out_.isPresent() ? " + readOut(n.inner(), "out_", plan.ownership().returns()) + " : null;");
					} else {
						out.line("return " + readOut(type, "out_", plan.ownership().returns()) + ";");
					}
				}
				case WRITEABLE -> {
					out.line(call + ";");
					out.line("return write_.contents();");
				}
				case PRESENCE_FLAG -> {
					out.open("if (" + call + " == 0)");
					out.line("return null;");
					out.close();
					out.line("return " + readOut(((NullableRef) type).inner(), "out_", plan.ownership().returns()) + ";");
				}
				case DISCRIMINANT -> writeDiscriminant(out, (FallibleRef) type, call);
			}
		}

		private void writeDirect(SourceWriter out, TypeRef type, String call) {
			boolean nullable = type instanceof NullableRef;
			TypeRef inner = nullable ? ((NullableRef) type).inner() : type;
			if (inner instanceof OpaqueRef o) {
				String local = claim("ret_");
				out.line(imports.use(JnaTypes.POINTER) + " " + local + " = " + call + ";");
				if (nullable) {
					out.open("if (" + local + " == null)");
					out.line("return null;");
					out.close();
				}
				out.line("return " + wrap(o, local, plan.ownership().returns()) + ";");
			} else if (inner instanceof PrimitiveRef p) {
				out.line("return " + (p.kind() == PrimitiveKind.BOOL ? call + " != 0" : call) + ";");
			} else if (inner instanceof EnumRef e) {
				out.line("return " + hostNames.nameOf(e.target()) + ".fromValue(" + call + ");");
			} else if (inner instanceof StructRef s) {
				out.line("return " + hostNames.nameOf(s.target()) + ".fromLayout(" + call + ");");
			} else {
				throw new IllegalStateException("Unexpected direct return type " + type);
			}
		}

		private void writeDiscriminant(SourceWriter out, FallibleRef type, String call) {
			String ok;
			if (type.ok() instanceof UnitRef) {
				ok = "null";
			} else if (type.ok() instanceof WriteableRef) {
				ok = "write_.contents()";
			} else {
				ok = readOut(type.ok(), "okOut_", plan.ownership().returns());
			}
			String err = (type.err() instanceof UnitRef)
				? "null"
				: readOut(type.err(), "errOut_", plan.ownership().error());
			String result = imports.use(JavaTypeMapper.RESULT);
			out.open("if (" + call + " != 0)");
			out.line("return " + result + ".ok(" + ok + ");");
			out.close();
			out.line("return " + result + ".err(" + err + ");");
		}

		/**
		 * @return an expression for the value native code wrote through {@code local}
		 */
		private String readOut(TypeRef payload, String local, ReturnOwnership ownership) {
			if (payload instanceof PrimitiveRef p) {
				return (p.kind() == PrimitiveKind.BOOL) ? local + ".getValue() != 0" : local + ".getValue()";
			} else if (payload instanceof EnumRef e) {
				return hostNames.nameOf(e.target()) + ".fromValue(" + local + ".getValue())";
			} else if (payload instanceof OpaqueRef o) {
				return wrap(o, local + ".getValue()", ownership);
			} else if (payload instanceof StructRef s) {
				return hostNames.nameOf(s.target()) + ".fromLayout(" + local + ")";
			} else if (payload instanceof SliceRef s) {
				return imports.use(SLICES) + "." + decoder(s) + "(" + local + ")";
			}
			throw new IllegalStateException("Unexpected out payload " + payload);
		}

		private String wrap(OpaqueRef type, String pointer, ReturnOwnership ownership) {
			StringBuilder sb = new StringBuilder("new ")
				.append(hostNames.nameOf(type.target()))
				.append("(").append(pointer).append(", ")
				.append(imports.use(OWNERSHIP));
			if (ownership == ReturnOwnership.BORROWED) {
				sb.append(".BORROWED");
				for (String edge: plan.ownership().lifetimeEdges()) {
					sb.append(", ").append(edge.equals("self") ? "this" : paramNames.get(edge));
				}
			} else {
				sb.append(".OWNED");
			}
			return sb.append(")").toString();
		}

		private String nativeObject() {
			return imports.use(NATIVE_OBJECT);
		}
	}

	private static String zero(PrimitiveKind kind) {
		return switch (JnaTypes.scalar(kind)) {
			case "byte" -> "(byte) 0";
			case "short" -> "(short) 0";
			case "long" -> "0L";
			case "float" -> "0f";
			case "double" -> "0d";
			default -> "0";
		};
	}

	private String encoding(SliceRef slice) {
		return switch (slice.encoding()) {
			case UTF8 -> "byte[]";
			case UTF16 -> "short[]";
			case STRINGS -> imports.use(UTF8_STRINGS);
			case PRIMITIVE -> throw new IllegalArgumentException("Primitive slices aren't encoded: " + slice);
		};
	}

	private static String encoder(SliceRef slice) {
		return switch (slice.encoding()) {
			case UTF8 -> "encodeUtf8";
			case UTF16 -> "encodeUtf16";
			case STRINGS -> "encodeStrings";
			case PRIMITIVE -> throw new IllegalArgumentException("Primitive slices aren't encoded: " + slice);
		};
	}

	private static String decoder(SliceRef slice) {
		return switch (slice.encoding()) {
			case UTF8 -> "decodeUtf8";
			case UTF16 -> "decodeUtf16";
			case STRINGS -> "decodeStrings";
			case PRIMITIVE -> JnaTypes.scalar(slice.element()) + "s";
		};
	}

	static final String NATIVE_OBJECT = "works.tether.runtime.NativeObject";
	static final String OWNERSHIP = "works.tether.runtime.Ownership";
	static final String SLICES = "works.tether.runtime.Slices";
	static final String UTF8_STRINGS = "works.tether.runtime.Utf8Strings";
}
