package works.tether.java;

import java.util.SortedSet;
import java.util.TreeSet;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.EnumRef;
import works.tether.ir.FallibleRef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceRef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeRef;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;
import works.tether.mapping.MappingContext;
import works.tether.mapping.Position;
import works.tether.mapping.TypeMapper;

import static works.tether.mapping.Position.PARAM;
import static works.tether.mapping.Position.RETURN;

/**
 * Maps IR types to the Java types that generated bindings expose.
 * <p>
 * Unsigned integers keep the width of their native type, so a {@code u32}
 * is an {@code int} whose bits are reinterpreted; the {@code @Unsigned}
 * annotation says so. Pointer-sized integers are {@code long}, which only
 * matches the native width on 64-bit targets.
 */
public final class JavaTypeMapper implements TypeMapper<JavaType> {
	@Override
	public JavaType map(TypeRef type, Position position, MappingContext context) {
		return type.accept(new TypeRef.Visitor<>() {
			@Override
			public JavaType visitPrimitive(PrimitiveRef ref) {
				return primitive(type, ref.kind(), context);
			}

			@Override
			public JavaType visitOpaque(OpaqueRef ref) {
				return JavaType.reference(context.hostNames().nameOf(ref.target()));
			}

			@Override
			public JavaType visitStruct(StructRef ref) {
				return JavaType.reference(context.hostNames().nameOf(ref.target()));
			}

			@Override
			public JavaType visitEnum(EnumRef ref) {
				return JavaType.reference(context.hostNames().nameOf(ref.target()));
			}

			@Override
			public JavaType visitSlice(SliceRef ref) {
				return switch (ref.encoding()) {
					case UTF8, UTF16 -> JavaType.reference("String");
					case STRINGS -> JavaType.reference("String[]");
					case PRIMITIVE -> {
						if (ref.element() == PrimitiveKind.BOOL) {
							throw new UnsupportedTypeException(type, "Slices of bool have no agreed native representation");
						}
						yield JavaType.reference(primitive(type, ref.element(), context).name() + "[]");
					}
				};
			}

			@Override
			public JavaType visitWriteable(WriteableRef ref) {
				if (position == PARAM) {
					return JavaType.reference("WriteableBuffer", WRITEABLE_BUFFER);
				} else if (position == RETURN) {
					return JavaType.reference("String");
				}
				throw new UnsupportedTypeException(type, "Writeable can't be stored in a field");
			}

			@Override
			public JavaType visitNullable(NullableRef ref) {
				TypeRef inner = ref.inner();
				if (inner instanceof NullableRef || inner instanceof FallibleRef
					|| inner instanceof WriteableRef || inner instanceof UnitRef) {
					throw new UnsupportedTypeException(type, "Unsupported nullable type");
				}
				return inner.accept(this).asNullable();
			}

			@Override
			public JavaType visitFallible(FallibleRef ref) {
				if (position != RETURN) {
					throw new UnsupportedTypeException(type, "Fallible is only allowed as a return type");
				}
				JavaType ok = payload(ref.ok(), true);
				JavaType err = payload(ref.err(), false);
				SortedSet<String> imports = new TreeSet<>(ok.imports());
				imports.addAll(err.imports());
				imports.add(RESULT);
				String name = "Result<" + ok.boxed() + ", " + err.boxed() + ">";
				return new JavaType(name, name, imports, false, false);
			}

			@Override
			public JavaType visitUnit(UnitRef ref) {
				if (position != RETURN) {
					throw new UnsupportedTypeException(type, "Unit is only allowed as a return type");
				}
				return JavaType.VOID;
			}

			private JavaType payload(TypeRef payload, boolean success) {
				if (payload instanceof NullableRef || payload instanceof FallibleRef) {
					throw new UnsupportedTypeException(type, "Fallible payloads can't be nullable or fallible");
				}
				if (payload instanceof WriteableRef && !success) {
					throw new UnsupportedTypeException(type, "Writeable is not supported as an error payload");
				}
				JavaType result = payload.accept(this);
				// Annotations don't survive as type arguments
				SortedSet<String> imports = new TreeSet<>(result.imports());
				imports.remove(JavaType.NULLABLE);
				imports.remove(JavaType.UNSIGNED);
				return new JavaType(result.boxed(), result.boxed(), imports, false, false);
			}
		});
	}

	static JavaType primitive(TypeRef whole, PrimitiveKind kind, MappingContext context) {
		JavaType result = switch (kind) {
			case BOOL -> JavaType.primitive("boolean", "Boolean");
			// A code point
			case CHAR -> JavaType.primitive("int", "Integer");
			case I8, U8 -> JavaType.primitive("byte", "Byte");
			case I16, U16 -> JavaType.primitive("short", "Short");
			case I32, U32 -> JavaType.primitive("int", "Integer");
			case I64, U64 -> JavaType.primitive("long", "Long");
			case ISIZE, USIZE -> {
				if (context.config().pointerWidth() != 64) {
					throw new UnsupportedTypeException(whole, "Pointer-sized integers are only supported on 64-bit targets");
				}
				yield JavaType.primitive("long", "Long");
			}
			case F32 -> JavaType.primitive("float", "Float");
			case F64 -> JavaType.primitive("double", "Double");
		};
		return kind.isUnsignedInteger() ? result.asUnsigned() : result;
	}

	static final String RESULT = "works.tether.runtime.Result";
	static final String WRITEABLE_BUFFER = "works.tether.runtime.WriteableBuffer";
}
