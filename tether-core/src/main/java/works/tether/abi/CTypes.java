package works.tether.abi;

import java.util.List;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.SliceEncoding;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;

import static java.util.stream.Collectors.joining;

/**
 * Renders {@link AbiType}s and {@link AbiSignature}s as C source.
 */
public final class CTypes {
	public static final String SLICE_TYPE = "TetherSlice";
	public static final String STRING_VIEW_TYPE = "TetherStringView";
	public static final String WRITE_TYPE = "TetherWrite";

	private final TypeRegistry registry;

	public CTypes(TypeRegistry registry) {
		this.registry = registry;
	}

	public static String primitive(PrimitiveKind kind) {
		return switch (kind) {
			case BOOL -> "bool";
			case CHAR -> "uint32_t";
			case I8 -> "int8_t";
			case U8 -> "uint8_t";
			case I16 -> "int16_t";
			case U16 -> "uint16_t";
			case I32 -> "int32_t";
			case U32 -> "uint32_t";
			case I64 -> "int64_t";
			case U64 -> "uint64_t";
			case ISIZE -> "intptr_t";
			case USIZE -> "size_t";
			case F32 -> "float";
			case F64 -> "double";
		};
	}

	public String typeName(AbiType type) {
		return type.accept(new Renderer());
	}

	public String declaration(AbiParam param) {
		return typeName(param.type()) + " " + param.name();
	}

	/**
	 * @return the prototype, without the trailing semicolon
	 */
	public String prototype(AbiSignature signature) {
		List<AbiParam> params = signature.params();
		String paramList = params.isEmpty()
			? "void"
			: params.stream().map(this::declaration).collect(joining(", "));
		return typeName(signature.returnType()) + " " + signature.symbol() + "(" + paramList + ")";
	}

	private String nameOf(TypeId id) {
		return registry.resolve(id).name();
	}

	private final class Renderer implements AbiType.Visitor<String> {
		@Override
		public String visitScalar(AbiType.Scalar type) {
			return primitive(type.kind());
		}

		@Override
		public String visitEnumValue(AbiType.EnumValue type) {
			return nameOf(type.target());
		}

		@Override
		public String visitOpaquePointer(AbiType.OpaquePointer type) {
			return nameOf(type.target()) + "*";
		}

		@Override
		public String visitStructValue(AbiType.StructValue type) {
			return nameOf(type.target());
		}

		@Override
		public String visitStructPointer(AbiType.StructPointer type) {
			return "const " + nameOf(type.target()) + "*";
		}

		@Override
		public String visitSliceData(AbiType.SliceData type) {
			return "const " + elementName(type.encoding(), type.element()) + "*";
		}

		@Override
		public String visitLength(AbiType.Length type) {
			return "size_t";
		}

		@Override
		public String visitFlag(AbiType.Flag type) {
			return "bool";
		}

		@Override
		public String visitSliceView(AbiType.SliceView type) {
			return SLICE_TYPE;
		}

		@Override
		public String visitWriteable(AbiType.Writeable type) {
			return WRITE_TYPE + "*";
		}

		@Override
		public String visitOutPointer(AbiType.OutPointer type) {
			return type.pointee().accept(this) + "*";
		}

		@Override
		public String visitVoid(AbiType.VoidType type) {
			return "void";
		}
	}

	static String elementName(SliceEncoding encoding, PrimitiveKind element) {
		return switch (encoding) {
			case PRIMITIVE -> primitive(element);
			case UTF8 -> "uint8_t";
			case UTF16 -> "uint16_t";
			case STRINGS -> STRING_VIEW_TYPE;
		};
	}
}
