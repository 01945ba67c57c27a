package works.tether.java;

import works.tether.abi.AbiType;
import works.tether.ir.PrimitiveKind;
import works.tether.mapping.HostNames;

/**
 * Renders native slots as the Java types JNA marshals them from.
 * These appear only in the generated {@code Abi} interfaces.
 */
final class JnaTypes implements AbiType.Visitor<String> {
	private final HostNames hostNames;
	private final Imports imports;

	JnaTypes(HostNames hostNames, Imports imports) {
		this.hostNames = hostNames;
		this.imports = imports;
	}

	String render(AbiType type) {
		return type.accept(this);
	}

	/**
	 * {@code bool} is a single byte in C, but JNA marshals Java {@code boolean} as a four-byte int.
	 */
	static String scalar(PrimitiveKind kind) {
		return switch (kind) {
			case BOOL, I8, U8 -> "byte";
			case I16, U16 -> "short";
			case CHAR, I32, U32 -> "int";
			case I64, U64, ISIZE, USIZE -> "long";
			case F32 -> "float";
			case F64 -> "double";
		};
	}

	/**
	 * @return the {@code com.sun.jna.ptr} class that receives a scalar through an out pointer
	 */
	static String byReference(PrimitiveKind kind) {
		String scalar = scalar(kind);
		return "com.sun.jna.ptr." + Character.toUpperCase(scalar.charAt(0)) + scalar.substring(1) + "ByReference";
	}

	String layoutOf(AbiType.StructValue type) {
		return hostNames.nameOf(type.target()) + ".Layout";
	}

	@Override
	public String visitScalar(AbiType.Scalar type) {
		return scalar(type.kind());
	}

	@Override
	public String visitEnumValue(AbiType.EnumValue type) {
		return "int";
	}

	@Override
	public String visitOpaquePointer(AbiType.OpaquePointer type) {
		return imports.use(POINTER);
	}

	@Override
	public String visitStructValue(AbiType.StructValue type) {
		return hostNames.nameOf(type.target()) + ".Layout.ByValue";
	}

	@Override
	public String visitStructPointer(AbiType.StructPointer type) {
		return hostNames.nameOf(type.target()) + ".Layout.ByReference";
	}

	@Override
	public String visitSliceData(AbiType.SliceData type) {
		return switch (type.encoding()) {
			case UTF8 -> "byte[]";
			case UTF16 -> "short[]";
			case STRINGS -> imports.use(POINTER);
			case PRIMITIVE -> scalar(type.element()) + "[]";
		};
	}

	@Override
	public String visitLength(AbiType.Length type) {
		return imports.use(SIZE_T);
	}

	@Override
	public String visitFlag(AbiType.Flag type) {
		return "byte";
	}

	@Override
	public String visitSliceView(AbiType.SliceView type) {
		return imports.use(SLICE_VIEW);
	}

	@Override
	public String visitWriteable(AbiType.Writeable type) {
		return imports.use(JavaTypeMapper.WRITEABLE_BUFFER);
	}

	@Override
	public String visitOutPointer(AbiType.OutPointer type) {
		return type.pointee().accept(new AbiType.Visitor<String>() {
			@Override public String visitScalar(AbiType.Scalar t) { return imports.use(byReference(t.kind())); }
			@Override public String visitEnumValue(AbiType.EnumValue t) { return imports.use(byReference(PrimitiveKind.I32)); }
			@Override public String visitOpaquePointer(AbiType.OpaquePointer t) { return imports.use(POINTER_BY_REFERENCE); }
			@Override public String visitStructValue(AbiType.StructValue t) { return layoutOf(t) + ".ByReference"; }
			@Override public String visitStructPointer(AbiType.StructPointer t) { return unexpected(t); }
			@Override public String visitSliceData(AbiType.SliceData t) { return unexpected(t); }
			@Override public String visitLength(AbiType.Length t) { return unexpected(t); }
			@Override public String visitFlag(AbiType.Flag t) { return unexpected(t); }
			@Override public String visitSliceView(AbiType.SliceView t) { return imports.use(SLICE_VIEW); }
			@Override public String visitWriteable(AbiType.Writeable t) { return unexpected(t); }
			@Override public String visitOutPointer(AbiType.OutPointer t) { return unexpected(t); }
			@Override public String visitVoid(AbiType.VoidType t) { return unexpected(t); }

			private String unexpected(AbiType pointee) {
				throw new IllegalArgumentException("Unexpected out pointer to " + pointee);
			}
		});
	}

	@Override
	public String visitVoid(AbiType.VoidType type) {
		return "void";
	}

	static final String POINTER = "com.sun.jna.Pointer";
	static final String POINTER_BY_REFERENCE = "com.sun.jna.ptr.PointerByReference";
	static final String SIZE_T = "works.tether.runtime.SizeT";
	static final String SLICE_VIEW = "works.tether.runtime.SliceView";
}
