package works.tether.abi;

import java.util.ArrayList;
import java.util.List;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.EnumRef;
import works.tether.ir.FallibleRef;
import works.tether.ir.FieldDef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceRef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeRef;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;

import static works.tether.abi.ParamRole.OUT_ERR;
import static works.tether.abi.ParamRole.OUT_OK;
import static works.tether.abi.ParamRole.OUT_VALUE;
import static works.tether.abi.ParamRole.PRESENCE;
import static works.tether.abi.ParamRole.RETURN_SINK;
import static works.tether.abi.ParamRole.SLICE_DATA;
import static works.tether.abi.ParamRole.SLICE_LENGTH;
import static works.tether.abi.ParamRole.VALUE;
import static works.tether.abi.ParamRole.WRITEABLE;

/**
 * Lowers IR types to native slots.
 * <p>
 * These rules are the native ABI contract, and they're the same for every backend:
 *
 * <ul>
 *     <li>
 *         Slices travel as two parameters, {@code name_data} and {@code name_len}.
 *         A null data pointer is how a nullable slice says it's absent.
 *     </li>
 *     <li>
 *         Nullable scalars, enums and structs travel as the value followed by
 *         {@code name_present}; nullable opaque pointers are simply null.
 *     </li>
 *     <li>
 *         Results that don't fit in a register come back through trailing
 *         pointers supplied by the caller, never through heap boxes.
 *     </li>
 *     <li>
 *         A fallible call returns a {@code bool} discriminant and writes exactly one of
 *         {@code ok_out} and {@code err_out}.
 *     </li>
 * </ul>
 */
public final class NativeLowering {
	public static final String OUT = "out";
	public static final String OK_OUT = "ok_out";
	public static final String ERR_OUT = "err_out";
	public static final String WRITE = "write";

	private final DataLayout layout;

	public NativeLowering(DataLayout layout) {
		this.layout = layout;
	}

	public static String dataName(String param) {
		return param + "_data";
	}

	public static String lengthName(String param) {
		return param + "_len";
	}

	public static String presenceName(String param) {
		return param + "_present";
	}

	/**
	 * @throws UnsupportedTypeException if the parameter's type can't be passed to native code
	 */
	public List<AbiParam> lowerParam(ParamDef param) {
		String name = param.name();
		TypeRef type = param.type();
		return type.accept(new TypeRef.Visitor<List<AbiParam>>() {
			@Override
			public List<AbiParam> visitPrimitive(PrimitiveRef ref) {
				return List.of(value(new AbiType.Scalar(ref.kind())));
			}

			@Override
			public List<AbiParam> visitOpaque(OpaqueRef ref) {
				return List.of(value(new AbiType.OpaquePointer(ref.target())));
			}

			@Override
			public List<AbiParam> visitStruct(StructRef ref) {
				return List.of(value(ref.byReference()
					? new AbiType.StructPointer(ref.target())
					: new AbiType.StructValue(ref.target())));
			}

			@Override
			public List<AbiParam> visitEnum(EnumRef ref) {
				return List.of(value(new AbiType.EnumValue(ref.target())));
			}

			@Override
			public List<AbiParam> visitSlice(SliceRef ref) {
				return List.of(
					new AbiParam(dataName(name), new AbiType.SliceData(ref.encoding(), ref.element()), SLICE_DATA, name),
					new AbiParam(lengthName(name), AbiType.LENGTH, SLICE_LENGTH, name));
			}

			@Override
			public List<AbiParam> visitWriteable(WriteableRef ref) {
				return List.of(new AbiParam(name, AbiType.WRITEABLE, WRITEABLE, name));
			}

			@Override
			public List<AbiParam> visitNullable(NullableRef ref) {
				TypeRef inner = ref.inner();
				if (inner instanceof OpaqueRef || inner instanceof SliceRef) {
					return inner.accept(this);
				}
				if (inner instanceof StructRef s && s.byReference()) {
					throw new UnsupportedTypeException(type, "Nullable struct parameters must be passed by value");
				}
				if (inner instanceof PrimitiveRef || inner instanceof EnumRef || inner instanceof StructRef) {
					List<AbiParam> result = new ArrayList<>(inner.accept(this));
					result.add(new AbiParam(presenceName(name), AbiType.FLAG, PRESENCE, name));
					return List.copyOf(result);
				}
				throw new UnsupportedTypeException(type, "Unsupported nullable parameter");
			}

			@Override
			public List<AbiParam> visitFallible(FallibleRef ref) {
				throw new UnsupportedTypeException(type, "Fallible is only allowed as a return type");
			}

			@Override
			public List<AbiParam> visitUnit(UnitRef ref) {
				throw new UnsupportedTypeException(type, "Unit is not a parameter type");
			}

			private AbiParam value(AbiType abiType) {
				return new AbiParam(name, abiType, VALUE, name);
			}
		});
	}

	/**
	 * @throws UnsupportedTypeException if the type can't be returned from native code
	 */
	public LoweredReturn lowerReturn(TypeRef type) {
		return type.accept(new TypeRef.Visitor<>() {
			@Override
			public LoweredReturn visitPrimitive(PrimitiveRef ref) {
				return LoweredReturn.direct(new AbiType.Scalar(ref.kind()));
			}

			@Override
			public LoweredReturn visitOpaque(OpaqueRef ref) {
				return LoweredReturn.direct(new AbiType.OpaquePointer(ref.target()));
			}

			@Override
			public LoweredReturn visitStruct(StructRef ref) {
				if (ref.byReference()) {
					throw new UnsupportedTypeException(type, "Structs must be returned by value");
				}
				AbiType value = new AbiType.StructValue(ref.target());
				if (layout.fitsInRegister(value)) {
					return LoweredReturn.direct(value);
				}
				return new LoweredReturn(AbiType.VOID, ReturnConvention.OUT_PARAM,
					List.of(AbiParam.hidden(OUT, new AbiType.OutPointer(value), OUT_VALUE)));
			}

			@Override
			public LoweredReturn visitEnum(EnumRef ref) {
				return LoweredReturn.direct(new AbiType.EnumValue(ref.target()));
			}

			@Override
			public LoweredReturn visitSlice(SliceRef ref) {
				// Two words never fit in one register
				return new LoweredReturn(AbiType.VOID, ReturnConvention.OUT_PARAM,
					List.of(AbiParam.hidden(OUT, new AbiType.OutPointer(new AbiType.SliceView(ref.encoding(), ref.element())), OUT_VALUE)));
			}

			@Override
			public LoweredReturn visitWriteable(WriteableRef ref) {
				return new LoweredReturn(AbiType.VOID, ReturnConvention.WRITEABLE,
					List.of(AbiParam.hidden(WRITE, AbiType.WRITEABLE, RETURN_SINK)));
			}

			@Override
			public LoweredReturn visitNullable(NullableRef ref) {
				TypeRef inner = ref.inner();
				if (inner instanceof OpaqueRef || inner instanceof SliceRef) {
					return inner.accept(this);
				}
				if (inner instanceof StructRef s && s.byReference()) {
					throw new UnsupportedTypeException(type, "Structs must be returned by value");
				}
				if (inner instanceof PrimitiveRef || inner instanceof EnumRef || inner instanceof StructRef) {
					return new LoweredReturn(AbiType.FLAG, ReturnConvention.PRESENCE_FLAG,
						List.of(AbiParam.hidden(OUT, new AbiType.OutPointer(payload(inner)), OUT_VALUE)));
				}
				throw new UnsupportedTypeException(type, "Unsupported nullable return type");
			}

			@Override
			public LoweredReturn visitFallible(FallibleRef ref) {
				List<AbiParam> trailing = new ArrayList<>();
				TypeRef ok = ref.ok();
				if (ok instanceof WriteableRef) {
					trailing.add(AbiParam.hidden(WRITE, AbiType.WRITEABLE, RETURN_SINK));
				} else if (!(ok instanceof UnitRef)) {
					trailing.add(AbiParam.hidden(OK_OUT, new AbiType.OutPointer(payload(ok)), OUT_OK));
				}
				TypeRef err = ref.err();
				if (err instanceof WriteableRef) {
					throw new UnsupportedTypeException(type, "Writeable is not supported as an error payload");
				} else if (!(err instanceof UnitRef)) {
					trailing.add(AbiParam.hidden(ERR_OUT, new AbiType.OutPointer(payload(err)), OUT_ERR));
				}
				return new LoweredReturn(AbiType.FLAG, ReturnConvention.DISCRIMINANT, trailing);
			}

			@Override
			public LoweredReturn visitUnit(UnitRef ref) {
				return new LoweredReturn(AbiType.VOID, ReturnConvention.VOID, List.of());
			}

			private AbiType payload(TypeRef payloadType) {
				return payloadType.accept(new PayloadLowering(type));
			}
		});
	}

	/**
	 * @throws UnsupportedTypeException if the field's type can't be stored in a native struct
	 */
	public static AbiType lowerField(FieldDef field) {
		TypeRef type = field.type();
		if (type instanceof PrimitiveRef p) {
			return new AbiType.Scalar(p.kind());
		} else if (type instanceof EnumRef e) {
			return new AbiType.EnumValue(e.target());
		} else if (type instanceof StructRef s && !s.byReference()) {
			return new AbiType.StructValue(s.target());
		} else if (type instanceof OpaqueRef o) {
			if (o.owned()) {
				throw new UnsupportedTypeException(type, "Field " + field.name() + " would own an opaque handle; struct fields may only borrow");
			}
			return new AbiType.OpaquePointer(o.target());
		} else if (type instanceof NullableRef n && n.inner() instanceof OpaqueRef o && !o.owned()) {
			return new AbiType.OpaquePointer(o.target());
		}
		throw new UnsupportedTypeException(type, "Unsupported type for field " + field.name());
	}

	/**
	 * The value written through an out pointer: the things a fallible or nullable return can carry.
	 */
	private record PayloadLowering(TypeRef whole) implements TypeRef.Visitor<AbiType> {
		@Override
		public AbiType visitPrimitive(PrimitiveRef ref) {
			return new AbiType.Scalar(ref.kind());
		}

		@Override
		public AbiType visitOpaque(OpaqueRef ref) {
			return new AbiType.OpaquePointer(ref.target());
		}

		@Override
		public AbiType visitStruct(StructRef ref) {
			if (ref.byReference()) {
				throw new UnsupportedTypeException(whole, "Structs must be returned by value");
			}
			return new AbiType.StructValue(ref.target());
		}

		@Override
		public AbiType visitEnum(EnumRef ref) {
			return new AbiType.EnumValue(ref.target());
		}

		@Override
		public AbiType visitSlice(SliceRef ref) {
			return new AbiType.SliceView(ref.encoding(), ref.element());
		}

		@Override
		public AbiType visitWriteable(WriteableRef ref) {
			throw new UnsupportedTypeException(whole, "Writeable can't be nested here");
		}

		@Override
		public AbiType visitNullable(NullableRef ref) {
			throw new UnsupportedTypeException(whole, "Nullable can't be nested here");
		}

		@Override
		public AbiType visitFallible(FallibleRef ref) {
			throw new UnsupportedTypeException(whole, "Fallible can't be nested");
		}

		@Override
		public AbiType visitUnit(UnitRef ref) {
			throw new UnsupportedTypeException(whole, "Unit can't be nested here");
		}
	}

	/**
	 * @param returnType the C return type
	 * @param trailing hidden slots appended after the declared parameters
	 */
	public record LoweredReturn(AbiType returnType, ReturnConvention convention, List<AbiParam> trailing) {
		public LoweredReturn {
			trailing = List.copyOf(trailing);
		}

		static LoweredReturn direct(AbiType type) {
			return new LoweredReturn(type, ReturnConvention.DIRECT, List.of());
		}
	}
}
