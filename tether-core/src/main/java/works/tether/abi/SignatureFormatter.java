package works.tether.abi;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import works.tether.exceptions.NamingConflictException;
import works.tether.ir.EnumDef;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;

import static works.tether.abi.ParamRole.SELF;

/**
 * Computes the {@link AbiSignature} of each exported entry point.
 * <p>
 * Slots appear in this order: the receiver, the declared parameters in source order
 * (each expanded by {@link NativeLowering}), then the hidden slots of the return convention.
 */
public final class SignatureFormatter {
	public static final String SELF_NAME = "self";

	private final NativeLowering lowering;

	public SignatureFormatter(DataLayout layout) {
		this.lowering = new NativeLowering(layout);
	}

	/**
	 * @throws works.tether.exceptions.UnsupportedTypeException if a parameter or the return type can't cross the boundary
	 * @throws NamingConflictException if two slots end up with the same C name
	 */
	public AbiSignature format(TypeDef owner, MethodDef method) {
		List<AbiParam> params = new ArrayList<>();
		if (!method.isStatic()) {
			params.add(new AbiParam(SELF_NAME, receiverType(owner), SELF, null));
		}
		for (ParamDef param: method.params()) {
			params.addAll(lowering.lowerParam(param));
		}
		NativeLowering.LoweredReturn lowered = lowering.lowerReturn(method.returnType());
		params.addAll(lowered.trailing());
		String symbol = SymbolFormatter.methodSymbol(owner, method);
		checkDistinctNames(symbol, params);
		return new AbiSignature(symbol, params, lowered.returnType(), lowered.convention());
	}

	/**
	 * {@code void Name_destroy(Name* self)}
	 */
	public AbiSignature destructor(OpaqueDef owner) {
		return new AbiSignature(
			SymbolFormatter.destructorSymbol(owner),
			List.of(new AbiParam(SELF_NAME, new AbiType.OpaquePointer(owner.id()), SELF, null)),
			AbiType.VOID,
			ReturnConvention.VOID);
	}

	private static AbiType receiverType(TypeDef owner) {
		return owner.accept(new TypeDef.Visitor<AbiType>() {
			@Override
			public AbiType visitOpaque(OpaqueDef def) {
				return new AbiType.OpaquePointer(def.id());
			}

			@Override
			public AbiType visitStruct(StructDef def) {
				return new AbiType.StructValue(def.id());
			}

			@Override
			public AbiType visitEnum(EnumDef def) {
				throw new IllegalArgumentException("Enums have no methods: " + def.id());
			}

			@Override
			public AbiType visitPrimitive(PrimitiveDef def) {
				throw new IllegalArgumentException("Primitives have no methods: " + def.id());
			}
		});
	}

	private static void checkDistinctNames(String symbol, List<AbiParam> params) {
		Set<String> seen = new HashSet<>();
		for (AbiParam param: params) {
			if (!seen.add(param.name())) {
				throw new NamingConflictException(param.name(),
					"Parameter name " + param.name() + " is used twice in the signature of " + symbol);
			}
		}
	}
}
