package works.tether.abi;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One slot of an {@link AbiSignature}.
 *
 * @param name the C parameter name
 * @param source the name of the declared parameter this slot was lowered from;
 *               null for the receiver and for hidden slots
 */
public record AbiParam(String name, AbiType type, ParamRole role, @Nullable String source) {
	public AbiParam {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(role);
	}

	public static AbiParam hidden(String name, AbiType type, ParamRole role) {
		return new AbiParam(name, type, role, null);
	}
}
