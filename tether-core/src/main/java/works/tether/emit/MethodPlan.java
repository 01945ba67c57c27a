package works.tether.emit;

import java.util.List;
import works.tether.abi.AbiSignature;
import works.tether.ir.MethodDef;
import works.tether.mapping.TypeMapping;
import works.tether.ownership.CallOwnership;

/**
 * Everything known about one method by the time its host code is written.
 *
 * @param returns the return type's mapping; its slots are the hidden slots of {@link #signature}
 */
public record MethodPlan<H>(
	MethodDef method,
	AbiSignature signature,
	CallOwnership ownership,
	List<ParamPlan<H>> params,
	TypeMapping<H> returns
) {
	public MethodPlan {
		params = List.copyOf(params);
	}

	public String name() {
		return method.name();
	}
}
