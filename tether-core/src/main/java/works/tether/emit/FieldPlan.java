package works.tether.emit;

import works.tether.abi.AbiType;
import works.tether.ir.FieldDef;

/**
 * @param abi the field's type inside the native struct
 */
public record FieldPlan<H>(FieldDef field, H host, AbiType abi) {
	public String name() {
		return field.name();
	}
}
