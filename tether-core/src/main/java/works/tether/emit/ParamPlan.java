package works.tether.emit;

import works.tether.ir.ParamDef;
import works.tether.mapping.TypeMapping;
import works.tether.ownership.Transfer;

public record ParamPlan<H>(ParamDef param, TypeMapping<H> mapping, Transfer transfer) {
	public String name() {
		return param.name();
	}
}
