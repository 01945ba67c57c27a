package works.tether.ir;

import static java.util.Objects.requireNonNull;

public record ParamDef(String name, TypeRef type) {
	public ParamDef {
		requireNonNull(name);
		requireNonNull(type);
	}

	public static ParamDef of(String name, TypeRef type) {
		return new ParamDef(name, type);
	}
}
