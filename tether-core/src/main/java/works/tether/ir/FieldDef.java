package works.tether.ir;

import static java.util.Objects.requireNonNull;

public record FieldDef(String name, TypeRef type, String docs) {
	public FieldDef {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(docs);
	}

	public static FieldDef of(String name, TypeRef type) {
		return new FieldDef(name, type, "");
	}
}
