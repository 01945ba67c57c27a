package works.tether.ir;

import static java.util.Objects.requireNonNull;

/**
 * @param discriminant the native value of this variant
 */
public record EnumVariant(String name, int discriminant, String docs) {
	public EnumVariant {
		requireNonNull(name);
		requireNonNull(docs);
	}

	public static EnumVariant of(String name, int discriminant) {
		return new EnumVariant(name, discriminant, "");
	}
}
