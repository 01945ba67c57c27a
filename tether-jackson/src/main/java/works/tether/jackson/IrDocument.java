package works.tether.jackson;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The JSON form of an IR document, as Jackson binds it.
 * Absent properties are null here; {@link IrDocumentReader} supplies the defaults.
 * <p>
 * Type references are left unbound ({@code Object}) because they're
 * either a string or an object whose single distinguishing key says what it is.
 */
public record IrDocument(@Nullable List<TypeEntry> types) {
	/**
	 * @param kind {@code opaque}, {@code struct}, {@code enum} or {@code primitive}
	 * @param id defaults to {@code name}
	 */
	public record TypeEntry(
		@Nullable String kind,
		@Nullable String id,
		@Nullable String name,
		@Nullable String docs,
		@Nullable AttributesEntry attributes,
		@Nullable List<MethodEntry> methods,
		@Nullable List<FieldEntry> fields,
		@Nullable List<VariantEntry> variants,
		@Nullable String primitive
	) { }

	/**
	 * @param self {@code none}, {@code value} or {@code borrowed}; absent means {@code none}
	 * @param returns absent means {@code unit}
	 */
	public record MethodEntry(
		@Nullable String name,
		@Nullable String self,
		@Nullable List<ParamEntry> params,
		@Nullable Object returns,
		@Nullable String docs,
		@Nullable AttributesEntry attributes
	) { }

	public record ParamEntry(@Nullable String name, @Nullable Object type) { }

	public record FieldEntry(@Nullable String name, @Nullable Object type, @Nullable String docs) { }

	public record VariantEntry(@Nullable String name, @Nullable Integer value, @Nullable String docs) { }

	public record AttributesEntry(
		@Nullable List<String> disabledBackends,
		@Nullable List<String> onlyBackends,
		@Nullable List<String> requiredFeatures,
		@Nullable List<String> excludedFeatures,
		@Nullable String rename
	) { }
}
