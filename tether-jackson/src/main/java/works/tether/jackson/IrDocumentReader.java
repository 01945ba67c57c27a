package works.tether.jackson;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tether.ir.Attributes;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumVariant;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.Registry;
import works.tether.ir.SelfKind;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.jackson.IrDocument.AttributesEntry;
import works.tether.jackson.IrDocument.FieldEntry;
import works.tether.jackson.IrDocument.MethodEntry;
import works.tether.jackson.IrDocument.ParamEntry;
import works.tether.jackson.IrDocument.TypeEntry;
import works.tether.jackson.IrDocument.VariantEntry;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;
import static works.tether.ir.UnitRef.UNIT;

/**
 * Reads a JSON IR document into a {@link Registry.Builder}.
 * <p>
 * The result is a builder rather than a registry so that structural problems
 * (duplicate ids, dangling references) surface from {@link Registry.Builder#build()},
 * where {@link works.tether.Generator Generator} reports them as lowering errors.
 * Problems with the document itself throw {@link IrFormatException} here.
 */
public final class IrDocumentReader {
	private final ObjectMapper mapper;

	public IrDocumentReader() {
		this(JsonMapper.builder()
			.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build());
	}

	public IrDocumentReader(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public Registry.Builder read(String json) {
		return toRegistry(parse(() -> mapper.readValue(json, IrDocument.class)));
	}

	public Registry.Builder read(Reader reader) {
		return toRegistry(parse(() -> mapper.readValue(reader, IrDocument.class)));
	}

	public Registry.Builder read(Path file) throws IOException {
		LOGGER.debug("Reading IR document {}", file);
		try (Reader reader = Files.newBufferedReader(file, UTF_8)) {
			return read(reader);
		}
	}

	private static IrDocument parse(Supplier<IrDocument> parser) {
		IrDocument document;
		try {
			document = parser.get();
		} catch (JacksonException e) {
			throw new IrFormatException("Malformed IR document: " + e.getOriginalMessage(), e);
		}
		if (document == null) {
			throw new IrFormatException("Empty IR document");
		}
		return document;
	}

	public Registry.Builder toRegistry(IrDocument document) {
		List<TypeEntry> entries = document.types();
		if (entries == null) {
			throw new IrFormatException("IR document has no \"types\"");
		}
		Registry.Builder result = Registry.builder();
		for (int i = 0; i < entries.size(); i++) {
			result.add(typeDef(entries.get(i), "types[" + i + "]"));
		}
		LOGGER.debug("Read {} types", entries.size());
		return result;
	}

	private static TypeDef typeDef(@Nullable TypeEntry entry, String where) {
		if (entry == null) {
			throw new IrFormatException("Null type at " + where);
		}
		String name = required(entry.name(), where + ".name");
		TypeId id = TypeId.of((entry.id() == null) ? name : required(entry.id().strip(), where + ".id"));
		String docs = requireNonNullElse(entry.docs(), "");
		Attributes attributes = attributes(entry.attributes());
		String kind = required(entry.kind(), where + ".kind");
		return switch (kind) {
			case "opaque" -> {
				rejectPresent(where, kind, "fields", entry.fields());
				rejectPresent(where, kind, "variants", entry.variants());
				rejectPresent(where, kind, "primitive", entry.primitive());
				yield new OpaqueDef(id, name, docs, attributes, methods(entry.methods(), where));
			}
			case "struct" -> {
				rejectPresent(where, kind, "variants", entry.variants());
				rejectPresent(where, kind, "primitive", entry.primitive());
				yield new StructDef(id, name, docs, attributes, fields(entry.fields(), where), methods(entry.methods(), where));
			}
			case "enum" -> {
				rejectPresent(where, kind, "methods", entry.methods());
				rejectPresent(where, kind, "fields", entry.fields());
				rejectPresent(where, kind, "primitive", entry.primitive());
				yield new EnumDef(id, name, docs, attributes, variants(entry.variants(), where));
			}
			case "primitive" -> {
				rejectPresent(where, kind, "methods", entry.methods());
				rejectPresent(where, kind, "fields", entry.fields());
				rejectPresent(where, kind, "variants", entry.variants());
				yield new PrimitiveDef(id, name, docs, attributes, TypeSyntax.primitive(entry.primitive(), where + ".primitive"));
			}
			default -> throw new IrFormatException("Unknown kind \"" + kind + "\" at " + where);
		};
	}

	private static List<MethodDef> methods(@Nullable List<MethodEntry> entries, String owner) {
		List<MethodDef> result = new ArrayList<>();
		for (int i = 0; i < sizeOf(entries); i++) {
			String where = owner + ".methods[" + i + "]";
			MethodEntry entry = nonNull(entries.get(i), where);
			List<ParamDef> params = new ArrayList<>();
			for (int j = 0; j < sizeOf(entry.params()); j++) {
				String paramWhere = where + ".params[" + j + "]";
				ParamEntry param = nonNull(entry.params().get(j), paramWhere);
				params.add(ParamDef.of(
					required(param.name(), paramWhere + ".name"),
					TypeSyntax.parse(param.type(), paramWhere + ".type")));
			}
			result.add(new MethodDef(
				required(entry.name(), where + ".name"),
				selfKind(entry.self(), where + ".self"),
				params,
				(entry.returns() == null) ? UNIT : TypeSyntax.parse(entry.returns(), where + ".returns"),
				requireNonNullElse(entry.docs(), ""),
				attributes(entry.attributes())));
		}
		return result;
	}

	private static List<FieldDef> fields(@Nullable List<FieldEntry> entries, String owner) {
		List<FieldDef> result = new ArrayList<>();
		for (int i = 0; i < sizeOf(entries); i++) {
			String where = owner + ".fields[" + i + "]";
			FieldEntry entry = nonNull(entries.get(i), where);
			result.add(new FieldDef(
				required(entry.name(), where + ".name"),
				TypeSyntax.parse(entry.type(), where + ".type"),
				requireNonNullElse(entry.docs(), "")));
		}
		return result;
	}

	private static List<EnumVariant> variants(@Nullable List<VariantEntry> entries, String owner) {
		List<EnumVariant> result = new ArrayList<>();
		for (int i = 0; i < sizeOf(entries); i++) {
			String where = owner + ".variants[" + i + "]";
			VariantEntry entry = nonNull(entries.get(i), where);
			if (entry.value() == null) {
				throw new IrFormatException("Missing value at " + where);
			}
			result.add(new EnumVariant(
				required(entry.name(), where + ".name"),
				entry.value(),
				requireNonNullElse(entry.docs(), "")));
		}
		return result;
	}

	private static Attributes attributes(@Nullable AttributesEntry entry) {
		if (entry == null) {
			return Attributes.NONE;
		}
		return new Attributes(
			setOf(entry.disabledBackends()),
			setOf(entry.onlyBackends()),
			setOf(entry.requiredFeatures()),
			setOf(entry.excludedFeatures()),
			entry.rename());
	}

	private static SelfKind selfKind(@Nullable String self, String where) {
		if (self == null) {
			return SelfKind.NONE;
		}
		return switch (self) {
			case "none" -> SelfKind.NONE;
			case "value" -> SelfKind.VALUE;
			case "borrowed" -> SelfKind.BORROWED;
			default -> throw new IrFormatException("Unknown self kind \"" + self + "\" at " + where);
		};
	}

	private static String required(@Nullable String value, String where) {
		if (value == null || value.isEmpty()) {
			throw new IrFormatException("Missing " + where);
		}
		return value;
	}

	private static <T> T nonNull(@Nullable T value, String where) {
		if (value == null) {
			throw new IrFormatException("Null entry at " + where);
		}
		return value;
	}

	private static void rejectPresent(String where, String kind, String property, @Nullable Object value) {
		if (value != null) {
			throw new IrFormatException("A type of kind " + kind + " can't have \"" + property + "\", at " + where);
		}
	}

	private static int sizeOf(@Nullable List<?> list) {
		return (list == null) ? 0 : list.size();
	}

	private static Set<String> setOf(@Nullable List<String> values) {
		return (values == null) ? Set.of() : Set.copyOf(values);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IrDocumentReader.class);
}
