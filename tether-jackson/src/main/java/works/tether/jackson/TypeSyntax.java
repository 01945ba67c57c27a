package works.tether.jackson;

import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.tether.ir.EnumRef;
import works.tether.ir.FallibleRef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceRef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRef;

import static works.tether.ir.UnitRef.UNIT;
import static works.tether.ir.WriteableRef.WRITEABLE;

/**
 * Interprets type references in an IR document.
 * <p>
 * A string names a primitive, {@code unit} or {@code writeable}.
 * An object is identified by which of {@code opaque}, {@code struct}, {@code enum},
 * {@code slice}, {@code nullable} or {@code fallible} it has; exactly one is required.
 */
final class TypeSyntax {
	private TypeSyntax() { }

	static TypeRef parse(@Nullable Object json, String where) {
		if (json instanceof String name) {
			return switch (name) {
				case "unit" -> UNIT;
				case "writeable" -> WRITEABLE;
				default -> PrimitiveRef.of(primitive(name, where));
			};
		} else if (json instanceof Map<?, ?> map) {
			return parseObject(map, where);
		} else if (json == null) {
			throw new IrFormatException("Missing type at " + where);
		}
		throw new IrFormatException("Expected a string or object for the type at " + where + ", not " + json);
	}

	static PrimitiveKind primitive(@Nullable String name, String where) {
		if (name == null) {
			throw new IrFormatException("Missing primitive at " + where);
		}
		return PrimitiveKind.fromIrName(name)
			.orElseThrow(() -> new IrFormatException("Unknown primitive \"" + name + "\" at " + where));
	}

	private static TypeRef parseObject(Map<?, ?> map, String where) {
		String form = null;
		for (Object key: map.keySet()) {
			if (FORMS.contains(key)) {
				if (form != null) {
					throw new IrFormatException("Type at " + where + " has both \"" + form + "\" and \"" + key + "\"");
				}
				form = (String) key;
			}
		}
		if (form == null) {
			throw new IrFormatException("Type at " + where + " has none of " + FORMS);
		}
		return switch (form) {
			case "opaque" -> {
				allowOnly(map, where, "opaque", "owned");
				TypeId opaque = typeId(map.get("opaque"), where + ".opaque");
				yield flag(map, "owned", where) ? OpaqueRef.owned(opaque) : OpaqueRef.borrowed(opaque);
			}
			case "struct" -> {
				allowOnly(map, where, "struct", "byReference");
				TypeId struct = typeId(map.get("struct"), where + ".struct");
				yield flag(map, "byReference", where) ? StructRef.byReference(struct) : StructRef.byValue(struct);
			}
			case "enum" -> {
				allowOnly(map, where, "enum");
				yield EnumRef.of(typeId(map.get("enum"), where + ".enum"));
			}
			case "slice" -> {
				allowOnly(map, where, "slice", "element");
				yield slice(map, where);
			}
			case "nullable" -> {
				allowOnly(map, where, "nullable");
				yield NullableRef.of(parse(map.get("nullable"), where + ".nullable"));
			}
			default -> fallible(map, where);
		};
	}

	private static TypeRef fallible(Map<?, ?> map, String where) {
		allowOnly(map, where, "fallible");
		if (!(map.get("fallible") instanceof Map<?, ?> fallible)) {
			throw new IrFormatException("Expected an object with \"ok\" and \"err\" at " + where + ".fallible");
		}
		allowOnly(fallible, where + ".fallible", "ok", "err");
		return FallibleRef.of(
			parse(fallible.get("ok"), where + ".fallible.ok"),
			parse(fallible.get("err"), where + ".fallible.err"));
	}

	private static TypeRef slice(Map<?, ?> map, String where) {
		Object encoding = map.get("slice");
		if ("primitive".equals(encoding)) {
			Object element = map.get("element");
			if (!(element instanceof String elementName)) {
				throw new IrFormatException("Primitive slice at " + where + " needs a string \"element\"");
			}
			return SliceRef.of(primitive(elementName, where + ".element"));
		}
		if (map.containsKey("element")) {
			throw new IrFormatException("Only primitive slices have an \"element\", at " + where);
		}
		if ("utf8".equals(encoding)) {
			return SliceRef.UTF8;
		} else if ("utf16".equals(encoding)) {
			return SliceRef.UTF16;
		} else if ("strings".equals(encoding)) {
			return SliceRef.STRINGS;
		}
		throw new IrFormatException("Unknown slice encoding " + encoding + " at " + where);
	}

	private static TypeId typeId(@Nullable Object value, String where) {
		if (value instanceof String id && !id.isEmpty()) {
			return TypeId.of(id);
		}
		throw new IrFormatException("Expected a type id at " + where + ", not " + value);
	}

	private static boolean flag(Map<?, ?> map, String key, String where) {
		Object value = map.get(key);
		if (value == null) {
			return false;
		} else if (value instanceof Boolean b) {
			return b;
		}
		throw new IrFormatException("Expected true or false for \"" + key + "\" at " + where + ", not " + value);
	}

	private static void allowOnly(Map<?, ?> map, String where, String... keys) {
		Set<String> allowed = Set.of(keys);
		for (Object key: map.keySet()) {
			if (!allowed.contains(key)) {
				throw new IrFormatException("Unexpected \"" + key + "\" in type at " + where);
			}
		}
	}

	private static final Set<String> FORMS = Set.of("opaque", "struct", "enum", "slice", "nullable", "fallible");
}
