package works.tether.java;

import java.util.Locale;
import java.util.Set;
import works.tether.exceptions.NamingConflictException;

/**
 * Derives Java identifiers from IR names.
 * <p>
 * IR names are C identifiers, which are almost always valid Java identifiers too.
 * The exceptions are Java keywords and names that would collide with members
 * the generated code already has; those get a trailing underscore.
 */
public final class JavaNames {
	private JavaNames() { }

	static final Set<String> KEYWORDS = Set.of(
		"abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
		"continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
		"for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
		"new", "package", "private", "protected", "public", "return", "short", "static", "strictfp", "super",
		"switch", "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "while",
		"true", "false", "null", "_");

	/**
	 * Methods every generated class inherits from {@link Object}.
	 */
	static final Set<String> OBJECT_METHODS = Set.of(
		"clone", "equals", "finalize", "getClass", "hashCode", "notify", "notifyAll", "toString", "wait");

	/**
	 * Simple names that generated units import or declare, so no generated type may take them.
	 */
	static final Set<String> RESERVED_TYPE_NAMES = Set.of(
		"Abi", "Layout", "ByValue", "ByReference",
		"Library", "Pointer", "Structure", "Nullable",
		"Bindings", "NativeObject", "Ownership", "Result", "SizeT", "SliceView", "Slices",
		"Unsigned", "Utf8Strings", "WriteableBuffer",
		"ByteByReference", "ShortByReference", "IntByReference", "LongByReference",
		"FloatByReference", "DoubleByReference", "PointerByReference",
		"Object", "String", "Void", "Boolean", "Byte", "Short", "Integer", "Long", "Float", "Double",
		"Override", "Deprecated", "Math", "System",
		"var", "yield", "record", "sealed", "permits");

	/**
	 * {@code add_two} becomes {@code addTwo}; names that are already camel case are kept.
	 */
	public static String camelCase(String irName) {
		StringBuilder sb = new StringBuilder();
		for (String part: irName.split("_")) {
			if (part.isEmpty()) {
				continue;
			}
			if (sb.length() == 0) {
				sb.append(isAllUpperCase(part) ? part.toLowerCase(Locale.ROOT) : lowerFirst(part));
			} else {
				sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
			}
		}
		if (sb.length() == 0 || !Character.isJavaIdentifierStart(sb.charAt(0))) {
			return escape(irName);
		}
		return escape(sb.toString());
	}

	/**
	 * {@code DarkRed} and {@code dark_red} both become {@code DARK_RED}.
	 */
	public static String constantCase(String irName) {
		StringBuilder sb = new StringBuilder();
		char previous = '_';
		for (char c: irName.toCharArray()) {
			if (Character.isUpperCase(c) && (Character.isLowerCase(previous) || Character.isDigit(previous))) {
				sb.append('_');
			}
			sb.append(Character.toUpperCase(c));
			previous = c;
		}
		return escape(sb.toString());
	}

	public static String escape(String name) {
		return KEYWORDS.contains(name) ? name + "_" : name;
	}

	/**
	 * @return {@code name}, or {@code name_} if it's in {@code taken}
	 */
	public static String avoiding(String name, Set<String> taken) {
		return taken.contains(name) ? name + "_" : name;
	}

	/**
	 * @throws NamingConflictException if {@code hostName} can't name a generated Java type
	 */
	public static void checkTypeName(String hostName) {
		if (KEYWORDS.contains(hostName) || RESERVED_TYPE_NAMES.contains(hostName)) {
			throw new NamingConflictException(hostName, "Host name " + hostName + " is reserved in generated Java code");
		}
	}

	private static boolean isAllUpperCase(String s) {
		return s.chars().noneMatch(Character::isLowerCase);
	}

	private static String lowerFirst(String s) {
		return Character.toLowerCase(s.charAt(0)) + s.substring(1);
	}
}
