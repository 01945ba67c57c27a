package works.tether.java;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSortedSet;
import static java.util.Objects.requireNonNull;

/**
 * A type as Java callers see it.
 *
 * @param name the type as written in a declaration, such as {@code int} or {@code Result<Integer, Void>}
 * @param boxed the type as written in a type argument; same as {@link #name} for reference types
 * @param imports fully qualified names the type needs
 * @param nullable whether null is a legal value
 * @param unsigned whether the bits of a signed Java primitive stand for an unsigned native value
 */
public record JavaType(String name, String boxed, SortedSet<String> imports, boolean nullable, boolean unsigned) {
	public JavaType {
		requireNonNull(name);
		requireNonNull(boxed);
		imports = unmodifiableSortedSet(new TreeSet<>(imports));
	}

	public static JavaType primitive(String name, String boxed) {
		return new JavaType(name, boxed, new TreeSet<>(), false, false);
	}

	public static JavaType reference(String name, String... imports) {
		return new JavaType(name, name, new TreeSet<>(Set.of(imports)), false, false);
	}

	public static final JavaType VOID = new JavaType("void", "Void", new TreeSet<>(), false, false);

	public JavaType asUnsigned() {
		SortedSet<String> withUnsigned = new TreeSet<>(imports);
		withUnsigned.add(UNSIGNED);
		return new JavaType(name, boxed, withUnsigned, nullable, true);
	}

	public JavaType asNullable() {
		SortedSet<String> withNullable = new TreeSet<>(imports);
		withNullable.add(NULLABLE);
		return new JavaType(boxed, boxed, withNullable, true, unsigned);
	}

	public boolean isVoid() {
		return this.equals(VOID);
	}

	public boolean isPrimitive() {
		return !name.equals(boxed);
	}

	/**
	 * @return the type with its annotations, for a parameter, return type or record component
	 */
	public String declaration() {
		StringBuilder sb = new StringBuilder();
		if (nullable) {
			sb.append("@Nullable ");
		}
		if (unsigned) {
			sb.append("@Unsigned ");
		}
		return sb.append(name).toString();
	}

	@Override
	public String toString() {
		return declaration();
	}

	static final String NULLABLE = "org.jetbrains.annotations.Nullable";
	static final String UNSIGNED = "works.tether.runtime.Unsigned";
}
