package works.tether.ir;

import java.util.regex.Pattern;

/**
 * Names in the IR end up in C declarations and symbol names,
 * so they're restricted to what a C identifier can hold.
 */
public final class Identifiers {
	private static final Pattern C_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public static boolean isValid(String name) {
		return name != null && C_IDENTIFIER.matcher(name).matches();
	}

	private Identifiers() {}
}
