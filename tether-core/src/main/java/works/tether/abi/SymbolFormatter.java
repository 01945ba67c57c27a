package works.tether.abi;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.tether.exceptions.NamingConflictException;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.TypeDef;

/**
 * Native symbol names.
 * <p>
 * Symbols are built from IR names only. Host renames never reach the native side,
 * so renaming a type for one backend can't break another backend's glue.
 */
public final class SymbolFormatter {
	public static final String DESTRUCTOR = "destroy";

	private SymbolFormatter() { }

	public static String methodSymbol(TypeDef owner, MethodDef method) {
		return owner.name() + "_" + method.name();
	}

	public static String destructorSymbol(OpaqueDef owner) {
		return owner.name() + "_" + DESTRUCTOR;
	}

	/**
	 * Every symbol one type exports: one per method, plus the destructor for an opaque type.
	 *
	 * @throws NamingConflictException if two of them are the same
	 */
	public static List<String> symbolsOf(TypeDef owner, List<MethodDef> methods) {
		List<String> result = new ArrayList<>();
		Map<String, String> producers = new HashMap<>();
		for (MethodDef method: methods) {
			String symbol = methodSymbol(owner, method);
			claim(producers, symbol, "method " + method.name());
			result.add(symbol);
		}
		if (owner instanceof OpaqueDef opaque) {
			String symbol = destructorSymbol(opaque);
			claim(producers, symbol, "the destructor");
			result.add(symbol);
		}
		return List.copyOf(result);
	}

	private static void claim(Map<String, String> producers, String symbol, String producer) {
		String previous = producers.putIfAbsent(symbol, producer);
		if (previous != null) {
			throw new NamingConflictException(symbol,
				"Symbol " + symbol + " is produced by both " + previous + " and " + producer);
		}
	}
}
