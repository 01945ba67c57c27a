package works.tether.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;

import static java.util.Collections.unmodifiableMap;

/**
 * The single table of host type names for one run.
 * <p>
 * Every unit that refers to another type looks its name up here,
 * so a rename applies everywhere at once and no unit derives names on its own.
 */
public final class HostNames {
	private final Map<TypeId, String> names;

	private HostNames(Map<TypeId, String> names) {
		this.names = unmodifiableMap(names);
	}

	public static HostNames of(List<TypeDef> types, Function<TypeDef, String> naming) {
		Map<TypeId, String> names = new TreeMap<>();
		for (TypeDef type: types) {
			names.put(type.id(), naming.apply(type));
		}
		return new HostNames(names);
	}

	/**
	 * @throws IllegalArgumentException if the type has no host name, meaning it's not part of the output
	 */
	public String nameOf(TypeId id) {
		String result = names.get(id);
		if (result == null) {
			throw new IllegalArgumentException("No host name for " + id);
		}
		return result;
	}

	/**
	 * @return groups of two or more types sharing a host name, keyed by that name
	 */
	public Map<String, List<TypeId>> collisions() {
		Map<String, List<TypeId>> byName = new TreeMap<>();
		names.forEach((id, name) -> byName.computeIfAbsent(name, n -> new ArrayList<>()).add(id));
		byName.values().removeIf(ids -> ids.size() < 2);
		return byName;
	}

	public Map<TypeId, String> asMap() {
		return names;
	}

	@Override
	public String toString() {
		return "HostNames" + names;
	}
}
