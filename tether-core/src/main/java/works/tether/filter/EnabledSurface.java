package works.tether.filter;

import java.util.List;
import java.util.Map;
import works.tether.ir.MethodDef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;
import works.tether.report.Diagnostic;
import works.tether.report.Omission;

import static java.util.Comparator.comparing;

/**
 * The part of a {@link TypeRegistry} that exists for one backend and feature set.
 * <p>
 * Disabled types are not visitable through this object at all;
 * the only thing it will say about them is why they're missing.
 */
public final class EnabledSurface {
	private final TypeRegistry registry;
	private final Map<TypeId, TypeDef> enabled;
	private final Map<TypeId, String> excluded;
	private final Map<TypeId, List<MethodDef>> methods;
	private final List<Omission> omissions;
	private final List<Diagnostic> diagnostics;

	EnabledSurface(
		TypeRegistry registry,
		Map<TypeId, TypeDef> enabled,
		Map<TypeId, String> excluded,
		Map<TypeId, List<MethodDef>> methods,
		List<Omission> omissions,
		List<Diagnostic> diagnostics
	) {
		this.registry = registry;
		this.enabled = Map.copyOf(enabled);
		this.excluded = Map.copyOf(excluded);
		this.methods = Map.copyOf(methods);
		this.omissions = List.copyOf(omissions);
		this.diagnostics = List.copyOf(diagnostics);
	}

	public TypeRegistry registry() {
		return registry;
	}

	public boolean isEnabled(TypeId id) {
		return enabled.containsKey(id);
	}

	/**
	 * @throws IllegalArgumentException if the type is not enabled
	 */
	public TypeDef get(TypeId id) {
		TypeDef result = enabled.get(id);
		if (result == null) {
			throw new IllegalArgumentException("Type " + id + " " + exclusionReason(id));
		}
		return result;
	}

	/**
	 * @return enabled types, sorted by id
	 */
	public List<TypeDef> types() {
		return enabled.values().stream()
			.sorted(comparing(TypeDef::id))
			.toList();
	}

	/**
	 * @return the enabled methods of an enabled type, in declaration order
	 */
	public List<MethodDef> methodsOf(TypeId id) {
		List<MethodDef> result = methods.get(id);
		if (result == null) {
			throw new IllegalArgumentException("Type " + id + " " + exclusionReason(id));
		}
		return result;
	}

	/**
	 * @return a phrase completing "the type ..." explaining why the type is absent
	 */
	public String exclusionReason(TypeId id) {
		if (enabled.containsKey(id)) {
			return "is enabled";
		}
		String reason = excluded.get(id);
		if (reason == null) {
			return "does not exist";
		}
		return "is not available: " + reason;
	}

	public List<Omission> omissions() {
		return omissions;
	}

	/**
	 * @return attribute errors found while filtering
	 */
	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}
}
