package works.tether.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tether.config.BackendId;
import works.tether.config.FeatureSet;
import works.tether.exceptions.AttributeResolutionException;
import works.tether.exceptions.UnresolvedTypeReferenceException;
import works.tether.ir.Attributes;
import works.tether.ir.FieldDef;
import works.tether.ir.Identifiers;
import works.tether.ir.MethodDef;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;
import works.tether.report.Diagnostic;
import works.tether.report.Omission;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Decides which parts of the IR exist for one backend and feature set.
 * <p>
 * This is a pure function of the resolved {@link Attributes}, the {@link BackendId},
 * and the {@link FeatureSet}: it never looks at anything else,
 * and in particular never interprets attribute syntax.
 */
public final class AttributeFilter {
	private final BackendId backend;
	private final FeatureSet features;

	public AttributeFilter(BackendId backend, FeatureSet features) {
		this.backend = requireNonNull(backend);
		this.features = requireNonNull(features);
	}

	/**
	 * @throws AttributeResolutionException if the attributes contradict themselves
	 */
	public Enablement evaluate(Attributes attributes) {
		validate(attributes);
		String name = backend.value();
		if (attributes.disabledBackends().contains(name)) {
			return Enablement.disabled("disabled for backend " + name);
		}
		if (!attributes.onlyBackends().isEmpty() && !attributes.onlyBackends().contains(name)) {
			return Enablement.disabled("enabled only for backends " + sorted(attributes.onlyBackends()));
		}
		List<String> missing = attributes.requiredFeatures().stream()
			.filter(f -> !features.isActive(f))
			.sorted()
			.toList();
		if (!missing.isEmpty()) {
			return Enablement.disabled("requires inactive features " + missing);
		}
		List<String> excluded = attributes.excludedFeatures().stream()
			.filter(features::isActive)
			.sorted()
			.toList();
		if (!excluded.isEmpty()) {
			return Enablement.disabled("excluded by active features " + excluded);
		}
		return Enablement.ENABLED;
	}

	/**
	 * Filters the whole registry.
	 * <p>
	 * Attribute errors don't stop the filter: they become diagnostics on the {@link EnabledSurface},
	 * and the offending item is treated as absent.
	 */
	public EnabledSurface resolve(TypeRegistry registry) {
		Map<TypeId, TypeDef> enabled = new TreeMap<>();
		Map<TypeId, String> excluded = new TreeMap<>();
		Map<TypeId, List<MethodDef>> methods = new TreeMap<>();
		List<Omission> omissions = new ArrayList<>();
		List<Diagnostic> diagnostics = new ArrayList<>();

		for (TypeDef type: registry.allTypes()) {
			Enablement enablement;
			try {
				enablement = evaluate(type.attributes());
			} catch (AttributeResolutionException e) {
				diagnostics.add(Diagnostic.of(type.id(), null, e));
				excluded.put(type.id(), "has invalid attributes");
				continue;
			}
			if (!enablement.enabled()) {
				LOGGER.debug("Omitting type {}: {}", type.id(), enablement.reason());
				omissions.add(new Omission(type.id(), null, enablement.reason()));
				excluded.put(type.id(), enablement.reason());
				continue;
			}
			enabled.put(type.id(), type);
			List<MethodDef> enabledMethods = new ArrayList<>();
			for (MethodDef method: type.methods()) {
				try {
					Enablement m = evaluate(method.attributes());
					if (m.enabled()) {
						enabledMethods.add(method);
					} else {
						LOGGER.debug("Omitting method {}.{}: {}", type.id(), method.name(), m.reason());
						omissions.add(new Omission(type.id(), method.name(), m.reason()));
					}
				} catch (AttributeResolutionException e) {
					diagnostics.add(Diagnostic.of(type.id(), method.name(), e));
				}
			}
			methods.put(type.id(), List.copyOf(enabledMethods));
		}

		return new EnabledSurface(registry, enabled, excluded, methods, omissions, diagnostics);
	}

	/**
	 * @throws UnresolvedTypeReferenceException if {@code method} mentions a type
	 * that is not part of {@code surface}
	 */
	public static void checkReferences(EnabledSurface surface, TypeDef owner, MethodDef method) {
		for (TypeId id: method.referencedTypes()) {
			requireEnabled(surface, id, () -> owner.name() + "." + method.name());
		}
	}

	/**
	 * Struct fields are part of the struct's surface, so a field of a disabled type
	 * is as much an error as a parameter of one.
	 *
	 * @throws UnresolvedTypeReferenceException if a field of {@code struct} mentions
	 * a type that is not part of {@code surface}
	 */
	public static void checkFieldReferences(EnabledSurface surface, StructDef struct) {
		for (FieldDef field: struct.fields()) {
			for (TypeId id: field.type().referencedTypes()) {
				requireEnabled(surface, id, () -> struct.name() + "." + field.name());
			}
		}
	}

	private static void requireEnabled(EnabledSurface surface, TypeId id, Supplier<String> where) {
		if (!surface.isEnabled(id)) {
			throw new UnresolvedTypeReferenceException(id,
				where.get() + " refers to " + id + ", which " + surface.exclusionReason(id));
		}
	}

	private void validate(Attributes attributes) {
		if (Stream.of(attributes.disabledBackends(), attributes.onlyBackends()).flatMap(Set::stream).anyMatch(String::isBlank)) {
			throw new AttributeResolutionException("Blank backend name in attributes");
		}
		if (Stream.of(attributes.requiredFeatures(), attributes.excludedFeatures()).flatMap(Set::stream).anyMatch(String::isBlank)) {
			throw new AttributeResolutionException("Blank feature name in attributes");
		}
		List<String> both = attributes.disabledBackends().stream()
			.filter(attributes.onlyBackends()::contains)
			.sorted()
			.toList();
		if (!both.isEmpty()) {
			throw new AttributeResolutionException("Backends both disabled and exclusively enabled: " + both);
		}
		List<String> contradictory = attributes.requiredFeatures().stream()
			.filter(attributes.excludedFeatures()::contains)
			.sorted()
			.toList();
		if (!contradictory.isEmpty()) {
			throw new AttributeResolutionException("Features both required and excluded: " + contradictory);
		}
		String rename = attributes.rename();
		if (rename != null && !Identifiers.isValid(rename)) {
			throw new AttributeResolutionException("Rename is not a valid identifier: \"" + rename + "\"");
		}
	}

	private static String sorted(Set<String> names) {
		return names.stream().sorted().collect(joining(", ", "[", "]"));
	}

	@Override
	public String toString() {
		return "AttributeFilter(" + backend + ", " + features + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AttributeFilter.class);
}
