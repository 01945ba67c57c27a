package works.tether.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tether.abi.AbiSignature;
import works.tether.abi.CTypes;
import works.tether.abi.DataLayout;
import works.tether.abi.NativeLowering;
import works.tether.abi.SignatureFormatter;
import works.tether.abi.SymbolFormatter;
import works.tether.config.GeneratorConfig;
import works.tether.exceptions.GenerationException;
import works.tether.exceptions.NamingConflictException;
import works.tether.exceptions.UnresolvedTypeReferenceException;
import works.tether.filter.AttributeFilter;
import works.tether.filter.EnabledSurface;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.ParamDef;
import works.tether.ir.StructDef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;
import works.tether.mapping.HostNames;
import works.tether.mapping.MappingContext;
import works.tether.mapping.Position;
import works.tether.mapping.TypeMapper;
import works.tether.mapping.TypeMapping;
import works.tether.ownership.CallOwnership;
import works.tether.ownership.OwnershipTracker;
import works.tether.report.Diagnostic;
import works.tether.report.GenerationResult;

import static java.util.Comparator.comparing;
import static works.tether.logging.MappedDiagnosticContext.MDCScope;
import static works.tether.logging.MappedDiagnosticContext.setupMDC;

/**
 * Runs the whole pipeline for one backend and turns its outcome into a {@link GenerationResult}.
 * <p>
 * Each enabled type goes through filter, mapping, formatting and emission on its own.
 * A {@link GenerationException} aborts only the type (or method) that threw it:
 * the error becomes a {@link Diagnostic}, that type's artifacts are withheld,
 * and every other type is still generated. A method with invalid attributes
 * withholds its owner the same way.
 * Once all types are done, clashes between them (host names, paths, native symbols)
 * are reported against every type involved, and any type that refers to a withheld
 * type is withheld too, since its output would call into code that doesn't exist.
 */
public final class OutputEmitter<H> {
	private final Backend<H> backend;
	private final GeneratorConfig config;

	public OutputEmitter(Backend<H> backend, GeneratorConfig config) {
		if (!backend.id().equals(config.backend())) {
			throw new IllegalArgumentException("Backend " + backend.id() + " can't run a configuration for " + config.backend());
		}
		this.backend = backend;
		this.config = config;
	}

	public GenerationResult emit(TypeRegistry registry) {
		LOGGER.debug("Emitting with {}", config);
		EnabledSurface surface = new AttributeFilter(config.backend(), config.features()).resolve(registry);
		HostNames hostNames = HostNames.of(surface.types(), backend::hostName);
		DataLayout layout = new DataLayout(registry, config.pointerWidth());
		EmissionContext context = new EmissionContext(config, surface, hostNames, layout, new CTypes(registry));
		SignatureFormatter formatter = new SignatureFormatter(layout);

		Stream<TypeDef> types = surface.types().stream();
		if (config.parallel()) {
			types = types.parallel();
		}
		List<TypeOutcome> outcomes = types
			.map(type -> process(type, context, formatter))
			.sorted(comparing(TypeOutcome::type))
			.toList();

		List<Artifact> library = new ArrayList<>();
		library.add(CHeaderEmitter.runtimeHeader());
		library.addAll(backend.emitLibrary(context));

		Map<TypeId, List<Diagnostic>> conflicts = findConflicts(outcomes, library, hostNames);
		Set<TypeId> invalidMethods = new TreeSet<>();
		surface.diagnostics().forEach(d -> invalidMethods.add(d.type()));

		Map<TypeId, List<Diagnostic>> withheld = new TreeMap<>();
		for (TypeOutcome outcome: outcomes) {
			List<Diagnostic> problems = new ArrayList<>(outcome.diagnostics());
			problems.addAll(conflicts.getOrDefault(outcome.type(), List.of()));
			if (!problems.isEmpty() || invalidMethods.contains(outcome.type())) {
				withheld.put(outcome.type(), problems);
			}
		}
		withholdDependents(outcomes, withheld);

		List<Artifact> artifacts = new ArrayList<>(library);
		Set<String> symbols = new TreeSet<>();
		List<Diagnostic> diagnostics = new ArrayList<>(surface.diagnostics());
		for (TypeOutcome outcome: outcomes) {
			List<Diagnostic> problems = withheld.get(outcome.type());
			if (problems == null) {
				artifacts.addAll(outcome.artifacts());
				symbols.addAll(outcome.symbols());
			} else {
				LOGGER.debug("Withholding artifacts of {}", outcome.type());
				diagnostics.addAll(problems);
			}
		}
		artifacts.sort(comparing(Artifact::path));

		GenerationResult result = new GenerationResult(artifacts, new TreeSet<>(symbols), diagnostics, surface.omissions());
		if (result.isSuccess()) {
			LOGGER.info("{} backend: {}", backend.id(), result.summary());
		} else {
			LOGGER.warn("{} backend: {}", backend.id(), result.summary());
		}
		return result;
	}

	private TypeOutcome process(TypeDef def, EmissionContext context, SignatureFormatter formatter) {
		try (MDCScope ignored = setupMDC(def.id())) {
			LOGGER.debug("Processing {} {}", def.kindName(), def.id());
			List<Diagnostic> diagnostics = new ArrayList<>();

			List<FieldPlan<H>> fields = List.of();
			if (def instanceof StructDef struct) {
				try {
					fields = planFields(struct, context);
				} catch (GenerationException e) {
					diagnostics.add(diagnostic(def, null, e));
				}
			}

			List<MethodDef> enabledMethods = context.surface().methodsOf(def.id());
			List<MethodPlan<H>> methods = new ArrayList<>();
			for (MethodDef method: enabledMethods) {
				try {
					methods.add(planMethod(def, method, context, formatter));
				} catch (GenerationException e) {
					diagnostics.add(diagnostic(def, method.name(), e));
				}
			}

			List<String> symbols = List.of();
			try {
				symbols = SymbolFormatter.symbolsOf(def, enabledMethods);
			} catch (NamingConflictException e) {
				diagnostics.add(diagnostic(def, null, e));
			}

			if (!diagnostics.isEmpty()) {
				return TypeOutcome.failed(def.id(), diagnostics);
			}

			Optional<AbiSignature> destructorSignature = (def instanceof OpaqueDef opaque)
				? Optional.of(formatter.destructor(opaque))
				: Optional.empty();
			TypeUnit<H> unit = new TypeUnit<>(
				def,
				context.hostNames().nameOf(def.id()),
				fields,
				methods,
				OwnershipTracker.destructorFor(def),
				destructorSignature,
				symbols);

			List<Artifact> artifacts = new ArrayList<>();
			try {
				artifacts.addAll(backend.emitUnit(unit, context));
			} catch (GenerationException e) {
				return TypeOutcome.failed(def.id(), List.of(diagnostic(def, null, e)));
			}
			artifacts.add(CHeaderEmitter.header(unit, context));
			LOGGER.trace("Emitted {}", artifacts);
			return new TypeOutcome(def.id(), artifacts, symbols, List.of(), referencesOf(def, enabledMethods));
		}
	}

	private List<FieldPlan<H>> planFields(StructDef struct, EmissionContext context) {
		AttributeFilter.checkFieldReferences(context.surface(), struct);
		OwnershipTracker.checkFields(struct);
		// Rejects structs that contain themselves
		context.layout().layoutOf(struct);
		TypeMapper<H> mapper = backend.typeMapper();
		MappingContext mappingContext = context.mappingContext();
		List<FieldPlan<H>> result = new ArrayList<>();
		for (FieldDef field: struct.fields()) {
			result.add(new FieldPlan<>(
				field,
				mapper.map(field.type(), Position.FIELD, mappingContext),
				NativeLowering.lowerField(field)));
		}
		return result;
	}

	private MethodPlan<H> planMethod(TypeDef owner, MethodDef method, EmissionContext context, SignatureFormatter formatter) {
		AttributeFilter.checkReferences(context.surface(), owner, method);
		AbiSignature signature = formatter.format(owner, method);
		CallOwnership ownership = OwnershipTracker.analyze(owner, method);
		TypeMapper<H> mapper = backend.typeMapper();
		MappingContext mappingContext = context.mappingContext();
		List<ParamPlan<H>> params = new ArrayList<>();
		for (ParamDef param: method.params()) {
			TypeMapping<H> mapping = new TypeMapping<>(
				param.type(),
				mapper.map(param.type(), Position.PARAM, mappingContext),
				signature.slotsFor(param.name()));
			params.add(new ParamPlan<>(param, mapping, ownership.transferOf(param.name())));
		}
		TypeMapping<H> returns = new TypeMapping<>(
			method.returnType(),
			mapper.map(method.returnType(), Position.RETURN, mappingContext),
			signature.hiddenParams());
		LOGGER.trace("Planned {}", signature);
		return new MethodPlan<>(method, signature, ownership, params, returns);
	}

	private static List<Reference> referencesOf(TypeDef def, List<MethodDef> enabledMethods) {
		List<Reference> result = new ArrayList<>();
		if (def instanceof StructDef struct) {
			for (FieldDef field: struct.fields()) {
				field.type().referencedTypes().forEach(id ->
					result.add(new Reference(id, null, def.name() + "." + field.name())));
			}
		}
		for (MethodDef method: enabledMethods) {
			method.referencedTypes().forEach(id ->
				result.add(new Reference(id, method.name(), def.name() + "." + method.name())));
		}
		return result;
	}

	/**
	 * Adds every type that refers to a withheld type to {@code withheld}, until nothing changes.
	 */
	private static void withholdDependents(List<TypeOutcome> outcomes, Map<TypeId, List<Diagnostic>> withheld) {
		boolean changed = true;
		while (changed) {
			changed = false;
			for (TypeOutcome outcome: outcomes) {
				if (withheld.containsKey(outcome.type())) {
					continue;
				}
				List<Diagnostic> unresolved = outcome.references().stream()
					.filter(r -> withheld.containsKey(r.target()))
					.distinct()
					.map(r -> Diagnostic.of(outcome.type(), r.method(), new UnresolvedTypeReferenceException(r.target(),
						r.where() + " refers to " + r.target() + ", which failed to generate")))
					.toList();
				if (!unresolved.isEmpty()) {
					LOGGER.debug("{} depends on a withheld type", outcome.type());
					withheld.put(outcome.type(), unresolved);
					changed = true;
				}
			}
		}
	}

	/**
	 * Names that must be unique across the whole run.
	 * Only types that generated cleanly take part in the path and symbol checks,
	 * since the others contribute nothing to the output.
	 */
	private static Map<TypeId, List<Diagnostic>> findConflicts(List<TypeOutcome> outcomes, List<Artifact> library, HostNames hostNames) {
		Map<TypeId, List<Diagnostic>> result = new TreeMap<>();

		hostNames.collisions().forEach((name, ids) -> {
			for (TypeId id: ids) {
				result.computeIfAbsent(id, k -> new ArrayList<>()).add(conflict(id, name,
					"Host name " + name + " is used by " + ids));
			}
		});

		Set<String> libraryPaths = new TreeSet<>();
		library.forEach(a -> libraryPaths.add(a.path()));
		Map<String, List<TypeId>> pathOwners = new TreeMap<>();
		Map<String, List<TypeId>> symbolOwners = new TreeMap<>();
		for (TypeOutcome outcome: outcomes) {
			if (!outcome.diagnostics().isEmpty()) {
				continue;
			}
			outcome.artifacts().forEach(a -> pathOwners.computeIfAbsent(a.path(), k -> new ArrayList<>()).add(outcome.type()));
			outcome.symbols().forEach(s -> symbolOwners.computeIfAbsent(s, k -> new ArrayList<>()).add(outcome.type()));
		}
		pathOwners.forEach((path, ids) -> {
			if (ids.size() > 1 || libraryPaths.contains(path)) {
				for (TypeId id: ids) {
					result.computeIfAbsent(id, k -> new ArrayList<>()).add(conflict(id, path,
						"Artifact path " + path + " is produced by " + (libraryPaths.contains(path) ? "the library and " : "") + ids));
				}
			}
		});
		symbolOwners.forEach((symbol, ids) -> {
			if (ids.size() > 1) {
				for (TypeId id: ids) {
					result.computeIfAbsent(id, k -> new ArrayList<>()).add(conflict(id, symbol,
						"Native symbol " + symbol + " is exported by " + ids));
				}
			}
		});
		return result;
	}

	private static Diagnostic conflict(TypeId id, String name, String message) {
		return Diagnostic.of(id, null, new NamingConflictException(name, message));
	}

	private static Diagnostic diagnostic(TypeDef def, @Nullable String method, GenerationException e) {
		LOGGER.debug("{} in {}{}: {}", e.kind(), def.id(), method == null ? "" : "." + method, e.getMessage());
		return Diagnostic.of(def.id(), method, e);
	}

	private record TypeOutcome(
		TypeId type,
		List<Artifact> artifacts,
		List<String> symbols,
		List<Diagnostic> diagnostics,
		List<Reference> references
	) {
		TypeOutcome {
			artifacts = List.copyOf(artifacts);
			symbols = List.copyOf(symbols);
			diagnostics = List.copyOf(diagnostics);
			references = List.copyOf(references);
		}

		static TypeOutcome failed(TypeId type, List<Diagnostic> diagnostics) {
			return new TypeOutcome(type, List.of(), List.of(), diagnostics, List.of());
		}
	}

	/**
	 * One mention of {@code target} by a field ({@code method} is null) or a method of another type.
	 */
	private record Reference(TypeId target, @Nullable String method, String where) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(OutputEmitter.class);
}
