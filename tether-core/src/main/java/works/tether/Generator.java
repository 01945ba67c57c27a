package works.tether;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tether.config.GeneratorConfig;
import works.tether.emit.ArtifactWriter;
import works.tether.emit.Backend;
import works.tether.emit.Backends;
import works.tether.emit.OutputEmitter;
import works.tether.exceptions.LoweringException;
import works.tether.ir.Registry;
import works.tether.ir.TypeRegistry;
import works.tether.report.Diagnostic;
import works.tether.report.GenerationResult;

/**
 * The entry point: one call is one generation run.
 * <p>
 * A run is a pure function of the IR and the configuration.
 * Nothing is written to disk unless {@link #write} is called.
 */
public final class Generator {
	private Generator() { }

	/**
	 * Uses the backend named by {@link GeneratorConfig#backend()}, found with {@link Backends#forId}.
	 */
	public static GenerationResult generate(TypeRegistry registry, GeneratorConfig config) {
		return generate(Backends.forId(config.backend()), registry, config);
	}

	public static <H> GenerationResult generate(Backend<H> backend, TypeRegistry registry, GeneratorConfig config) {
		return new OutputEmitter<>(backend, config).emit(registry);
	}

	/**
	 * Like {@link #generate(TypeRegistry, GeneratorConfig)}, except that if the registry can't be built,
	 * the result is a failure with one {@link works.tether.report.ErrorKind#LOWERING_ERROR LOWERING_ERROR} per problem.
	 */
	public static GenerationResult generate(Registry.Builder builder, GeneratorConfig config) {
		return generate(Backends.forId(config.backend()), builder, config);
	}

	public static <H> GenerationResult generate(Backend<H> backend, Registry.Builder builder, GeneratorConfig config) {
		Registry registry;
		try {
			registry = builder.build();
		} catch (LoweringException e) {
			LOGGER.warn("Unable to build registry: {}", e.getMessage());
			return GenerationResult.failed(e.problems().stream().map(Diagnostic::lowering).toList());
		}
		return generate(backend, registry, config);
	}

	/**
	 * Writes the artifacts of {@code result} below {@link GeneratorConfig#outputDirectory()}.
	 * Partial output of a failed run is written too; check {@link GenerationResult#isSuccess()} first
	 * if that's not wanted.
	 */
	public static List<Path> write(GenerationResult result, GeneratorConfig config) throws IOException {
		return new ArtifactWriter(config.outputDirectory()).writeAll(result.artifacts());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Generator.class);
}
