package works.tether.jackson;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.StreamWriteFeature;
import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;
import works.tether.report.GenerationResult;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Writes a {@link GenerationReport} as indented JSON, properties in declaration order.
 */
public final class GenerationReportWriter {
	private final ObjectMapper mapper;

	public GenerationReportWriter() {
		this(JsonMapper.builder()
			.enable(SerializationFeature.INDENT_OUTPUT)
			.disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
			.disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
			.build());
	}

	public GenerationReportWriter(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public String write(GenerationResult result) {
		return mapper.writeValueAsString(GenerationReport.of(result));
	}

	/**
	 * Leaves {@code out} open.
	 */
	public void write(GenerationResult result, Writer out) {
		mapper.writeValue(out, GenerationReport.of(result));
	}

	/**
	 * Creates or replaces {@code file}, creating its parent directories as needed.
	 */
	public void write(GenerationResult result, Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		try (Writer out = Files.newBufferedWriter(file, UTF_8)) {
			write(result, out);
		}
		LOGGER.debug("Wrote generation report to {}", file);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GenerationReportWriter.class);
}
