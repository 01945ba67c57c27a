package works.tether.jackson;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tether.Generator;
import works.tether.config.GeneratorConfig;
import works.tether.emit.Artifact;
import works.tether.ir.Attributes;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.Registry;
import works.tether.ir.SliceRef;
import works.tether.jackson.GenerationReport.ArtifactEntry;
import works.tether.jackson.GenerationReport.DiagnosticEntry;
import works.tether.jackson.GenerationReport.OmissionEntry;
import works.tether.java.JavaBackend;
import works.tether.report.GenerationResult;
import works.tether.testing.SampleRegistries;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationReportWriterTest {
	static final GeneratorConfig CONFIG = GeneratorConfig.builder(JavaBackend.ID).build();

	final GenerationReportWriter writer = new GenerationReportWriter();
	final ObjectMapper mapper = JsonMapper.builder().build();

	@Test
	void success() {
		GenerationResult result = Generator.generate(new JavaBackend(), SampleRegistries.addTwo(), CONFIG);
		GenerationReport report = mapper.readValue(writer.write(result), GenerationReport.class);

		assertEquals(GenerationReport.SUCCESS, report.status());
		assertEquals(List.copyOf(result.exportedSymbols()), report.exportedSymbols());
		assertEquals(result.artifacts().stream().map(Artifact::path).toList(),
			report.artifacts().stream().map(ArtifactEntry::path).toList());
		assertTrue(report.diagnostics().isEmpty());
		assertTrue(report.omissions().isEmpty());
	}

	@Test
	void failure_listsDiagnosticsAndOmissions() {
		Registry registry = Registry.of(
			OpaqueDef.of("Widget", MethodDef.borrowing("flags", SliceRef.of(PrimitiveKind.BOOL))),
			OpaqueDef.of("Hidden").withAttributes(Attributes.disabledFor("java")));
		GenerationResult result = Generator.generate(new JavaBackend(), registry, CONFIG);
		GenerationReport report = mapper.readValue(writer.write(result), GenerationReport.class);

		assertEquals(GenerationReport.FAILED, report.status());
		assertEquals(result.summary(), report.summary());
		DiagnosticEntry diagnostic = report.diagnostics().get(0);
		assertEquals("Widget", diagnostic.type());
		assertEquals("flags", diagnostic.method());
		assertEquals("UNSUPPORTED_TYPE", diagnostic.kind());
		OmissionEntry omission = report.omissions().get(0);
		assertEquals("Hidden", omission.type());
		assertNull(omission.method());
	}

	@Test
	void propertiesInDeclarationOrder() {
		GenerationResult result = Generator.generate(new JavaBackend(), SampleRegistries.addTwo(), CONFIG);
		String json = writer.write(result);
		assertTrue(json.indexOf("\"status\"") < json.indexOf("\"summary\""), json);
		assertTrue(json.indexOf("\"summary\"") < json.indexOf("\"artifacts\""), json);
		assertTrue(json.indexOf("\"diagnostics\"") < json.indexOf("\"omissions\""), json);
	}

	@Test
	void writer_isLeftOpen() {
		GenerationResult result = Generator.generate(new JavaBackend(), SampleRegistries.addTwo(), CONFIG);
		boolean[] closed = { false };
		StringWriter out = new StringWriter() {
			@Override
			public void close() {
				closed[0] = true;
			}
		};
		writer.write(result, out);
		assertFalse(closed[0]);
		assertEquals(writer.write(result), out.toString());
	}

	@Test
	void file_createsDirectories(@TempDir Path directory) throws IOException {
		GenerationResult result = Generator.generate(new JavaBackend(), SampleRegistries.addTwo(), CONFIG);
		Path file = directory.resolve("reports/nested/report.json");
		writer.write(result, file);
		assertEquals(writer.write(result), Files.readString(file, UTF_8));
	}
}
