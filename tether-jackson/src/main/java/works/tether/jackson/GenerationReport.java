package works.tether.jackson;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.tether.report.Diagnostic;
import works.tether.report.GenerationResult;
import works.tether.report.Omission;

/**
 * The JSON form of a {@link GenerationResult}.
 * Artifact contents are left out; they're written as files of their own.
 *
 * @param status {@code success} or {@code failed}
 */
public record GenerationReport(
	String status,
	String summary,
	List<ArtifactEntry> artifacts,
	List<String> exportedSymbols,
	List<DiagnosticEntry> diagnostics,
	List<OmissionEntry> omissions
) {
	public record ArtifactEntry(String path, int length) { }

	public record DiagnosticEntry(@Nullable String type, @Nullable String method, String kind, String message) { }

	public record OmissionEntry(String type, @Nullable String method, String reason) { }

	public static GenerationReport of(GenerationResult result) {
		return new GenerationReport(
			result.isSuccess() ? SUCCESS : FAILED,
			result.summary(),
			result.artifacts().stream()
				.map(a -> new ArtifactEntry(a.path(), a.content().length()))
				.toList(),
			List.copyOf(result.exportedSymbols()),
			result.diagnostics().stream()
				.map(GenerationReport::entry)
				.toList(),
			result.omissions().stream()
				.map(GenerationReport::entry)
				.toList());
	}

	private static DiagnosticEntry entry(Diagnostic d) {
		return new DiagnosticEntry(
			(d.type() == null) ? null : d.type().value(),
			d.method(),
			d.kind().name(),
			d.message());
	}

	private static OmissionEntry entry(Omission o) {
		return new OmissionEntry(o.type().value(), o.method(), o.reason());
	}

	public static final String SUCCESS = "success";
	public static final String FAILED = "failed";
}
