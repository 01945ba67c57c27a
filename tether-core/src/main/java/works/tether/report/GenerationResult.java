package works.tether.report;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import works.tether.emit.Artifact;

import static java.util.Collections.unmodifiableSortedSet;

/**
 * Everything a run produced.
 * <p>
 * Artifacts of types that generated cleanly are present even when the run failed:
 * a failure in one type doesn't withhold the output of unrelated types.
 * Callers decide whether to write partial output.
 *
 * @param artifacts sorted by path
 * @param exportedSymbols every native symbol the emitted artifacts declare
 * @param diagnostics every error, in a deterministic order
 * @param omissions everything skipped because it's disabled for this backend
 */
public record GenerationResult(
	List<Artifact> artifacts,
	SortedSet<String> exportedSymbols,
	List<Diagnostic> diagnostics,
	List<Omission> omissions
) {
	public GenerationResult {
		artifacts = List.copyOf(artifacts);
		exportedSymbols = unmodifiableSortedSet(new TreeSet<>(exportedSymbols));
		diagnostics = diagnostics.stream().sorted(Diagnostic.ORDER).toList();
		omissions = omissions.stream().sorted(Omission.ORDER).toList();
	}

	public static GenerationResult failed(List<Diagnostic> diagnostics) {
		return new GenerationResult(List.of(), new TreeSet<>(), diagnostics, List.of());
	}

	public boolean isSuccess() {
		return diagnostics.isEmpty();
	}

	public List<Diagnostic> diagnosticsOfKind(ErrorKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	public String summary() {
		if (isSuccess()) {
			return "Generated " + artifacts.size() + " artifacts exporting " + exportedSymbols.size() + " symbols";
		}
		StringBuilder sb = new StringBuilder()
			.append("Generation failed with ")
			.append(diagnostics.size())
			.append(diagnostics.size() == 1 ? " error:" : " errors:");
		diagnostics.forEach(d -> sb.append("\n\t").append(d));
		return sb.toString();
	}
}
