package works.tether.exceptions;

import java.util.List;

/**
 * The IR could not be assembled into a {@link works.tether.ir.Registry Registry}.
 * <p>
 * Unlike {@link GenerationException}, this is not tied to any one type:
 * without a registry there is nothing to generate, so the run stops here.
 */
public class LoweringException extends RuntimeException {
	private final List<String> problems;

	public LoweringException(List<String> problems) {
		super(problems.size() == 1
			? problems.get(0)
			: problems.size() + " problems with the IR:\n\t" + String.join("\n\t", problems));
		this.problems = List.copyOf(problems);
	}

	public List<String> problems() {
		return problems;
	}
}
