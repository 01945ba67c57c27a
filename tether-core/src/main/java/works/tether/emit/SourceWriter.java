package works.tether.emit;

/**
 * Accumulates tab-indented source text.
 */
public final class SourceWriter {
	private final StringBuilder sb = new StringBuilder();
	private int depth = 0;

	public SourceWriter line(String text) {
		if (!text.isEmpty()) {
			sb.append("\t".repeat(depth)).append(text);
		}
		sb.append('\n');
		return this;
	}

	public SourceWriter line() {
		return line("");
	}

	/**
	 * Writes {@code header} followed by an opening brace, and indents.
	 */
	public SourceWriter open(String header) {
		line(header + " {");
		depth++;
		return this;
	}

	/**
	 * Outdents and writes a closing brace followed by {@code suffix}.
	 */
	public SourceWriter close(String suffix) {
		outdent();
		return line("}" + suffix);
	}

	public SourceWriter close() {
		return close("");
	}

	public SourceWriter indent() {
		depth++;
		return this;
	}

	public SourceWriter outdent() {
		if (depth == 0) {
			throw new IllegalStateException("Unbalanced outdent");
		}
		depth--;
		return this;
	}

	/**
	 * Writes a {@code /** ... *}{@code /} block, or nothing if {@code docs} is blank.
	 */
	public SourceWriter docComment(String docs) {
		if (docs.isBlank()) {
			return this;
		}
		line("/**");
		for (String docLine: docs.strip().split("\n")) {
			String text = docLine.stripTrailing().replace("*/", "* /");
			line(text.isEmpty() ? " *" : " * " + text);
		}
		return line(" */");
	}

	@Override
	public String toString() {
		return sb.toString();
	}
}
