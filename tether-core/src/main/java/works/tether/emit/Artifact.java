package works.tether.emit;

import static java.util.Objects.requireNonNull;

/**
 * One generated file.
 *
 * @param path relative to the output directory, with {@code /} separators
 */
public record Artifact(String path, String content) {
	public Artifact {
		requireNonNull(path);
		requireNonNull(content);
		if (path.isEmpty() || path.startsWith("/") || path.contains("\\")) {
			throw new IllegalArgumentException("Artifact path must be relative with forward slashes: \"" + path + "\"");
		}
		for (String segment: path.split("/")) {
			if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
				throw new IllegalArgumentException("Invalid segment in artifact path \"" + path + "\"");
			}
		}
	}

	@Override
	public String toString() {
		return "Artifact(" + path + ", " + content.length() + " chars)";
	}
}
