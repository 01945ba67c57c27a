package works.tether.emit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes artifacts below an output directory, creating directories as needed.
 * Existing files at the same paths are replaced.
 */
public final class ArtifactWriter {
	private final Path outputDirectory;

	public ArtifactWriter(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	/**
	 * @return the files written, in the order of {@code artifacts}
	 */
	public List<Path> writeAll(List<Artifact> artifacts) throws IOException {
		Path root = outputDirectory.toAbsolutePath().normalize();
		Files.createDirectories(root);
		List<Path> written = new ArrayList<>();
		for (Artifact artifact: artifacts) {
			Path target = root.resolve(artifact.path()).normalize();
			if (!target.startsWith(root)) {
				throw new IllegalArgumentException("Artifact escapes the output directory: " + artifact.path());
			}
			Files.createDirectories(target.getParent());
			Files.writeString(target, artifact.content(), UTF_8);
			LOGGER.debug("Wrote {}", target);
			written.add(target);
		}
		LOGGER.info("Wrote {} artifacts to {}", written.size(), root);
		return List.copyOf(written);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactWriter.class);
}
