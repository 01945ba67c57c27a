package works.tether.config;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Everything a generation run needs to know besides the IR.
 * <p>
 * This arrives fully resolved: the generator never looks at command lines
 * or environment variables itself.
 */
public final class GeneratorConfig {
	private final BackendId backend;
	private final Path outputDirectory;
	private final FeatureSet features;
	private final String hostPackage;
	private final String libraryName;
	private final int pointerWidth;
	private final boolean parallel;

	private GeneratorConfig(
		BackendId backend,
		Path outputDirectory,
		FeatureSet features,
		String hostPackage,
		String libraryName,
		int pointerWidth,
		boolean parallel
	) {
		this.backend = backend;
		this.outputDirectory = outputDirectory;
		this.features = features;
		this.hostPackage = hostPackage;
		this.libraryName = libraryName;
		this.pointerWidth = pointerWidth;
		this.parallel = parallel;
	}

	public static Builder builder(BackendId backend) {
		return new Builder(backend);
	}

	public BackendId backend() {
		return backend;
	}

	public Path outputDirectory() {
		return outputDirectory;
	}

	public FeatureSet features() {
		return features;
	}

	/**
	 * @return the namespace generated host units are placed in, such as a Java package
	 */
	public String hostPackage() {
		return hostPackage;
	}

	/**
	 * @return the name of the native library the generated bindings load
	 */
	public String libraryName() {
		return libraryName;
	}

	/**
	 * @return the width in bits of a native pointer, which is also the register width
	 * used to decide whether a value can be returned directly
	 */
	public int pointerWidth() {
		return pointerWidth;
	}

	public boolean parallel() {
		return parallel;
	}

	public Builder toBuilder() {
		return new Builder(backend)
			.outputDirectory(outputDirectory)
			.features(features)
			.hostPackage(hostPackage)
			.libraryName(libraryName)
			.pointerWidth(pointerWidth)
			.parallel(parallel);
	}

	@Override
	public String toString() {
		return "GeneratorConfig(backend=" + backend
			+ ", outputDirectory=" + outputDirectory
			+ ", features=" + features
			+ ", hostPackage=" + hostPackage
			+ ", libraryName=" + libraryName
			+ ", pointerWidth=" + pointerWidth
			+ ", parallel=" + parallel + ")";
	}

	public static class Builder {
		private final BackendId backend;
		private Path outputDirectory = Path.of("generated");
		private FeatureSet features = FeatureSet.NONE;
		private String hostPackage = "bindings";
		private String libraryName = "native";
		private int pointerWidth = 64;
		private boolean parallel = false;

		Builder(BackendId backend) {
			this.backend = requireNonNull(backend);
		}

		public Builder outputDirectory(Path outputDirectory) {
			this.outputDirectory = requireNonNull(outputDirectory);
			return this;
		}

		public Builder features(FeatureSet features) {
			this.features = requireNonNull(features);
			return this;
		}

		public Builder hostPackage(String hostPackage) {
			if (hostPackage.isBlank()) {
				throw new IllegalArgumentException("Host package can't be blank");
			}
			this.hostPackage = hostPackage;
			return this;
		}

		public Builder libraryName(String libraryName) {
			if (libraryName.isBlank()) {
				throw new IllegalArgumentException("Library name can't be blank");
			}
			this.libraryName = libraryName;
			return this;
		}

		public Builder pointerWidth(int pointerWidth) {
			if (pointerWidth != 32 && pointerWidth != 64) {
				throw new IllegalArgumentException("Unsupported pointer width: " + pointerWidth);
			}
			this.pointerWidth = pointerWidth;
			return this;
		}

		public Builder parallel(boolean parallel) {
			this.parallel = parallel;
			return this;
		}

		public GeneratorConfig build() {
			return new GeneratorConfig(backend, outputDirectory, features, hostPackage, libraryName, pointerWidth, parallel);
		}
	}
}
