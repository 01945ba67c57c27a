package works.tether.config;

/**
 * Names the host language a backend targets, as it appears in attribute state.
 */
public record BackendId(String value) {
	public BackendId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Backend id can't be blank");
		}
	}

	public static BackendId of(String value) {
		return new BackendId(value);
	}

	@Override
	public String toString() {
		return value;
	}
}
