package works.tether.emit;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import works.tether.config.BackendId;

/**
 * Finds {@link Backend} implementations on the classpath.
 */
public final class Backends {
	private Backends() { }

	public static List<Backend<?>> available() {
		return ServiceLoader.load(Backend.class, Backends.class.getClassLoader()).stream()
			.<Backend<?>>map(ServiceLoader.Provider::get)
			.toList();
	}

	/**
	 * @throws IllegalArgumentException if no backend has that id
	 */
	public static Backend<?> forId(BackendId id) {
		List<Backend<?>> backends = available();
		return backends.stream()
			.filter(b -> b.id().equals(id))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("No backend with id \"" + id + "\"; available: "
				+ backends.stream().map(b -> b.id().value()).sorted().collect(Collectors.joining(", ", "[", "]"))));
	}
}
