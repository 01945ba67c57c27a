package works.tether.runtime;

import com.sun.jna.Library;
import com.sun.jna.Native;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the native entry points of generated bindings.
 * <p>
 * An implementation registered with {@link #override} takes the place of the native library
 * for that interface. This lets bindings run against a Java stand-in,
 * which is how they're tested without a compiled library.
 * Overrides must be registered before the generated class is initialized.
 */
public final class Bindings {
	private static final Map<Class<?>, Object> OVERRIDES = new ConcurrentHashMap<>();

	private Bindings() { }

	public static <T extends Library> T load(String libraryName, Class<T> abi) {
		Object override = OVERRIDES.get(abi);
		if (override != null) {
			LOGGER.debug("Using override for {}", abi.getName());
			return abi.cast(override);
		}
		LOGGER.debug("Loading native library {} for {}", libraryName, abi.getName());
		return Native.load(libraryName, abi);
	}

	/**
	 * @param abi the generated interface declaring the entry points
	 * @param implementation an instance of {@code abi}, such as a {@link java.lang.reflect.Proxy}
	 */
	public static void override(Class<?> abi, Object implementation) {
		if (!Library.class.isAssignableFrom(abi)) {
			throw new IllegalArgumentException(abi.getName() + " is not a native library interface");
		}
		OVERRIDES.put(abi, abi.cast(implementation));
	}

	public static void clearOverride(Class<?> abi) {
		OVERRIDES.remove(abi);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Bindings.class);
}
