package works.tether.jackson;

/**
 * An IR document that can't be read: invalid JSON, or JSON that doesn't describe types.
 * <p>
 * Structural problems with the types themselves, such as dangling references,
 * are found later, when the {@link works.tether.ir.Registry.Builder Registry.Builder} is built.
 */
public class IrFormatException extends RuntimeException {
	public IrFormatException(String message) {
		super(message);
	}

	public IrFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
