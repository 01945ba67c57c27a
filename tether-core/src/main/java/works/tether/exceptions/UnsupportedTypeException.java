package works.tether.exceptions;

import works.tether.ir.TypeRef;
import works.tether.report.ErrorKind;

/**
 * The IR uses a type, or a combination of types, that this backend can't marshal.
 */
public final class UnsupportedTypeException extends GenerationException {
	private final TypeRef type;

	public UnsupportedTypeException(TypeRef type, String message) {
		super(message + ": " + type);
		this.type = type;
	}

	public TypeRef type() {
		return type;
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.UNSUPPORTED_TYPE;
	}
}
