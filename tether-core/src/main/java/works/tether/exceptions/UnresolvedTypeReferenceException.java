package works.tether.exceptions;

import works.tether.ir.TypeId;
import works.tether.report.ErrorKind;

/**
 * An enabled method refers to a type that does not exist in this backend's output.
 */
public final class UnresolvedTypeReferenceException extends GenerationException {
	private final TypeId referencedType;

	public UnresolvedTypeReferenceException(TypeId referencedType, String message) {
		super(message);
		this.referencedType = referencedType;
	}

	public TypeId referencedType() {
		return referencedType;
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.UNRESOLVED_TYPE_REFERENCE;
	}
}
