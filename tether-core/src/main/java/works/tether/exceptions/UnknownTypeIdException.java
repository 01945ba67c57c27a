package works.tether.exceptions;

import works.tether.ir.TypeId;

public class UnknownTypeIdException extends RuntimeException {
	private final TypeId typeId;

	public UnknownTypeIdException(TypeId typeId) {
		super("No type with id " + typeId);
		this.typeId = typeId;
	}

	public TypeId typeId() {
		return typeId;
	}
}
