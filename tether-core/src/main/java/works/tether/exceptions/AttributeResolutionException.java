package works.tether.exceptions;

import works.tether.report.ErrorKind;

/**
 * The resolved attribute state handed to the generator is malformed or contradicts itself.
 */
public final class AttributeResolutionException extends GenerationException {
	public AttributeResolutionException(String message) {
		super(message);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.ATTRIBUTE_RESOLUTION_ERROR;
	}
}
