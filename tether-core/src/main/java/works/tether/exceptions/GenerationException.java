package works.tether.exceptions;

import works.tether.report.ErrorKind;

/**
 * A problem that prevents correct glue from being generated for one type or method.
 * <p>
 * These are thrown by the individual passes and caught by the
 * {@link works.tether.emit.OutputEmitter OutputEmitter}, which turns them into
 * {@link works.tether.report.Diagnostic Diagnostic}s so that one bad type
 * doesn't stop the rest of the run.
 */
public sealed abstract class GenerationException extends RuntimeException permits
	UnresolvedTypeReferenceException,
	NamingConflictException,
	UnsupportedTypeException,
	AttributeResolutionException
{
	protected GenerationException(String message) {
		super(message);
	}

	protected GenerationException(String message, Throwable cause) {
		super(message, cause);
	}

	public abstract ErrorKind kind();
}
