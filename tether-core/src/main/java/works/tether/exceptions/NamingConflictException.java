package works.tether.exceptions;

import works.tether.report.ErrorKind;

/**
 * Two generated names that must be distinct are the same.
 */
public final class NamingConflictException extends GenerationException {
	private final String name;

	public NamingConflictException(String name, String message) {
		super(message);
		this.name = name;
	}

	/**
	 * @return the name that was generated twice
	 */
	public String name() {
		return name;
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.NAMING_CONFLICT;
	}
}
