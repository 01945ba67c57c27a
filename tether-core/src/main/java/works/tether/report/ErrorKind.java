package works.tether.report;

public enum ErrorKind {
	/**
	 * An enabled method references a type that is disabled for this backend.
	 */
	UNRESOLVED_TYPE_REFERENCE,

	/**
	 * Two generated names that must be distinct collide.
	 */
	NAMING_CONFLICT,

	/**
	 * A type or combination of types that this backend does not implement.
	 */
	UNSUPPORTED_TYPE,

	/**
	 * Malformed or contradictory resolved attribute state.
	 */
	ATTRIBUTE_RESOLUTION_ERROR,

	/**
	 * The IR itself could not be built; nothing was generated.
	 */
	LOWERING_ERROR,
}
