package works.tether.runtime;

/**
 * Whether a wrapper is responsible for destroying its native object.
 */
public enum Ownership {
	/**
	 * The wrapper destroys the native object exactly once:
	 * when it's closed, or when it becomes unreachable if it never was.
	 */
	OWNED,

	/**
	 * Someone else owns the native object. The wrapper never destroys it,
	 * and keeps its lifetime edges reachable so the owner outlives it.
	 */
	BORROWED,
}
