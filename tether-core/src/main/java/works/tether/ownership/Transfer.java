package works.tether.ownership;

/**
 * What happens to an argument's ownership when it crosses into native code.
 */
public enum Transfer {
	/**
	 * The callee receives its own copy. Used for every value type and every slice.
	 */
	COPY,

	/**
	 * The callee may use the argument only for the duration of the call.
	 */
	BORROW,

	/**
	 * The callee takes over the handle, including the obligation to destroy it.
	 * The host wrapper is disarmed and must not be used again.
	 */
	MOVE,
}
