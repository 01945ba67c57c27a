package works.tether.ownership;

/**
 * Who owns a value native code hands back.
 */
public enum ReturnOwnership {
	/**
	 * Nothing comes back.
	 */
	NONE,

	/**
	 * A value the caller receives as its own copy.
	 */
	COPY,

	/**
	 * A fresh handle the caller must eventually destroy.
	 */
	OWNED,

	/**
	 * A view into memory owned by someone else; it must not outlive its lifetime edges.
	 */
	BORROWED,
}
