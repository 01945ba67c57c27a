package works.tether.ir;

/**
 * How a method receives its owner.
 */
public enum SelfKind {
	/**
	 * Static method: no receiver.
	 */
	NONE,

	/**
	 * The receiver is passed by value. For opaque types this consumes the handle.
	 */
	VALUE,

	/**
	 * The receiver is lent for the duration of the call.
	 */
	BORROWED,
}
