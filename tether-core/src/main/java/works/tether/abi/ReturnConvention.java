package works.tether.abi;

/**
 * How a method's result gets back to the caller. This is part of the native ABI contract.
 */
public enum ReturnConvention {
	/**
	 * Nothing is returned.
	 */
	VOID,

	/**
	 * The value fits a register and is the C return value.
	 */
	DIRECT,

	/**
	 * The C function returns {@code void} and writes the value through a trailing {@code out} pointer.
	 */
	OUT_PARAM,

	/**
	 * The C function returns a {@code bool} saying whether a value is present,
	 * and if so writes it through a trailing {@code out} pointer.
	 */
	PRESENCE_FLAG,

	/**
	 * The C function returns a {@code bool} that is true on success;
	 * the success payload is written through {@code ok_out} (or the writeable sink)
	 * and the error payload through {@code err_out}. Exactly one of them is written.
	 */
	DISCRIMINANT,

	/**
	 * The C function returns {@code void} and appends its result to a trailing writeable sink.
	 */
	WRITEABLE,
}
