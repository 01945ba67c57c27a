package works.tether.ir;

public enum SliceEncoding {
	/**
	 * A buffer of raw primitive values.
	 */
	PRIMITIVE,

	/**
	 * UTF-8 text; the length counts bytes.
	 */
	UTF8,

	/**
	 * UTF-16 text; the length counts code units.
	 */
	UTF16,

	/**
	 * An array of (pointer, length) pairs, each one UTF-8 text.
	 */
	STRINGS,
}
