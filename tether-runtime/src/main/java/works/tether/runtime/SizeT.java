package works.tether.runtime;

import com.sun.jna.IntegerType;
import com.sun.jna.Native;

/**
 * A C {@code size_t}, whose width follows the platform.
 */
public final class SizeT extends IntegerType {
	public SizeT() {
		this(0);
	}

	public SizeT(long value) {
		super(Native.SIZE_T_SIZE, value, true);
	}

	public static SizeT of(long value) {
		if (value < 0) {
			throw new IllegalArgumentException("Negative size: " + value);
		}
		return new SizeT(value);
	}
}
