package works.tether.runtime;

import com.sun.jna.Native;
import com.sun.jna.Pointer;
import org.jetbrains.annotations.Nullable;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Conversions between Java values and native slices.
 * <p>
 * Outgoing values are encoded into Java arrays that JNA copies for the duration of the call.
 * Incoming {@link SliceView}s are copied into Java values straight away,
 * because the memory they point to isn't ours.
 */
public final class Slices {
	private Slices() { }

	public static byte @Nullable [] encodeUtf8(@Nullable String value) {
		return (value == null) ? null : value.getBytes(UTF_8);
	}

	public static short @Nullable [] encodeUtf16(@Nullable String value) {
		if (value == null) {
			return null;
		}
		short[] result = new short[value.length()];
		for (int i = 0; i < result.length; i++) {
			result[i] = (short) value.charAt(i);
		}
		return result;
	}

	/**
	 * @return a native array of {@code TetherStringView}, or null if {@code values} is null.
	 * An empty array gets a valid address so that it isn't mistaken for an absent slice.
	 */
	public static @Nullable Utf8Strings encodeStrings(String @Nullable [] values) {
		return (values == null) ? null : new Utf8Strings(values);
	}

	public static SizeT length(byte @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(short @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(int @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(long @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(float @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(double @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static SizeT length(Object @Nullable [] values) {
		return SizeT.of(values == null ? 0 : values.length);
	}

	public static String decodeUtf8(SliceView view) {
		return new String(bytes(view), UTF_8);
	}

	public static String decodeUtf16(SliceView view) {
		short[] units = shorts(view);
		char[] chars = new char[units.length];
		for (int i = 0; i < units.length; i++) {
			chars[i] = (char) units[i];
		}
		return new String(chars);
	}

	public static String[] decodeStrings(SliceView view) {
		int count = count(view);
		String[] result = new String[count];
		long stride = Utf8Strings.VIEW_SIZE;
		for (int i = 0; i < count; i++) {
			long offset = i * stride;
			Pointer data = view.data.getPointer(offset);
			int length = Math.toIntExact(readSize(view.data, offset + Native.POINTER_SIZE));
			result[i] = (length == 0) ? "" : new String(data.getByteArray(0, length), UTF_8);
		}
		return result;
	}

	public static byte[] bytes(SliceView view) {
		int count = count(view);
		return (count == 0) ? new byte[0] : view.data.getByteArray(0, count);
	}

	public static short[] shorts(SliceView view) {
		int count = count(view);
		return (count == 0) ? new short[0] : view.data.getShortArray(0, count);
	}

	public static int[] ints(SliceView view) {
		int count = count(view);
		return (count == 0) ? new int[0] : view.data.getIntArray(0, count);
	}

	public static long[] longs(SliceView view) {
		int count = count(view);
		return (count == 0) ? new long[0] : view.data.getLongArray(0, count);
	}

	public static float[] floats(SliceView view) {
		int count = count(view);
		return (count == 0) ? new float[0] : view.data.getFloatArray(0, count);
	}

	public static double[] doubles(SliceView view) {
		int count = count(view);
		return (count == 0) ? new double[0] : view.data.getDoubleArray(0, count);
	}

	/**
	 * An absent view reads as empty.
	 */
	private static int count(SliceView view) {
		return view.isPresent() ? Math.toIntExact(view.length()) : 0;
	}

	static long readSize(Pointer pointer, long offset) {
		return (Native.SIZE_T_SIZE == 8)
			? pointer.getLong(offset)
			: Integer.toUnsignedLong(pointer.getInt(offset));
	}

	static void writeSize(Pointer pointer, long offset, long value) {
		if (Native.SIZE_T_SIZE == 8) {
			pointer.setLong(offset, value);
		} else {
			pointer.setInt(offset, (int) value);
		}
	}
}
