package works.tether.runtime;

import com.sun.jna.Memory;
import com.sun.jna.Native;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A native array of {@code TetherStringView}s, together with the UTF-8 data they point to.
 * All of it stays allocated for as long as this object is reachable.
 * <p>
 * An empty array still has a non-null address, since a null data pointer means an absent slice.
 */
public final class Utf8Strings extends Memory {
	static final int VIEW_SIZE = Native.POINTER_SIZE + Native.SIZE_T_SIZE;

	private final int count;
	private final List<Memory> data = new ArrayList<>();

	Utf8Strings(String[] values) {
		super((long) VIEW_SIZE * Math.max(1, values.length));
		this.count = values.length;
		if (values.length == 0) {
			clear();
		}
		for (int i = 0; i < values.length; i++) {
			byte[] bytes = values[i].getBytes(UTF_8);
			long offset = (long) i * VIEW_SIZE;
			if (bytes.length == 0) {
				setPointer(offset, null);
			} else {
				Memory memory = new Memory(bytes.length);
				memory.write(0, bytes, 0, bytes.length);
				data.add(memory);
				setPointer(offset, memory);
			}
			Slices.writeSize(this, offset + Native.POINTER_SIZE, bytes.length);
		}
	}

	public int count() {
		return count;
	}
}
