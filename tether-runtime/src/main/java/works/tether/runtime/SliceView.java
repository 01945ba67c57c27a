package works.tether.runtime;

import com.sun.jna.Pointer;
import com.sun.jna.Structure;

/**
 * A {@code TetherSlice}: a (data, length) pair that native code fills in to return a slice.
 * A null {@link #data} means the slice is absent.
 * <p>
 * The memory it points to belongs to native code and is only valid until the next call on
 * the object it came from, so generated code copies it out immediately with {@link Slices}.
 */
@Structure.FieldOrder({"data", "len"})
public class SliceView extends Structure {
	public Pointer data;
	public SizeT len = new SizeT();

	public SliceView() { }

	public SliceView(Pointer pointer) {
		super(pointer);
		read();
	}

	public boolean isPresent() {
		return data != null;
	}

	public long length() {
		return len.longValue();
	}
}
