package works.tether.runtime;

import com.sun.jna.Callback;
import com.sun.jna.Memory;
import com.sun.jna.Pointer;
import com.sun.jna.Structure;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A {@code TetherWrite}: a growable UTF-8 buffer that native code writes text into.
 * <p>
 * Native code appends at {@code buf + len} and asks {@link #grow} for more room
 * when it would pass {@code cap}. The buffer lives in Java-managed memory,
 * so nothing needs to be freed afterward.
 * Field names match the C declaration.
 */
@Structure.FieldOrder({"context", "buf", "len", "cap", "grow_failed", "flush", "grow"})
public class WriteableBuffer extends Structure {
	public static final int DEFAULT_CAPACITY = 64;

	public Pointer context;
	public Pointer buf;
	public SizeT len = new SizeT();
	public SizeT cap = new SizeT();
	public byte grow_failed;
	public FlushCallback flush;
	public GrowCallback grow;

	private Memory storage;
	private boolean flushed = false;

	public interface FlushCallback extends Callback {
		void invoke(Pointer write);
	}

	public interface GrowCallback extends Callback {
		byte invoke(Pointer write, SizeT capacity);
	}

	public WriteableBuffer() {
		this(DEFAULT_CAPACITY);
	}

	public WriteableBuffer(int initialCapacity) {
		storage = new Memory(Math.max(1, initialCapacity));
		buf = storage;
		cap = SizeT.of(storage.size());
		flush = new Flush();
		grow = new Grow();
	}

	/**
	 * @return everything written so far
	 */
	public String contents() {
		int length = Math.toIntExact(len.longValue());
		return (length == 0) ? "" : new String(buf.getByteArray(0, length), UTF_8);
	}

	public boolean isFlushed() {
		return flushed;
	}

	public boolean growFailed() {
		return grow_failed != 0;
	}

	/**
	 * Writes {@code text} the way native code would.
	 * Useful for Java stand-ins of native functions.
	 */
	public void append(String text) {
		byte[] bytes = text.getBytes(UTF_8);
		long length = len.longValue();
		long needed = length + bytes.length;
		if (needed > cap.longValue() && !growTo(needed)) {
			grow_failed = 1;
			return;
		}
		buf.write(length, bytes, 0, bytes.length);
		len = SizeT.of(needed);
	}

	private boolean growTo(long requested) {
		long target = Math.max(requested, 2 * cap.longValue());
		if (target > Integer.MAX_VALUE) {
			return false;
		}
		int length = Math.toIntExact(len.longValue());
		Memory bigger = new Memory(target);
		if (length > 0) {
			bigger.write(0, buf.getByteArray(0, length), 0, length);
		}
		storage = bigger;
		buf = bigger;
		cap = SizeT.of(target);
		return true;
	}

	private final class Flush implements FlushCallback {
		@Override
		public void invoke(Pointer write) {
			flushed = true;
		}
	}

	private final class Grow implements GrowCallback {
		@Override
		public byte invoke(Pointer write, SizeT capacity) {
			// Native code has been writing straight into memory, so our copy of len is stale
			readField("len");
			if (growTo(capacity.longValue())) {
				writeField("buf");
				writeField("cap");
				return 1;
			}
			grow_failed = 1;
			writeField("grow_failed");
			return 0;
		}
	}
}
