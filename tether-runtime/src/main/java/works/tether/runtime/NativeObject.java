package works.tether.runtime;

import com.sun.jna.Pointer;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of every generated wrapper around an opaque native type.
 * <p>
 * Generated subclasses declare no methods with these names;
 * IR methods that would collide get a trailing underscore.
 */
public abstract class NativeObject implements AutoCloseable {
	private final NativeHandle handle;

	/**
	 * @param lifetimeEdges nulls are ignored, since a missing optional argument has nothing to keep alive
	 */
	protected NativeObject(Pointer pointer, Ownership ownership, Consumer<Pointer> destructor, Object... lifetimeEdges) {
		this.handle = new NativeHandle(pointer, ownership, destructor,
			Arrays.stream(lifetimeEdges).filter(Objects::nonNull).toList());
	}

	/**
	 * @throws IllegalStateException if this object was closed or given away
	 */
	public final Pointer pointer() {
		return handle.pointer();
	}

	/**
	 * Hands this object to native code. This wrapper is unusable afterward.
	 */
	public final Pointer transferOwnership() {
		return handle.transferOwnership();
	}

	public final Ownership ownership() {
		return handle.ownership();
	}

	public final boolean isClosed() {
		return handle.state() != NativeHandle.State.LIVE;
	}

	/**
	 * Destroys the native object if this wrapper owns it. Idempotent.
	 */
	@Override
	public final void close() {
		handle.close();
	}

	/**
	 * @return the address of {@code object} for a borrowing call, or null if it's null
	 */
	public static @Nullable Pointer addressOf(@Nullable NativeObject object) {
		return (object == null) ? null : object.pointer();
	}

	/**
	 * @return the address of {@code object} for a call that takes ownership, or null if it's null
	 */
	public static @Nullable Pointer transferOf(@Nullable NativeObject object) {
		return (object == null) ? null : object.transferOwnership();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + handle + ")";
	}
}
