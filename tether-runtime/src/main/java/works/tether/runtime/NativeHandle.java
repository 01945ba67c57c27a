package works.tether.runtime;

import com.sun.jna.Pointer;
import java.lang.ref.Cleaner;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * One native object address, plus the bookkeeping that decides whether and when it's destroyed.
 * <p>
 * An {@link Ownership#OWNED owned} handle runs its destructor exactly once:
 * on {@link #close()}, or from a {@link Cleaner} if it becomes unreachable first.
 * {@link #transferOwnership()} hands the obligation to native code instead,
 * after which the destructor never runs on this side.
 * Once closed or transferred, the handle refuses to give out its address.
 * Beyond that, misuse (such as native code destroying a borrowed object) is not detected.
 */
public final class NativeHandle {
	private static final Cleaner CLEANER = Cleaner.create();

	private final Pointer pointer;
	private final Ownership ownership;
	private final AtomicReference<State> state = new AtomicReference<>(State.LIVE);
	private final Destroyer destroyer;
	private final Cleaner.Cleanable cleanable;

	/**
	 * Strong references that keep a borrowed object's owners reachable.
	 */
	@SuppressWarnings({"unused", "FieldCanBeLocal"})
	private final List<Object> lifetimeEdges;

	public enum State {
		LIVE,
		CLOSED,
		TRANSFERRED,
	}

	/**
	 * @param destructor ignored for borrowed handles
	 * @param lifetimeEdges objects that must stay reachable while this handle is
	 */
	public NativeHandle(Pointer pointer, Ownership ownership, Consumer<Pointer> destructor, List<Object> lifetimeEdges) {
		this.pointer = requireNonNull(pointer, "Native object pointer can't be null");
		this.ownership = requireNonNull(ownership);
		this.lifetimeEdges = List.copyOf(lifetimeEdges);
		if (ownership == Ownership.OWNED) {
			// The destroyer must not refer to this object, or the cleaner would keep it reachable forever
			this.destroyer = new Destroyer(pointer, requireNonNull(destructor));
			this.cleanable = CLEANER.register(this, destroyer);
		} else {
			this.destroyer = null;
			this.cleanable = null;
		}
	}

	public Ownership ownership() {
		return ownership;
	}

	public State state() {
		return state.get();
	}

	/**
	 * @throws IllegalStateException if the handle was closed or its ownership transferred
	 */
	public Pointer pointer() {
		State current = state.get();
		if (current != State.LIVE) {
			throw new IllegalStateException("Native object " + pointer + " is no longer usable: " + current);
		}
		return pointer;
	}

	/**
	 * Gives the native object to native code, which becomes responsible for destroying it.
	 *
	 * @throws IllegalStateException if the handle is borrowed, closed, or already transferred
	 */
	public Pointer transferOwnership() {
		if (ownership != Ownership.OWNED) {
			throw new IllegalStateException("Can't transfer ownership of borrowed native object " + pointer);
		}
		if (!state.compareAndSet(State.LIVE, State.TRANSFERRED)) {
			throw new IllegalStateException("Native object " + pointer + " is no longer usable: " + state.get());
		}
		destroyer.disarm();
		cleanable.clean();
		LOGGER.trace("Transferred {}", pointer);
		return pointer;
	}

	/**
	 * Destroys an owned native object. Idempotent; does nothing for borrowed or transferred handles.
	 */
	public void close() {
		if (state.compareAndSet(State.LIVE, State.CLOSED) && cleanable != null) {
			cleanable.clean();
		}
	}

	@Override
	public String toString() {
		return "NativeHandle(" + pointer + ", " + ownership + ", " + state.get() + ")";
	}

	private static final class Destroyer implements Runnable {
		private final Pointer pointer;
		private final Consumer<Pointer> destructor;
		private volatile boolean armed = true;

		Destroyer(Pointer pointer, Consumer<Pointer> destructor) {
			this.pointer = pointer;
			this.destructor = destructor;
		}

		void disarm() {
			armed = false;
		}

		@Override
		public void run() {
			// The cleaner guarantees this runs at most once
			if (armed) {
				LOGGER.trace("Destroying {}", pointer);
				destructor.accept(pointer);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NativeHandle.class);
}
