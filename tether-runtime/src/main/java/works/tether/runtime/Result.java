package works.tether.runtime;

import java.util.function.Function;

/**
 * The outcome of a fallible native call: exactly one of {@link Ok} and {@link Err}.
 * A payload of {@link Void} is always null.
 */
public sealed interface Result<T, E> {
	record Ok<T, E>(T value) implements Result<T, E> {
		@Override
		public boolean isOk() {
			return true;
		}
	}

	record Err<T, E>(E error) implements Result<T, E> {
		@Override
		public boolean isOk() {
			return false;
		}
	}

	boolean isOk();

	/**
	 * @throws X built from the error if this is an {@link Err}
	 */
	default <X extends Exception> T orElseThrow(Function<? super E, X> exceptionFactory) throws X {
		if (this instanceof Ok<T, E> ok) {
			return ok.value();
		}
		throw exceptionFactory.apply(((Err<T, E>) this).error());
	}

	default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
		if (this instanceof Ok<T, E> ok) {
			return new Ok<>(mapper.apply(ok.value()));
		}
		return new Err<>(((Err<T, E>) this).error());
	}

	static <T, E> Result<T, E> ok(T value) {
		return new Ok<>(value);
	}

	static <T, E> Result<T, E> err(E error) {
		return new Err<>(error);
	}
}
