package works.tether.ir;

import java.util.List;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Either a success payload or an error payload, never both and never neither.
 * Only meaningful as a return type.
 */
public record FallibleRef(TypeRef ok, TypeRef err) implements TypeRef {
	public FallibleRef {
		requireNonNull(ok);
		requireNonNull(err);
	}

	public static FallibleRef of(TypeRef ok, TypeRef err) {
		return new FallibleRef(ok, err);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFallible(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return Stream.concat(ok.referencedTypes().stream(), err.referencedTypes().stream()).toList();
	}

	@Override
	public String toString() {
		return "Result<" + ok + ", " + err + ">";
	}
}
