package works.tether.ir;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A pointer to an {@link OpaqueDef}.
 *
 * @param owned true if ownership of the handle crosses the boundary with it;
 *              false for a reference that is only lent for a limited time
 */
public record OpaqueRef(TypeId target, boolean owned) implements TypeRef {
	public OpaqueRef {
		requireNonNull(target);
	}

	public static OpaqueRef owned(TypeId target) {
		return new OpaqueRef(target, true);
	}

	public static OpaqueRef borrowed(TypeId target) {
		return new OpaqueRef(target, false);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitOpaque(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of(target);
	}

	@Override
	public String toString() {
		return (owned ? "Box<" : "&") + target + (owned ? ">" : "");
	}
}
