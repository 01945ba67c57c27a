package works.tether.ir;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A contiguous run of elements, passed natively as a (pointer, length) pair.
 *
 * @param element the element type for {@link SliceEncoding#PRIMITIVE} slices; null otherwise
 */
public record SliceRef(SliceEncoding encoding, @Nullable PrimitiveKind element) implements TypeRef {
	public SliceRef {
		requireNonNull(encoding);
		if ((encoding == SliceEncoding.PRIMITIVE) != (element != null)) {
			throw new IllegalArgumentException("Element kind must be given exactly for primitive slices: " + encoding + " of " + element);
		}
	}

	public static SliceRef of(PrimitiveKind element) {
		return new SliceRef(SliceEncoding.PRIMITIVE, element);
	}

	public static final SliceRef UTF8 = new SliceRef(SliceEncoding.UTF8, null);
	public static final SliceRef UTF16 = new SliceRef(SliceEncoding.UTF16, null);
	public static final SliceRef STRINGS = new SliceRef(SliceEncoding.STRINGS, null);

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitSlice(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of();
	}

	@Override
	public String toString() {
		return switch (encoding) {
			case PRIMITIVE -> "[" + element.irName() + "]";
			case UTF8 -> "str";
			case UTF16 -> "str16";
			case STRINGS -> "[str]";
		};
	}
}
