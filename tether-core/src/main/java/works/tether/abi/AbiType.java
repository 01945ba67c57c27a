package works.tether.abi;

import org.jetbrains.annotations.Nullable;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.SliceEncoding;
import works.tether.ir.TypeId;

import static java.util.Objects.requireNonNull;

/**
 * The type of one slot in a native call signature.
 * <p>
 * This is the native marshaling representation:
 * each IR type lowers to one or more of these,
 * and each backend renders them in its own terms
 * (a C declaration, a JNA parameter type, and so on).
 */
public sealed interface AbiType {
	<R> R accept(Visitor<R> visitor);

	/**
	 * A primitive passed in its natural width.
	 */
	record Scalar(PrimitiveKind kind) implements AbiType {
		public Scalar {
			requireNonNull(kind);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitScalar(this);
		}
	}

	/**
	 * A C enum, which has the width of an {@code int32_t}.
	 */
	record EnumValue(TypeId target) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEnumValue(this);
		}
	}

	/**
	 * {@code T*} for an opaque {@code T}. May be null where the IR says it's nullable.
	 */
	record OpaquePointer(TypeId target) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOpaquePointer(this);
		}
	}

	/**
	 * A struct passed or returned by value.
	 */
	record StructValue(TypeId target) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStructValue(this);
		}
	}

	/**
	 * {@code const T*} pointing at a caller-owned copy of a struct.
	 */
	record StructPointer(TypeId target) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStructPointer(this);
		}
	}

	/**
	 * The data half of a slice: a pointer to the first element.
	 *
	 * @param element non-null only for {@link SliceEncoding#PRIMITIVE}
	 */
	record SliceData(SliceEncoding encoding, @Nullable PrimitiveKind element) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSliceData(this);
		}
	}

	/**
	 * A {@code size_t} element count.
	 */
	record Length() implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLength(this);
		}
	}

	/**
	 * A {@code bool} indicating whether the adjacent value is present,
	 * or whether a fallible call succeeded.
	 */
	record Flag() implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFlag(this);
		}
	}

	/**
	 * A (data, length) pair as one struct, used where a slice must travel through memory.
	 */
	record SliceView(SliceEncoding encoding, @Nullable PrimitiveKind element) implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSliceView(this);
		}
	}

	/**
	 * A pointer to the caller's growable output buffer.
	 */
	record Writeable() implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWriteable(this);
		}
	}

	/**
	 * A pointer to caller-provided storage that native code fills in.
	 */
	record OutPointer(AbiType pointee) implements AbiType {
		public OutPointer {
			requireNonNull(pointee);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOutPointer(this);
		}
	}

	record VoidType() implements AbiType {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVoid(this);
		}
	}

	AbiType LENGTH = new Length();
	AbiType FLAG = new Flag();
	AbiType WRITEABLE = new Writeable();
	AbiType VOID = new VoidType();

	interface Visitor<R> {
		R visitScalar(Scalar type);
		R visitEnumValue(EnumValue type);
		R visitOpaquePointer(OpaquePointer type);
		R visitStructValue(StructValue type);
		R visitStructPointer(StructPointer type);
		R visitSliceData(SliceData type);
		R visitLength(Length type);
		R visitFlag(Flag type);
		R visitSliceView(SliceView type);
		R visitWriteable(Writeable type);
		R visitOutPointer(OutPointer type);
		R visitVoid(VoidType type);
	}
}
