package works.tether.abi;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.FieldDef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRegistry;

/**
 * Sizes and alignments of native values under the C rules for natural alignment.
 * <p>
 * The generator needs these for exactly one decision:
 * whether a struct return fits in a register.
 * Struct layouts are recomputed on demand rather than cached;
 * they're small, and this keeps the object immutable.
 */
public final class DataLayout {
	private final TypeRegistry registry;
	private final int pointerBytes;

	public DataLayout(TypeRegistry registry, int pointerWidth) {
		this.registry = registry;
		this.pointerBytes = pointerWidth / 8;
	}

	public int pointerBytes() {
		return pointerBytes;
	}

	/**
	 * @return the size of a general-purpose register, which is the largest value returned directly
	 */
	public int registerBytes() {
		return pointerBytes;
	}

	public int sizeOf(PrimitiveKind kind) {
		return kind.isPointerSized() ? pointerBytes : kind.bits() / 8;
	}

	public int sizeOf(AbiType type) {
		return type.accept(new Measure()).size();
	}

	public int alignOf(AbiType type) {
		return type.accept(new Measure()).align();
	}

	/**
	 * @throws UnsupportedTypeException if the struct contains itself by value,
	 * or has a field that can't be laid out
	 */
	public StructLayout layoutOf(StructDef struct) {
		return layoutOf(struct, new ArrayDeque<>());
	}

	public boolean fitsInRegister(AbiType type) {
		return sizeOf(type) <= registerBytes();
	}

	private StructLayout layoutOf(StructDef struct, Deque<TypeId> enclosing) {
		if (enclosing.contains(struct.id())) {
			throw new UnsupportedTypeException(StructRef.byValue(struct.id()),
				"Struct contains itself by value via " + enclosing);
		}
		enclosing.push(struct.id());
		try {
			int offset = 0;
			int align = 1;
			List<Integer> offsets = new ArrayList<>();
			for (FieldDef field: struct.fields()) {
				Extent extent = NativeLowering.lowerField(field).accept(new Measure(enclosing));
				offset = roundUp(offset, extent.align());
				offsets.add(offset);
				offset += extent.size();
				align = Math.max(align, extent.align());
			}
			// An empty struct is still one byte in C++, and most C compilers agree
			int size = Math.max(1, roundUp(offset, align));
			return new StructLayout(size, align, offsets);
		} finally {
			enclosing.pop();
		}
	}

	private static int roundUp(int value, int alignment) {
		return (value + alignment - 1) / alignment * alignment;
	}

	public record StructLayout(int size, int align, List<Integer> fieldOffsets) {
		public StructLayout {
			fieldOffsets = List.copyOf(fieldOffsets);
		}
	}

	private record Extent(int size, int align) {
		static Extent of(int size) {
			return new Extent(size, size);
		}
	}

	private final class Measure implements AbiType.Visitor<Extent> {
		final Deque<TypeId> enclosing;

		Measure() {
			this(new ArrayDeque<>());
		}

		Measure(Deque<TypeId> enclosing) {
			this.enclosing = enclosing;
		}

		@Override
		public Extent visitScalar(AbiType.Scalar type) {
			return Extent.of(sizeOf(type.kind()));
		}

		@Override
		public Extent visitEnumValue(AbiType.EnumValue type) {
			return Extent.of(4);
		}

		@Override
		public Extent visitOpaquePointer(AbiType.OpaquePointer type) {
			return pointer();
		}

		@Override
		public Extent visitStructValue(AbiType.StructValue type) {
			TypeDef def = registry.resolve(type.target());
			if (!(def instanceof StructDef struct)) {
				throw new IllegalStateException("Expected struct but got " + def.kindName() + " for " + type.target());
			}
			StructLayout layout = layoutOf(struct, enclosing);
			return new Extent(layout.size(), layout.align());
		}

		@Override
		public Extent visitStructPointer(AbiType.StructPointer type) {
			return pointer();
		}

		@Override
		public Extent visitSliceData(AbiType.SliceData type) {
			return pointer();
		}

		@Override
		public Extent visitLength(AbiType.Length type) {
			return pointer();
		}

		@Override
		public Extent visitFlag(AbiType.Flag type) {
			return Extent.of(1);
		}

		@Override
		public Extent visitSliceView(AbiType.SliceView type) {
			return new Extent(2 * pointerBytes, pointerBytes);
		}

		@Override
		public Extent visitWriteable(AbiType.Writeable type) {
			return pointer();
		}

		@Override
		public Extent visitOutPointer(AbiType.OutPointer type) {
			return pointer();
		}

		@Override
		public Extent visitVoid(AbiType.VoidType type) {
			return new Extent(0, 1);
		}

		private Extent pointer() {
			return Extent.of(pointerBytes);
		}
	}
}
