package works.tether.ir;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * The primitive types that can cross the boundary unchanged.
 * <p>
 * {@link #ISIZE} and {@link #USIZE} are as wide as a pointer, so their
 * {@link #bits()} is zero; ask a {@link works.tether.abi.DataLayout DataLayout} for their size.
 */
public enum PrimitiveKind {
	BOOL("bool", 8, false, false),
	/**
	 * A Unicode scalar value.
	 */
	CHAR("char", 32, false, false),
	I8("i8", 8, true, false),
	U8("u8", 8, false, false),
	I16("i16", 16, true, false),
	U16("u16", 16, false, false),
	I32("i32", 32, true, false),
	U32("u32", 32, false, false),
	I64("i64", 64, true, false),
	U64("u64", 64, false, false),
	ISIZE("isize", 0, true, false),
	USIZE("usize", 0, false, false),
	F32("f32", 32, true, true),
	F64("f64", 64, true, true),
	;

	private final String irName;
	private final int bits;
	private final boolean signed;
	private final boolean floatingPoint;

	PrimitiveKind(String irName, int bits, boolean signed, boolean floatingPoint) {
		this.irName = irName;
		this.bits = bits;
		this.signed = signed;
		this.floatingPoint = floatingPoint;
	}

	public String irName() {
		return irName;
	}

	public int bits() {
		return bits;
	}

	public boolean isSigned() {
		return signed;
	}

	public boolean isFloatingPoint() {
		return floatingPoint;
	}

	public boolean isPointerSized() {
		return bits == 0;
	}

	/**
	 * @return true for unsigned integers, whose host representation may need to reinterpret the sign bit
	 */
	public boolean isUnsignedInteger() {
		return !signed && this != BOOL && this != CHAR;
	}

	public static Optional<PrimitiveKind> fromIrName(String irName) {
		return Optional.ofNullable(BY_IR_NAME.get(irName));
	}

	private static final Map<String, PrimitiveKind> BY_IR_NAME = Arrays.stream(values())
		.collect(toUnmodifiableMap(PrimitiveKind::irName, identity()));
}
