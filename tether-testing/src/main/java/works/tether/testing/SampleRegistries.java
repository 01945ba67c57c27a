package works.tether.testing;

import java.util.List;
import works.tether.ir.Attributes;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumRef;
import works.tether.ir.EnumVariant;
import works.tether.ir.FallibleRef;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.Registry;
import works.tether.ir.SliceRef;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRef;

import static works.tether.ir.PrimitiveKind.BOOL;
import static works.tether.ir.PrimitiveKind.I32;
import static works.tether.ir.PrimitiveKind.I64;
import static works.tether.ir.PrimitiveKind.U64;
import static works.tether.ir.PrimitiveKind.U8;
import static works.tether.ir.UnitRef.UNIT;
import static works.tether.ir.WriteableRef.WRITEABLE;

/**
 * Registries that exercise the generator end to end.
 */
public final class SampleRegistries {
	private SampleRegistries() { }

	public static final TypeId OPAQUE_STRUCT = TypeId.of("OpaqueStruct");
	public static final TypeId COLOR = TypeId.of("Color");
	public static final TypeId ERROR_CODE = TypeId.of("ErrorCode");
	public static final TypeId POINT = TypeId.of("Point");
	public static final TypeId RECT = TypeId.of("Rect");
	public static final TypeId TAGGED = TypeId.of("Tagged");
	public static final TypeId HANDLE = TypeId.of("Handle");

	static final TypeRef I32_REF = PrimitiveRef.of(I32);

	/**
	 * The smallest useful library: one opaque type with one static method.
	 */
	public static Registry addTwo() {
		return Registry.of(OpaqueDef.of("OpaqueStruct",
			MethodDef.staticMethod("add_two", I32_REF, ParamDef.of("i", I32_REF))
				.withDocs("Returns {@code i + 2}.")));
	}

	/**
	 * One of every kind of type, with methods covering every return convention.
	 */
	public static Registry demo() {
		return Registry.builder().addAll(demoTypes()).build();
	}

	public static List<TypeDef> demoTypes() {
		return List.of(opaqueStruct(), color(), errorCode(), point(), rect(), tagged(), handle());
	}

	public static OpaqueDef opaqueStruct() {
		OpaqueRef borrowedSelf = OpaqueRef.borrowed(OPAQUE_STRUCT);
		return new OpaqueDef(OPAQUE_STRUCT, "OpaqueStruct", "A counter that lives on the native heap.", Attributes.NONE, List.of(
			MethodDef.staticMethod("add_two", I32_REF, ParamDef.of("i", I32_REF))
				.withDocs("Returns {@code i + 2}."),
			MethodDef.staticMethod("create", OpaqueRef.owned(OPAQUE_STRUCT), ParamDef.of("start", I32_REF)),
			MethodDef.borrowing("value", I32_REF),
			MethodDef.borrowing("maybe_value", NullableRef.of(I32_REF)),
			MethodDef.staticMethod("is_null", PrimitiveRef.of(BOOL), ParamDef.of("other", NullableRef.of(borrowedSelf))),
			MethodDef.borrowing("divide", FallibleRef.of(I32_REF, EnumRef.of(ERROR_CODE)),
				ParamDef.of("divisor", I32_REF)),
			MethodDef.borrowing("describe", WRITEABLE),
			MethodDef.borrowing("greet", UNIT, ParamDef.of("name", SliceRef.UTF8), ParamDef.of("sink", WRITEABLE)),
			MethodDef.borrowing("bytes", SliceRef.of(U8)),
			MethodDef.staticMethod("sum", PrimitiveRef.of(I64), ParamDef.of("values", SliceRef.of(I32))),
			MethodDef.borrowing("color", EnumRef.of(COLOR)),
			MethodDef.borrowing("set_color", UNIT, ParamDef.of("color", NullableRef.of(EnumRef.of(COLOR)))),
			MethodDef.borrowing("child", borrowedSelf),
			MethodDef.consuming("into_value", I32_REF),
			MethodDef.borrowing("adopt", UNIT, ParamDef.of("other", OpaqueRef.owned(OPAQUE_STRUCT))),
			MethodDef.borrowing("position", StructRef.byValue(POINT)),
			MethodDef.borrowing("bounds", StructRef.byValue(RECT)),
			MethodDef.borrowing("tag", NullableRef.of(StructRef.byValue(TAGGED))),
			MethodDef.borrowing("labels", FallibleRef.of(SliceRef.STRINGS, UNIT)),
			MethodDef.borrowing("try_reset", FallibleRef.of(UNIT, SliceRef.UTF8))));
	}

	public static EnumDef color() {
		return new EnumDef(COLOR, "Color", "A primary color.", Attributes.NONE, List.of(
			EnumVariant.of("Red", 0),
			EnumVariant.of("Green", 1),
			new EnumVariant("Blue", 7, "Not adjacent to the others.")));
	}

	public static EnumDef errorCode() {
		return EnumDef.of("ErrorCode",
			EnumVariant.of("DivideByZero", 1),
			EnumVariant.of("Overflow", 2));
	}

	/**
	 * Eight bytes: returned directly on 64-bit targets.
	 */
	public static StructDef point() {
		return new StructDef(POINT, "Point", "", Attributes.NONE, List.of(
			new FieldDef("x", I32_REF, "Horizontal offset"),
			FieldDef.of("y", I32_REF)
		), List.of(
			MethodDef.borrowing("scaled", StructRef.byValue(POINT), ParamDef.of("factor", I32_REF))));
	}

	/**
	 * Sixteen bytes: returned through an out pointer.
	 */
	public static StructDef rect() {
		return StructDef.of("Rect", List.of(
			FieldDef.of("origin", StructRef.byValue(POINT)),
			FieldDef.of("size", StructRef.byValue(POINT))),
			MethodDef.staticMethod("unit", StructRef.byValue(RECT)),
			MethodDef.borrowing("area", PrimitiveRef.of(I64)));
	}

	public static StructDef tagged() {
		return StructDef.of("Tagged", List.of(
			FieldDef.of("color", EnumRef.of(COLOR)),
			FieldDef.of("visible", PrimitiveRef.of(BOOL)),
			FieldDef.of("owner", NullableRef.of(OpaqueRef.borrowed(OPAQUE_STRUCT)))));
	}

	public static PrimitiveDef handle() {
		return PrimitiveDef.of("Handle", U64);
	}
}
