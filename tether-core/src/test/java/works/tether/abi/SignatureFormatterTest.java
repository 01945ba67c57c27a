package works.tether.abi;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.tether.exceptions.NamingConflictException;
import works.tether.exceptions.UnsupportedTypeException;
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
import works.tether.ir.PrimitiveRef;
import works.tether.ir.Registry;
import works.tether.ir.SliceRef;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRef;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.tether.abi.ReturnConvention.DIRECT;
import static works.tether.abi.ReturnConvention.DISCRIMINANT;
import static works.tether.abi.ReturnConvention.OUT_PARAM;
import static works.tether.abi.ReturnConvention.PRESENCE_FLAG;
import static works.tether.abi.ReturnConvention.VOID;
import static works.tether.abi.ReturnConvention.WRITEABLE;
import static works.tether.ir.PrimitiveKind.BOOL;
import static works.tether.ir.PrimitiveKind.F64;
import static works.tether.ir.PrimitiveKind.I32;
import static works.tether.ir.PrimitiveKind.U8;

class SignatureFormatterTest {
	static final TypeId WIDGET = TypeId.of("Widget");
	static final TypeId SMALL = TypeId.of("Small");
	static final TypeId BIG = TypeId.of("Big");
	static final TypeId ERROR = TypeId.of("Error");
	static final PrimitiveRef INT = PrimitiveRef.of(I32);

	final Registry registry = Registry.of(
		OpaqueDef.of("Widget"),
		StructDef.of("Small", List.of(FieldDef.of("x", INT), FieldDef.of("y", INT))),
		StructDef.of("Big", List.of(FieldDef.of("a", PrimitiveRef.of(F64)), FieldDef.of("b", PrimitiveRef.of(F64)))),
		EnumDef.of("Error", EnumVariant.of("Bad", 1)));
	final SignatureFormatter formatter = new SignatureFormatter(new DataLayout(registry, 64));
	final CTypes c = new CTypes(registry);
	final OpaqueDef widget = (OpaqueDef) registry.resolve(WIDGET);

	AbiSignature format(MethodDef method) {
		return formatter.format(widget, method);
	}

	String prototype(MethodDef method) {
		return c.prototype(format(method));
	}

	static List<String> names(AbiSignature signature) {
		return signature.params().stream().map(AbiParam::name).toList();
	}

	@Test
	void staticMethod() {
		MethodDef method = MethodDef.staticMethod("add_two", INT, ParamDef.of("i", INT));
		AbiSignature signature = format(method);
		assertEquals("Widget_add_two", signature.symbol());
		assertEquals(DIRECT, signature.convention());
		assertEquals("int32_t Widget_add_two(int32_t i)", c.prototype(signature));
	}

	@Test
	void noParams_isVoidParameterList() {
		assertEquals("void Widget_reset(void)", prototype(MethodDef.staticMethod("reset", UnitRef.UNIT)));
	}

	@Test
	void receiverComesFirst() {
		MethodDef method = MethodDef.borrowing("scale", UnitRef.UNIT, ParamDef.of("factor", INT));
		assertEquals("void Widget_scale(Widget* self, int32_t factor)", prototype(method));
	}

	@Test
	void structReceiverIsPassedByValue() {
		StructDef small = (StructDef) registry.resolve(SMALL);
		AbiSignature signature = formatter.format(small, MethodDef.borrowing("sum", INT));
		assertEquals("int32_t Small_sum(Small self)", c.prototype(signature));
	}

	@Test
	void sliceExpandsToDataAndLength() {
		MethodDef method = MethodDef.staticMethod("parse", UnitRef.UNIT,
			ParamDef.of("text", SliceRef.UTF8),
			ParamDef.of("bytes", SliceRef.of(U8)),
			ParamDef.of("names", SliceRef.STRINGS));
		assertEquals("void Widget_parse(const uint8_t* text_data, size_t text_len, "
				+ "const uint8_t* bytes_data, size_t bytes_len, "
				+ "const TetherStringView* names_data, size_t names_len)",
			prototype(method));
		assertEquals(List.of("text_data", "text_len"), format(method).slotsFor("text").stream().map(AbiParam::name).toList());
	}

	@Test
	void nullableScalarGetsPresenceFlag() {
		MethodDef method = MethodDef.staticMethod("limit", UnitRef.UNIT,
			ParamDef.of("max", NullableRef.of(INT)),
			ParamDef.of("owner", NullableRef.of(OpaqueRef.borrowed(WIDGET))));
		assertEquals("void Widget_limit(int32_t max, bool max_present, Widget* owner)", prototype(method));
	}

	@Test
	void structParams() {
		MethodDef method = MethodDef.staticMethod("place", UnitRef.UNIT,
			ParamDef.of("at", StructRef.byValue(SMALL)),
			ParamDef.of("box", StructRef.byReference(BIG)));
		assertEquals("void Widget_place(Small at, const Big* box)", prototype(method));
	}

	@Test
	void smallStructIsReturnedDirectly() {
		AbiSignature signature = format(MethodDef.staticMethod("origin", StructRef.byValue(SMALL)));
		assertEquals(DIRECT, signature.convention());
		assertEquals("Small Widget_origin(void)", c.prototype(signature));
	}

	@Test
	void bigStructIsReturnedThroughOutPointer() {
		AbiSignature signature = format(MethodDef.borrowing("bounds", StructRef.byValue(BIG)));
		assertEquals(OUT_PARAM, signature.convention());
		assertEquals("void Widget_bounds(Widget* self, Big* out)", c.prototype(signature));
		assertEquals(List.of("out"), signature.hiddenParams().stream().map(AbiParam::name).toList());
	}

	@Test
	void smallStructOn32BitIsReturnedThroughOutPointer() {
		SignatureFormatter narrow = new SignatureFormatter(new DataLayout(registry, 32));
		assertEquals(OUT_PARAM, narrow.format(widget, MethodDef.staticMethod("origin", StructRef.byValue(SMALL))).convention());
	}

	@Test
	void sliceReturn() {
		AbiSignature signature = format(MethodDef.borrowing("name", NullableRef.of(SliceRef.UTF8)));
		assertEquals(OUT_PARAM, signature.convention());
		assertEquals("void Widget_name(Widget* self, TetherSlice* out)", c.prototype(signature));
	}

	@Test
	void writeableReturn() {
		AbiSignature signature = format(MethodDef.borrowing("describe", WriteableRef.WRITEABLE, ParamDef.of("verbose", PrimitiveRef.of(BOOL))));
		assertEquals(WRITEABLE, signature.convention());
		assertEquals("void Widget_describe(Widget* self, bool verbose, TetherWrite* write)", c.prototype(signature));
	}

	@Test
	void nullableReturns() {
		AbiSignature scalar = format(MethodDef.staticMethod("find", NullableRef.of(INT)));
		assertEquals(PRESENCE_FLAG, scalar.convention());
		assertEquals("bool Widget_find(int32_t* out)", c.prototype(scalar));

		AbiSignature opaque = format(MethodDef.staticMethod("lookup", NullableRef.of(OpaqueRef.owned(WIDGET))));
		assertEquals(DIRECT, opaque.convention());
		assertEquals("Widget* Widget_lookup(void)", c.prototype(opaque));
	}

	@Test
	void fallibleReturns() {
		AbiSignature both = format(MethodDef.staticMethod("create", FallibleRef.of(OpaqueRef.owned(WIDGET), EnumRef.of(ERROR))));
		assertEquals(DISCRIMINANT, both.convention());
		assertEquals("bool Widget_create(Widget** ok_out, Error* err_out)", c.prototype(both));

		AbiSignature units = format(MethodDef.borrowing("check", FallibleRef.of(UnitRef.UNIT, UnitRef.UNIT)));
		assertEquals("bool Widget_check(Widget* self)", c.prototype(units));

		AbiSignature written = format(MethodDef.borrowing("render", FallibleRef.of(WriteableRef.WRITEABLE, EnumRef.of(ERROR))));
		assertEquals("bool Widget_render(Widget* self, TetherWrite* write, Error* err_out)", c.prototype(written));

		AbiSignature big = format(MethodDef.staticMethod("measure", FallibleRef.of(StructRef.byValue(BIG), SliceRef.UTF8)));
		assertEquals("bool Widget_measure(Big* ok_out, TetherSlice* err_out)", c.prototype(big));
	}

	@Test
	void unitReturn() {
		assertEquals(VOID, format(MethodDef.staticMethod("noop", UnitRef.UNIT)).convention());
	}

	@Test
	void destructor() {
		assertEquals("void Widget_destroy(Widget* self)", c.prototype(formatter.destructor(widget)));
	}

	@ParameterizedTest
	@MethodSource("unsupportedReturns")
	void unsupportedReturn_throws(TypeRef returnType) {
		assertThrows(UnsupportedTypeException.class, () -> format(MethodDef.staticMethod("m", returnType)));
	}

	static Stream<TypeRef> unsupportedReturns() {
		return Stream.of(
			NullableRef.of(FallibleRef.of(INT, INT)),
			NullableRef.of(NullableRef.of(INT)),
			NullableRef.of(WriteableRef.WRITEABLE),
			NullableRef.of(UnitRef.UNIT),
			FallibleRef.of(FallibleRef.of(INT, INT), INT),
			FallibleRef.of(NullableRef.of(INT), INT),
			FallibleRef.of(INT, WriteableRef.WRITEABLE),
			StructRef.byReference(SMALL)
		);
	}

	@ParameterizedTest
	@MethodSource("unsupportedParams")
	void unsupportedParam_throws(TypeRef paramType) {
		assertThrows(UnsupportedTypeException.class, () -> format(MethodDef.staticMethod("m", UnitRef.UNIT, ParamDef.of("p", paramType))));
	}

	static Stream<TypeRef> unsupportedParams() {
		return Stream.of(
			UnitRef.UNIT,
			FallibleRef.of(INT, INT),
			NullableRef.of(NullableRef.of(INT)),
			NullableRef.of(WriteableRef.WRITEABLE),
			NullableRef.of(StructRef.byReference(SMALL))
		);
	}

	@Test
	void paramCollidingWithHiddenSlot_isNamingConflict() {
		MethodDef method = MethodDef.staticMethod("bounds", StructRef.byValue(BIG), ParamDef.of("out", INT));
		NamingConflictException e = assertThrows(NamingConflictException.class, () -> format(method));
		assertEquals("out", e.name());
	}

	@Test
	void paramCollidingWithExpandedSlot_isNamingConflict() {
		MethodDef method = MethodDef.staticMethod("m", UnitRef.UNIT,
			ParamDef.of("text", SliceRef.UTF8),
			ParamDef.of("text_len", INT));
		assertThrows(NamingConflictException.class, () -> format(method));
	}

	@Test
	void slotOrder() {
		MethodDef method = MethodDef.borrowing("m", FallibleRef.of(INT, INT),
			ParamDef.of("s", SliceRef.UTF16),
			ParamDef.of("n", NullableRef.of(EnumRef.of(ERROR))));
		assertEquals(List.of("self", "s_data", "s_len", "n", "n_present", "ok_out", "err_out"), names(format(method)));
	}
}
