package works.tether.java;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.tether.config.GeneratorConfig;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumRef;
import works.tether.ir.EnumVariant;
import works.tether.ir.FallibleRef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.Registry;
import works.tether.ir.SliceRef;
import works.tether.ir.TypeId;
import works.tether.ir.TypeRef;
import works.tether.mapping.HostNames;
import works.tether.mapping.MappingContext;
import works.tether.mapping.Position;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.tether.ir.UnitRef.UNIT;
import static works.tether.ir.WriteableRef.WRITEABLE;
import static works.tether.mapping.Position.FIELD;
import static works.tether.mapping.Position.PARAM;
import static works.tether.mapping.Position.RETURN;

class JavaTypeMapperTest {
	static final TypeId WIDGET = TypeId.of("Widget");
	static final TypeId MODE = TypeId.of("Mode");
	static final Registry REGISTRY = Registry.of(
		OpaqueDef.of("Widget"),
		EnumDef.of("Mode", EnumVariant.of("On", 1)));

	final JavaTypeMapper mapper = new JavaTypeMapper();

	static Stream<Arguments> declarations() {
		return Stream.of(
			Arguments.of(PrimitiveRef.of(PrimitiveKind.BOOL), PARAM, "boolean"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.CHAR), PARAM, "int"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.U8), PARAM, "@Unsigned byte"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.I16), FIELD, "short"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.U64), RETURN, "@Unsigned long"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.USIZE), PARAM, "@Unsigned long"),
			Arguments.of(PrimitiveRef.of(PrimitiveKind.F32), PARAM, "float"),
			Arguments.of(OpaqueRef.owned(WIDGET), PARAM, "Widget"),
			Arguments.of(EnumRef.of(MODE), FIELD, "Mode"),
			Arguments.of(SliceRef.UTF8, PARAM, "String"),
			Arguments.of(SliceRef.UTF16, RETURN, "String"),
			Arguments.of(SliceRef.STRINGS, PARAM, "String[]"),
			Arguments.of(SliceRef.of(PrimitiveKind.U32), PARAM, "int[]"),
			Arguments.of(SliceRef.of(PrimitiveKind.F64), RETURN, "double[]"),
			Arguments.of(WRITEABLE, PARAM, "WriteableBuffer"),
			Arguments.of(WRITEABLE, RETURN, "String"),
			Arguments.of(NullableRef.of(PrimitiveRef.of(PrimitiveKind.I32)), PARAM, "@Nullable Integer"),
			Arguments.of(NullableRef.of(PrimitiveRef.of(PrimitiveKind.U16)), RETURN, "@Nullable @Unsigned Short"),
			Arguments.of(NullableRef.of(OpaqueRef.borrowed(WIDGET)), PARAM, "@Nullable Widget"),
			Arguments.of(NullableRef.of(SliceRef.UTF8), RETURN, "@Nullable String"),
			Arguments.of(FallibleRef.of(PrimitiveRef.of(PrimitiveKind.U32), EnumRef.of(MODE)), RETURN, "Result<Integer, Mode>"),
			Arguments.of(FallibleRef.of(UNIT, SliceRef.UTF8), RETURN, "Result<Void, String>"),
			Arguments.of(FallibleRef.of(WRITEABLE, UNIT), RETURN, "Result<String, Void>"),
			Arguments.of(UNIT, RETURN, "void")
		);
	}

	@ParameterizedTest
	@MethodSource("declarations")
	void declaration(TypeRef type, Position position, String expected) {
		assertEquals(expected, mapper.map(type, position, context(64)).declaration());
	}

	static Stream<Arguments> unsupported() {
		return Stream.of(
			Arguments.of(SliceRef.of(PrimitiveKind.BOOL), PARAM),
			Arguments.of(WRITEABLE, FIELD),
			Arguments.of(UNIT, PARAM),
			Arguments.of(FallibleRef.of(UNIT, UNIT), PARAM),
			Arguments.of(NullableRef.of(NullableRef.of(PrimitiveRef.of(PrimitiveKind.I32))), PARAM),
			Arguments.of(NullableRef.of(WRITEABLE), RETURN),
			Arguments.of(FallibleRef.of(NullableRef.of(PrimitiveRef.of(PrimitiveKind.I32)), UNIT), RETURN),
			Arguments.of(FallibleRef.of(UNIT, WRITEABLE), RETURN)
		);
	}

	@ParameterizedTest
	@MethodSource("unsupported")
	void unsupported(TypeRef type, Position position) {
		assertThrows(UnsupportedTypeException.class, () -> mapper.map(type, position, context(64)));
	}

	@Test
	void pointerSized_needs64Bits() {
		TypeRef isize = PrimitiveRef.of(PrimitiveKind.ISIZE);
		assertEquals("long", mapper.map(isize, PARAM, context(64)).name());
		assertThrows(UnsupportedTypeException.class, () -> mapper.map(isize, PARAM, context(32)));
		assertThrows(UnsupportedTypeException.class, () -> mapper.map(SliceRef.of(PrimitiveKind.USIZE), RETURN, context(32)));
	}

	@Test
	void imports() {
		JavaType result = mapper.map(FallibleRef.of(PrimitiveRef.of(PrimitiveKind.U32), EnumRef.of(MODE)), RETURN, context(64));
		assertEquals(List.of("works.tether.runtime.Result"), List.copyOf(result.imports()));
		JavaType nullable = mapper.map(NullableRef.of(PrimitiveRef.of(PrimitiveKind.U8)), PARAM, context(64));
		assertEquals(List.of("org.jetbrains.annotations.Nullable", "works.tether.runtime.Unsigned"), List.copyOf(nullable.imports()));
		assertTrue(nullable.nullable());
		assertFalse(nullable.isPrimitive());
	}

	@Test
	void renamedTypes_useHostName() {
		HostNames renamed = HostNames.of(REGISTRY.allTypes(), def -> def.name().equals("Widget") ? "Gizmo" : def.name());
		MappingContext context = new MappingContext(REGISTRY, renamed, config(64));
		assertEquals("Gizmo", mapper.map(OpaqueRef.borrowed(WIDGET), PARAM, context).name());
	}

	private static MappingContext context(int pointerWidth) {
		HostNames hostNames = HostNames.of(REGISTRY.allTypes(), def -> def.name());
		return new MappingContext(REGISTRY, hostNames, config(pointerWidth));
	}

	private static GeneratorConfig config(int pointerWidth) {
		return GeneratorConfig.builder(JavaBackend.ID).pointerWidth(pointerWidth).build();
	}
}
