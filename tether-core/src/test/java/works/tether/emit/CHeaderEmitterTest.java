package works.tether.emit;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.tether.config.GeneratorConfig;
import works.tether.ir.Attributes;
import works.tether.ir.EnumDef;
import works.tether.ir.EnumRef;
import works.tether.ir.EnumVariant;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveDef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.Registry;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeId;
import works.tether.report.GenerationResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CHeaderEmitterTest {
	static final PrimitiveRef INT = PrimitiveRef.of(PrimitiveKind.I32);

	static String header(GenerationResult result, String name) {
		return result.artifacts().stream()
			.filter(a -> a.path().equals("include/" + name + ".h"))
			.findFirst()
			.orElseThrow(() -> new AssertionError("No header for " + name + ": " + result.summary()))
			.content();
	}

	GenerationResult emit(Registry registry) {
		GeneratorConfig config = GeneratorConfig.builder(FakeBackend.ID).build();
		return new OutputEmitter<>(new FakeBackend(), config).emit(registry);
	}

	@Test
	void opaqueHeader() {
		TypeId id = TypeId.of("OpaqueStruct");
		OpaqueDef opaque = new OpaqueDef(id, "OpaqueStruct", "A thing with a hidden layout.", Attributes.NONE, List.of(
			MethodDef.staticMethod("add_two", INT, ParamDef.of("i", INT)).withDocs("Adds two."),
			MethodDef.staticMethod("new", OpaqueRef.owned(id))));
		assertEquals("""
			#ifndef TETHER_OPAQUESTRUCT_H
			#define TETHER_OPAQUESTRUCT_H

			#include "tether_runtime.h"

			/**
			 * A thing with a hidden layout.
			 */
			typedef struct OpaqueStruct OpaqueStruct;

			/**
			 * Adds two.
			 */
			int32_t OpaqueStruct_add_two(int32_t i);

			OpaqueStruct* OpaqueStruct_new(void);

			void OpaqueStruct_destroy(OpaqueStruct* self);

			#endif
			""", header(emit(Registry.of(opaque)), "OpaqueStruct"));
	}

	@Test
	void structHeader_includesValueDependenciesBeforeDefinition() {
		TypeId color = TypeId.of("Color");
		TypeId brush = TypeId.of("Brush");
		Registry registry = Registry.of(
			EnumDef.of("Color", EnumVariant.of("Red", 0), EnumVariant.of("Blue", 7)),
			OpaqueDef.of("Brush"),
			StructDef.of("Stroke", List.of(
					FieldDef.of("color", EnumRef.of(color)),
					FieldDef.of("width", PrimitiveRef.of(PrimitiveKind.F32)),
					FieldDef.of("brush", OpaqueRef.borrowed(brush))),
				MethodDef.borrowing("apply", StructRef.byValue(TypeId.of("Stroke")), ParamDef.of("with", OpaqueRef.borrowed(brush)))));
		GenerationResult result = emit(registry);
		assertTrue(result.isSuccess(), result.summary());
		assertEquals("""
			#ifndef TETHER_STROKE_H
			#define TETHER_STROKE_H

			#include "tether_runtime.h"
			#include "Color.h"

			typedef struct Brush Brush;

			typedef struct Stroke {
				Color color;
				float width;
				Brush* brush;
			} Stroke;

			void Stroke_apply(Stroke self, Brush* with, Stroke* out);

			#endif
			""", header(result, "Stroke"));
		assertEquals("""
			#ifndef TETHER_COLOR_H
			#define TETHER_COLOR_H

			#include "tether_runtime.h"

			typedef enum Color {
				Color_Red = 0,
				Color_Blue = 7,
			} Color;

			#endif
			""", header(result, "Color"));
	}

	@Test
	void methodDependenciesAreIncludedAfterDefinition() {
		TypeId point = TypeId.of("Point");
		Registry registry = Registry.of(
			StructDef.of("Point", List.of(FieldDef.of("x", INT))),
			OpaqueDef.of("Cursor", MethodDef.borrowing("position", StructRef.byValue(point))));
		String header = header(emit(registry), "Cursor");
		assertTrue(header.contains("""
			typedef struct Cursor Cursor;

			#include "Point.h"

			Point Cursor_position(Cursor* self);
			"""), header);
	}

	@Test
	void primitiveHeader() {
		String header = header(emit(Registry.of(PrimitiveDef.of("Handle", PrimitiveKind.USIZE))), "Handle");
		assertTrue(header.contains("typedef size_t Handle;"), header);
	}

	@Test
	void runtimeHeader_declaresSharedTypes() {
		String header = CHeaderEmitter.runtimeHeader().content();
		assertTrue(header.contains("} TetherSlice;"), header);
		assertTrue(header.contains("} TetherStringView;"), header);
		assertTrue(header.contains("bool (*grow)(struct TetherWrite*, size_t);"), header);
		assertTrue(header.contains("#include <stdint.h>"), header);
	}
}
