package works.tether.abi;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.tether.exceptions.NamingConflictException;
import works.tether.ir.Attributes;
import works.tether.ir.MethodDef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.StructDef;
import works.tether.ir.UnitRef;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SymbolFormatterTest {
	@Test
	void opaqueType_exportsOneSymbolPerMethodPlusDestructor() {
		OpaqueDef widget = OpaqueDef.of("Widget",
			MethodDef.staticMethod("create", UnitRef.UNIT),
			MethodDef.borrowing("size", UnitRef.UNIT),
			MethodDef.consuming("finish", UnitRef.UNIT));
		assertEquals(List.of("Widget_create", "Widget_size", "Widget_finish", "Widget_destroy"),
			SymbolFormatter.symbolsOf(widget, widget.methods()));
	}

	@Test
	void structType_hasNoDestructor() {
		StructDef point = StructDef.of("Point", List.of(), MethodDef.borrowing("norm", UnitRef.UNIT));
		assertEquals(List.of("Point_norm"), SymbolFormatter.symbolsOf(point, point.methods()));
	}

	@Test
	void renamesDoNotAffectSymbols() {
		OpaqueDef widget = OpaqueDef.of("Widget", MethodDef.staticMethod("create", UnitRef.UNIT))
			.withAttributes(Attributes.renamed("Gadget"));
		assertEquals("Widget_create", SymbolFormatter.methodSymbol(widget, widget.methods().get(0)));
	}

	@Test
	void methodNamedDestroy_conflictsWithDestructor() {
		OpaqueDef widget = OpaqueDef.of("Widget", MethodDef.consuming("destroy", UnitRef.UNIT));
		NamingConflictException e = assertThrows(NamingConflictException.class,
			() -> SymbolFormatter.symbolsOf(widget, widget.methods()));
		assertEquals("Widget_destroy", e.name());
	}

	@Test
	void duplicateMethodNames_conflict() {
		OpaqueDef widget = OpaqueDef.of("Widget",
			MethodDef.staticMethod("get", UnitRef.UNIT),
			MethodDef.borrowing("get", UnitRef.UNIT));
		assertThrows(NamingConflictException.class, () -> SymbolFormatter.symbolsOf(widget, widget.methods()));
	}
}
