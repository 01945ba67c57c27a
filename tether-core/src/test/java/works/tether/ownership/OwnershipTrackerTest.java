package works.tether.ownership;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.ir.EnumDef;
import works.tether.ir.FallibleRef;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveKind;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceRef;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeId;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.tether.ownership.ReturnOwnership.BORROWED;
import static works.tether.ownership.ReturnOwnership.COPY;
import static works.tether.ownership.ReturnOwnership.NONE;
import static works.tether.ownership.ReturnOwnership.OWNED;

class OwnershipTrackerTest {
	static final TypeId WIDGET = TypeId.of("Widget");
	static final TypeId POINT = TypeId.of("Point");
	final OpaqueDef widget = OpaqueDef.of("Widget");
	final StructDef point = StructDef.of("Point", List.of());

	@Test
	void parameterTransfers() {
		MethodDef method = MethodDef.staticMethod("m", UnitRef.UNIT,
			ParamDef.of("owned", OpaqueRef.owned(WIDGET)),
			ParamDef.of("borrowed", OpaqueRef.borrowed(WIDGET)),
			ParamDef.of("maybe", NullableRef.of(OpaqueRef.owned(WIDGET))),
			ParamDef.of("value", StructRef.byValue(POINT)),
			ParamDef.of("ref", StructRef.byReference(POINT)),
			ParamDef.of("text", SliceRef.UTF8),
			ParamDef.of("n", PrimitiveRef.of(PrimitiveKind.I32)),
			ParamDef.of("sink", WriteableRef.WRITEABLE));
		CallOwnership ownership = OwnershipTracker.analyze(widget, method);
		assertNull(ownership.self());
		assertEquals(Map.of(
				"owned", Transfer.MOVE,
				"borrowed", Transfer.BORROW,
				"maybe", Transfer.MOVE,
				"value", Transfer.COPY,
				"ref", Transfer.COPY,
				"text", Transfer.COPY,
				"n", Transfer.COPY,
				"sink", Transfer.BORROW),
			ownership.params());
		assertEquals(List.of("owned", "borrowed", "maybe", "value", "ref", "text", "n", "sink"),
			List.copyOf(ownership.params().keySet()));
		assertEquals(NONE, ownership.returns());
	}

	@Test
	void receiverTransfers() {
		assertEquals(Transfer.BORROW, OwnershipTracker.analyze(widget, MethodDef.borrowing("m", UnitRef.UNIT)).self());
		assertEquals(Transfer.MOVE, OwnershipTracker.analyze(widget, MethodDef.consuming("m", UnitRef.UNIT)).self());
		assertEquals(Transfer.COPY, OwnershipTracker.analyze(point, MethodDef.consuming("m", UnitRef.UNIT)).self());
		assertEquals(Transfer.COPY, OwnershipTracker.analyze(point, MethodDef.borrowing("m", UnitRef.UNIT)).self());
		assertTrue(OwnershipTracker.analyze(widget, MethodDef.consuming("m", UnitRef.UNIT)).consumesSelf());
	}

	@Test
	void returnOwnership() {
		assertEquals(OWNED, OwnershipTracker.analyze(widget, MethodDef.staticMethod("m", OpaqueRef.owned(WIDGET))).returns());
		assertEquals(COPY, OwnershipTracker.analyze(widget, MethodDef.staticMethod("m", StructRef.byValue(POINT))).returns());
		assertEquals(COPY, OwnershipTracker.analyze(widget, MethodDef.staticMethod("m", WriteableRef.WRITEABLE)).returns());

		CallOwnership fallible = OwnershipTracker.analyze(widget,
			MethodDef.staticMethod("m", FallibleRef.of(OpaqueRef.owned(WIDGET), SliceRef.UTF8)));
		assertEquals(OWNED, fallible.returns());
		assertEquals(COPY, fallible.error());
	}

	@Test
	void borrowedReturn_borrowsFromReceiverAndBorrowedArguments() {
		MethodDef method = MethodDef.borrowing("child", NullableRef.of(OpaqueRef.borrowed(WIDGET)),
			ParamDef.of("parent", OpaqueRef.borrowed(WIDGET)),
			ParamDef.of("gift", OpaqueRef.owned(WIDGET)),
			ParamDef.of("index", PrimitiveRef.of(PrimitiveKind.USIZE)));
		CallOwnership ownership = OwnershipTracker.analyze(widget, method);
		assertEquals(BORROWED, ownership.returns());
		assertEquals(List.of("self", "parent"), ownership.lifetimeEdges());
	}

	@Test
	void ownedReturn_hasNoLifetimeEdges() {
		MethodDef method = MethodDef.borrowing("copy", OpaqueRef.owned(WIDGET));
		assertEquals(List.of(), OwnershipTracker.analyze(widget, method).lifetimeEdges());
	}

	@Test
	void borrowedReturnFromConsumedReceiver_isUnsupported() {
		MethodDef method = MethodDef.consuming("leak", OpaqueRef.borrowed(WIDGET));
		assertThrows(UnsupportedTypeException.class, () -> OwnershipTracker.analyze(widget, method));
	}

	@Test
	void destructors_onlyForOpaqueTypes() {
		assertEquals(Optional.of(new DestructorPlan(WIDGET, "Widget_destroy")), OwnershipTracker.destructorFor(widget));
		assertEquals(Optional.empty(), OwnershipTracker.destructorFor(point));
		assertEquals(Optional.empty(), OwnershipTracker.destructorFor(EnumDef.of("E")));
	}

	@Test
	void ownedHandleInField_isUnsupported() {
		StructDef holder = StructDef.of("Holder", List.of(FieldDef.of("w", NullableRef.of(OpaqueRef.owned(WIDGET)))));
		assertThrows(UnsupportedTypeException.class, () -> OwnershipTracker.checkFields(holder));
		OwnershipTracker.checkFields(StructDef.of("Viewer", List.of(FieldDef.of("w", OpaqueRef.borrowed(WIDGET)))));
	}
}
