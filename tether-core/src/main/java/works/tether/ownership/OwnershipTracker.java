package works.tether.ownership;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tether.abi.SignatureFormatter;
import works.tether.abi.SymbolFormatter;
import works.tether.exceptions.UnsupportedTypeException;
import works.tether.filter.EnabledSurface;
import works.tether.ir.EnumRef;
import works.tether.ir.FallibleRef;
import works.tether.ir.FieldDef;
import works.tether.ir.MethodDef;
import works.tether.ir.NullableRef;
import works.tether.ir.OpaqueDef;
import works.tether.ir.OpaqueRef;
import works.tether.ir.ParamDef;
import works.tether.ir.PrimitiveRef;
import works.tether.ir.SliceRef;
import works.tether.ir.StructDef;
import works.tether.ir.StructRef;
import works.tether.ir.TypeDef;
import works.tether.ir.TypeRef;
import works.tether.ir.UnitRef;
import works.tether.ir.WriteableRef;

/**
 * Decides, for every value crossing the boundary, who owns it afterward.
 * <p>
 * The rules:
 * <ul>
 *     <li>Owned opaque handles passed by value, including a consumed receiver, are {@link Transfer#MOVE moved}.</li>
 *     <li>Borrowed opaque references and writeable sinks are {@link Transfer#BORROW borrowed} for the call only.</li>
 *     <li>Everything else is copied.</li>
 *     <li>
 *         A borrowed result borrows from the receiver (if borrowed) and every borrowed opaque argument.
 *         It can't borrow from a receiver the call consumes.
 *     </li>
 * </ul>
 */
public final class OwnershipTracker {
	private OwnershipTracker() { }

	/**
	 * @throws UnsupportedTypeException if the method returns a borrowed reference
	 * while consuming its receiver
	 */
	public static CallOwnership analyze(TypeDef owner, MethodDef method) {
		Transfer self = selfTransfer(owner, method);
		Map<String, Transfer> params = new LinkedHashMap<>();
		List<String> edges = new ArrayList<>();
		if (self == Transfer.BORROW) {
			edges.add(SignatureFormatter.SELF_NAME);
		}
		for (ParamDef param: method.params()) {
			Transfer transfer = transferOf(param.type());
			params.put(param.name(), transfer);
			if (transfer == Transfer.BORROW && isOpaque(param.type())) {
				edges.add(param.name());
			}
		}

		ReturnOwnership returns;
		ReturnOwnership error;
		if (method.returnType() instanceof FallibleRef f) {
			returns = returnOf(f.ok());
			error = returnOf(f.err());
		} else {
			returns = returnOf(method.returnType());
			error = ReturnOwnership.NONE;
		}

		CallOwnership result;
		if (returns == ReturnOwnership.BORROWED || error == ReturnOwnership.BORROWED) {
			if (self == Transfer.MOVE) {
				throw new UnsupportedTypeException(method.returnType(),
					"Method " + method.name() + " returns a borrowed reference but consumes its receiver");
			}
			result = new CallOwnership(self, params, returns, error, edges);
		} else {
			result = new CallOwnership(self, params, returns, error, List.of());
		}
		LOGGER.trace("{}.{}: {}", owner.name(), method.name(), result);
		return result;
	}

	/**
	 * @return the destructor of {@code type} if it has one; only opaque types do
	 */
	public static Optional<DestructorPlan> destructorFor(TypeDef type) {
		if (type instanceof OpaqueDef opaque) {
			return Optional.of(new DestructorPlan(opaque.id(), SymbolFormatter.destructorSymbol(opaque)));
		}
		return Optional.empty();
	}

	/**
	 * @return one destructor per enabled opaque type, in type order
	 */
	public static List<DestructorPlan> destructors(EnabledSurface surface) {
		return surface.types().stream()
			.map(OwnershipTracker::destructorFor)
			.flatMap(Optional::stream)
			.toList();
	}

	/**
	 * A struct is copied across the boundary, so nothing would ever destroy
	 * an owned handle stored in one of its fields.
	 *
	 * @throws UnsupportedTypeException if a field owns an opaque handle
	 */
	public static void checkFields(StructDef struct) {
		for (FieldDef field: struct.fields()) {
			TypeRef type = field.type();
			TypeRef inner = (type instanceof NullableRef n) ? n.inner() : type;
			if (inner instanceof OpaqueRef o && o.owned()) {
				throw new UnsupportedTypeException(type,
					"Field " + struct.name() + "." + field.name() + " owns an opaque handle, which a copied struct can't destroy");
			}
		}
	}

	private static @Nullable Transfer selfTransfer(TypeDef owner, MethodDef method) {
		return switch (method.self()) {
			case NONE -> null;
			case BORROWED -> (owner instanceof OpaqueDef) ? Transfer.BORROW : Transfer.COPY;
			case VALUE -> (owner instanceof OpaqueDef) ? Transfer.MOVE : Transfer.COPY;
		};
	}

	private static boolean isOpaque(TypeRef type) {
		return type instanceof OpaqueRef
			|| (type instanceof NullableRef n && n.inner() instanceof OpaqueRef);
	}

	static Transfer transferOf(TypeRef type) {
		return type.accept(new TypeRef.Visitor<>() {
			@Override public Transfer visitPrimitive(PrimitiveRef ref) { return Transfer.COPY; }
			@Override public Transfer visitOpaque(OpaqueRef ref) { return ref.owned() ? Transfer.MOVE : Transfer.BORROW; }
			@Override public Transfer visitStruct(StructRef ref) { return Transfer.COPY; }
			@Override public Transfer visitEnum(EnumRef ref) { return Transfer.COPY; }
			@Override public Transfer visitSlice(SliceRef ref) { return Transfer.COPY; }
			@Override public Transfer visitWriteable(WriteableRef ref) { return Transfer.BORROW; }
			@Override public Transfer visitNullable(NullableRef ref) { return ref.inner().accept(this); }
			@Override public Transfer visitFallible(FallibleRef ref) {
				throw new UnsupportedTypeException(ref, "Fallible is only allowed as a return type");
			}
			@Override public Transfer visitUnit(UnitRef ref) {
				throw new UnsupportedTypeException(ref, "Unit is not a parameter type");
			}
		});
	}

	static ReturnOwnership returnOf(TypeRef type) {
		return type.accept(new TypeRef.Visitor<>() {
			@Override public ReturnOwnership visitPrimitive(PrimitiveRef ref) { return ReturnOwnership.COPY; }
			@Override public ReturnOwnership visitOpaque(OpaqueRef ref) { return ref.owned() ? ReturnOwnership.OWNED : ReturnOwnership.BORROWED; }
			@Override public ReturnOwnership visitStruct(StructRef ref) { return ReturnOwnership.COPY; }
			@Override public ReturnOwnership visitEnum(EnumRef ref) { return ReturnOwnership.COPY; }
			@Override public ReturnOwnership visitSlice(SliceRef ref) { return ReturnOwnership.COPY; }
			@Override public ReturnOwnership visitWriteable(WriteableRef ref) { return ReturnOwnership.COPY; }
			@Override public ReturnOwnership visitNullable(NullableRef ref) { return ref.inner().accept(this); }
			@Override public ReturnOwnership visitFallible(FallibleRef ref) {
				throw new UnsupportedTypeException(ref, "Fallible can't be nested");
			}
			@Override public ReturnOwnership visitUnit(UnitRef ref) { return ReturnOwnership.NONE; }
		});
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OwnershipTracker.class);
}
