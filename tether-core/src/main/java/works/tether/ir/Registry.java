package works.tether.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import works.tether.exceptions.LoweringException;
import works.tether.exceptions.UnknownTypeIdException;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The standard immutable {@link TypeRegistry}.
 * <p>
 * Instances can only be obtained from a {@link Builder}, which checks
 * the structural rules that every later pass relies on:
 * identifiers are unique and well-formed,
 * and every {@link TypeId} mentioned anywhere names a definition of the right kind.
 * Rules that depend on the backend (enablement, supported combinations, symbol clashes)
 * are not checked here; they're per-type diagnostics, not lowering failures.
 */
public final class Registry implements TypeRegistry {
	private final Map<TypeId, TypeDef> types;

	private Registry(Map<TypeId, TypeDef> types) {
		this.types = types;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Registry of(TypeDef... types) {
		return builder().addAll(List.of(types)).build();
	}

	@Override
	public List<TypeDef> allTypes() {
		return List.copyOf(types.values());
	}

	@Override
	public TypeDef resolve(TypeId id) {
		TypeDef result = types.get(requireNonNull(id));
		if (result == null) {
			throw new UnknownTypeIdException(id);
		}
		return result;
	}

	@Override
	public boolean contains(TypeId id) {
		return types.containsKey(id);
	}

	@Override
	public String toString() {
		return "Registry" + types.keySet();
	}

	public static final class Builder {
		private final List<TypeDef> pending = new ArrayList<>();

		Builder() { }

		public Builder add(TypeDef type) {
			pending.add(requireNonNull(type));
			return this;
		}

		public Builder addAll(Collection<? extends TypeDef> types) {
			types.forEach(this::add);
			return this;
		}

		/**
		 * @throws LoweringException listing every structural problem found
		 */
		public Registry build() {
			List<String> problems = new ArrayList<>();
			Map<TypeId, TypeDef> byId = new LinkedHashMap<>();
			for (TypeDef type: pending) {
				TypeDef existing = byId.putIfAbsent(type.id(), type);
				if (existing != null) {
					problems.add("Duplicate type id " + type.id() + " for " + existing.name() + " and " + type.name());
				}
			}
			for (TypeDef type: byId.values()) {
				new Checker(byId, type, problems).check();
			}
			if (!problems.isEmpty()) {
				throw new LoweringException(problems);
			}
			// Sorted so that nothing downstream can depend on the order types were added
			return new Registry(unmodifiableMap(new TreeMap<>(byId)));
		}
	}

	private record Checker(Map<TypeId, TypeDef> byId, TypeDef owner, List<String> problems) {
		void check() {
			checkIdentifier(owner.name(), "type name");
			owner.accept(new TypeDef.Visitor<Void>() {
				@Override
				public Void visitOpaque(OpaqueDef def) {
					return null;
				}

				@Override
				public Void visitStruct(StructDef def) {
					checkUnique(def.fields(), FieldDef::name, "field");
					for (FieldDef field: def.fields()) {
						checkIdentifier(field.name(), "field name");
						checkReferences(field.type(), "field " + field.name());
					}
					return null;
				}

				@Override
				public Void visitEnum(EnumDef def) {
					checkUnique(def.variants(), EnumVariant::name, "variant");
					checkUnique(def.variants(), EnumVariant::discriminant, "discriminant");
					def.variants().forEach(v -> checkIdentifier(v.name(), "variant name"));
					return null;
				}

				@Override
				public Void visitPrimitive(PrimitiveDef def) {
					return null;
				}
			});
			for (MethodDef method: owner.methods()) {
				checkIdentifier(method.name(), "method name");
				checkUnique(method.params(), ParamDef::name, "parameter of " + method.name());
				for (ParamDef param: method.params()) {
					checkIdentifier(param.name(), "parameter name");
					checkReferences(param.type(), "parameter " + method.name() + "." + param.name());
				}
				checkReferences(method.returnType(), "return type of " + method.name());
			}
		}

		private void checkIdentifier(String name, String what) {
			if (!Identifiers.isValid(name)) {
				problems.add(owner.id() + ": invalid " + what + " \"" + name + "\"");
			}
		}

		private <T, K> void checkUnique(List<T> items, Function<T, K> key, String what) {
			Set<K> seen = new HashSet<>();
			for (T item: items) {
				K k = key.apply(item);
				if (!seen.add(k)) {
					problems.add(owner.id() + ": duplicate " + what + " " + k);
				}
			}
		}

		private void checkReferences(TypeRef ref, String where) {
			ref.accept(new KindCheck(where));
		}

		/**
		 * Verifies that each reference names an existing definition of the matching kind.
		 */
		private final class KindCheck implements TypeRef.Visitor<Void> {
			final String where;

			KindCheck(String where) {
				this.where = where;
			}

			private void expect(TypeId target, Class<? extends TypeDef> kind) {
				TypeDef def = byId.get(target);
				if (def == null) {
					problems.add(owner.id() + ": " + where + " refers to unknown type " + target);
				} else if (!kind.isInstance(def)) {
					problems.add(owner.id() + ": " + where + " refers to " + target
						+ " as " + kind.getSimpleName() + " but it is " + def.kindName());
				}
			}

			@Override public Void visitPrimitive(PrimitiveRef ref) { return null; }
			@Override public Void visitOpaque(OpaqueRef ref) { expect(ref.target(), OpaqueDef.class); return null; }
			@Override public Void visitStruct(StructRef ref) { expect(ref.target(), StructDef.class); return null; }
			@Override public Void visitEnum(EnumRef ref) { expect(ref.target(), EnumDef.class); return null; }
			@Override public Void visitSlice(SliceRef ref) { return null; }
			@Override public Void visitWriteable(WriteableRef ref) { return null; }
			@Override public Void visitNullable(NullableRef ref) { return ref.inner().accept(this); }

			@Override
			public Void visitFallible(FallibleRef ref) {
				ref.ok().accept(this);
				return ref.err().accept(this);
			}

			@Override public Void visitUnit(UnitRef ref) { return null; }
		}
	}
}
