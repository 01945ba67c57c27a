package works.tether.ir;

import java.util.List;

/**
 * The type of a parameter, return value, or field.
 * <p>
 * Like {@link TypeDef}, the set of variants is closed,
 * and {@link #accept} is the way to handle all of them.
 * Variants that name a {@link TypeDef} do so only by {@link TypeId};
 * the definition itself lives in the {@link TypeRegistry}.
 */
public sealed interface TypeRef permits
	PrimitiveRef,
	OpaqueRef,
	StructRef,
	EnumRef,
	SliceRef,
	WriteableRef,
	NullableRef,
	FallibleRef,
	UnitRef
{
	<R> R accept(Visitor<R> visitor);

	/**
	 * @return the {@link TypeId}s this type mentions, including those nested in combinators
	 */
	List<TypeId> referencedTypes();

	interface Visitor<R> {
		R visitPrimitive(PrimitiveRef ref);
		R visitOpaque(OpaqueRef ref);
		R visitStruct(StructRef ref);
		R visitEnum(EnumRef ref);
		R visitSlice(SliceRef ref);
		R visitWriteable(WriteableRef ref);
		R visitNullable(NullableRef ref);
		R visitFallible(FallibleRef ref);
		R visitUnit(UnitRef ref);
	}
}
