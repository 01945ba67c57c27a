/**
 * The typed, immutable description of a native library's exported surface.
 * <p>
 * A {@link works.tether.ir.TypeRegistry TypeRegistry} holds one
 * {@link works.tether.ir.TypeDef TypeDef} per exported declaration,
 * each identified by a {@link works.tether.ir.TypeId TypeId}.
 * Methods, fields and parameters describe their types with
 * {@link works.tether.ir.TypeRef TypeRef}s, which refer to other definitions
 * only through their ids.
 * <p>
 * Both {@code TypeDef} and {@code TypeRef} are closed hierarchies with visitors.
 * Every pass of the generator goes through those visitors,
 * so a new variant cannot be added without each pass deciding what to do with it.
 */
package works.tether.ir;
