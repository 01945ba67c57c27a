package works.tether.mapping;

import works.tether.ir.TypeRef;

/**
 * Translates IR types into one backend's host representation.
 * <p>
 * The native representation is not up to the backend:
 * it's fixed by {@link works.tether.abi.NativeLowering}, and every backend shares it.
 * A mapper decides only what callers on the host side see.
 *
 * @param <H> the backend's host type representation
 */
public interface TypeMapper<H> {
	/**
	 * @throws works.tether.exceptions.UnsupportedTypeException if this host can't represent the type at that position
	 */
	H map(TypeRef type, Position position, MappingContext context);
}
