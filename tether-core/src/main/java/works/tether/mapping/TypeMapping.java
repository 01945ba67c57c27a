package works.tether.mapping;

import java.util.List;
import works.tether.abi.AbiParam;
import works.tether.ir.TypeRef;

import static java.util.Objects.requireNonNull;

/**
 * One IR type as both sides see it.
 *
 * @param host the backend's representation of the type callers use
 * @param slots the native slots carrying it; empty for values that travel by return value alone
 * @param <H> the backend's host type representation
 */
public record TypeMapping<H>(TypeRef type, H host, List<AbiParam> slots) {
	public TypeMapping {
		requireNonNull(type);
		requireNonNull(host);
		slots = List.copyOf(slots);
	}
}
