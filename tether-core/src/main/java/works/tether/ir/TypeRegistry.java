package works.tether.ir;

import java.util.List;
import works.tether.exceptions.UnknownTypeIdException;

/**
 * Read-only access to every {@link TypeDef} of one generation run.
 * <p>
 * Implementations must be immutable: every component of the generator
 * receives the same instance and may read it from any thread.
 */
public interface TypeRegistry {
	/**
	 * @return every type definition; callers must not depend on the order
	 */
	List<TypeDef> allTypes();

	/**
	 * @throws UnknownTypeIdException if there's no such type
	 */
	TypeDef resolve(TypeId id);

	boolean contains(TypeId id);
}
