package works.tether.emit;

import java.util.List;
import works.tether.config.BackendId;
import works.tether.ir.TypeDef;
import works.tether.mapping.TypeMapper;

/**
 * A host language.
 * <p>
 * Implementations are found with {@link java.util.ServiceLoader}
 * and must have a public no-argument constructor.
 * One instance serves one run at a time but may be called from several threads within it;
 * implementations should be stateless.
 *
 * @param <H> the backend's representation of a host type
 */
public interface Backend<H> {
	BackendId id();

	TypeMapper<H> typeMapper();

	/**
	 * @return the name callers see for {@code type}: its rename if it has one, otherwise its IR name
	 */
	default String hostName(TypeDef type) {
		String rename = type.attributes().rename();
		return (rename == null) ? type.name() : rename;
	}

	/**
	 * @throws works.tether.exceptions.GenerationException if the unit can't be expressed in this host language;
	 * the unit's artifacts are then withheld
	 */
	List<Artifact> emitUnit(TypeUnit<H> unit, EmissionContext context);

	/**
	 * @return artifacts shared by every unit
	 */
	default List<Artifact> emitLibrary(EmissionContext context) {
		return List.of();
	}
}
