package works.tether.emit;

import java.util.List;
import java.util.Optional;
import works.tether.abi.AbiSignature;
import works.tether.ir.TypeDef;
import works.tether.ownership.DestructorPlan;

/**
 * A fully analyzed type, ready to be written out.
 * Backends receive only these: by the time one exists, every check has passed.
 *
 * @param fields empty unless {@link #def} is a struct
 * @param destructor present exactly when {@link #def} is opaque
 * @param destructorSignature present exactly when {@link #destructor} is
 * @param symbols every native symbol this type exports
 */
public record TypeUnit<H>(
	TypeDef def,
	String hostName,
	List<FieldPlan<H>> fields,
	List<MethodPlan<H>> methods,
	Optional<DestructorPlan> destructor,
	Optional<AbiSignature> destructorSignature,
	List<String> symbols
) {
	public TypeUnit {
		fields = List.copyOf(fields);
		methods = List.copyOf(methods);
		symbols = List.copyOf(symbols);
		if (destructor.isPresent() != destructorSignature.isPresent()) {
			throw new IllegalArgumentException("Destructor plan and signature must be present together");
		}
	}
}
