package works.tether.abi;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The complete native calling contract for one exported symbol.
 *
 * @param params slots in call order: receiver, declared parameters, then hidden slots
 * @param returnType the C return type
 */
public record AbiSignature(
	String symbol,
	List<AbiParam> params,
	AbiType returnType,
	ReturnConvention convention
) {
	public AbiSignature {
		requireNonNull(symbol);
		params = List.copyOf(params);
		requireNonNull(returnType);
		requireNonNull(convention);
	}

	/**
	 * @return the slots lowered from the declared parameter called {@code source}
	 */
	public List<AbiParam> slotsFor(String source) {
		return params.stream()
			.filter(p -> source.equals(p.source()))
			.toList();
	}

	public List<AbiParam> hiddenParams() {
		return params.stream()
			.filter(p -> p.role().isHidden())
			.toList();
	}

	@Override
	public String toString() {
		return symbol + params.stream().map(AbiParam::name).toList() + " -> " + convention;
	}
}
