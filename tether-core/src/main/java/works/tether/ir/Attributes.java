package works.tether.ir;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The already-resolved attribute state of a type or method.
 * <p>
 * This is not attribute syntax: whatever produced the IR has already parsed it.
 * What remains is a small set of conditions that the
 * {@link works.tether.filter.AttributeFilter AttributeFilter} evaluates
 * against a backend and a feature set.
 * No validation happens here, because contradictory state is reported
 * by the filter as a diagnostic rather than refused at construction.
 *
 * @param disabledBackends backends for which the item is disabled
 * @param onlyBackends if non-empty, the item is enabled only for these backends
 * @param requiredFeatures features that must all be active
 * @param excludedFeatures features that must all be inactive
 * @param rename host-side name to use instead of the IR name
 */
public record Attributes(
	Set<String> disabledBackends,
	Set<String> onlyBackends,
	Set<String> requiredFeatures,
	Set<String> excludedFeatures,
	@Nullable String rename
) {
	public Attributes {
		disabledBackends = Set.copyOf(disabledBackends);
		onlyBackends = Set.copyOf(onlyBackends);
		requiredFeatures = Set.copyOf(requiredFeatures);
		excludedFeatures = Set.copyOf(excludedFeatures);
	}

	public static final Attributes NONE = new Attributes(Set.of(), Set.of(), Set.of(), Set.of(), null);

	public static Attributes disabledFor(String... backends) {
		return NONE.withDisabledBackends(Set.of(backends));
	}

	public static Attributes requiring(String... features) {
		return new Attributes(Set.of(), Set.of(), Set.of(features), Set.of(), null);
	}

	public static Attributes renamed(String rename) {
		return new Attributes(Set.of(), Set.of(), Set.of(), Set.of(), requireNonNull(rename));
	}

	public Attributes withDisabledBackends(Set<String> disabledBackends) {
		return new Attributes(disabledBackends, onlyBackends, requiredFeatures, excludedFeatures, rename);
	}

	public Attributes withOnlyBackends(Set<String> onlyBackends) {
		return new Attributes(disabledBackends, onlyBackends, requiredFeatures, excludedFeatures, rename);
	}

	public Attributes withExcludedFeatures(Set<String> excludedFeatures) {
		return new Attributes(disabledBackends, onlyBackends, requiredFeatures, excludedFeatures, rename);
	}

	public Attributes withRename(@Nullable String rename) {
		return new Attributes(disabledBackends, onlyBackends, requiredFeatures, excludedFeatures, rename);
	}
}
