package works.tether.config;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSortedSet;

/**
 * The features active for one run. Sorted so its printed form is stable.
 */
public record FeatureSet(SortedSet<String> features) {
	public FeatureSet {
		features = unmodifiableSortedSet(new TreeSet<>(features));
		if (features.stream().anyMatch(String::isBlank)) {
			throw new IllegalArgumentException("Feature names can't be blank: " + features);
		}
	}

	public static final FeatureSet NONE = new FeatureSet(new TreeSet<>());

	public static FeatureSet of(String... features) {
		return new FeatureSet(new TreeSet<>(Set.of(features)));
	}

	public boolean isActive(String feature) {
		return features.contains(feature);
	}

	@Override
	public String toString() {
		return features.toString();
	}
}
