package works.tether.filter;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of filtering one type or method.
 *
 * @param reason why the item is disabled; empty when enabled
 */
public record Enablement(boolean enabled, String reason) {
	public Enablement {
		requireNonNull(reason);
	}

	public static final Enablement ENABLED = new Enablement(true, "");

	public static Enablement disabled(String reason) {
		return new Enablement(false, reason);
	}
}
