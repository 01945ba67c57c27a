package works.tether.ownership;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The ownership semantics of one call.
 *
 * @param self null for static methods
 * @param params keyed by declared parameter name, in declaration order
 * @param returns the ownership of the returned value, or of the success payload of a fallible call
 * @param error the ownership of a fallible call's error payload; {@link ReturnOwnership#NONE} otherwise
 * @param lifetimeEdges names of the arguments a {@link ReturnOwnership#BORROWED BORROWED}
 *                      result borrows from; the host keeps them reachable while the result is
 */
public record CallOwnership(
	@Nullable Transfer self,
	Map<String, Transfer> params,
	ReturnOwnership returns,
	ReturnOwnership error,
	List<String> lifetimeEdges
) {
	public CallOwnership {
		params = unmodifiableMap(new LinkedHashMap<>(params));
		requireNonNull(returns);
		requireNonNull(error);
		lifetimeEdges = List.copyOf(lifetimeEdges);
	}

	public Transfer transferOf(String param) {
		Transfer result = params.get(param);
		if (result == null) {
			throw new IllegalArgumentException("No such parameter: " + param);
		}
		return result;
	}

	public boolean consumesSelf() {
		return self == Transfer.MOVE;
	}

	public boolean returnsBorrowed() {
		return returns == ReturnOwnership.BORROWED || error == ReturnOwnership.BORROWED;
	}
}
