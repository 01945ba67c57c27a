package works.tether.ir;

import java.util.List;

/**
 * A caller-owned, growable output buffer into which native code appends.
 */
public record WriteableRef() implements TypeRef {
	public static final WriteableRef WRITEABLE = new WriteableRef();

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitWriteable(this);
	}

	@Override
	public List<TypeId> referencedTypes() {
		return List.of();
	}

	@Override
	public String toString() {
		return "Writeable";
	}
}
