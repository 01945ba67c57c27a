package works.tether.abi;

/**
 * Why a slot exists in a native signature.
 * A declared parameter can expand to several slots, and some slots have no declared counterpart.
 */
public enum ParamRole {
	SELF,
	VALUE,
	SLICE_DATA,
	SLICE_LENGTH,
	PRESENCE,
	/**
	 * A {@link works.tether.ir.WriteableRef Writeable} declared as a parameter.
	 */
	WRITEABLE,
	/**
	 * The sink receiving a {@link works.tether.ir.WriteableRef Writeable} return value.
	 */
	RETURN_SINK,
	OUT_VALUE,
	OUT_OK,
	OUT_ERR;

	/**
	 * @return true for slots the caller doesn't see as parameters
	 */
	public boolean isHidden() {
		return switch (this) {
			case RETURN_SINK, OUT_VALUE, OUT_OK, OUT_ERR -> true;
			default -> false;
		};
	}
}
