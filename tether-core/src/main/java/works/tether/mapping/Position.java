package works.tether.mapping;

/**
 * Where a type appears. Some types map differently depending on direction:
 * a writeable parameter is a sink the caller supplies, while a writeable return is the text it collects.
 */
public enum Position {
	PARAM,
	RETURN,
	FIELD,
}
