package works.tether.ownership;

import works.tether.ir.TypeId;

/**
 * The single destructor entry point of an opaque type.
 */
public record DestructorPlan(TypeId type, String symbol) { }
