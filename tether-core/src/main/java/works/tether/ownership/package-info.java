/**
 * Ownership and lifetime semantics of values crossing the boundary.
 */
package works.tether.ownership;
