/**
 * Host-side type representation, supplied per backend.
 */
package works.tether.mapping;
