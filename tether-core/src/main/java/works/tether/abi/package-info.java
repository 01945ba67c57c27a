/**
 * The native side of the boundary: how IR types lower to C slots,
 * what each exported symbol is called, and what its prototype looks like.
 */
package works.tether.abi;
