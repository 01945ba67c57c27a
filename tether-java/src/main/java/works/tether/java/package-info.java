/**
 * The Java host backend.
 * <p>
 * Generated code depends on JNA and on {@code tether-runtime},
 * and loads the native library once per generated type that has entry points.
 * Every generated type lives in one package, so they can use each other's
 * package-private constructors and conversion methods.
 */
package works.tether.java;
