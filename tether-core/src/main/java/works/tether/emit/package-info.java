/**
 * Assembles analyzed types into artifacts.
 * <p>
 * {@link works.tether.emit.OutputEmitter} drives a run;
 * {@link works.tether.emit.Backend} is the extension point for host languages.
 */
package works.tether.emit;
