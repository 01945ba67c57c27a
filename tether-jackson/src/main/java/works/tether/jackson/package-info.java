/**
 * JSON input and output for the generator: IR documents in, generation reports out.
 */
package works.tether.jackson;
