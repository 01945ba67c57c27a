package works.tether.mapping;

import works.tether.config.GeneratorConfig;
import works.tether.ir.TypeRegistry;

/**
 * What a {@link TypeMapper} may consult besides the type itself.
 */
public record MappingContext(TypeRegistry registry, HostNames hostNames, GeneratorConfig config) { }
