package works.tether.emit;

import works.tether.abi.CTypes;
import works.tether.abi.DataLayout;
import works.tether.config.GeneratorConfig;
import works.tether.filter.EnabledSurface;
import works.tether.mapping.HostNames;
import works.tether.mapping.MappingContext;

/**
 * The run-wide, read-only state shared by every unit.
 */
public record EmissionContext(
	GeneratorConfig config,
	EnabledSurface surface,
	HostNames hostNames,
	DataLayout layout,
	CTypes cTypes
) {
	public MappingContext mappingContext() {
		return new MappingContext(surface.registry(), hostNames, config);
	}
}
