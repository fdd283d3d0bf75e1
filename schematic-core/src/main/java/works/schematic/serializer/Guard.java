package works.schematic.serializer;

import works.schematic.compiler.ConversionContext;

/**
 * Classifies a raw value as belonging to one union candidate.
 */
@FunctionalInterface
public interface Guard {
	boolean test(Object value, ConversionContext ctx);
}
