package works.schematic.serializer;

import works.schematic.compiler.CompilerState;
import works.schematic.compiler.ValueConverter;
import works.schematic.schema.FieldSchema;

/**
 * Produces the primary conversion step for fields of one type tag.
 * Called once per field at compile time; the result runs once per value.
 */
@FunctionalInterface
public interface ConverterGenerator {
	ValueConverter generate(FieldSchema field, CompilerState state);
}
