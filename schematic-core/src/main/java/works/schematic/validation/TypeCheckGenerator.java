package works.schematic.validation;

import works.schematic.schema.FieldSchema;

@FunctionalInterface
public interface TypeCheckGenerator {
	TypeCheck generate(FieldSchema field, ValidationCompiler compiler);
}
