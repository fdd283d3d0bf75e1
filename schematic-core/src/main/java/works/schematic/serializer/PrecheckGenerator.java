package works.schematic.serializer;

import org.jetbrains.annotations.Nullable;
import works.schematic.compiler.CompilerState;
import works.schematic.schema.FieldSchema;

/**
 * Produces a {@link Precheck} to run ahead of a field's primary conversion step.
 */
@FunctionalInterface
public interface PrecheckGenerator {
	/**
	 * @return null if this generator has nothing to check for {@code field}
	 */
	@Nullable Precheck generate(FieldSchema field, CompilerState state);
}
