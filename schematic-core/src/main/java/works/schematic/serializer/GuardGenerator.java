package works.schematic.serializer;

import org.jetbrains.annotations.Nullable;
import works.schematic.compiler.CompilerState;
import works.schematic.schema.FieldSchema;

@FunctionalInterface
public interface GuardGenerator {
	/**
	 * @param candidate one of a union field's candidates
	 * @return null if this generator can't classify values for {@code candidate}
	 */
	@Nullable Guard generate(FieldSchema candidate, CompilerState state);
}
