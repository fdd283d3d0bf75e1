package works.schematic.serializer;

import org.jetbrains.annotations.Nullable;
import works.schematic.compiler.ConversionContext;

/**
 * Runs ahead of a field's primary conversion step and may decide the field's outcome outright.
 */
@FunctionalInterface
public interface Precheck {
	/**
	 * @param input the source value; may be null or {@link works.schematic.compiler.Unset#UNSET UNSET}
	 */
	Outcome check(@Nullable Object input, ConversionContext ctx);

	sealed interface Outcome {
		Outcome PROCEED = new Proceed();

		static Outcome assign(@Nullable Object value) {
			return new Assign(value);
		}
	}

	/**
	 * Fall through to the next check, and finally to the primary conversion.
	 */
	record Proceed() implements Outcome { }

	/**
	 * Use this value as the field's result; {@link works.schematic.compiler.Unset#UNSET UNSET} leaves it unset.
	 */
	record Assign(@Nullable Object value) implements Outcome { }
}
