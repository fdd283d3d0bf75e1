package works.schematic.validation;

import org.jetbrains.annotations.Nullable;
import works.schematic.schema.FieldSchema;

/**
 * A custom validation rule attached to a field.
 * Runs only when the field has a non-null value that passed its type check.
 */
@FunctionalInterface
public interface PropertyValidator {
	/**
	 * @return null if {@code value} is acceptable
	 */
	@Nullable PropertyValidatorError validate(Object value, FieldSchema field);
}
