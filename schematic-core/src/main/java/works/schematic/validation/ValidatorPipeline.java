package works.schematic.validation;

import java.util.ArrayList;
import java.util.List;
import works.schematic.schema.ClassSchema;

/**
 * Checks values against one {@link ClassSchema}, collecting every error rather than stopping at the first.
 * <p>
 * Accepts either plain data (a {@link java.util.Map}) or an entity.
 */
public sealed interface ValidatorPipeline permits SchemaValidator, ForwardValidator {
	ClassSchema schema();

	/**
	 * @return the errors found, in field declaration order; empty if {@code value} is valid
	 */
	default List<FieldError> validate(Object value) {
		List<FieldError> errors = new ArrayList<>();
		validate(value, "", errors);
		return errors;
	}

	default boolean isValid(Object value) {
		return validate(value).isEmpty();
	}

	/**
	 * @param path prefix for the paths of any errors found
	 */
	void validate(Object value, String path, List<FieldError> errors);
}
