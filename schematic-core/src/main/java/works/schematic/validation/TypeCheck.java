package works.schematic.validation;

import java.util.List;

/**
 * Checks that a non-null value has the shape a field's type tag calls for.
 */
@FunctionalInterface
public interface TypeCheck {
	/**
	 * Appends an error to {@code errors} for each problem found.
	 *
	 * @param path dotted path of {@code value}, used for the errors
	 */
	void check(Object value, String path, List<FieldError> errors);

	TypeCheck ANYTHING = (value, path, errors) -> { };
}
