package works.schematic.exceptions;

import java.util.List;
import works.schematic.validation.FieldError;

import static java.util.stream.Collectors.joining;

/**
 * Aggregate of every {@link FieldError} found by a validation pass.
 * Raised only by the throwing validation entry points.
 */
public final class ValidationFailedException extends SchematicException {
	private final List<FieldError> errors;

	public ValidationFailedException(List<FieldError> errors) {
		super("Validation failed: " + errors.stream()
			.map(FieldError::toString)
			.collect(joining(", ")));
		assert !errors.isEmpty();
		this.errors = List.copyOf(errors);
	}

	public List<FieldError> errors() {
		return errors;
	}
}
