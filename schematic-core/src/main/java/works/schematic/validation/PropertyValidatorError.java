package works.schematic.validation;

import static java.util.Objects.requireNonNull;

public record PropertyValidatorError(String code, String message) {
	public PropertyValidatorError {
		requireNonNull(code);
		requireNonNull(message);
	}
}
