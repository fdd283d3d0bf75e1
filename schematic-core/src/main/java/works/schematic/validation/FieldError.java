package works.schematic.validation;

import static java.util.Objects.requireNonNull;

/**
 * One problem found by validation.
 *
 * @param path dotted path from the validated value to the offending field
 * @param code symbolic kind of error, such as {@code required} or {@code invalid_number}
 * @param message human-readable description
 */
public record FieldError(String path, String code, String message) {
	public FieldError {
		requireNonNull(path);
		requireNonNull(code);
		requireNonNull(message);
	}

	@Override
	public String toString() {
		return path + "(" + code + "): " + message;
	}
}
