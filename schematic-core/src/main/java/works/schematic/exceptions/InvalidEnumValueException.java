package works.schematic.exceptions;

import java.util.List;

public final class InvalidEnumValueException extends ConversionException {
	private final Object value;
	private final List<Object> validValues;

	public InvalidEnumValueException(String path, String fieldName, Object value, List<?> validValues) {
		super(path, "Invalid ENUM given in property " + fieldName + ": " + value + ", valid: " + joined(validValues));
		this.value = value;
		this.validValues = List.copyOf(validValues);
	}

	public Object value() {
		return value;
	}

	public List<Object> validValues() {
		return validValues;
	}

	private static String joined(List<?> values) {
		return String.join(",", values.stream().map(String::valueOf).toList());
	}
}
