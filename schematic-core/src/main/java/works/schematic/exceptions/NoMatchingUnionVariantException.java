package works.schematic.exceptions;

import java.util.List;

/**
 * No union candidate's guard accepted the input,
 * and the field has no optional, nullable, or default fallback.
 */
public final class NoMatchingUnionVariantException extends ConversionException {
	private final String fieldName;
	private final List<String> discriminants;

	public NoMatchingUnionVariantException(String path, String fieldName, List<String> discriminants) {
		super(path, "No valid discriminant was found for " + fieldName
			+ ", so could not determine class type. Guard tried: [" + String.join(",", discriminants) + "]");
		this.fieldName = fieldName;
		this.discriminants = List.copyOf(discriminants);
	}

	public String fieldName() {
		return fieldName;
	}

	public List<String> discriminants() {
		return discriminants;
	}
}
