package works.schematic.exceptions;

/**
 * A value could not be converted while running a compiled pipeline.
 * <p>
 * This class is concrete so it can be thrown for conversion failures
 * that have no more specific subclass, such as an unparseable date.
 */
public sealed class ConversionException extends SchematicException permits
	InvalidEnumValueException,
	NoMatchingUnionVariantException
{
	private final String path;

	public ConversionException(String path, String message) {
		super(fullMessage(path, message));
		this.path = path;
	}

	public ConversionException(String path, String message, Throwable cause) {
		super(fullMessage(path, message), cause);
		this.path = path;
	}

	/**
	 * @return dotted path of the field being converted, from the root of the conversion
	 */
	public String path() {
		return path;
	}

	private static String fullMessage(String path, String message) {
		if (path.isEmpty()) {
			return message;
		} else {
			return message + " (at " + path + ")";
		}
	}
}
