package works.schematic.exceptions;

public sealed abstract class SchematicException extends RuntimeException permits
	SchemaDefinitionException,
	ConversionException,
	ValidationFailedException
{
	protected SchematicException(String message) {
		super(message);
	}

	protected SchematicException(Throwable cause) {
		super(cause);
	}

	protected SchematicException(String message, Throwable cause) {
		super(message, cause);
	}
}
