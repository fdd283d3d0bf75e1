package works.schematic.exceptions;

/**
 * The field descriptors of a schema are inconsistent,
 * or the entity class cannot support them.
 * <p>
 * Thrown while a schema is being built or first compiled; never recovered.
 */
public final class SchemaDefinitionException extends SchematicException {
	public SchemaDefinitionException(String message) {
		super(message);
	}

	public SchemaDefinitionException(String message, Throwable cause) {
		super(message, cause);
	}

	public static SchemaDefinitionException forField(String schemaName, String fieldName, String message) {
		return new SchemaDefinitionException("Invalid field " + schemaName + "." + fieldName + ": " + message);
	}
}
