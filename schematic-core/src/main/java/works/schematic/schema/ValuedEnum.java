package works.schematic.schema;

/**
 * Implemented by enums whose external representation is something
 * other than their constant name.
 * <p>
 * For such enums, {@link #value()} is what appears in neutral data,
 * and {@link Enum#name()} is the enum's <em>label</em>,
 * which a field may opt to accept in place of the value.
 */
public interface ValuedEnum {
	Object value();
}
