package works.schematic.compiler;

/**
 * Marks a value that is absent, as distinct from null.
 * <p>
 * On input, stands for a key missing from the source map.
 * As a converter result, means the target field is to be left as it is.
 */
public enum Unset {
	UNSET;

	public static boolean isUnset(Object value) {
		return value == UNSET;
	}
}
