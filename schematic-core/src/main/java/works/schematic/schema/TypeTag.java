package works.schematic.schema;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Names the kind of value a {@link FieldSchema} holds.
 * The tag alone determines which converter, guard, and type-check
 * registry entries apply to a field.
 * <p>
 * The set of tags is open: the constants here are the ones
 * the built-in serializers understand, and new tags can be created
 * with {@link #of} and registered alongside them.
 */
public record TypeTag(String name) {
	public TypeTag {
		requireNonNull(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Type tag name can't be empty");
		}
	}

	public static final TypeTag STRING = new TypeTag("string");
	public static final TypeTag NUMBER = new TypeTag("number");
	public static final TypeTag BOOLEAN = new TypeTag("boolean");
	public static final TypeTag DATE = new TypeTag("date");
	public static final TypeTag UUID = new TypeTag("uuid");
	public static final TypeTag ENUM = new TypeTag("enum");
	public static final TypeTag LITERAL = new TypeTag("literal");
	public static final TypeTag CLASS = new TypeTag("class");
	public static final TypeTag UNION = new TypeTag("union");
	public static final TypeTag ARRAY = new TypeTag("array");
	public static final TypeTag MAP = new TypeTag("map");
	public static final TypeTag PARTIAL = new TypeTag("partial");
	public static final TypeTag ANY = new TypeTag("any");
	public static final TypeTag ARRAY_BUFFER = new TypeTag("arrayBuffer");

	public static final TypeTag UINT8_ARRAY = new TypeTag("uint8array");
	public static final TypeTag INT8_ARRAY = new TypeTag("int8array");
	public static final TypeTag INT16_ARRAY = new TypeTag("int16array");
	public static final TypeTag INT32_ARRAY = new TypeTag("int32array");
	public static final TypeTag FLOAT32_ARRAY = new TypeTag("float32array");
	public static final TypeTag FLOAT64_ARRAY = new TypeTag("float64array");

	private static final Set<TypeTag> BINARY = Set.of(
		UINT8_ARRAY, INT8_ARRAY, INT16_ARRAY, INT32_ARRAY, FLOAT32_ARRAY, FLOAT64_ARRAY);

	public static TypeTag of(String name) {
		return new TypeTag(name);
	}

	/**
	 * @return true for the typed-array tags handled by the registries' binary slot
	 */
	public boolean isBinary() {
		return BINARY.contains(this);
	}

	@Override
	public String toString() {
		return name;
	}
}
