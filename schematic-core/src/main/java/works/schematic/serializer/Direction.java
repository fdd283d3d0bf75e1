package works.schematic.serializer;

public enum Direction {
	/**
	 * External data to entity.
	 */
	DECODE,

	/**
	 * Entity to external data.
	 */
	ENCODE,
}
