package works.schematic.compiler;

import java.util.Map;
import works.schematic.schema.ClassSchema;

/**
 * Converts whole values of one {@link ClassSchema} in one direction.
 * <p>
 * This is the internal, context-passing form used by converters nested in other pipelines.
 * Callers outside the compiler use {@link CompiledPipeline}.
 */
public sealed interface Pipeline permits CompiledPipeline, ForwardPipeline {
	ClassSchema schema();

	/**
	 * Decodes a map into a new entity, or encodes an entity into a new map.
	 */
	Object execute(Object input, ConversionContext ctx);

	/**
	 * Decodes the fields present in {@code input} onto an existing entity,
	 * leaving all others untouched.
	 */
	Object executeInto(Object target, Map<String, ?> input, ConversionContext ctx);

	/**
	 * Converts a map of some of this schema's field values, key by key.
	 * Keys that aren't fields of this pipeline are dropped.
	 */
	Map<String, Object> convertValues(Map<String, ?> values, ConversionContext ctx);
}
