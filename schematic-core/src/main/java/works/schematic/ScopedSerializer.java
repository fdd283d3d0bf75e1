package works.schematic;

import java.util.Map;
import works.schematic.compiler.CompiledPipeline;
import works.schematic.compiler.JitCompiler;
import works.schematic.schema.ClassSchema;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Serializer;

import static works.schematic.serializer.Direction.DECODE;
import static works.schematic.serializer.Direction.ENCODE;

/**
 * One serializer applied to one entity class.
 * <p>
 * Pipelines are looked up on every call, so a {@link Schematic#resetCaches() reset}
 * is picked up by existing instances.
 */
public final class ScopedSerializer<T> {
	private final Schematic schematic;
	private final Serializer serializer;
	private final ClassSchema schema;
	private final Class<T> entityClass;

	ScopedSerializer(Schematic schematic, Serializer serializer, ClassSchema schema, Class<T> entityClass) {
		this.schematic = schematic;
		this.serializer = serializer;
		this.schema = schema;
		this.entityClass = entityClass;
	}

	public ClassSchema schema() {
		return schema;
	}

	public Serializer serializer() {
		return serializer;
	}

	public T deserialize(Map<String, ?> data) {
		return deserialize(data, ConverterOptions.DEFAULT);
	}

	public T deserialize(Map<String, ?> data, ConverterOptions options) {
		return entityClass.cast(compiler().compile(schema, serializer, DECODE).run(data, options));
	}

	public Map<String, Object> serialize(T entity) {
		return serialize(entity, ConverterOptions.DEFAULT);
	}

	@SuppressWarnings("unchecked")
	public Map<String, Object> serialize(T entity, ConverterOptions options) {
		return (Map<String, Object>) compiler().compile(schema, serializer, ENCODE).run(entity, options);
	}

	/**
	 * Decodes whichever field values appear in {@code data}, map to map.
	 * Keys that aren't fields of the schema are dropped.
	 */
	public Map<String, Object> partialDeserialize(Map<String, ?> data) {
		return pipeline(DECODE).convertValues(data, ConverterOptions.DEFAULT);
	}

	public Map<String, Object> partialSerialize(Map<String, ?> data) {
		return pipeline(ENCODE).convertValues(data, ConverterOptions.DEFAULT);
	}

	/**
	 * Decodes the fields present in {@code data} onto {@code target}.
	 */
	public T patch(T target, Map<String, ?> data) {
		return patch(target, data, ConverterOptions.DEFAULT);
	}

	public T patch(T target, Map<String, ?> data, ConverterOptions options) {
		return pipeline(DECODE).runInto(target, data, options);
	}

	/**
	 * Map-to-map conversion and patching only touch the fields present in their input,
	 * so one full pipeline per direction serves every combination of present keys.
	 */
	private CompiledPipeline pipeline(Direction direction) {
		return compiler().compile(schema, serializer, direction);
	}

	private JitCompiler compiler() {
		return schematic.compiler();
	}

	@Override
	public String toString() {
		return "ScopedSerializer(" + serializer.name() + ", " + schema.name() + ")";
	}
}
