package works.schematic;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.compiler.CompiledPipeline;
import works.schematic.compiler.JitCompiler;
import works.schematic.exceptions.ValidationFailedException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.SchemaRegistry;
import works.schematic.schema.TypeTag;
import works.schematic.serializer.ConverterGenerator;
import works.schematic.serializer.Direction;
import works.schematic.serializer.JsonSerializer;
import works.schematic.serializer.PrecheckGenerator;
import works.schematic.serializer.Serializer;
import works.schematic.validation.FieldError;
import works.schematic.validation.ValidationCompiler;

import static java.util.Objects.requireNonNull;
import static works.schematic.serializer.Direction.DECODE;

/**
 * The entry point: owns a {@link SchemaRegistry}, a set of named {@link Serializer}s,
 * and the compilers that turn them into cached pipelines.
 * <p>
 * Every instance starts with the {@link JsonSerializer json} serializer.
 * Instances are independent of each other; {@link #global()} is a shared one
 * for code that doesn't want to pass one around.
 */
public class Schematic {
	private final SchemaRegistry schemas;
	private final Map<String, Serializer> serializers = new ConcurrentHashMap<>();
	private final ValidationCompiler validation;
	private final JitCompiler compiler;

	public Schematic() {
		this(new SchemaRegistry());
	}

	public Schematic(SchemaRegistry schemas) {
		this.schemas = requireNonNull(schemas);
		this.validation = new ValidationCompiler();
		this.compiler = new JitCompiler(validation);
		addSerializer(new JsonSerializer());
	}

	public static Schematic global() {
		return GLOBAL;
	}

	public SchemaRegistry schemas() {
		return schemas;
	}

	public ClassSchema getSchema(Class<?> entityClass) {
		return schemas.getSchema(entityClass);
	}

	/**
	 * @throws IllegalArgumentException if no serializer has that name
	 */
	public Serializer serializer(String name) {
		Serializer result = serializers.get(requireNonNull(name));
		if (result == null) {
			throw new IllegalArgumentException("No serializer named \"" + name + "\"; known: " + serializers.keySet());
		}
		return result;
	}

	public boolean hasSerializer(String name) {
		return serializers.containsKey(name);
	}

	/**
	 * Makes {@code serializer} available by its name, replacing any other of the same name.
	 */
	public Schematic addSerializer(Serializer serializer) {
		Serializer old = serializers.put(serializer.name(), serializer);
		if (old != null && old != serializer) {
			LOGGER.debug("Replaced serializer {}", serializer.name());
		}
		return this;
	}

	public JitCompiler compiler() {
		return compiler;
	}

	public ValidationCompiler validation() {
		return validation;
	}

	public CompiledPipeline pipeline(ClassSchema schema, String serializerName, Direction direction) {
		return compiler.compile(schema, serializer(serializerName), direction);
	}

	public Object convert(ClassSchema schema, String serializerName, Direction direction, Object data) {
		return convert(schema, serializerName, direction, data, ConverterOptions.DEFAULT);
	}

	/**
	 * Decodes a {@link Map} into a new entity, or encodes an entity into a new {@link Map}.
	 */
	public Object convert(ClassSchema schema, String serializerName, Direction direction, Object data, ConverterOptions options) {
		return pipeline(schema, serializerName, direction).run(data, options);
	}

	/**
	 * Converts only the entries of {@code data} named in {@code fieldNames}, map to map.
	 */
	public Map<String, Object> convertPartial(ClassSchema schema, String serializerName, Direction direction, Set<String> fieldNames, Map<String, ?> data) {
		return convertPartial(schema, serializerName, direction, fieldNames, data, ConverterOptions.DEFAULT);
	}

	public Map<String, Object> convertPartial(ClassSchema schema, String serializerName, Direction direction, Set<String> fieldNames, Map<String, ?> data, ConverterOptions options) {
		return compiler.compilePartial(schema, serializer(serializerName), direction, fieldNames)
			.convertValues(data, options);
	}

	/**
	 * Decodes the entries of {@code data} named in {@code fieldNames} onto {@code target},
	 * leaving its other fields alone.
	 */
	public <T> T patch(ClassSchema schema, String serializerName, Set<String> fieldNames, T target, Map<String, ?> data, ConverterOptions options) {
		return compiler.compilePartial(schema, serializer(serializerName), DECODE, fieldNames)
			.runInto(target, data, options);
	}

	/**
	 * Like {@link #patch(ClassSchema, String, Set, Object, Map, ConverterOptions)},
	 * for whichever fields of {@code schema} appear in {@code data}.
	 */
	public <T> T patch(ClassSchema schema, String serializerName, T target, Map<String, ?> data) {
		return compiler.compile(schema, serializer(serializerName), DECODE)
			.runInto(target, data, ConverterOptions.DEFAULT);
	}

	/**
	 * @return every problem found in {@code data}, which may be plain data or an entity
	 */
	public List<FieldError> validate(ClassSchema schema, Object data) {
		return validation.compileValidator(schema).validate(data);
	}

	public Object validateAndThrow(ClassSchema schema, Object data) {
		return validateAndThrow(schema, data, ConverterOptions.DEFAULT);
	}

	/**
	 * @return the entity decoded from {@code data} by the json serializer,
	 * or {@code data} itself if it's already an entity
	 * @throws ValidationFailedException if {@code data} isn't valid
	 */
	public Object validateAndThrow(ClassSchema schema, Object data, ConverterOptions options) {
		List<FieldError> errors = validate(schema, data);
		if (!errors.isEmpty()) {
			throw new ValidationFailedException(errors);
		}
		if (data instanceof Map<?, ?> && !schema.entityClass().isInstance(data)) {
			return convert(schema, JsonSerializer.NAME, DECODE, data, options);
		}
		return data;
	}

	/**
	 * Registers a primary generator, discarding compiled pipelines so that it takes effect.
	 */
	public void registerTypeConverter(String serializerName, Direction direction, TypeTag tag, ConverterGenerator generator) {
		serializer(serializerName).compilers(direction).register(tag, generator);
		resetCaches();
	}

	/**
	 * Adds a precheck, discarding compiled pipelines so that it takes effect.
	 */
	public void prependTypeConverter(String serializerName, Direction direction, TypeTag tag, PrecheckGenerator generator) {
		serializer(serializerName).compilers(direction).prepend(tag, generator);
		resetCaches();
	}

	public void resetCaches() {
		compiler.reset();
		validation.reset();
	}

	public <T> T plainToClass(Class<T> entityClass, Map<String, ?> data) {
		return plainToClass(entityClass, data, ConverterOptions.DEFAULT);
	}

	public <T> T plainToClass(Class<T> entityClass, Map<String, ?> data, ConverterOptions options) {
		return serializerFor(entityClass).deserialize(data, options);
	}

	public <T> Map<String, Object> classToPlain(Class<T> entityClass, T entity) {
		return serializerFor(entityClass).serialize(entity);
	}

	public <T> T validatedPlainToClass(Class<T> entityClass, Map<String, ?> data) {
		return entityClass.cast(validateAndThrow(getSchema(entityClass), data));
	}

	/**
	 * @return a copy of {@code entity}, made by encoding and then decoding it with the json serializer
	 */
	public <T> T cloneEntity(Class<T> entityClass, T entity) {
		ScopedSerializer<T> json = serializerFor(entityClass);
		return json.deserialize(json.serialize(entity));
	}

	public <T> ScopedSerializer<T> serializerFor(Class<T> entityClass) {
		return scoped(JsonSerializer.NAME, entityClass);
	}

	public <T> ScopedSerializer<T> scoped(String serializerName, Class<T> entityClass) {
		return new ScopedSerializer<>(this, serializer(serializerName), getSchema(entityClass), entityClass);
	}

	@Override
	public String toString() {
		return "Schematic(" + serializers.keySet() + ")";
	}

	private static final Schematic GLOBAL = new Schematic(SchemaRegistry.global());
	private static final Logger LOGGER = LoggerFactory.getLogger(Schematic.class);
}
