package works.schematic.schema;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.annotations.AutoIncrement;
import works.schematic.annotations.Entity;
import works.schematic.annotations.Field;
import works.schematic.annotations.ParentReference;
import works.schematic.annotations.Primary;
import works.schematic.annotations.Reference;
import works.schematic.annotations.Union;
import works.schematic.annotations.Validate;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.validation.Validators;

import static java.lang.invoke.MethodType.methodType;

/**
 * Reflectively reads an entity class's instance fields and annotations
 * to build its {@link ClassSchema}.
 * <p>
 * Fields are taken superclass first, in declaration order; static, transient
 * and synthetic fields are ignored.
 * A field whose initializer leaves a non-null value on a freshly constructed
 * instance has that value as its default. A primitive field still holding its
 * zero value has no default; use the boxed type to default to zero.
 * <p>
 * Referenced entity classes are not scanned here; fields referring to them hold a
 * {@link SchemaReference} that consults the owning {@link SchemaRegistry} on first use.
 */
class SchemaScanner {
	private final SchemaRegistry registry;

	SchemaScanner(SchemaRegistry registry) {
		this.registry = registry;
	}

	ClassSchema scan(Class<?> entityClass) {
		if (entityClass.isInterface() || entityClass.isPrimitive() || entityClass.isArray() || entityClass.isEnum()) {
			throw new SchemaDefinitionException("Not an entity class: " + entityClass.getName());
		}
		LOGGER.debug("Scanning {}", entityClass.getName());
		MethodHandle constructor = constructorFor(entityClass, EntityLookups.lookupFor(entityClass));
		Object prototype = instantiate(constructor, entityClass);

		Entity entity = entityClass.getAnnotation(Entity.class);
		String name = (entity == null) ? entityClass.getSimpleName() : entity.value();
		ClassSchema.Builder builder = ClassSchema.builder(name, entityClass);
		for (java.lang.reflect.Field field : instanceFields(entityClass)) {
			builder.field(scanField(name, entityClass, field, constructor, prototype));
		}
		return builder.build();
	}

	private FieldSchema scanField(String schemaName, Class<?> entityClass, java.lang.reflect.Field field, MethodHandle constructor, Object prototype) {
		Field options = field.getAnnotation(Field.class);
		String fieldName = (options == null || options.name().isEmpty()) ? field.getName() : options.name();
		FieldSchema.Builder builder;
		try {
			builder = typeOf(fieldName, field, options);
		} catch (SchemaDefinitionException e) {
			throw SchemaDefinitionException.forField(schemaName, fieldName, e.getMessage());
		}

		builder.member(field.getName());
		if (options != null) {
			builder
				.optional(options.optional())
				.nullable(options.nullable())
				.groups(options.groups());
			if (options.allowLabelsAsValue()) {
				builder.allowLabelsAsValue();
			}
		}
		if (field.isAnnotationPresent(Primary.class)) {
			builder.primary();
		}
		if (field.isAnnotationPresent(AutoIncrement.class)) {
			builder.autoIncrement();
		}
		if (field.isAnnotationPresent(Reference.class)) {
			builder.reference();
		}
		if (field.isAnnotationPresent(ParentReference.class)) {
			builder.parentReference();
		}
		Validate validate = field.getAnnotation(Validate.class);
		if (validate != null) {
			addValidators(builder, validate);
		}

		MethodHandle getter = getterFor(field, EntityLookups.lookupFor(field.getDeclaringClass()));
		Object initial = read(getter, prototype, fieldName);
		if (initial != null && !(field.getType().isPrimitive() && isZero(initial))) {
			if (isImmutable(initial)) {
				builder.initializerDefault(() -> initial);
			} else {
				builder.initializerDefault(() -> read(getter, instantiate(constructor, entityClass), fieldName));
			}
		}
		try {
			return builder.build();
		} catch (SchemaDefinitionException e) {
			throw SchemaDefinitionException.forField(schemaName, fieldName, e.getMessage());
		}
	}

	private FieldSchema.Builder typeOf(String fieldName, java.lang.reflect.Field field, Field options) {
		Class<?> rawType = field.getType();
		Union union = field.getAnnotation(Union.class);
		if (union != null) {
			return FieldSchema.builder(fieldName, TypeTag.UNION)
				.javaType(rawType)
				.candidates(unionCandidates(fieldName, union));
		}
		if (options != null && !options.literal().isEmpty()) {
			return FieldSchema.builder(fieldName, TypeTag.LITERAL)
				.javaType(rawType)
				.literal(options.literal());
		}
		if (options != null && options.partialOf() != Void.class) {
			if (!Map.class.isAssignableFrom(rawType)) {
				throw new SchemaDefinitionException("partial values must be held in a Map");
			}
			Class<?> partialOf = options.partialOf();
			return FieldSchema.builder(fieldName, TypeTag.PARTIAL)
				.javaType(rawType)
				.schema(SchemaReference.lazy(() -> registry.getSchema(partialOf)));
		}
		if (options != null && !options.type().isEmpty()) {
			TypeTag tag = TypeTag.of(options.type());
			if (!tag.isBinary() && !TypeTag.ARRAY_BUFFER.equals(tag) && !TypeTag.ANY.equals(tag)) {
				throw new SchemaDefinitionException("type override must be a binary tag or any; got " + tag);
			}
			return FieldSchema.builder(fieldName, tag).javaType(rawType);
		}
		return typeOf(fieldName, field.getGenericType());
	}

	@SuppressWarnings("unchecked")
	private FieldSchema.Builder typeOf(String fieldName, Type type) {
		Class<?> rawType = rawClass(type);
		if (rawType == String.class || rawType == char.class || rawType == Character.class) {
			return FieldSchema.builder(fieldName, TypeTag.STRING).javaType(rawType);
		} else if (isNumber(rawType)) {
			return FieldSchema.builder(fieldName, TypeTag.NUMBER).javaType(rawType);
		} else if (rawType == boolean.class || rawType == Boolean.class) {
			return FieldSchema.builder(fieldName, TypeTag.BOOLEAN).javaType(rawType);
		} else if (rawType == Instant.class) {
			return FieldSchema.builder(fieldName, TypeTag.DATE);
		} else if (rawType == UUID.class) {
			return FieldSchema.builder(fieldName, TypeTag.UUID);
		} else if (rawType.isEnum()) {
			return FieldSchema.builder(fieldName, TypeTag.ENUM).enumType((Class<? extends Enum<?>>) rawType);
		} else if (BINARY_TYPES.containsKey(rawType)) {
			return FieldSchema.builder(fieldName, BINARY_TYPES.get(rawType)).javaType(rawType);
		} else if (rawType == List.class || rawType == Collection.class || rawType == Set.class) {
			FieldSchema element = typeOf(fieldName, typeArgument(type, 0)).build();
			return FieldSchema.builder(fieldName, TypeTag.ARRAY).javaType(rawType).element(element);
		} else if (rawType == Map.class) {
			if (rawClass(typeArgument(type, 0)) != String.class) {
				throw new SchemaDefinitionException("map keys must be strings");
			}
			FieldSchema element = typeOf(fieldName, typeArgument(type, 1)).build();
			return FieldSchema.builder(fieldName, TypeTag.MAP).javaType(rawType).element(element);
		} else if (rawType == Object.class) {
			return FieldSchema.builder(fieldName, TypeTag.ANY);
		} else if (rawType.isArray() || rawType.isInterface() || rawType.isPrimitive()
			|| Collection.class.isAssignableFrom(rawType) || Map.class.isAssignableFrom(rawType)) {
			throw new SchemaDefinitionException("unsupported type " + type.getTypeName());
		} else {
			return FieldSchema.builder(fieldName, TypeTag.CLASS)
				.javaType(rawType)
				.schema(SchemaReference.lazy(() -> registry.getSchema(rawType)));
		}
	}

	private List<FieldSchema> unionCandidates(String fieldName, Union union) {
		List<FieldSchema> result = new ArrayList<>();
		for (String literal : union.literals()) {
			result.add(FieldSchema.literal(fieldName, literal));
		}
		for (Class<?> type : union.types()) {
			result.add(typeOf(fieldName, type).build());
		}
		for (String tag : union.tags()) {
			result.add(FieldSchema.of(fieldName, TypeTag.of(tag)));
		}
		if (result.isEmpty()) {
			throw new SchemaDefinitionException("union has no candidates");
		}
		return result;
	}

	private static void addValidators(FieldSchema.Builder builder, Validate validate) {
		if (validate.minLength() >= 0) {
			builder.validator(Validators.minLength(validate.minLength()));
		}
		if (validate.maxLength() >= 0) {
			builder.validator(Validators.maxLength(validate.maxLength()));
		}
		if (!validate.pattern().isEmpty()) {
			builder.validator(Validators.pattern(validate.pattern()));
		}
		if (!Double.isNaN(validate.minimum())) {
			builder.validator(Validators.minimum(validate.minimum()));
		}
		if (!Double.isNaN(validate.maximum())) {
			builder.validator(Validators.maximum(validate.maximum()));
		}
	}

	private static List<java.lang.reflect.Field> instanceFields(Class<?> entityClass) {
		List<java.lang.reflect.Field> result = new ArrayList<>();
		Class<?> superclass = entityClass.getSuperclass();
		if (superclass != null && superclass != Object.class) {
			result.addAll(instanceFields(superclass));
		}
		for (java.lang.reflect.Field f : entityClass.getDeclaredFields()) {
			int modifiers = f.getModifiers();
			if (!Modifier.isStatic(modifiers) && !Modifier.isTransient(modifiers) && !f.isSynthetic()) {
				result.add(f);
			}
		}
		return result;
	}

	private static MethodHandle constructorFor(Class<?> entityClass, Lookup lookup) {
		try {
			return lookup.findConstructor(entityClass, methodType(void.class)).asType(methodType(Object.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new SchemaDefinitionException("Entity class " + entityClass.getName() + " needs a no-argument constructor", e);
		}
	}

	private static MethodHandle getterFor(java.lang.reflect.Field field, Lookup lookup) {
		try {
			return lookup.unreflectGetter(field).asType(methodType(Object.class, Object.class));
		} catch (IllegalAccessException e) {
			throw new SchemaDefinitionException("Unable to read field " + field, e);
		}
	}

	private static Object instantiate(MethodHandle constructor, Class<?> entityClass) {
		try {
			return (Object) constructor.invokeExact();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new SchemaDefinitionException("Unable to construct " + entityClass.getName(), e);
		}
	}

	private static Object read(MethodHandle getter, Object instance, String fieldName) {
		try {
			return (Object) getter.invokeExact(instance);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to read field " + fieldName, e);
		}
	}

	private static Type typeArgument(Type type, int index) {
		if (type instanceof ParameterizedType p) {
			Type arg = p.getActualTypeArguments()[index];
			if (arg instanceof WildcardType w) {
				return w.getUpperBounds()[0];
			}
			return arg;
		}
		throw new SchemaDefinitionException("raw type " + type.getTypeName() + " needs type arguments");
	}

	private static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return (Class<?>) p.getRawType();
		} else if (type instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else {
			throw new SchemaDefinitionException("unsupported type " + type.getTypeName());
		}
	}

	private static boolean isNumber(Class<?> type) {
		return (type.isPrimitive() && type != boolean.class && type != char.class && type != void.class)
			|| Number.class.isAssignableFrom(type);
	}

	private static boolean isZero(Object primitive) {
		if (primitive instanceof Boolean b) {
			return !b;
		} else if (primitive instanceof Character c) {
			return c == '\0';
		} else {
			return ((Number) primitive).doubleValue() == 0;
		}
	}

	private static boolean isImmutable(Object value) {
		return value instanceof String
			|| value instanceof Number
			|| value instanceof Boolean
			|| value instanceof Character
			|| value instanceof Enum<?>
			|| value instanceof Instant
			|| value instanceof UUID;
	}

	private static final Map<Class<?>, TypeTag> BINARY_TYPES = Map.of(
		byte[].class, TypeTag.UINT8_ARRAY,
		short[].class, TypeTag.INT16_ARRAY,
		int[].class, TypeTag.INT32_ARRAY,
		float[].class, TypeTag.FLOAT32_ARRAY,
		double[].class, TypeTag.FLOAT64_ARRAY,
		ByteBuffer.class, TypeTag.ARRAY_BUFFER
	);

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaScanner.class);
}
