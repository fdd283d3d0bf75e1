package works.schematic.serializer;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.compiler.CompilerState;
import works.schematic.compiler.ConversionContext;
import works.schematic.compiler.EntityAccessor;
import works.schematic.compiler.Numbers;
import works.schematic.compiler.Pipeline;
import works.schematic.compiler.ValueConverter;
import works.schematic.exceptions.ConversionException;
import works.schematic.exceptions.InvalidEnumValueException;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.EnumValues;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.TypeTag;
import works.schematic.validation.ValidatorPipeline;

import static works.schematic.compiler.Unset.UNSET;
import static works.schematic.serializer.Direction.DECODE;
import static works.schematic.serializer.Direction.ENCODE;

/**
 * The default serializer, converting between entities and JSON-compatible data:
 * maps, lists, strings, numbers, booleans and nulls.
 * <p>
 * Decoding is lenient in the ways loosely typed input calls for:
 * numbers and booleans are accepted as strings, dates as epoch milliseconds,
 * and nested entities as strings of JSON text.
 */
public class JsonSerializer extends Serializer {
	public static final String NAME = "json";

	public JsonSerializer() {
		super(NAME);
		registerDecoders(decoders());
		registerEncoders(encoders());
		registerDecodeGuards(guards(DECODE));
		registerEncodeGuards(guards(ENCODE));
	}

	private static void registerDecoders(CompilerRegistry r) {
		r.register(TypeTag.STRING, JsonSerializer::decodeString);
		r.register(TypeTag.NUMBER, JsonSerializer::decodeNumber);
		r.register(TypeTag.BOOLEAN, (field, state) -> (value, ctx) -> {
			Boolean b = toBoolean(value);
			return (b == null) ? UNSET : b;
		});
		r.register(TypeTag.DATE, (field, state) -> JsonSerializer::decodeDate);
		r.register(TypeTag.UUID, (field, state) -> JsonSerializer::decodeUuid);
		r.register(TypeTag.ENUM, JsonSerializer::decodeEnum);
		r.register(TypeTag.LITERAL, (field, state) -> {
			Object literal = field.literalValue();
			return (value, ctx) -> literal;
		});
		r.prepend(TypeTag.LITERAL, JsonSerializer::literalPrecheck);
		r.register(TypeTag.ANY, (field, state) -> ValueConverter.IDENTITY);
		r.register(TypeTag.CLASS, JsonSerializer::decodeClass);
		r.register(TypeTag.ARRAY, JsonSerializer::arrayConverter);
		r.register(TypeTag.MAP, JsonSerializer::mapConverter);
		r.register(TypeTag.PARTIAL, JsonSerializer::partialConverter);
		r.registerForBinary(JsonSerializer::decodeBinary);
		r.register(TypeTag.ARRAY_BUFFER, JsonSerializer::decodeBinary);
	}

	private static void registerEncoders(CompilerRegistry r) {
		r.register(TypeTag.STRING, (field, state) -> (value, ctx) ->
			(value instanceof Character c) ? c.toString() : value);
		r.register(TypeTag.NUMBER, (field, state) -> (value, ctx) -> {
			if (value instanceof Number) {
				return value;
			}
			BigDecimal parsed = Numbers.parse(value.toString());
			return (parsed == null) ? UNSET : parsed.doubleValue();
		});
		r.register(TypeTag.BOOLEAN, (field, state) -> ValueConverter.IDENTITY);
		r.register(TypeTag.DATE, (field, state) -> (value, ctx) -> value.toString());
		r.register(TypeTag.UUID, (field, state) -> (value, ctx) -> value.toString());
		r.register(TypeTag.ENUM, (field, state) -> (value, ctx) ->
			(value instanceof Enum<?> e) ? EnumValues.externalValueOf(e) : value);
		r.register(TypeTag.LITERAL, (field, state) -> {
			Object literal = field.literalValue();
			return (value, ctx) -> literal;
		});
		r.prepend(TypeTag.LITERAL, JsonSerializer::literalPrecheck);
		r.register(TypeTag.ANY, (field, state) -> ValueConverter.IDENTITY);
		r.register(TypeTag.CLASS, (field, state) -> {
			Pipeline pipeline = state.pipelineFor(field.referencedSchema());
			return pipeline::execute;
		});
		r.register(TypeTag.ARRAY, JsonSerializer::arrayConverter);
		r.register(TypeTag.MAP, JsonSerializer::mapConverter);
		r.register(TypeTag.PARTIAL, JsonSerializer::partialConverter);
		r.registerForBinary((field, state) -> (value, ctx) -> BinaryCodec.encode(value));
		r.register(TypeTag.ARRAY_BUFFER, (field, state) -> (value, ctx) -> BinaryCodec.encode(value));
	}

	private static void registerDecodeGuards(GuardRegistry g) {
		g.register(1, TypeTag.LITERAL, (candidate, state) -> {
			Object literal = candidate.literalValue();
			return (value, ctx) -> sameLiteral(literal, value);
		});
		g.register(1.5, TypeTag.ENUM, (candidate, state) -> {
			EnumValues values = EnumValues.of(candidate.enumType());
			boolean allowLabels = candidate.allowLabelsAsValue();
			return (value, ctx) -> values.isValid(value, allowLabels);
		});
		g.register(1.5, TypeTag.DATE, (candidate, state) -> (value, ctx) ->
			value instanceof Instant || value instanceof String s && parseInstant(s) != null);
		g.register(1.5, TypeTag.UUID, (candidate, state) -> (value, ctx) ->
			value instanceof UUID || value instanceof String s && UUID_PATTERN.matcher(s).matches());
		g.register(1.5, TypeTag.CLASS, JsonSerializer::discriminantGuard);
		g.register(2, TypeTag.STRING, (candidate, state) -> (value, ctx) -> value instanceof String);
		g.register(2, TypeTag.NUMBER, (candidate, state) -> (value, ctx) -> value instanceof Number);
		g.register(2, TypeTag.BOOLEAN, (candidate, state) -> (value, ctx) -> value instanceof Boolean);
		g.register(2, TypeTag.ARRAY, (candidate, state) -> (value, ctx) -> value instanceof Collection<?>);
		g.register(3, TypeTag.CLASS, JsonSerializer::shapeGuard);
		g.register(3, TypeTag.MAP, (candidate, state) -> (value, ctx) -> value instanceof Map<?, ?>);
		g.register(3, TypeTag.PARTIAL, (candidate, state) -> (value, ctx) -> value instanceof Map<?, ?>);
		for (TypeTag tag : BINARY_TAGS) {
			g.register(3, tag, (candidate, state) -> (value, ctx) ->
				BinaryCodec.isBinary(value) || value instanceof String s && BinaryCodec.isBase64(s));
		}
		g.register(10, TypeTag.ANY, (candidate, state) -> (value, ctx) -> true);

		g.registerLoose(2, TypeTag.NUMBER, (candidate, state) -> (value, ctx) ->
			value instanceof String s && Numbers.parse(s) != null);
		g.registerLoose(2, TypeTag.BOOLEAN, (candidate, state) -> (value, ctx) ->
			toBoolean(value) != null);
	}

	private static void registerEncodeGuards(GuardRegistry g) {
		g.register(1, TypeTag.LITERAL, (candidate, state) -> {
			Object literal = candidate.literalValue();
			return (value, ctx) -> sameLiteral(literal, value);
		});
		g.register(1.5, TypeTag.ENUM, (candidate, state) -> {
			Class<?> enumType = candidate.enumType();
			return (value, ctx) -> enumType.isInstance(value);
		});
		g.register(1.5, TypeTag.DATE, (candidate, state) -> (value, ctx) -> value instanceof Instant);
		g.register(1.5, TypeTag.UUID, (candidate, state) -> (value, ctx) -> value instanceof UUID);
		g.register(1.5, TypeTag.CLASS, (candidate, state) -> {
			ClassSchema schema = candidate.referencedSchema();
			FieldSchema discriminant = schema.discriminantField();
			if (Map.class.isAssignableFrom(schema.entityClass()) && discriminant != null) {
				return (value, ctx) -> value instanceof Map<?, ?> map
					&& sameLiteral(discriminant.literalValue(), map.get(discriminant.name()));
			}
			return (value, ctx) -> schema.entityClass().isInstance(value);
		});
		g.register(2, TypeTag.STRING, (candidate, state) -> (value, ctx) -> value instanceof String || value instanceof Character);
		g.register(2, TypeTag.NUMBER, (candidate, state) -> (value, ctx) -> value instanceof Number);
		g.register(2, TypeTag.BOOLEAN, (candidate, state) -> (value, ctx) -> value instanceof Boolean);
		g.register(2, TypeTag.ARRAY, (candidate, state) -> (value, ctx) -> value instanceof Collection<?>);
		for (TypeTag tag : BINARY_TAGS) {
			g.register(2, tag, (candidate, state) -> {
				Class<?> javaType = candidate.javaType();
				return (value, ctx) -> javaType.isInstance(value);
			});
		}
		g.register(3, TypeTag.MAP, (candidate, state) -> (value, ctx) -> value instanceof Map<?, ?>);
		g.register(3, TypeTag.PARTIAL, (candidate, state) -> (value, ctx) -> value instanceof Map<?, ?>);
		g.register(10, TypeTag.ANY, (candidate, state) -> (value, ctx) -> true);
	}

	/**
	 * Supplies the literal for a required literal field that is absent, or null without being nullable.
	 */
	private static @Nullable Precheck literalPrecheck(FieldSchema field, CompilerState state) {
		if (field.optional()) {
			return null;
		}
		Object literal = field.literalValue();
		boolean nullable = field.nullable();
		return (input, ctx) -> {
			if (input == UNSET || input == null && !nullable) {
				return Precheck.Outcome.assign(literal);
			}
			return Precheck.Outcome.PROCEED;
		};
	}

	private static ValueConverter decodeString(FieldSchema field, CompilerState state) {
		Class<?> javaType = field.javaType();
		if (javaType == char.class || javaType == Character.class) {
			return (value, ctx) -> {
				String s = value.toString();
				return s.isEmpty() ? UNSET : s.charAt(0);
			};
		}
		return (value, ctx) -> (value instanceof String) ? value : value.toString();
	}

	private static ValueConverter decodeNumber(FieldSchema field, CompilerState state) {
		Class<?> javaType = Numbers.isNumeric(field.javaType()) ? field.javaType() : Double.class;
		Class<?> parsedType = (javaType == Number.class) ? Double.class : javaType;
		return (value, ctx) -> {
			if (value instanceof Number n) {
				return coerceOrUnset(n, javaType, ctx);
			} else if (value instanceof Boolean b) {
				return Numbers.coerce(b ? 1 : 0, parsedType);
			} else if (value instanceof String s) {
				BigDecimal parsed = Numbers.parse(s);
				if (parsed != null) {
					return coerceOrUnset(parsed, parsedType, ctx);
				}
			}
			LOGGER.trace("Leaving {} unset: not a number", ctx.path());
			return UNSET;
		};
	}

	private static Object coerceOrUnset(Number n, Class<?> javaType, ConversionContext ctx) {
		try {
			return Numbers.coerce(n, javaType);
		} catch (ArithmeticException e) {
			LOGGER.trace("Leaving {} unset: {}", ctx.path(), e.getMessage());
			return UNSET;
		}
	}

	private static Object decodeDate(Object value, ConversionContext ctx) {
		if (value instanceof Instant) {
			return value;
		} else if (value instanceof Number n) {
			return Instant.ofEpochMilli(n.longValue());
		}
		Instant result = parseInstant(value.toString());
		if (result == null) {
			throw new ConversionException(ctx.path(), "Invalid date: " + value);
		}
		return result;
	}

	private static Object decodeUuid(Object value, ConversionContext ctx) {
		if (value instanceof UUID) {
			return value;
		}
		try {
			return UUID.fromString(value.toString());
		} catch (IllegalArgumentException e) {
			throw new ConversionException(ctx.path(), "Invalid UUID: " + value, e);
		}
	}

	private static ValueConverter decodeEnum(FieldSchema field, CompilerState state) {
		EnumValues values = EnumValues.of(field.enumType());
		boolean allowLabels = field.allowLabelsAsValue();
		return (value, ctx) -> {
			Enum<?> result = values.resolve(value, allowLabels);
			if (result == null) {
				throw new InvalidEnumValueException(ctx.path(), field.name(), value, values.validInputs(allowLabels));
			}
			return result;
		};
	}

	private static ValueConverter decodeClass(FieldSchema field, CompilerState state) {
		ClassSchema schema = field.referencedSchema();
		Pipeline pipeline = state.pipelineFor(schema);
		if (field.isReference()) {
			FieldSchema primary = schema.primaryField().orElseThrow(() ->
				new SchemaDefinitionException("Invalid field " + field.name() + ": referenced schema " + schema.name() + " has no primary field"));
			Pipeline keyPipeline = state.partialPipelineFor(schema, Set.of(primary.name()));
			EntityAccessor accessor = state.accessorFor(schema);
			return (value, ctx) -> {
				if (value instanceof Map<?, ?> || schema.entityClass().isInstance(value)) {
					return decodeEntity(pipeline, schema, value, ctx);
				}
				// Anything else is the primary key of the referenced entity
				return keyPipeline.executeInto(accessor.newInstance(), Map.of(primary.name(), value), ctx);
			};
		}
		return (value, ctx) -> {
			if (value instanceof Map<?, ?> || schema.entityClass().isInstance(value)) {
				return decodeEntity(pipeline, schema, value, ctx);
			} else if (value instanceof String s) {
				// Unparseable text leaves the field unset rather than failing the conversion
				return EmbeddedJson.parseObject(s)
					.map(map -> pipeline.execute(map, ctx))
					.orElse(UNSET);
			}
			LOGGER.trace("Leaving {} unset: {} is not an object", ctx.path(), value.getClass().getSimpleName());
			return UNSET;
		};
	}

	private static Object decodeEntity(Pipeline pipeline, ClassSchema schema, Object value, ConversionContext ctx) {
		if (value instanceof Map<?, ?>) {
			return pipeline.execute(value, ctx);
		}
		assert schema.entityClass().isInstance(value);
		return value;
	}

	private static ValueConverter arrayConverter(FieldSchema field, CompilerState state) {
		ValueConverter element = state.converterFor(field.element());
		boolean toSet = state.direction() == DECODE && Set.class.isAssignableFrom(field.javaType());
		return (value, ctx) -> {
			if (!(value instanceof Collection<?> items)) {
				LOGGER.trace("Leaving {} unset: not an array", ctx.path());
				return UNSET;
			}
			Collection<Object> result = toSet ? new LinkedHashSet<>() : new ArrayList<>(items.size());
			int i = 0;
			for (Object item : items) {
				Object converted = element.convert(item, ctx.child(i++));
				if (converted != UNSET) {
					result.add(converted);
				}
			}
			return result;
		};
	}

	private static ValueConverter mapConverter(FieldSchema field, CompilerState state) {
		ValueConverter element = state.converterFor(field.element());
		return (value, ctx) -> {
			if (!(value instanceof Map<?, ?> map)) {
				LOGGER.trace("Leaving {} unset: not an object", ctx.path());
				return UNSET;
			}
			Map<String, Object> result = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				String key = String.valueOf(entry.getKey());
				Object converted = element.convert(entry.getValue(), ctx.child(key));
				if (converted != UNSET) {
					result.put(key, converted);
				}
			}
			return result;
		};
	}

	@SuppressWarnings("unchecked")
	private static ValueConverter partialConverter(FieldSchema field, CompilerState state) {
		Pipeline pipeline = state.pipelineFor(field.referencedSchema());
		return (value, ctx) -> {
			if (value instanceof Map<?, ?> map) {
				return pipeline.convertValues((Map<String, ?>) map, ctx);
			}
			LOGGER.trace("Leaving {} unset: not an object", ctx.path());
			return UNSET;
		};
	}

	private static ValueConverter decodeBinary(FieldSchema field, CompilerState state) {
		TypeTag tag = field.type();
		return (value, ctx) -> {
			if (BinaryCodec.isBinary(value)) {
				return value;
			}
			try {
				return BinaryCodec.decode(value.toString(), tag);
			} catch (IllegalArgumentException e) {
				throw new ConversionException(ctx.path(), "Invalid " + tag + " data", e);
			}
		};
	}

	private static @Nullable Guard discriminantGuard(FieldSchema candidate, CompilerState state) {
		ClassSchema schema = candidate.referencedSchema();
		FieldSchema discriminant = schema.discriminantField();
		if (discriminant == null) {
			return null;
		}
		String key = discriminant.name();
		Object literal = discriminant.literalValue();
		return (value, ctx) -> value instanceof Map<?, ?> map && sameLiteral(literal, map.get(key))
			|| schema.entityClass().isInstance(value) && !(value instanceof Map<?, ?>);
	}

	private static @Nullable Guard shapeGuard(FieldSchema candidate, CompilerState state) {
		ClassSchema schema = candidate.referencedSchema();
		if (schema.discriminantField() != null) {
			return null;
		}
		ValidatorPipeline validator = state.validatorFor(schema);
		return (value, ctx) -> value instanceof Map<?, ?> && validator.isValid(value)
			|| schema.entityClass().isInstance(value) && !(value instanceof Map<?, ?>);
	}

	static @Nullable Boolean toBoolean(Object value) {
		if (value instanceof Boolean b) {
			return b;
		} else if ("true".equals(value) || "1".equals(value) || value instanceof Number n && isExactly(n, 1)) {
			return true;
		} else if ("false".equals(value) || "0".equals(value) || value instanceof Number n && isExactly(n, 0)) {
			return false;
		} else {
			return null;
		}
	}

	private static boolean isExactly(Number n, int expected) {
		return Numbers.sameNumber(n, expected);
	}

	static boolean sameLiteral(Object literal, Object value) {
		if (literal instanceof Number a && value instanceof Number b) {
			return Numbers.sameNumber(a, b);
		}
		return Objects.equals(literal, value);
	}

	static @Nullable Instant parseInstant(String text) {
		try {
			return Instant.parse(text);
		} catch (DateTimeParseException e) {
			return null;
		}
	}

	private static final Set<TypeTag> BINARY_TAGS = Set.of(
		TypeTag.ARRAY_BUFFER, TypeTag.UINT8_ARRAY, TypeTag.INT8_ARRAY, TypeTag.INT16_ARRAY,
		TypeTag.INT32_ARRAY, TypeTag.FLOAT32_ARRAY, TypeTag.FLOAT64_ARRAY);

	private static final Pattern UUID_PATTERN = Pattern.compile(
		"[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonSerializer.class);
}
