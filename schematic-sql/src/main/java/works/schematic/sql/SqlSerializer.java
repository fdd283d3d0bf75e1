package works.schematic.sql;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import works.schematic.Schematic;
import works.schematic.compiler.CompilerState;
import works.schematic.compiler.EntityAccessor;
import works.schematic.compiler.ValueConverter;
import works.schematic.exceptions.ConversionException;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.TypeTag;
import works.schematic.serializer.CompilerRegistry;
import works.schematic.serializer.EmbeddedJson;
import works.schematic.serializer.Guard;
import works.schematic.serializer.GuardGenerator;
import works.schematic.serializer.GuardRegistry;
import works.schematic.serializer.JsonSerializer;
import works.schematic.serializer.Precheck;
import works.schematic.serializer.Serializer;

import static java.util.Objects.requireNonNull;
import static works.schematic.compiler.Unset.UNSET;
import static works.schematic.serializer.Direction.DECODE;

/**
 * Converts between entities and the column values of a relational row.
 * <p>
 * Forks the json serializer, overriding what relational columns can't hold as is:
 * <ul>
 *     <li>booleans are {@code 1} or {@code 0},</li>
 *     <li>dates are UTC text formatted as {@code yyyy-MM-dd HH:mm:ss.SSS};
 *         anything finer than a millisecond is dropped,</li>
 *     <li>UUIDs are 16 bytes, most significant first,</li>
 *     <li>nested entities, arrays, maps and partials are JSON text,</li>
 *     <li>references to other entities are their primary key.</li>
 * </ul>
 */
public class SqlSerializer extends Serializer {
	public static final String NAME = "sql";

	private final Serializer json;

	public SqlSerializer() {
		this(new JsonSerializer());
	}

	/**
	 * @param json the serializer for values stored as JSON text, and for everything else not overridden here
	 */
	public SqlSerializer(Serializer json) {
		super(NAME, requireNonNull(json));
		this.json = json;
		registerEncoders(encoders());
		registerDecoders(decoders());
		registerDecodeGuards(guards(DECODE));
	}

	/**
	 * Adds a {@link SqlSerializer} forking the json serializer of {@code schematic},
	 * unless it already has one.
	 */
	public static Schematic install(Schematic schematic) {
		if (!schematic.hasSerializer(NAME)) {
			schematic.addSerializer(new SqlSerializer(schematic.serializer(JsonSerializer.NAME)));
		}
		return schematic;
	}

	private void registerEncoders(CompilerRegistry r) {
		r.register(TypeTag.BOOLEAN, (field, state) -> (value, ctx) ->
			(value instanceof Boolean b) ? (b ? 1 : 0) : value);
		r.register(TypeTag.DATE, (field, state) -> (value, ctx) ->
			(value instanceof Instant i) ? DATE_FORMAT.format(i) : value);
		r.register(TypeTag.UUID, (field, state) -> (value, ctx) ->
			(value instanceof UUID u) ? uuidBytes(u) : value);
		for (TypeTag tag : JSON_COLUMNS) {
			r.register(tag, this::encodeJsonColumn);
		}
		r.prepend(TypeTag.CLASS, SqlSerializer::referenceKey);
	}

	private void registerDecoders(CompilerRegistry r) {
		r.register(TypeTag.DATE, (field, state) -> {
			ValueConverter fallback = inJson(state).converterFor(field);
			return (value, ctx) -> {
				if (value instanceof String s) {
					Instant parsed = parseDate(s);
					if (parsed != null) {
						return parsed;
					}
				}
				return fallback.convert(value, ctx);
			};
		});
		r.register(TypeTag.UUID, (field, state) -> {
			ValueConverter fallback = inJson(state).converterFor(field);
			return (value, ctx) -> {
				if (value instanceof byte[] bytes) {
					if (bytes.length != 16) {
						throw new ConversionException(ctx.path(), "Expected 16 bytes for a UUID; got " + bytes.length);
					}
					ByteBuffer buffer = ByteBuffer.wrap(bytes);
					return new UUID(buffer.getLong(), buffer.getLong());
				}
				return fallback.convert(value, ctx);
			};
		});
		for (TypeTag tag : JSON_COLUMNS) {
			r.register(tag, this::decodeJsonColumn);
		}
	}

	/**
	 * Union candidates stored as JSON text are classified by what the text encodes.
	 */
	private static void registerDecodeGuards(GuardRegistry g) {
		GuardRegistry inherited = requireNonNull(g.parent());
		for (TypeTag tag : JSON_COLUMNS) {
			for (GuardRegistry.Entry entry : inherited.entriesFor(tag)) {
				GuardGenerator wrapped = jsonTextGuard(entry.generator());
				if (entry.loose()) {
					g.registerLoose(entry.specificality(), tag, wrapped);
				} else {
					g.register(entry.specificality(), tag, wrapped);
				}
			}
		}
	}

	private static GuardGenerator jsonTextGuard(GuardGenerator inner) {
		return (candidate, state) -> {
			Guard guard = inner.generate(candidate, state);
			if (guard == null) {
				return null;
			}
			return (value, ctx) -> {
				if (value instanceof String s) {
					Object parsed = parseLeniently(s);
					return parsed != null && guard.test(parsed, ctx);
				}
				return guard.test(value, ctx);
			};
		};
	}

	private ValueConverter encodeJsonColumn(FieldSchema field, CompilerState state) {
		ValueConverter inner = inJson(state).converterFor(field);
		return (value, ctx) -> {
			Object converted = inner.convert(value, ctx);
			if (converted == UNSET || converted == null) {
				return converted;
			}
			try {
				return EmbeddedJson.write(converted);
			} catch (JacksonException e) {
				throw new ConversionException(ctx.path(), "Unable to write " + field.name() + " as JSON", e);
			}
		};
	}

	private ValueConverter decodeJsonColumn(FieldSchema field, CompilerState state) {
		ValueConverter inner = inJson(state).converterFor(field);
		if (field.isReference()) {
			// Reference columns hold the primary key, which may well be text
			return inner;
		}
		return (value, ctx) -> {
			if (value instanceof String s) {
				Object parsed;
				try {
					parsed = EmbeddedJson.parse(s);
				} catch (JacksonException e) {
					throw new ConversionException(ctx.path(), "Column " + field.name() + " does not hold valid JSON", e);
				}
				return (parsed == null) ? UNSET : inner.convert(parsed, ctx);
			}
			return inner.convert(value, ctx);
		};
	}

	/**
	 * Encodes a reference as the primary key of the referenced entity.
	 */
	private static @Nullable Precheck referenceKey(FieldSchema field, CompilerState state) {
		if (!field.isReference()) {
			return null;
		}
		ClassSchema schema = field.referencedSchema();
		FieldSchema primary = schema.primaryField().orElseThrow(() ->
			new SchemaDefinitionException("Invalid field " + field.name() + ": referenced schema " + schema.name() + " has no primary field"));
		EntityAccessor.Slot slot = state.accessorFor(schema).slot(primary);
		ValueConverter keyConverter = state.converterFor(primary);
		return (input, ctx) -> {
			if (input == UNSET || input == null) {
				return Precheck.Outcome.PROCEED;
			}
			if (!schema.entityClass().isInstance(input)) {
				throw new ConversionException(ctx.path(), "Expected a " + schema.name() + " reference; got " + input.getClass().getSimpleName());
			}
			return Precheck.Outcome.assign(keyConverter.convert(slot.get(input), ctx.child(primary.name())));
		};
	}

	private CompilerState inJson(CompilerState state) {
		return state.withSerializer(json);
	}

	static byte[] uuidBytes(UUID uuid) {
		return ByteBuffer.allocate(16)
			.putLong(uuid.getMostSignificantBits())
			.putLong(uuid.getLeastSignificantBits())
			.array();
	}

	static @Nullable Instant parseDate(String text) {
		try {
			return LocalDateTime.parse(text, DATE_PARSE_FORMAT).toInstant(ZoneOffset.UTC);
		} catch (DateTimeParseException e) {
			return null;
		}
	}

	private static @Nullable Object parseLeniently(String text) {
		try {
			return EmbeddedJson.parse(text);
		} catch (JacksonException e) {
			LOGGER.trace("Not JSON text: {}", e.getMessage());
			return null;
		}
	}

	private static final TypeTag[] JSON_COLUMNS = { TypeTag.CLASS, TypeTag.ARRAY, TypeTag.MAP, TypeTag.PARTIAL };

	static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
		.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
		.withZone(ZoneOffset.UTC);

	private static final DateTimeFormatter DATE_PARSE_FORMAT = new DateTimeFormatterBuilder()
		.appendPattern("yyyy-MM-dd HH:mm:ss")
		.optionalStart()
		.appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
		.optionalEnd()
		.toFormatter();

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlSerializer.class);
}
