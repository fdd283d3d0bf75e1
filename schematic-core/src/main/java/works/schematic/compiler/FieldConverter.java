package works.schematic.compiler;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.exceptions.ConversionException;
import works.schematic.schema.FieldSchema;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Precheck;

import static works.schematic.compiler.Unset.UNSET;
import static works.schematic.serializer.Direction.DECODE;

/**
 * The compiled step for one field of a pipeline:
 * prechecks, then absent/null/default handling, then the primary converter.
 */
final class FieldConverter {
	private final FieldSchema field;
	private final Direction direction;
	private final EntityAccessor.Slot slot;
	private final List<Precheck> prechecks;
	private final ValueConverter converter;
	private final @Nullable Class<?> parentType;

	FieldConverter(FieldSchema field, Direction direction, EntityAccessor.Slot slot, List<Precheck> prechecks, ValueConverter converter) {
		this.field = field;
		this.direction = direction;
		this.slot = slot;
		this.prechecks = List.copyOf(prechecks);
		this.converter = converter;
		this.parentType = field.isParentReference() ? field.referencedSchema().entityClass() : null;
	}

	FieldSchema field() {
		return field;
	}

	/**
	 * @param fresh true if {@code entity} was just constructed,
	 *              in which case absent fields get their defaults
	 */
	void decodeInto(Object entity, Map<String, ?> input, ConversionContext ctx, boolean fresh) {
		if (!ctx.includes(field)) {
			return;
		}
		if (parentType != null) {
			Object parent = ctx.nearestAncestor(parentType);
			if (parent == null) {
				LOGGER.trace("No enclosing {} for {}", parentType.getSimpleName(), field.name());
			} else {
				write(entity, parent, ctx);
			}
			return;
		}
		Object raw = input.containsKey(field.name()) ? input.get(field.name()) : UNSET;
		Object value = resolve(raw, ctx, fresh);
		if (value != UNSET) {
			write(entity, value, ctx);
		}
	}

	void encodeInto(Object entity, Map<String, Object> output, ConversionContext ctx) {
		if (parentType != null || !ctx.includes(field)) {
			return;
		}
		Object value = resolve(slot.get(entity), ctx, false);
		if (value != UNSET) {
			output.put(field.name(), value);
		}
	}

	/**
	 * Converts one entry of a map of field values.
	 */
	void convertEntry(Map<String, ?> input, Map<String, Object> output, ConversionContext ctx) {
		if (parentType != null || !ctx.includes(field) || !input.containsKey(field.name())) {
			return;
		}
		Object value = resolve(input.get(field.name()), ctx, false);
		if (value != UNSET) {
			output.put(field.name(), value);
		}
	}

	/**
	 * @param raw may be null or {@link Unset#UNSET UNSET}
	 * @return the value for the target, or {@link Unset#UNSET UNSET} to leave it unset
	 */
	private Object resolve(@Nullable Object raw, ConversionContext ctx, boolean fresh) {
		ConversionContext fieldCtx = ctx.child(field.name());
		for (Precheck precheck : prechecks) {
			if (precheck.check(raw, fieldCtx) instanceof Precheck.Assign assign) {
				return assign.value();
			}
		}
		if (raw == UNSET) {
			if (direction == DECODE && fresh && field.hasDefault()) {
				return defaultValue(true);
			}
			return UNSET;
		} else if (raw == null) {
			if (field.nullable()) {
				return null;
			} else if (direction == DECODE && field.hasDefault()) {
				return defaultValue(fresh);
			}
			return UNSET;
		} else {
			return converter.convert(raw, fieldCtx);
		}
	}

	private Object defaultValue(boolean fresh) {
		if (fresh && field.defaultFromInitializer()) {
			// The constructor already set it
			return UNSET;
		}
		return field.defaultValue();
	}

	private void write(Object entity, @Nullable Object value, ConversionContext ctx) {
		try {
			slot.set(entity, value);
		} catch (ClassCastException e) {
			throw new ConversionException(ctx.child(field.name()).path(),
				"Cannot assign " + ((value == null) ? "null" : value.getClass().getSimpleName()) + " to field " + field.name(), e);
		} catch (ArithmeticException e) {
			throw new ConversionException(ctx.child(field.name()).path(),
				"Cannot assign " + value + " to field " + field.name() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public String toString() {
		return direction + ":" + field;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldConverter.class);
}
