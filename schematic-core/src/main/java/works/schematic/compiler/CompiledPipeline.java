package works.schematic.compiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.schematic.ConverterOptions;
import works.schematic.exceptions.ConversionException;
import works.schematic.schema.ClassSchema;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Serializer;

import static java.util.Objects.requireNonNull;
import static works.schematic.serializer.Direction.DECODE;

/**
 * A finished, immutable pipeline for one (schema, serializer, direction, field subset).
 * Safe for concurrent use.
 * <p>
 * Decoding turns a {@link Map} into a new entity; encoding turns an entity into a new {@link Map}.
 * Errors raised by field steps propagate unchanged.
 */
public final class CompiledPipeline implements Pipeline {
	private final PipelineKey key;
	private final EntityAccessor accessor;
	private final List<FieldConverter> steps;

	CompiledPipeline(PipelineKey key, EntityAccessor accessor, List<FieldConverter> steps) {
		this.key = key;
		this.accessor = accessor;
		this.steps = List.copyOf(steps);
	}

	@Override
	public ClassSchema schema() {
		return key.schema();
	}

	public Serializer serializer() {
		return key.serializer();
	}

	public Direction direction() {
		return key.direction();
	}

	/**
	 * @return the names of the fields this pipeline converts, if it's partial
	 */
	public Optional<Set<String>> fieldSubset() {
		return Optional.ofNullable(key.fieldSubset());
	}

	public Object run(Object input) {
		return run(input, ConverterOptions.DEFAULT);
	}

	public Object run(Object input, ConverterOptions options) {
		return execute(requireNonNull(input), ConversionContext.root(options));
	}

	/**
	 * Decodes the fields present in {@code input} onto {@code target},
	 * leaving the rest of it untouched.
	 */
	public <T> T runInto(T target, Map<String, ?> input, ConverterOptions options) {
		executeInto(requireNonNull(target), input, ConversionContext.root(options));
		return target;
	}

	public Map<String, Object> convertValues(Map<String, ?> values, ConverterOptions options) {
		return convertValues(values, ConversionContext.root(options));
	}

	@Override
	@SuppressWarnings("unchecked")
	public Object execute(Object input, ConversionContext ctx) {
		if (key.direction() == DECODE) {
			if (!(input instanceof Map<?, ?> map)) {
				throw new ConversionException(ctx.path(), "Expected an object for " + schema().name() + ", got " + input.getClass().getSimpleName());
			}
			Object entity = accessor.newInstance();
			ConversionContext fieldCtx = ctx.enter(entity);
			for (FieldConverter step : steps) {
				step.decodeInto(entity, (Map<String, ?>) map, fieldCtx, true);
			}
			return entity;
		} else {
			if (!schema().entityClass().isInstance(input)) {
				throw new ConversionException(ctx.path(), "Expected " + schema().entityClass().getSimpleName() + " for " + schema().name() + ", got " + input.getClass().getSimpleName());
			}
			Map<String, Object> result = new LinkedHashMap<>();
			ConversionContext fieldCtx = ctx.enter(input);
			for (FieldConverter step : steps) {
				step.encodeInto(input, result, fieldCtx);
			}
			return result;
		}
	}

	@Override
	public Object executeInto(Object target, Map<String, ?> input, ConversionContext ctx) {
		if (key.direction() != DECODE) {
			throw new IllegalStateException("Only decoding pipelines can write onto an existing entity: " + key);
		}
		if (!schema().entityClass().isInstance(target)) {
			throw new IllegalArgumentException("Expected " + schema().entityClass().getSimpleName() + "; got " + target.getClass().getSimpleName());
		}
		ConversionContext fieldCtx = ctx.enter(target);
		for (FieldConverter step : steps) {
			if (input.containsKey(step.field().name())) {
				step.decodeInto(target, input, fieldCtx, false);
			}
		}
		return target;
	}

	@Override
	public Map<String, Object> convertValues(Map<String, ?> values, ConversionContext ctx) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (FieldConverter step : steps) {
			step.convertEntry(values, result, ctx);
		}
		return result;
	}

	@Override
	public String toString() {
		return "CompiledPipeline(" + key + ")";
	}
}
