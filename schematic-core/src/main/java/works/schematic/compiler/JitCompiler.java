package works.schematic.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.serializer.CompilerRegistry;
import works.schematic.serializer.ConverterGenerator;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Precheck;
import works.schematic.serializer.PrecheckGenerator;
import works.schematic.serializer.Serializer;
import works.schematic.validation.ValidationCompiler;

import static java.util.Objects.requireNonNull;

/**
 * Builds and caches one {@link CompiledPipeline} per
 * (schema, serializer, direction, field subset).
 * <p>
 * Each field's step comes from the serializer's {@link CompilerRegistry}:
 * the prechecks registered for its type tag, then its primary generator.
 * Union fields go to the {@link UnionResolver} instead.
 * Generators for nested entities ask for the nested pipeline through {@link CompilerState},
 * which is where self-referential schemas get their forward references.
 * <p>
 * Pipelines already built are unaffected by later registry changes;
 * call {@link #reset()} to rebuild them.
 */
public class JitCompiler {
	private final ValidationCompiler validation;
	private final PipelineCache<PipelineKey, Pipeline> cache;
	private final Map<ClassSchema, EntityAccessor> accessors = new ConcurrentHashMap<>();

	public JitCompiler(ValidationCompiler validation) {
		this.validation = requireNonNull(validation);
		this.cache = new PipelineCache<>("JitCompiler", ForwardReference::new);
	}

	public CompiledPipeline compile(ClassSchema schema, Serializer serializer, Direction direction) {
		return finished(pipeline(new PipelineKey(schema, serializer, direction, null)));
	}

	/**
	 * @param fieldNames must all name fields of {@code schema}
	 */
	public CompiledPipeline compilePartial(ClassSchema schema, Serializer serializer, Direction direction, Set<String> fieldNames) {
		for (String name : fieldNames) {
			if (schema.field(name).isEmpty()) {
				throw new IllegalArgumentException("Schema " + schema.name() + " has no field " + name);
			}
		}
		return finished(pipeline(new PipelineKey(schema, serializer, direction, fieldNames)));
	}

	/**
	 * Discards all compiled pipelines.
	 */
	public void reset() {
		cache.clear();
		accessors.clear();
		LOGGER.debug("Pipelines discarded");
	}

	public int cachedPipelineCount() {
		return cache.size();
	}

	ValidationCompiler validation() {
		return validation;
	}

	Pipeline pipeline(PipelineKey key) {
		return cache.get(key, this::build);
	}

	EntityAccessor accessorFor(ClassSchema schema) {
		return accessors.computeIfAbsent(schema, EntityAccessor::of);
	}

	ValueConverter valueConverter(FieldSchema field, CompilerState state) {
		if (field.isUnion()) {
			return UnionResolver.resolve(field, state);
		}
		ConverterGenerator generator = state.serializer().compilers(state.direction()).generatorFor(field.type());
		if (generator == null) {
			LOGGER.debug("No {} generator for {} in {}; values pass through unchanged", state.direction(), field.type(), state.serializer().name());
			return ValueConverter.IDENTITY;
		}
		return requireNonNull(generator.generate(field, state), "Generator returned null");
	}

	private CompiledPipeline build(PipelineKey key) {
		CompilerState state = new CompilerState(this, key.serializer(), key.direction());
		CompilerRegistry registry = key.serializer().compilers(key.direction());
		EntityAccessor accessor = accessorFor(key.schema());
		List<FieldConverter> steps = new ArrayList<>();
		for (FieldSchema field : key.schema().fields()) {
			if (key.isPartial() && !key.fieldSubset().contains(field.name())) {
				continue;
			}
			List<Precheck> prechecks = new ArrayList<>();
			for (PrecheckGenerator g : registry.prechecksFor(field.type())) {
				Precheck precheck = g.generate(field, state);
				if (precheck != null) {
					prechecks.add(precheck);
				}
			}
			ValueConverter converter = field.isParentReference()
				? ValueConverter.IDENTITY
				: valueConverter(field, state);
			steps.add(new FieldConverter(field, key.direction(), accessor.slot(field), prechecks, converter));
		}
		return new CompiledPipeline(key, accessor, steps);
	}

	private static CompiledPipeline finished(Pipeline pipeline) {
		if (pipeline instanceof CompiledPipeline c) {
			return c;
		}
		throw new IllegalStateException("Pipeline " + pipeline + " requested while it is being compiled; generators should use CompilerState.pipelineFor");
	}

	private static final class ForwardReference implements PipelineCache.ForwardReference<Pipeline> {
		private final ForwardPipeline placeholder;

		ForwardReference(PipelineKey key) {
			this.placeholder = new ForwardPipeline(key);
		}

		@Override
		public Pipeline placeholder() {
			return placeholder;
		}

		@Override
		public void bind(Pipeline target) {
			placeholder.bind(target);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JitCompiler.class);
}
