package works.schematic.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.compiler.EntityAccessor;
import works.schematic.compiler.PipelineCache;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.validation.SchemaValidator.FieldValidator;

import static java.util.Objects.requireNonNull;

/**
 * Builds and caches one {@link ValidatorPipeline} per schema.
 * <p>
 * Shares the compilation discipline of {@link works.schematic.compiler.JitCompiler}:
 * a schema that refers to itself gets a forward reference to its own validator.
 */
public class ValidationCompiler {
	private final TypeCheckRegistry registry;
	private final PipelineCache<ClassSchema, ValidatorPipeline> cache;

	public ValidationCompiler() {
		this(TypeCheckRegistry.withDefaults());
	}

	public ValidationCompiler(TypeCheckRegistry registry) {
		this.registry = requireNonNull(registry);
		this.cache = new PipelineCache<>("ValidationCompiler", ForwardReference::new);
	}

	public TypeCheckRegistry registry() {
		return registry;
	}

	public ValidatorPipeline compileValidator(ClassSchema schema) {
		return cache.get(schema, this::build);
	}

	/**
	 * @return the check for non-null values of {@code field}
	 */
	public TypeCheck typeCheckFor(FieldSchema field) {
		TypeCheckGenerator generator = registry.generatorFor(field.type());
		if (generator == null) {
			LOGGER.debug("No type check for {}; any value is accepted", field.type());
			return TypeCheck.ANYTHING;
		}
		return generator.generate(field, this);
	}

	public void reset() {
		cache.clear();
	}

	private ValidatorPipeline build(ClassSchema schema) {
		EntityAccessor accessor = Map.class.isAssignableFrom(schema.entityClass())
			? null
			: EntityAccessor.of(schema);
		List<FieldValidator> fields = new ArrayList<>();
		for (FieldSchema field : schema.fields()) {
			if (field.isParentReference()) {
				continue;
			}
			EntityAccessor.Slot slot = (accessor == null) ? null : accessor.slot(field);
			fields.add(new FieldValidator(field, slot, typeCheckFor(field)));
		}
		return new SchemaValidator(schema, fields);
	}

	static String childPath(String path, String segment) {
		return path.isEmpty() ? segment : path + "." + segment;
	}

	private static final class ForwardReference implements PipelineCache.ForwardReference<ValidatorPipeline> {
		private final ForwardValidator placeholder;

		ForwardReference(ClassSchema schema) {
			this.placeholder = new ForwardValidator(schema);
		}

		@Override
		public ValidatorPipeline placeholder() {
			return placeholder;
		}

		@Override
		public void bind(ValidatorPipeline target) {
			placeholder.bind(target);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidationCompiler.class);
}
