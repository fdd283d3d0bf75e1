package works.schematic.compiler;

import java.util.Set;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Serializer;
import works.schematic.validation.ValidatorPipeline;

import static java.util.Objects.requireNonNull;

/**
 * What a generator may ask of the compiler while producing its conversion step.
 * <p>
 * Nested pipelines obtained here may be forward references to pipelines still being built,
 * so generators must not run them at compile time.
 */
public final class CompilerState {
	private final JitCompiler compiler;
	private final Serializer serializer;
	private final Direction direction;

	CompilerState(JitCompiler compiler, Serializer serializer, Direction direction) {
		this.compiler = compiler;
		this.serializer = requireNonNull(serializer);
		this.direction = requireNonNull(direction);
	}

	public Serializer serializer() {
		return serializer;
	}

	public Direction direction() {
		return direction;
	}

	/**
	 * @return the same compiler state, but for another serializer,
	 * such as a parent whose encoding a nested value should use
	 */
	public CompilerState withSerializer(Serializer other) {
		return new CompilerState(compiler, other, direction);
	}

	public Pipeline pipelineFor(ClassSchema schema) {
		return compiler.pipeline(new PipelineKey(schema, serializer, direction, null));
	}

	public Pipeline partialPipelineFor(ClassSchema schema, Set<String> fieldNames) {
		return compiler.pipeline(new PipelineKey(schema, serializer, direction, fieldNames));
	}

	/**
	 * @return a converter for values of {@code field}, passing nulls through as nulls
	 */
	public ValueConverter converterFor(FieldSchema field) {
		ValueConverter converter = compiler.valueConverter(field, this);
		return (value, ctx) -> (value == null) ? null : converter.convert(value, ctx);
	}

	public EntityAccessor accessorFor(ClassSchema schema) {
		return compiler.accessorFor(schema);
	}

	public ValidatorPipeline validatorFor(ClassSchema schema) {
		return compiler.validation().compileValidator(schema);
	}

	@Override
	public String toString() {
		return "CompilerState(" + serializer.name() + "/" + direction + ")";
	}
}
