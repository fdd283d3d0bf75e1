package works.schematic.compiler;

import java.util.Map;
import works.schematic.schema.ClassSchema;

/**
 * Stands in for a pipeline that is still being built further up the compilation stack.
 * Bound to the real pipeline once that build finishes.
 */
final class ForwardPipeline implements Pipeline {
	private final PipelineKey key;
	private volatile Pipeline target;

	ForwardPipeline(PipelineKey key) {
		this.key = key;
	}

	void bind(Pipeline target) {
		assert this.target == null: "Forward reference bound twice: " + key;
		assert target.schema() == key.schema();
		this.target = target;
	}

	private Pipeline target() {
		Pipeline result = target;
		if (result == null) {
			throw new IllegalStateException("Pipeline used before it finished compiling: " + key);
		}
		return result;
	}

	@Override
	public ClassSchema schema() {
		return key.schema();
	}

	@Override
	public Object execute(Object input, ConversionContext ctx) {
		return target().execute(input, ctx);
	}

	@Override
	public Object executeInto(Object entity, Map<String, ?> input, ConversionContext ctx) {
		return target().executeInto(entity, input, ctx);
	}

	@Override
	public Map<String, Object> convertValues(Map<String, ?> values, ConversionContext ctx) {
		return target().convertValues(values, ctx);
	}

	@Override
	public String toString() {
		return "ForwardPipeline(" + key + ")";
	}
}
