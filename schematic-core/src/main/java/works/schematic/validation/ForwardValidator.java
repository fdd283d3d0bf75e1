package works.schematic.validation;

import java.util.List;
import works.schematic.schema.ClassSchema;

final class ForwardValidator implements ValidatorPipeline {
	private final ClassSchema schema;
	private volatile ValidatorPipeline target;

	ForwardValidator(ClassSchema schema) {
		this.schema = schema;
	}

	void bind(ValidatorPipeline target) {
		assert this.target == null;
		this.target = target;
	}

	@Override
	public ClassSchema schema() {
		return schema;
	}

	@Override
	public void validate(Object value, String path, List<FieldError> errors) {
		ValidatorPipeline t = target;
		if (t == null) {
			throw new IllegalStateException("Validator used before it finished compiling: " + schema.name());
		}
		t.validate(value, path, errors);
	}
}
