package works.schematic.validation;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.schematic.compiler.EntityAccessor;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;

import static works.schematic.validation.ValidationCompiler.childPath;

/**
 * Runs each field's checks in turn: required-ness, then type shape, then custom rules.
 * The first failing check for a field ends that field's checks, but not the other fields'.
 */
final class SchemaValidator implements ValidatorPipeline {
	private final ClassSchema schema;
	private final List<FieldValidator> fields;

	record FieldValidator(FieldSchema field, @Nullable EntityAccessor.Slot slot, TypeCheck typeCheck) { }

	SchemaValidator(ClassSchema schema, List<FieldValidator> fields) {
		this.schema = schema;
		this.fields = List.copyOf(fields);
	}

	@Override
	public ClassSchema schema() {
		return schema;
	}

	@Override
	@SuppressWarnings("unchecked")
	public void validate(Object value, String path, List<FieldError> errors) {
		Map<String, ?> data = null;
		if (value instanceof Map<?, ?> map) {
			data = (Map<String, ?>) map;
		} else if (!schema.entityClass().isInstance(value)) {
			errors.add(new FieldError(path, "invalid_type", "Type is not an object"));
			return;
		}
		for (FieldValidator v : fields) {
			FieldSchema field = v.field();
			String fieldPath = childPath(path, field.name());
			boolean present;
			Object fieldValue;
			if (data != null) {
				present = data.containsKey(field.name());
				fieldValue = data.get(field.name());
			} else {
				fieldValue = v.slot().get(value);
				present = fieldValue != null || field.nullable();
			}

			if (!present) {
				if (!field.optional() && !field.hasDefault() && !field.isAutoIncrement()) {
					errors.add(new FieldError(fieldPath, "required", "Required value is undefined"));
				}
				continue;
			}
			if (fieldValue == null) {
				if (!field.nullable() && !field.optional()) {
					errors.add(new FieldError(fieldPath, "required", "Required value is null"));
				}
				continue;
			}

			int before = errors.size();
			v.typeCheck().check(fieldValue, fieldPath, errors);
			if (errors.size() > before) {
				continue;
			}
			for (PropertyValidator rule : field.validators()) {
				PropertyValidatorError error = rule.validate(fieldValue, field);
				if (error != null) {
					errors.add(new FieldError(fieldPath, error.code(), error.message()));
					break;
				}
			}
		}
	}

	@Override
	public String toString() {
		return "SchemaValidator(" + schema.name() + ")";
	}
}
