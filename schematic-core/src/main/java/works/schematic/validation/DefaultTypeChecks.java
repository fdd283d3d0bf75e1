package works.schematic.validation;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.EnumValues;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.TypeTag;
import works.schematic.serializer.BinaryCodec;

import static works.schematic.validation.ValidationCompiler.childPath;

/**
 * The built-in type checks. Each accepts both the entity-side and the external form
 * of its values, so that plain data and entities validate alike.
 */
final class DefaultTypeChecks {
	private DefaultTypeChecks() { }

	static void registerAll(TypeCheckRegistry registry) {
		registry.register(TypeTag.STRING, simple(
			v -> v instanceof CharSequence || v instanceof Character,
			"invalid_string", "No string given"));
		registry.register(TypeTag.NUMBER, simple(
			v -> v instanceof Number n && !Double.isNaN(n.doubleValue()),
			"invalid_number", "No number given"));
		registry.register(TypeTag.BOOLEAN, simple(
			v -> v instanceof Boolean,
			"invalid_boolean", "No Boolean given"));
		registry.register(TypeTag.DATE, simple(
			v -> v instanceof Instant || v instanceof String s && isInstant(s),
			"invalid_date", "No Date given"));
		registry.register(TypeTag.UUID, simple(
			v -> v instanceof UUID || v instanceof String s && UUID_PATTERN.matcher(s).matches(),
			"invalid_uuid", "No UUID given"));
		registry.register(TypeTag.ANY, (field, compiler) -> TypeCheck.ANYTHING);

		registry.register(TypeTag.ENUM, (field, compiler) -> {
			EnumValues values = EnumValues.of(field.enumType());
			boolean allowLabels = field.allowLabelsAsValue();
			String message = "Invalid enum value received. Allowed: " + String.join(",",
				values.validInputs(allowLabels).stream().map(String::valueOf).toList());
			return simple(v -> values.isValid(v, allowLabels), "invalid_enum", message)
				.generate(field, compiler);
		});

		registry.register(TypeTag.LITERAL, (field, compiler) -> {
			Object literal = field.literalValue();
			return simple(v -> Objects.equals(v, literal), "invalid_literal", "Invalid literal value, expected " + literal)
				.generate(field, compiler);
		});

		registry.register(TypeTag.CLASS, DefaultTypeChecks::classCheck);
		registry.register(TypeTag.PARTIAL, DefaultTypeChecks::partialCheck);
		registry.register(TypeTag.ARRAY, DefaultTypeChecks::arrayCheck);
		registry.register(TypeTag.MAP, DefaultTypeChecks::mapCheck);
		registry.register(TypeTag.UNION, DefaultTypeChecks::unionCheck);

		for (TypeTag tag : List.of(TypeTag.ARRAY_BUFFER, TypeTag.UINT8_ARRAY, TypeTag.INT8_ARRAY, TypeTag.INT16_ARRAY,
			TypeTag.INT32_ARRAY, TypeTag.FLOAT32_ARRAY, TypeTag.FLOAT64_ARRAY)) {
			registry.register(tag, (field, compiler) -> simple(
				v -> field.javaType().isInstance(v) || BinaryCodec.isBinary(v) || v instanceof String s && BinaryCodec.isBase64(s),
				"invalid_type", "No binary data given").generate(field, compiler));
		}
	}

	private interface Condition {
		boolean test(Object value);
	}

	private static TypeCheckGenerator simple(Condition condition, String code, String message) {
		TypeCheck check = (value, path, errors) -> {
			if (!condition.test(value)) {
				errors.add(new FieldError(path, code, message));
			}
		};
		return (field, compiler) -> check;
	}

	private static TypeCheck classCheck(FieldSchema field, ValidationCompiler compiler) {
		ClassSchema schema = field.referencedSchema();
		ValidatorPipeline nested = compiler.compileValidator(schema);
		TypeCheck primaryKeyCheck = field.isReference() && schema.primaryField().isPresent()
			? compiler.typeCheckFor(schema.requirePrimaryField())
			: null;
		return (value, path, errors) -> {
			if (value instanceof Map<?, ?> || schema.entityClass().isInstance(value)) {
				nested.validate(value, path, errors);
			} else if (primaryKeyCheck != null) {
				primaryKeyCheck.check(value, path, errors);
			} else {
				errors.add(new FieldError(path, "invalid_type", "Type is not an object"));
			}
		};
	}

	private static TypeCheck partialCheck(FieldSchema field, ValidationCompiler compiler) {
		Map<String, TypeCheck> checks = new LinkedHashMap<>();
		for (FieldSchema f : field.referencedSchema().fields()) {
			if (!f.isParentReference()) {
				checks.put(f.name(), compiler.typeCheckFor(f));
			}
		}
		return (value, path, errors) -> {
			if (!(value instanceof Map<?, ?> map)) {
				errors.add(new FieldError(path, "invalid_type", "Type is not an object"));
				return;
			}
			checks.forEach((name, check) -> {
				Object v = map.get(name);
				if (v != null) {
					check.check(v, childPath(path, name), errors);
				}
			});
		};
	}

	private static TypeCheck arrayCheck(FieldSchema field, ValidationCompiler compiler) {
		TypeCheck elementCheck = compiler.typeCheckFor(field.element());
		boolean elementNullable = field.element().nullable();
		return (value, path, errors) -> {
			if (!(value instanceof Collection<?> items)) {
				errors.add(new FieldError(path, "invalid_type", "Type is not an array"));
				return;
			}
			int i = 0;
			for (Object item : items) {
				String itemPath = childPath(path, Integer.toString(i++));
				if (item != null) {
					elementCheck.check(item, itemPath, errors);
				} else if (!elementNullable) {
					errors.add(new FieldError(itemPath, "required", "Required value is null"));
				}
			}
		};
	}

	private static TypeCheck mapCheck(FieldSchema field, ValidationCompiler compiler) {
		TypeCheck elementCheck = compiler.typeCheckFor(field.element());
		boolean elementNullable = field.element().nullable();
		return (value, path, errors) -> {
			if (!(value instanceof Map<?, ?> map)) {
				errors.add(new FieldError(path, "invalid_type", "Type is not an object"));
				return;
			}
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				String entryPath = childPath(path, String.valueOf(entry.getKey()));
				if (entry.getValue() != null) {
					elementCheck.check(entry.getValue(), entryPath, errors);
				} else if (!elementNullable) {
					errors.add(new FieldError(entryPath, "required", "Required value is null"));
				}
			}
		};
	}

	private static TypeCheck unionCheck(FieldSchema field, ValidationCompiler compiler) {
		List<TypeCheck> candidates = new ArrayList<>();
		for (FieldSchema candidate : field.unionCandidates()) {
			candidates.add(compiler.typeCheckFor(candidate));
		}
		return (value, path, errors) -> {
			for (TypeCheck candidate : candidates) {
				List<FieldError> candidateErrors = new ArrayList<>();
				candidate.check(value, path, candidateErrors);
				if (candidateErrors.isEmpty()) {
					return;
				}
			}
			errors.add(new FieldError(path, "invalid_union", "No compatible type for union found"));
		};
	}

	private static boolean isInstant(String text) {
		try {
			Instant.parse(text);
			return true;
		} catch (DateTimeParseException e) {
			return false;
		}
	}

	private static final Pattern UUID_PATTERN = Pattern.compile(
		"[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
}
