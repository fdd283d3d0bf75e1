package works.schematic.validation;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.schematic.annotations.Field;
import works.schematic.annotations.Primary;
import works.schematic.annotations.Reference;
import works.schematic.annotations.Validate;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.SchemaRegistry;
import works.schematic.schema.TypeTag;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationCompilerTest {
	SchemaRegistry registry;
	ValidationCompiler compiler;

	enum Color { RED, GREEN }

	static class Inner {
		String label;
	}

	static class Outer {
		String name;
		Inner inner;
		List<String> tags;
		@Field(optional = true) Color color;
		@Field(nullable = true) String note;
		int count;
		@Field(optional = true) @Validate(minimum = 1, maximum = 10) Integer rating;
	}

	static class Box {
		int count;
		boolean open;
		double ratio = 0.5;
	}

	static class Node {
		String name;
		@Field(optional = true) Node child;
	}

	static class Owner {
		@Primary Integer id;
	}

	static class Pet {
		@Reference Owner owner;
	}

	@BeforeEach
	void setup() {
		registry = new SchemaRegistry();
		compiler = new ValidationCompiler();
	}

	@Test
	void plainData_validWhenShapesMatch() {
		Map<String, Object> data = new HashMap<>();
		data.put("name", "n");
		data.put("inner", Map.of("label", "l"));
		data.put("tags", List.of("a", "b"));
		data.put("color", "GREEN");
		data.put("note", null);
		data.put("count", 3);
		assertThat(validate(Outer.class, data), empty());
	}

	@Test
	void errors_carryNestedPaths() {
		Map<String, Object> data = new HashMap<>();
		data.put("name", "n");
		data.put("inner", Map.of("label", 5));
		data.put("tags", Arrays.asList("a", 7, null));
		data.put("note", "x");
		data.put("count", "three");

		List<FieldError> errors = validate(Outer.class, data);

		assertEquals(List.of(
			new FieldError("inner.label", "invalid_string", "No string given"),
			new FieldError("tags.1", "invalid_string", "No string given"),
			new FieldError("tags.2", "required", "Required value is null"),
			new FieldError("count", "invalid_number", "No number given")
		), errors);
	}

	@Test
	void enumErrors_listAllowedValues() {
		Map<String, Object> data = new HashMap<>();
		data.put("name", "n");
		data.put("inner", Map.of("label", "l"));
		data.put("tags", List.of());
		data.put("color", "BLUE");
		data.put("note", null);
		data.put("count", 1);

		assertEquals(List.of(new FieldError("color", "invalid_enum", "Invalid enum value received. Allowed: RED,GREEN")),
			validate(Outer.class, data));
	}

	@Test
	void customRules_runAfterTypeChecks() {
		Map<String, Object> data = new HashMap<>();
		data.put("name", "n");
		data.put("inner", Map.of("label", "l"));
		data.put("tags", List.of());
		data.put("note", null);
		data.put("count", 1);

		data.put("rating", 11);
		assertEquals(List.of(new FieldError("rating", "maximum", "Number needs to be smaller than or equal to 10")),
			validate(Outer.class, data));

		data.put("rating", "high");
		assertEquals(List.of(new FieldError("rating", "invalid_number", "No number given")),
			validate(Outer.class, data));
	}

	@Test
	void entities_reportMissingRequiredFields() {
		Outer outer = new Outer();
		outer.name = "n";
		outer.tags = List.of("a");

		List<FieldError> errors = validate(Outer.class, outer);

		assertEquals(List.of(
			new FieldError("inner", "required", "Required value is undefined")
		), errors);
	}

	@Test
	void entities_validateNestedEntities() {
		Outer outer = new Outer();
		outer.name = "n";
		outer.tags = List.of();
		outer.inner = new Inner();
		outer.color = Color.RED;

		assertEquals(List.of(new FieldError("inner.label", "required", "Required value is undefined")),
			validate(Outer.class, outer));

		outer.inner.label = "l";
		assertTrue(compiler.compileValidator(registry.getSchema(Outer.class)).isValid(outer));
	}

	@Test
	void primitiveFields_areRequiredUnlessInitialized() {
		assertEquals(List.of(
			new FieldError("count", "required", "Required value is undefined"),
			new FieldError("open", "required", "Required value is undefined")
		), validate(Box.class, Map.of()));
		assertThat(validate(Box.class, Map.of("count", 0, "open", false)), empty());
		assertThat(validate(Box.class, new Box()), empty());
	}

	@Test
	void nonObjects_areRejected() {
		assertEquals(List.of(new FieldError("", "invalid_type", "Type is not an object")), validate(Inner.class, "text"));
	}

	@Test
	void selfReferencingSchema_validatesRecursively() {
		Map<String, Object> data = Map.of("name", "a", "child", Map.of("name", "b", "child", Map.of("name", 3)));
		assertEquals(List.of(new FieldError("child.child.name", "invalid_string", "No string given")),
			validate(Node.class, data));
	}

	@Test
	void references_acceptPrimaryKeys() {
		assertThat(validate(Pet.class, Map.of("owner", 4)), empty());
		assertThat(validate(Pet.class, Map.of("owner", Map.of("id", 4))), empty());
		assertThat(validate(Pet.class, Map.of("owner", "four")), contains(
			new FieldError("owner", "invalid_number", "No number given")));
	}

	@Test
	void unions_needOneMatchingCandidate() {
		ClassSchema schema = ClassSchema.builder("Choice", Map.class)
			.field(FieldSchema.union("value",
				FieldSchema.literal("value", "none"),
				FieldSchema.of("value", TypeTag.NUMBER)))
			.build();
		assertThat(compiler.compileValidator(schema).validate(Map.of("value", "none")), empty());
		assertThat(compiler.compileValidator(schema).validate(Map.of("value", 2)), empty());
		assertEquals(List.of(new FieldError("value", "invalid_union", "No compatible type for union found")),
			compiler.compileValidator(schema).validate(Map.of("value", "some")));
	}

	@Test
	void customTypeChecks_replaceDefaults() {
		TypeCheckRegistry custom = TypeCheckRegistry.withDefaults()
			.register(TypeTag.STRING, (field, c) -> (value, path, errors) -> {
				if (!"ok".equals(value)) {
					errors.add(new FieldError(path, "not_ok", "Must be ok"));
				}
			});
		ValidationCompiler customCompiler = new ValidationCompiler(custom);
		ClassSchema schema = registry.getSchema(Inner.class);
		assertTrue(customCompiler.compileValidator(schema).isValid(Map.of("label", "ok")));
		assertFalse(customCompiler.compileValidator(schema).isValid(Map.of("label", "fine")));
	}

	@Test
	void validators_areCachedUntilReset() {
		ClassSchema schema = registry.getSchema(Node.class);
		ValidatorPipeline first = compiler.compileValidator(schema);
		assertThat(compiler.compileValidator(schema), sameInstance(first));
		compiler.reset();
		assertEquals(first.validate(Map.of("name", 1)), compiler.compileValidator(schema).validate(Map.of("name", 1)));
	}

	@Test
	void builtInRules_reportCodesAndMessages() {
		FieldSchema field = FieldSchema.of("f", TypeTag.STRING);
		assertEquals(new PropertyValidatorError("minLength", "Min length is 3"), Validators.minLength(3).validate("ab", field));
		assertNull(Validators.minLength(3).validate("abc", field));
		assertEquals(new PropertyValidatorError("maxLength", "Max length is 1"), Validators.maxLength(1).validate(List.of(1, 2), field));
		assertEquals(new PropertyValidatorError("pattern", "Pattern [a-z]+ does not match"), Validators.pattern("[a-z]+").validate("A1", field));
		assertEquals(new PropertyValidatorError("minimum", "Number needs to be greater than or equal to 0.5"), Validators.minimum(0.5).validate(0, field));
		assertNull(Validators.maximum(2).validate("not a number", field));
	}

	private List<FieldError> validate(Class<?> entityClass, Object value) {
		return compiler.compileValidator(registry.getSchema(entityClass)).validate(value);
	}
}
