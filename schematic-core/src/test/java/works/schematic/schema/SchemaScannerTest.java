package works.schematic.schema;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.schematic.annotations.AutoIncrement;
import works.schematic.annotations.Entity;
import works.schematic.annotations.Field;
import works.schematic.annotations.Primary;
import works.schematic.annotations.Reference;
import works.schematic.annotations.Union;
import works.schematic.annotations.Validate;
import works.schematic.exceptions.SchemaDefinitionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaScannerTest {
	SchemaRegistry registry;

	static class Base {
		@Primary @AutoIncrement long id;
	}

	@Entity("item")
	static class Item extends Base {
		static int ignoredStatic;
		transient String ignoredTransient;

		@Field(name = "label") String title;
		@Field(optional = true, nullable = true) Integer count;
		double price = 9.5;
		List<String> tags = new ArrayList<>();
		Map<String, Double> ratings;
		Set<UUID> owners;
		Instant created;
		byte[] payload;
		ByteBuffer raw;
		@Field(type = "any") Object extra;
		@Field(groups = {"admin"}) String notes;
		@Validate(minLength = 2, maxLength = 10) String code;
		@Reference Owner owner;
		@Field(partialOf = Owner.class) Map<String, Object> ownerChanges;
		@Union(literals = "none", types = Owner.class, tags = "number") Object choice;
	}

	static class Owner {
		@Primary String name;
	}

	static class Counter {
		int count;
		boolean open;
		char mark;
		double ratio = 0.25;
		Integer boxed = 0;
	}

	static class TwoPrimaries {
		@Primary int a;
		@Primary int b;
	}

	static class IntegerKeys {
		Map<Integer, String> byNumber;
	}

	static class RawList {
		@SuppressWarnings("rawtypes") List items;
	}

	static class NoDefaultConstructor {
		String name;

		NoDefaultConstructor(String name) {
			this.name = name;
		}
	}

	static class BadOverride {
		@Field(type = "string") Object value;
	}

	@BeforeEach
	void setup() {
		registry = new SchemaRegistry();
	}

	@Test
	void scan_readsFieldsSuperclassFirst() {
		ClassSchema schema = registry.getSchema(Item.class);
		assertEquals("item", schema.name());
		assertThat(schema.fields().stream().map(FieldSchema::name).toList(), contains(
			"id", "label", "count", "price", "tags", "ratings", "owners", "created", "payload", "raw",
			"extra", "notes", "code", "owner", "ownerChanges", "choice"));
	}

	@Test
	void scan_mapsJavaTypesToTags() {
		ClassSchema schema = registry.getSchema(Item.class);
		assertEquals(TypeTag.NUMBER, schema.getField("id").type());
		assertEquals(TypeTag.STRING, schema.getField("label").type());
		assertEquals(TypeTag.ARRAY, schema.getField("tags").type());
		assertEquals(TypeTag.STRING, schema.getField("tags").element().type());
		assertEquals(TypeTag.MAP, schema.getField("ratings").type());
		assertEquals(TypeTag.NUMBER, schema.getField("ratings").element().type());
		assertEquals(TypeTag.UUID, schema.getField("owners").element().type());
		assertEquals(TypeTag.DATE, schema.getField("created").type());
		assertEquals(TypeTag.UINT8_ARRAY, schema.getField("payload").type());
		assertEquals(TypeTag.ARRAY_BUFFER, schema.getField("raw").type());
		assertEquals(TypeTag.ANY, schema.getField("extra").type());
		assertEquals(TypeTag.CLASS, schema.getField("owner").type());
		assertEquals(TypeTag.PARTIAL, schema.getField("ownerChanges").type());
		assertEquals(TypeTag.UNION, schema.getField("choice").type());
	}

	@Test
	void scan_readsModifiers() {
		ClassSchema schema = registry.getSchema(Item.class);
		FieldSchema id = schema.getField("id");
		assertTrue(id.isPrimary());
		assertTrue(id.isAutoIncrement());
		assertThat(schema.primaryField().orElseThrow(), sameInstance(id));
		assertThat(schema.autoIncrementField().orElseThrow(), sameInstance(id));

		FieldSchema label = schema.getField("label");
		assertEquals("title", label.memberName());
		assertFalse(label.optional());

		FieldSchema count = schema.getField("count");
		assertTrue(count.optional());
		assertTrue(count.nullable());

		assertEquals(Set.of("admin"), schema.getField("notes").groups());
		assertThat(schema.getField("code").validators(), hasSize(2));
		assertTrue(schema.getField("owner").isReference());
		assertThat(schema.getField("owner").referencedSchema(), sameInstance(registry.getSchema(Owner.class)));
	}

	@Test
	void scan_unionCandidatesInDeclarationOrder() {
		List<FieldSchema> candidates = registry.getSchema(Item.class).getField("choice").unionCandidates();
		assertThat(candidates.stream().map(FieldSchema::type).toList(), contains(TypeTag.LITERAL, TypeTag.CLASS, TypeTag.NUMBER));
		assertEquals("none", candidates.get(0).literalValue());
	}

	@Test
	void initializers_becomeDefaults() {
		ClassSchema schema = registry.getSchema(Item.class);
		FieldSchema price = schema.getField("price");
		assertTrue(price.hasDefault());
		assertTrue(price.defaultFromInitializer());
		assertEquals(9.5, price.defaultValue());

		FieldSchema tags = schema.getField("tags");
		assertEquals(List.of(), tags.defaultValue());
		assertThat(tags.defaultValue(), not(sameInstance(tags.defaultValue())));

		assertFalse(schema.getField("label").hasDefault());
		assertNull(schema.discriminantField());
	}

	@Test
	void primitiveZeroValues_areNotDefaults() {
		ClassSchema schema = registry.getSchema(Counter.class);
		assertFalse(schema.getField("count").hasDefault());
		assertFalse(schema.getField("open").hasDefault());
		assertFalse(schema.getField("mark").hasDefault());
		assertEquals(0.25, schema.getField("ratio").defaultValue());
		assertEquals(0, schema.getField("boxed").defaultValue());
		assertFalse(registry.getSchema(Item.class).getField("id").hasDefault());
	}

	@Test
	void getSchema_isMemoized() {
		assertThat(registry.getSchema(Item.class), sameInstance(registry.getSchema(Item.class)));
		assertTrue(registry.isRegistered(Item.class));
		assertFalse(new SchemaRegistry().isRegistered(Item.class));
	}

	@Test
	void register_replacesScannedSchema() {
		ClassSchema explicit = ClassSchema.builder("Custom", Owner.class)
			.field(FieldSchema.builder("name", TypeTag.STRING).primary())
			.build();
		registry.register(explicit);
		assertThat(registry.getSchema(Owner.class), sameInstance(explicit));
	}

	@Test
	void twoPrimaries_throws() {
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(TwoPrimaries.class));
	}

	@Test
	void nonStringMapKeys_throw() {
		SchemaDefinitionException e = assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(IntegerKeys.class));
		assertThat(e.getMessage(), containsString("byNumber"));
	}

	@Test
	void rawCollections_throw() {
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(RawList.class));
	}

	@Test
	void missingConstructor_throws() {
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(NoDefaultConstructor.class));
	}

	@Test
	void typeOverride_mustBeBinaryOrAny() {
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(BadOverride.class));
	}

	@Test
	void nonEntities_throw() {
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(Runnable.class));
		assertThrows(SchemaDefinitionException.class, () -> registry.getSchema(Kind.class));
	}

	enum Kind { A }
}
