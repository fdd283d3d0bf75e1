package works.schematic.compiler;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.schematic.ConverterOptions;
import works.schematic.Schematic;
import works.schematic.annotations.Field;
import works.schematic.annotations.Union;
import works.schematic.exceptions.NoMatchingUnionVariantException;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.TypeTag;
import works.schematic.serializer.JsonSerializer;
import works.schematic.serializer.Serializer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.schematic.serializer.Direction.DECODE;
import static works.schematic.serializer.Direction.ENCODE;

class UnionResolverTest {
	Schematic schematic;
	ClassSchema holder;

	static class Cat {
		@Field(literal = "cat") String type;
		String name;
	}

	static class Dog {
		@Field(literal = "dog") String type;
		int barks;
	}

	static class Pet {
		@Union(types = {Cat.class, Dog.class}) Object animal;
	}

	static class Coordinate {
		double x;
	}

	static class Marker {
		@Union(literals = {"a", "b"}, types = Coordinate.class) Object value;
	}

	static class Amount {
		@Union(tags = "number") Object value;
	}

	static class Setting {
		@Field(optional = true) @Union(literals = {"on", "off"}, tags = "boolean") Object value;
	}

	@BeforeEach
	void setup() {
		schematic = new Schematic();
		ClassSchema point = ClassSchema.builder("Point", Map.class)
			.field(FieldSchema.of("x", TypeTag.NUMBER))
			.build();
		holder = ClassSchema.builder("Holder", Map.class)
			.field(FieldSchema.union("value",
				FieldSchema.literal("value", "a"),
				FieldSchema.literal("value", "b"),
				FieldSchema.builder("value", TypeTag.CLASS).schema(point).build()))
			.build();
	}

	@Test
	void literalCandidate_matchesItsLiteral() {
		assertEquals(Map.of("value", "a"), decode(Map.of("value", "a")));
		assertEquals(Map.of("value", "b"), decode(Map.of("value", "b")));
	}

	@Test
	void shapeCandidate_matchesObjectOfItsShape() {
		assertEquals(Map.of("value", Map.of("x", 5.0)), decode(Map.of("value", Map.of("x", 5))));
	}

	@Test
	void shapeCandidate_requiresPrimitiveFields() {
		Marker marker = schematic.plainToClass(Marker.class, Map.of("value", Map.of("x", 2)));
		assertThat(marker.value, instanceOf(Coordinate.class));
		assertEquals(2.0, ((Coordinate) marker.value).x);

		assertThrows(NoMatchingUnionVariantException.class, () ->
			schematic.plainToClass(Marker.class, Map.of("value", Map.of("y", "junk"))));
	}

	@Test
	void noMatch_throwsNamingCandidates() {
		NoMatchingUnionVariantException e = assertThrows(NoMatchingUnionVariantException.class, () ->
			decode(Map.of("value", "z")));
		assertEquals("value", e.fieldName());
		assertEquals("value", e.path());
		assertThat(e.discriminants(), hasItems("a", "b"));
	}

	@Test
	void noMatch_fallsBackToDefault() {
		ClassSchema withDefault = ClassSchema.builder("Defaulted", Map.class)
			.field(FieldSchema.builder("value", TypeTag.UNION)
				.candidates(holder.getField("value").unionCandidates())
				.defaultValue("b"))
			.build();
		Object result = schematic.convert(withDefault, JsonSerializer.NAME, DECODE, Map.of("value", "z"));
		assertEquals(Map.of("value", "b"), result);
	}

	@Test
	void noMatch_optionalLeavesUnset() {
		Setting setting = schematic.plainToClass(Setting.class, Map.of("value", "maybe"));
		assertNull(setting.value);
	}

	@Test
	void discriminatedClasses_selectedByLiteral() {
		Pet pet = schematic.plainToClass(Pet.class, Map.of("animal", Map.of("type", "dog", "barks", 3)));
		assertThat(pet.animal, instanceOf(Dog.class));
		assertEquals(3, ((Dog) pet.animal).barks);

		pet = schematic.plainToClass(Pet.class, Map.of("animal", Map.of("type", "cat", "name", "Tom")));
		assertThat(pet.animal, instanceOf(Cat.class));
		assertEquals("Tom", ((Cat) pet.animal).name);
	}

	@Test
	void discriminatedClasses_encodeByInstanceType() {
		Pet pet = new Pet();
		Dog dog = new Dog();
		dog.barks = 2;
		pet.animal = dog;
		assertEquals(Map.of("animal", Map.of("type", "dog", "barks", 2)), schematic.classToPlain(Pet.class, pet));
	}

	@Test
	void discriminatedClasses_unknownDiscriminantNamesLiterals() {
		NoMatchingUnionVariantException e = assertThrows(NoMatchingUnionVariantException.class, () ->
			schematic.plainToClass(Pet.class, Map.of("animal", Map.of("type", "cow"))));
		assertThat(e.discriminants(), contains("cat", "dog"));
	}

	@Test
	void looseGuards_acceptNumericText() {
		Amount amount = schematic.plainToClass(Amount.class, Map.of("value", "12"));
		assertEquals(12.0, amount.value);
	}

	@Test
	void looseGuards_disabledByOptions() {
		ConverterOptions strict = ConverterOptions.builder().loosely(false).build();
		assertThrows(NoMatchingUnionVariantException.class, () ->
			schematic.plainToClass(Amount.class, Map.of("value", "12"), strict));
	}

	@Test
	void strictGuardsWin_overLooseOnes() {
		Setting on = schematic.plainToClass(Setting.class, Map.of("value", "on"));
		assertEquals("on", on.value);
		Setting loose = schematic.plainToClass(Setting.class, Map.of("value", "true"));
		assertEquals(true, loose.value);
		Setting exact = schematic.plainToClass(Setting.class, Map.of("value", false));
		assertEquals(false, exact.value);
	}

	@Test
	void candidatesWithoutGuards_failToCompile() {
		Serializer bare = new Serializer("bare");
		schematic.addSerializer(bare);
		assertThrows(SchemaDefinitionException.class, () ->
			schematic.pipeline(holder, "bare", ENCODE));
	}

	private Object decode(Map<String, ?> input) {
		return schematic.convert(holder, JsonSerializer.NAME, DECODE, input);
	}
}
