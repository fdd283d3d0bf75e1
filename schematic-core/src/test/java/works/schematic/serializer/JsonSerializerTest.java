package works.schematic.serializer;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.schematic.ConverterOptions;
import works.schematic.Schematic;
import works.schematic.ScopedSerializer;
import works.schematic.annotations.Field;
import works.schematic.annotations.Primary;
import works.schematic.annotations.Reference;
import works.schematic.exceptions.ConversionException;
import works.schematic.exceptions.InvalidEnumValueException;
import works.schematic.schema.TypeTag;
import works.schematic.schema.ValuedEnum;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class JsonSerializerTest {
	Schematic schematic;

	enum Color { RED, GREEN }

	enum Size implements ValuedEnum {
		SMALL("s"), LARGE("l");

		private final String value;

		Size(String value) {
			this.value = value;
		}

		@Override
		public Object value() {
			return value;
		}
	}

	enum Level implements ValuedEnum {
		LOW(1), HIGH(2);

		private final int value;

		Level(int value) {
			this.value = value;
		}

		@Override
		public Object value() {
			return value;
		}
	}

	static class Gauge {
		Level level;
	}

	static class Shirt {
		Color color;
		Size size;
		@Field(optional = true, allowLabelsAsValue = true) Size altSize;
	}

	static class Event {
		Instant at;
		UUID id;
	}

	static class Blob {
		byte[] data;
		int[] ints;
		double[] doubles;
		ByteBuffer buffer;
	}

	static class Flags {
		boolean on;
		@Field(nullable = true) Boolean maybe;
		int count;
		char initial;
	}

	static class Inner {
		String label;
	}

	static class Wrapper {
		@Field(optional = true) Inner inner;
		@Field(optional = true) List<Inner> list;
		@Field(optional = true) Set<String> tags;
		@Field(optional = true) Map<String, Integer> scores;
		@Field(optional = true) Object anything;
	}

	static class Customer {
		@Primary Integer id;
		String name;
	}

	static class Order {
		@Reference Customer customer;
	}

	static class Cat {
		@Field(literal = "cat") String type;
		String name;
	}

	static class Account {
		String name;
		@Field(groups = "secret") String password;
		@Field(groups = {"secret", "audit"}) String lastLogin;
	}

	@BeforeEach
	void setup() {
		schematic = new Schematic();
	}

	@Test
	void enums_decodeValuesAndOptionallyLabels() {
		Shirt shirt = schematic.plainToClass(Shirt.class, Map.of("color", "RED", "size", "s", "altSize", "LARGE"));
		assertEquals(Color.RED, shirt.color);
		assertEquals(Size.SMALL, shirt.size);
		assertEquals(Size.LARGE, shirt.altSize);
		assertEquals(Map.of("color", "RED", "size", "s", "altSize", "l"), schematic.classToPlain(Shirt.class, shirt));
	}

	@Test
	void invalidEnum_listsValidValues() {
		InvalidEnumValueException e = assertThrows(InvalidEnumValueException.class, () ->
			schematic.plainToClass(Shirt.class, Map.of("color", "BLUE", "size", "s")));
		assertEquals("color", e.path());
		assertEquals("BLUE", e.value());
		assertEquals(List.of("RED", "GREEN"), e.validValues());
	}

	@Test
	void enumLabel_rejectedUnlessAllowed() {
		InvalidEnumValueException e = assertThrows(InvalidEnumValueException.class, () ->
			schematic.plainToClass(Shirt.class, Map.of("color", "RED", "size", "SMALL")));
		assertEquals(List.of("s", "l"), e.validValues());
	}

	@Test
	void datesAndUuids_roundTrip() {
		UUID id = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
		Event event = schematic.plainToClass(Event.class, Map.of("at", "2020-01-02T03:04:05Z", "id", id.toString()));
		assertEquals(Instant.parse("2020-01-02T03:04:05Z"), event.at);
		assertEquals(id, event.id);
		assertEquals(Map.of("at", "2020-01-02T03:04:05Z", "id", id.toString()), schematic.classToPlain(Event.class, event));
	}

	@Test
	void dates_acceptEpochMillis() {
		Event event = schematic.plainToClass(Event.class, Map.of("at", 1000));
		assertEquals(Instant.ofEpochMilli(1000), event.at);
	}

	@Test
	void invalidDate_throws() {
		ConversionException e = assertThrows(ConversionException.class, () ->
			schematic.plainToClass(Event.class, Map.of("at", "yesterday")));
		assertEquals("at", e.path());
	}

	@Test
	void invalidUuid_throws() {
		assertThrows(ConversionException.class, () -> schematic.plainToClass(Event.class, Map.of("id", "nope")));
	}

	@Test
	void binary_isBase64OfLittleEndianBytes() {
		Blob blob = new Blob();
		blob.data = new byte[]{1, 2, 3};
		blob.ints = new int[]{1};
		blob.doubles = new double[]{1.5, -2};
		blob.buffer = ByteBuffer.wrap(new byte[]{9});

		Map<String, Object> plain = schematic.classToPlain(Blob.class, blob);
		assertEquals("AQID", plain.get("data"));
		assertEquals("AQAAAA==", plain.get("ints"));
		assertEquals("CQ==", plain.get("buffer"));

		Blob decoded = schematic.plainToClass(Blob.class, plain);
		assertArrayEquals(blob.data, decoded.data);
		assertArrayEquals(blob.ints, decoded.ints);
		assertArrayEquals(blob.doubles, decoded.doubles);
		assertEquals(ByteBuffer.wrap(new byte[]{9}), decoded.buffer);
	}

	@Test
	void binary_wrongLengthThrows() {
		// Three bytes can't hold a whole int
		assertThrows(ConversionException.class, () -> schematic.plainToClass(Blob.class, Map.of("ints", "AQID")));
	}

	@ParameterizedTest
	@MethodSource("booleanInputs")
	void booleans_acceptCommonSpellings(Object input, Boolean expected) {
		Flags flags = schematic.plainToClass(Flags.class, Map.of("maybe", input));
		assertEquals(expected, flags.maybe);
	}

	static Stream<Arguments> booleanInputs() {
		return Stream.of(
			arguments(true, true),
			arguments("true", true),
			arguments("1", true),
			arguments(1, true),
			arguments(false, false),
			arguments("false", false),
			arguments("0", false),
			arguments(0, false),
			arguments(1.0, true),
			arguments("yes", null),
			arguments(2, null),
			arguments(Double.NaN, null),
			arguments(Double.NEGATIVE_INFINITY, null)
		);
	}

	@Test
	void nullableField_keepsNull() {
		Map<String, Object> input = new HashMap<>();
		input.put("maybe", null);
		input.put("on", null);
		Flags flags = schematic.plainToClass(Flags.class, input);
		assertNull(flags.maybe);
		assertFalse(flags.on);
	}

	@Test
	void numbers_coerceToFieldType() {
		assertEquals(12, schematic.plainToClass(Flags.class, Map.of("count", "12")).count);
		assertEquals(3, schematic.plainToClass(Flags.class, Map.of("count", 3.0)).count);
		assertEquals(1, schematic.plainToClass(Flags.class, Map.of("count", true)).count);
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", "twelve")).count);
	}

	@Test
	void numbers_thatDoNotFitTheFieldAreLeftUnset() {
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", 3000000000L)).count);
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", "3000000000")).count);
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", 2.9)).count);
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", Double.NaN)).count);
		assertEquals(0, schematic.plainToClass(Flags.class, Map.of("count", Double.POSITIVE_INFINITY)).count);
	}

	@Test
	void convertedValuesThatDoNotFit_throwWithPath() {
		schematic.registerTypeConverter(JsonSerializer.NAME, Direction.DECODE, TypeTag.NUMBER,
			(field, state) -> (value, ctx) -> 3000000000L);
		ConversionException e = assertThrows(ConversionException.class, () ->
			schematic.plainToClass(Flags.class, Map.of("count", 1)));
		assertEquals("count", e.path());
	}

	@Test
	void numericEnumValues_matchByValue() {
		assertEquals(Level.HIGH, schematic.plainToClass(Gauge.class, Map.of("level", 2.0)).level);
		assertEquals(Level.LOW, schematic.plainToClass(Gauge.class, Map.of("level", 1)).level);
		InvalidEnumValueException e = assertThrows(InvalidEnumValueException.class, () ->
			schematic.plainToClass(Gauge.class, Map.of("level", Double.NaN)));
		assertEquals("level", e.path());
	}

	@Test
	void strings_stringifyAndFillChars() {
		Flags flags = schematic.plainToClass(Flags.class, Map.of("initial", "Xavier"));
		assertEquals('X', flags.initial);
		assertEquals("X", schematic.classToPlain(Flags.class, flags).get("initial"));
	}

	@Test
	void nestedValues_roundTrip() {
		Map<String, Object> plain = Map.of(
			"inner", Map.of("label", "a"),
			"list", List.of(Map.of("label", "b"), Map.of("label", "c")),
			"tags", List.of("x", "y"),
			"scores", Map.of("math", 90),
			"anything", List.of(1, "two"));

		Wrapper wrapper = schematic.plainToClass(Wrapper.class, plain);

		assertEquals("a", wrapper.inner.label);
		assertEquals(List.of("b", "c"), wrapper.list.stream().map(i -> i.label).toList());
		assertThat(wrapper.tags, instanceOf(LinkedHashSet.class));
		assertThat(wrapper.tags, contains("x", "y"));
		assertEquals(Map.of("math", 90), wrapper.scores);
		assertEquals(List.of(1, "two"), wrapper.anything);

		Map<String, Object> encoded = schematic.classToPlain(Wrapper.class, wrapper);
		assertEquals(plain.get("inner"), encoded.get("inner"));
		assertEquals(plain.get("list"), encoded.get("list"));
		assertEquals(new ArrayList<>(wrapper.tags), encoded.get("tags"));
		assertEquals(plain.get("scores"), encoded.get("scores"));
	}

	@Test
	void nestedEntityAsJsonText_isParsed() {
		Wrapper wrapper = schematic.plainToClass(Wrapper.class, Map.of("inner", "{\"label\":\"x\"}"));
		assertEquals("x", wrapper.inner.label);
	}

	@Test
	void nestedEntityAsUnparseableText_isLeftUnset() {
		Wrapper wrapper = schematic.plainToClass(Wrapper.class, Map.of("inner", "not json"));
		assertNull(wrapper.inner);
	}

	@Test
	void references_acceptPrimaryKeys() {
		Order byKey = schematic.plainToClass(Order.class, Map.of("customer", 7));
		assertEquals(7, byKey.customer.id);
		assertNull(byKey.customer.name);

		Order byValue = schematic.plainToClass(Order.class, Map.of("customer", Map.of("id", 8, "name", "Ann")));
		assertEquals(8, byValue.customer.id);
		assertEquals("Ann", byValue.customer.name);
	}

	@Test
	void literal_isSuppliedWhenAbsentAndAlwaysEncoded() {
		Cat cat = schematic.plainToClass(Cat.class, Map.of("name", "Tom"));
		assertEquals("cat", cat.type);

		Cat overridden = schematic.plainToClass(Cat.class, Map.of("type", "dog", "name", "Rex"));
		assertEquals("cat", overridden.type);

		cat.type = null;
		assertEquals(Map.of("type", "cat", "name", "Tom"), schematic.classToPlain(Cat.class, cat));
	}

	@Test
	void groups_filterFields() {
		Account account = new Account();
		account.name = "ann";
		account.password = "pw";
		account.lastLogin = "today";
		ScopedSerializer<Account> json = schematic.serializerFor(Account.class);

		assertEquals(Map.of("name", "ann"),
			json.serialize(account, ConverterOptions.builder().groupsExclude(Set.of("secret")).build()));
		assertEquals(Map.of("password", "pw", "lastLogin", "today"),
			json.serialize(account, ConverterOptions.builder().groups(Set.of("secret")).build()));
		assertEquals(Map.of("name", "ann", "password", "pw"),
			json.serialize(account, ConverterOptions.builder().groupsExclude(Set.of("audit")).build()));

		Account decoded = json.deserialize(Map.of("name", "bob", "password", "x"),
			ConverterOptions.builder().groups(Set.of("audit")).build());
		assertNull(decoded.name);
		assertNull(decoded.password);
	}

	@Test
	void helpers_recognizeBooleansAndLiterals() {
		assertTrue(JsonSerializer.sameLiteral(1, 1.0));
		assertFalse(JsonSerializer.sameLiteral("1", 1));
		assertNull(JsonSerializer.toBoolean("maybe"));
		assertNull(JsonSerializer.parseInstant("2020-13-01"));
	}
}
