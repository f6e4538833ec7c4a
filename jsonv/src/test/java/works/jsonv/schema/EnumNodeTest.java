package works.jsonv.schema;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import works.jsonv.codec.Holder;
import works.jsonv.codec.ValidatingParser;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.InvalidData;
import works.jsonv.validation.ValidationErrors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonv.schema.Schemas.integer;
import static works.jsonv.schema.Schemas.oneOf;
import static works.jsonv.schema.Schemas.property;
import static works.jsonv.schema.Schemas.slice;
import static works.jsonv.schema.Schemas.string;
import static works.jsonv.schema.Schemas.struct;
import static works.jsonv.validation.Validators.maxLength;

class EnumNodeTest {

	static class Shirt {
		String size;
		int sleeves;
	}

	@Test
	void allowedString() throws IOException {
		Holder<String> holder = new Holder<>();
		assertTrue(ValidatingParser.of(String.class, oneOf(string(), "a", "b")).parse("\"b\"", holder).isEmpty());
		assertEquals("b", holder.value());
	}

	@Test
	void disallowedValueIsNotAssigned() throws IOException {
		Holder<String> holder = new Holder<>("before");
		ValidationErrors errors = ValidatingParser.of(String.class, oneOf(string(), "a", "b")).parse("\"c\"", holder);
		assertEquals(ValidationErrors.of(new InvalidData("/", "Must be one of: a,b")), errors);
		assertEquals("before", holder.value());
	}

	@Test
	void delegateErrorsAreNotRepeated() throws IOException {
		Holder<String> holder = new Holder<>();
		ValidationErrors errors = ValidatingParser.of(String.class, oneOf(string(maxLength(1)), "a", "bb")).parse("\"bb\"", holder);
		assertEquals(ValidationErrors.of(new InvalidData("/", "Must be no more than 1 characters long")), errors);
		assertNull(holder.value());

		assertEquals(ValidationErrors.of(new InvalidData("/", "Must not be null")),
			ValidatingParser.of(String.class, oneOf(string(), "a")).parse("null", new Holder<>()));
	}

	@Test
	void structFields() throws IOException {
		ValidatingParser<Shirt> parser = ValidatingParser.of(Shirt.class, struct(
			property("size", oneOf(string(), "S", "M", "L")),
			property("sleeves", oneOf(integer(), 0, 2))));
		Shirt shirt = new Shirt();
		ValidationErrors errors = parser.parse("{\"size\": \"XL\", \"sleeves\": 1}", shirt);
		assertEquals(ValidationErrors.of(
			new InvalidData("/size", "Must be one of: S,M,L"),
			new InvalidData("/sleeves", "Must be one of: 0,2")
		), errors);
		assertNull(shirt.size);

		assertTrue(parser.parse("{\"size\": \"M\", \"sleeves\": 2}", shirt).isEmpty());
		assertEquals("M", shirt.size);
		assertEquals(2, shirt.sleeves);
	}

	@Test
	void arraysCompareStructurally() throws IOException {
		ValidatingParser<int[]> parser = ValidatingParser.of(int[].class,
			oneOf(slice(integer()), new int[]{1, 2}, new int[]{3}));
		Holder<int[]> holder = new Holder<>();
		assertTrue(parser.parse("[1, 2]", holder).isEmpty());
		assertArrayEquals(new int[]{1, 2}, holder.value());
		assertEquals(ValidationErrors.of(new InvalidData("/", "Must be one of: [1, 2],[3]")),
			parser.parse("[2, 1]", new Holder<>()));
	}

	@Test
	void allowedValuesMustFitDestination() {
		assertThrows(InvalidTypeException.class, () -> oneOf(integer(), 1L, 2L).prepare(int.class));
		assertThrows(InvalidTypeException.class, () -> oneOf(string(), "a", 1).prepare(String.class));
		assertThrows(IllegalArgumentException.class, () -> oneOf(string()));
	}
}
