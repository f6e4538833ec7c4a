package works.jsonv.schema;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonv.codec.Holder;
import works.jsonv.codec.ValidatingParser;
import works.jsonv.exceptions.InvalidFieldTypeException;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonContentException;
import works.jsonv.exceptions.JsonFormatException;
import works.jsonv.exceptions.JsonSyntaxException;
import works.jsonv.validation.InvalidData;
import works.jsonv.validation.ValidationErrors;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonv.schema.Schemas.integer;
import static works.jsonv.schema.Schemas.property;
import static works.jsonv.schema.Schemas.slice;
import static works.jsonv.schema.Schemas.string;
import static works.jsonv.schema.Schemas.struct;
import static works.jsonv.validation.Validators.max;
import static works.jsonv.validation.Validators.min;
import static works.jsonv.validation.Validators.minLength;

class StructNodeTest {

	static class Person {
		String first;
		String last;
	}

	static class Address {
		String street;
		String zip;
	}

	static class Customer {
		String name;
		int age;
		Address address;
		Optional<String> nickname;
		Optional<Integer> rank;
		Optional<Address> billing;
		List<Address> others;
	}

	static class Base {
		String id;
		String title;
	}

	static class Audit {
		String createdBy;
		long version;
	}

	static class Document extends Base {
		String title;
		@Embedded Audit audit;
	}

	static class Renamed {
		@JsonName("e-mail") String email;
	}

	static class WithFinal {
		final String fixed = "constant";
	}

	record Point(int x, int y) { }

	static ValidatingParser<Person> personParser() {
		return ValidatingParser.of(Person.class, struct(
			property("first", string(minLength(1))),
			property("last", string(minLength(1)))));
	}

	static ValidatingParser<Customer> customerParser() {
		StructNode address = struct(
			property("street", string()),
			property("zip", string(minLength(5))));
		return ValidatingParser.of(Customer.class, struct(
			property("name", string()),
			property("age", integer(min(0), max(150))).withDefault(21),
			property("address", address),
			property("nickname", string()),
			property("rank", integer()),
			property("billing", struct(property("street", string()), property("zip", string()))),
			property("others", slice(struct(property("street", string()), property("zip", string()))))
				.withDefault(List.of())));
	}

	@Test
	void missingRequiredPropertiesInDeclaredOrder() throws IOException {
		Person person = new Person();
		ValidationErrors errors = personParser().parse("{}", person);
		assertEquals(ValidationErrors.of(
			new InvalidData("/first", "Is required"),
			new InvalidData("/last", "Is required")
		), errors);
	}

	@Test
	void fillsExistingObject() throws IOException {
		Person person = new Person();
		assertValid(personParser().parse("{\"last\": \"Lovelace\", \"first\": \"Ada\"}", person));
		assertEquals("Ada", person.first);
		assertEquals("Lovelace", person.last);
	}

	@Test
	void allocatesIntoEmptyHolder() throws IOException {
		Holder<Person> holder = new Holder<>();
		assertValid(personParser().parse("{\"first\": \"Grace\", \"last\": \"Hopper\"}", holder));
		assertNotNull(holder.value());
		assertEquals("Grace", holder.value().first);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"1",
		"\"string\"",
		"null",
		"{\"first\": \"nested\", \"deeper\": {\"x\": [1, 2, {}]}}",
		"[[], [{}], {\"a\": [\"]\"]}]",
	})
	void unknownMembersAreSkipped(String value) throws IOException {
		Person person = new Person();
		String json = "{\"first\": \"Ada\", \"extra\": " + value + ", \"last\": \"Lovelace\"}";
		assertValid(personParser().parse(json, person));
		assertEquals("Ada", person.first);
		assertEquals("Lovelace", person.last);
	}

	@Test
	void errorsAccumulateAcrossMembers() throws IOException {
		Customer customer = new Customer();
		ValidationErrors errors = customerParser().parse("""
			{
				"name": 12,
				"age": -1,
				"address": {"street": "Main", "zip": "123"},
				"rank": "high"
			}""", customer);
		assertEquals(ValidationErrors.of(
			new InvalidData("/name", "Must be a string, got value 12"),
			new InvalidData("/age", "Must be greater than or equal to 0"),
			new InvalidData("/address/zip", "Must be at least 5 characters long"),
			new InvalidData("/rank", "Must be an integer, got value \"high\"")
		), errors);
		assertEquals("Main", customer.address.street);
		assertEquals(0, customer.age);
	}

	@Test
	void defaultsAreAssignedWithoutValidation() throws IOException {
		ValidatingParser<Customer> parser = ValidatingParser.of(Customer.class, struct(
			property("age", integer(min(100))).withDefault(5)));
		Customer customer = new Customer();
		assertValid(parser.parse("{}", customer));
		assertEquals(5, customer.age);
	}

	@Test
	void optionalFields() throws IOException {
		Customer customer = new Customer();
		assertValid(customerParser().parse("""
			{
				"name": "Ada",
				"address": {"street": "Main", "zip": "12345"},
				"nickname": null,
				"rank": 3,
				"billing": {"street": "Side", "zip": "54321"}
			}""", customer));
		assertEquals(Optional.empty(), customer.nickname);
		assertEquals(Optional.of(3), customer.rank);
		assertTrue(customer.billing.isPresent());
		assertEquals("Side", customer.billing.get().street);
		assertEquals(21, customer.age);
		assertEquals(List.of(), customer.others);
	}

	@Test
	void absentOptionalFieldIsUntouched() throws IOException {
		Customer customer = new Customer();
		customer.nickname = Optional.of("unchanged");
		assertValid(customerParser().parse("{\"name\": \"Ada\", \"address\": {\"street\": \"a\", \"zip\": \"12345\"}}", customer));
		assertEquals(Optional.of("unchanged"), customer.nickname);
		assertNull(customer.rank);
	}

	@Test
	void nullForRequiredStruct() throws IOException {
		Customer customer = new Customer();
		ValidationErrors errors = customerParser().parse("{\"name\": \"Ada\", \"address\": null}", customer);
		assertEquals(ValidationErrors.of(new InvalidData("/address", "Must not be null")), errors);
		assertNull(customer.address);
	}

	@Test
	void existingNestedObjectIsReused() throws IOException {
		Customer customer = new Customer();
		Address existing = new Address();
		customer.address = existing;
		assertValid(customerParser().parse("{\"name\": \"Ada\", \"address\": {\"street\": \"Elm\", \"zip\": \"12345\"}}", customer));
		assertSame(existing, customer.address);
		assertEquals("Elm", existing.street);
	}

	@Test
	void elementPathsInsideStruct() throws IOException {
		ValidatingParser<Customer> parser = ValidatingParser.of(Customer.class, struct(
			property("others", slice(struct(property("street", string()), property("zip", string(minLength(5))))))));
		Customer customer = new Customer();
		ValidationErrors errors = parser.parse("{\"others\": [{\"street\": \"a\", \"zip\": \"12345\"}, {\"street\": \"b\"}, {\"street\": \"c\", \"zip\": \"1\"}]}", customer);
		assertEquals(ValidationErrors.of(
			new InvalidData("/others/1/zip", "Is required"),
			new InvalidData("/others/2/zip", "Must be at least 5 characters long")
		), errors);
		assertEquals(3, customer.others.size());
	}

	@Test
	void caseInsensitiveKeys() throws IOException {
		Person person = new Person();
		assertValid(personParser().parse("{\"FIRST\": \"Ada\", \"Last\": \"Lovelace\"}", person));
		assertEquals("Ada", person.first);
		assertEquals("Lovelace", person.last);
	}

	@Test
	void caseSensitiveKeys() throws IOException {
		ValidatingParser<Person> parser = ValidatingParser.of(Person.class, struct(
			property("first", string()),
			property("last", string())).withCaseSensitiveKeys());
		Person person = new Person();
		ValidationErrors errors = parser.parse("{\"FIRST\": \"Ada\", \"last\": \"Lovelace\"}", person);
		assertEquals(ValidationErrors.of(new InvalidData("/first", "Is required")), errors);
		assertNull(person.first);
	}

	@Test
	void escapedKey() throws IOException {
		Person person = new Person();
		assertValid(personParser().parse("{\"f\\u0069rst\": \"Ada\", \"last\": \"L\"}", person));
		assertEquals("Ada", person.first);
	}

	@Test
	void trailingCommaIsAccepted() throws IOException {
		Person person = new Person();
		assertValid(personParser().parse("{\"first\": \"Ada\", \"last\": \"L\",}", person));
	}

	@Test
	void superclassAndEmbeddedFields() throws IOException {
		ValidatingParser<Document> parser = ValidatingParser.of(Document.class, struct(
			property("id", string()),
			property("title", string()),
			property("createdBy", string()),
			property("version", integer())));
		Document document = new Document();
		assertValid(parser.parse("{\"id\": \"d1\", \"title\": \"Notes\", \"createdBy\": \"ada\", \"version\": 7}", document));
		assertEquals("d1", document.id);
		assertEquals("Notes", document.title);
		assertNull(((Base) document).title);
		assertNotNull(document.audit);
		assertEquals("ada", document.audit.createdBy);
		assertEquals(7L, document.audit.version);
	}

	@Test
	void missingEmbeddedFieldPath() throws IOException {
		ValidatingParser<Document> parser = ValidatingParser.of(Document.class, struct(
			property("createdBy", string())));
		assertEquals(ValidationErrors.of(new InvalidData("/createdBy", "Is required")),
			parser.parse("{}", new Document()));
	}

	@Test
	void jsonName() throws IOException {
		ValidatingParser<Renamed> parser = ValidatingParser.of(Renamed.class, struct(property("e-mail", string())));
		Renamed renamed = new Renamed();
		assertValid(parser.parse("{\"e-mail\": \"ada@example.com\"}", renamed));
		assertEquals("ada@example.com", renamed.email);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"[]",
		"\"object\"",
		"42",
	})
	void wrongKindIsFatal(String json) {
		assertThrows(JsonContentException.class, () -> personParser().parse(json, new Person()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{\"first\" \"Ada\"}",
		"{\"first\": \"Ada\" \"last\": \"L\"}",
		"{1: 2}",
		"{\"first\": \"Ada\"]",
		"{\"bad\\x\": 1}",
		"{,}",
	})
	void malformedObjectIsFatal(String json) {
		assertThrows(JsonFormatException.class, () -> personParser().parse(json, new Person()));
	}

	@Test
	void malformedKeyIsSyntaxError() {
		assertThrows(JsonSyntaxException.class, () -> personParser().parse("{\"bad\\x\": 1}", new Person()));
	}

	@Test
	void missingField() {
		InvalidTypeException e = assertThrows(InvalidTypeException.class, () ->
			ValidatingParser.prepare(Person.class, struct(property("middle", string()))));
		assertThat(e.getMessage(), containsString("middle"));
	}

	@Test
	void fieldTypeMismatch() {
		InvalidFieldTypeException e = assertThrows(InvalidFieldTypeException.class, () ->
			ValidatingParser.prepare(Person.class, struct(property("first", integer()))));
		assertEquals(Person.class, e.containingClass());
		assertEquals("first", e.fieldName());
	}

	@Test
	void defaultTypeMismatch() {
		assertThrows(InvalidFieldTypeException.class, () ->
			ValidatingParser.prepare(Customer.class, struct(property("age", integer()).withDefault("old"))));
	}

	@Test
	void finalField() {
		assertThrows(InvalidFieldTypeException.class, () ->
			ValidatingParser.prepare(WithFinal.class, struct(property("fixed", string()))));
	}

	@Test
	void recordsAreNotSupported() {
		assertThrows(InvalidTypeException.class, () ->
			ValidatingParser.prepare(Point.class, struct(property("x", integer()))));
	}

	@Test
	void duplicatePropertyNames() {
		assertThrows(IllegalArgumentException.class, () ->
			struct(property("first", string()), property("first", string())));
	}

	@Test
	void twoPropertiesForOneField() {
		assertThrows(InvalidFieldTypeException.class, () ->
			ValidatingParser.prepare(Person.class, struct(property("first", string()), property("FIRST", string()))));
	}

	static void assertValid(ValidationErrors errors) {
		assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
	}
}
