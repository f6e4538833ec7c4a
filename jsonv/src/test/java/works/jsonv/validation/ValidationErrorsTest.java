package works.jsonv.validation;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationErrorsTest {

	@Test
	void keepsInsertionOrder() {
		ValidationErrors errors = new ValidationErrors()
			.add("/b", "second")
			.add("/a", "first");
		List<InvalidData> seen = new ArrayList<>();
		errors.forEach(seen::add);
		assertEquals(List.of(new InvalidData("/b", "second"), new InvalidData("/a", "first")), seen);
		assertEquals(2, errors.size());
	}

	@Test
	void addAll() {
		ValidationErrors errors = ValidationErrors.of(new InvalidData("/", "one"));
		errors.addAll(ValidationErrors.of(new InvalidData("/x", "two")));
		assertEquals(ValidationErrors.of(new InvalidData("/", "one"), new InvalidData("/x", "two")), errors);
	}

	@Test
	void recordsAreReadOnly() {
		ValidationErrors errors = new ValidationErrors();
		assertTrue(errors.isEmpty());
		assertThrows(UnsupportedOperationException.class, () -> errors.records().add(new InvalidData("/", "nope")));
	}

	@Test
	void rendering() {
		assertEquals("/a/0/: Must not be null", new InvalidData("/a/0/", "Must not be null").toString());
		assertEquals("ValidationErrors[/a: x; /b: y]", ValidationErrors.of(new InvalidData("/a", "x"), new InvalidData("/b", "y")).toString());
	}
}
