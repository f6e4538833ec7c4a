package works.jsonv.validation;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.jsonv.validation.Validators.exclusiveMax;
import static works.jsonv.validation.Validators.exclusiveMin;
import static works.jsonv.validation.Validators.max;
import static works.jsonv.validation.Validators.maxLength;
import static works.jsonv.validation.Validators.min;
import static works.jsonv.validation.Validators.minLength;
import static works.jsonv.validation.Validators.multipleOf;
import static works.jsonv.validation.Validators.pattern;

class ValidatorsTest {
	static final Optional<String> OK = Optional.empty();

	@Test
	void integerBounds() {
		assertEquals(OK, min(3).validateInteger(3));
		assertEquals(Optional.of("Must be greater than or equal to 3"), min(3).validateInteger(2));
		assertEquals(OK, exclusiveMin(3).validateInteger(4));
		assertEquals(Optional.of("Must be greater than 3"), exclusiveMin(3).validateInteger(3));
		assertEquals(OK, max(5).validateInteger(5));
		assertEquals(Optional.of("Must be less than or equal to 5"), max(5).validateInteger(7));
		assertEquals(OK, exclusiveMax(5).validateInteger(4));
		assertEquals(Optional.of("Must be less than 5"), exclusiveMax(5).validateInteger(5));
	}

	@Test
	void integerMultipleOf() {
		assertEquals(OK, multipleOf(3).validateInteger(9));
		assertEquals(OK, multipleOf(3).validateInteger(-6));
		assertEquals(OK, multipleOf(3).validateInteger(0));
		assertEquals(Optional.of("Must be a multiple of 3"), multipleOf(3).validateInteger(10));
		assertThrows(IllegalArgumentException.class, () -> multipleOf(0));
		assertThrows(IllegalArgumentException.class, () -> multipleOf(-2));
	}

	@Test
	void floatBounds() {
		assertEquals(OK, min(1.5).validateFloat(1.5));
		assertEquals(Optional.of("Must be greater than or equal to 1.5"), min(1.5).validateFloat(1.25));
		assertEquals(Optional.of("Must be greater than 2"), exclusiveMin(2.0).validateFloat(2.0));
		assertEquals(Optional.of("Must be less than or equal to 0.1"), max(0.1).validateFloat(0.2));
		assertEquals(OK, exclusiveMax(10.0).validateFloat(9.999));
	}

	@Test
	void floatMultipleOfUsesDecimalArithmetic() {
		assertEquals(OK, multipleOf(0.1).validateFloat(0.3));
		assertEquals(OK, multipleOf(0.25).validateFloat(1.75));
		assertEquals(Optional.of("Must be a multiple of 0.25"), multipleOf(0.25).validateFloat(1.3));
		assertEquals(Optional.of("Must be a multiple of 0.5"), multipleOf(0.5).validateFloat(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> multipleOf(0.0));
		assertThrows(IllegalArgumentException.class, () -> multipleOf(Double.NaN));
	}

	@Test
	void stringLengthCountsCodePoints() {
		assertEquals(OK, maxLength(1).validateString("😎"));
		assertEquals(Optional.of("Must be no more than 1 characters long"), maxLength(1).validateString("ab"));
		assertEquals(Optional.of("Must be at least 2 characters long"), minLength(2).validateString("😎"));
		assertEquals(OK, minLength(0).validateString(""));
	}

	@Test
	void bytesLength() {
		assertEquals(OK, maxLength(4).validateBytes(new byte[4]));
		assertEquals(Optional.of("Must be no more than 4 bytes long"), maxLength(4).validateBytes(new byte[5]));
		assertEquals(Optional.of("Must be at least 1 bytes long"), minLength(1).validateBytes(new byte[0]));
	}

	@Test
	void sliceLength() {
		assertEquals(OK, maxLength(2).validateSlice(List.of(1, 2)));
		assertEquals(Optional.of("Must contain no more than 2 items"), maxLength(2).validateSlice(List.of(1, 2, 3)));
		assertEquals(Optional.of("Must contain at least 1 items"), minLength(1).validateSlice(List.of()));
	}

	@Test
	void negativeLengths() {
		assertThrows(IllegalArgumentException.class, () -> minLength(-1));
		assertThrows(IllegalArgumentException.class, () -> maxLength(-1));
	}

	@Test
	void patternFindsAnywhere() {
		assertEquals(OK, pattern("[0-9]+").validateString("abc123"));
		assertEquals(Optional.of("Must match regex pattern ^[0-9]+$"), pattern("^[0-9]+$").validateString("abc123"));
	}

	@Test
	void numberFormatting() {
		assertEquals("5", ValidationMessages.number(5.0));
		assertEquals("0.1", ValidationMessages.number(0.1));
		assertEquals("-2.5", ValidationMessages.number(-2.5));
		assertEquals("1000000", ValidationMessages.number(1e6));
	}
}
