package works.jsonv.schema;

import java.lang.reflect.Type;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.IntegerValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.NUMBER;

/**
 * Parses a JSON number with no fraction or exponent into
 * a {@code byte}, {@code short}, {@code int}, or {@code long}, or their boxed equivalents.
 * <p>
 * Validators see the value as a {@code long}; a value that passes
 * but doesn't fit the destination is reported as invalid rather than truncated.
 */
public final class IntegerNode extends ScalarNode {
	private final List<IntegerValidator> validators;
	private volatile Width width;

	public IntegerNode(List<IntegerValidator> validators) {
		this.validators = List.copyOf(validators);
	}

	private enum Width {
		BYTE(Byte.MIN_VALUE, Byte.MAX_VALUE),
		SHORT(Short.MIN_VALUE, Short.MAX_VALUE),
		INT(Integer.MIN_VALUE, Integer.MAX_VALUE),
		LONG(Long.MIN_VALUE, Long.MAX_VALUE);

		final long min;
		final long max;

		Width(long min, long max) {
			this.min = min;
			this.max = max;
		}

		Object box(long value) {
			return switch (this) {
				case BYTE -> (byte) value;
				case SHORT -> (short) value;
				case INT -> (int) value;
				case LONG -> value;
			};
		}
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.boxed(Types.rawClass(destinationType));
		if (c == Byte.class) {
			width = Width.BYTE;
		} else if (c == Short.class) {
			width = Width.SHORT;
		} else if (c == Integer.class) {
			width = Width.INT;
		} else if (c == Long.class) {
			width = Width.LONG;
		} else {
			throw InvalidTypeException.wrongKind(toString(), "an integer type", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == NUMBER;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_INT;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		String text = span.asString();
		long value;
		try {
			value = Long.parseLong(text);
		} catch (NumberFormatException e) {
			if (isWholeNumberText(text)) {
				errors.add(path.toString(), String.format(ValidationMessages.PARSE_INT, "value out of range: " + text));
			} else {
				errors.add(path.toString(), String.format(ValidationMessages.INVALID_INT, text));
			}
			return;
		}

		boolean valid = true;
		for (IntegerValidator validator : validators) {
			valid &= passes(validator.validateInteger(value), path, errors);
		}
		if (!valid) {
			return;
		}

		Width w = width;
		if (value < w.min || value > w.max) {
			errors.add(path.toString(), String.format(ValidationMessages.INT_OUT_OF_RANGE, w.min, w.max));
			return;
		}
		slot.set(w.box(value));
	}

	private static boolean isWholeNumberText(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '.' || c == 'e' || c == 'E') {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "IntegerNode";
	}
}
