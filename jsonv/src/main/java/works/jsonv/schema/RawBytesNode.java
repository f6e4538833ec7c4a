package works.jsonv.schema;

import java.lang.reflect.Type;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

/**
 * Copies the bytes between the quotes of a JSON string into a {@code byte[]}
 * without decoding escapes.
 * Suitable for content known to contain no escapes, like base64 text.
 * No validators.
 */
public final class RawBytesNode extends ScalarNode {
	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		if (destinationType != byte[].class) {
			throw InvalidTypeException.wrongKind(toString(), "byte[]", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == STRING;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_STRING;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		slot.set(span.interior().toByteArray());
	}

	@Override
	public String toString() {
		return "RawBytesNode";
	}
}
