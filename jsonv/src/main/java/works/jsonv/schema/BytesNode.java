package works.jsonv.schema;

import java.lang.reflect.Type;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.BytesValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

/**
 * Parses a JSON string into a {@code byte[]} holding its UTF-8 encoding, escapes decoded.
 *
 * @see RawBytesNode
 */
public final class BytesNode extends ScalarNode {
	private final List<BytesValidator> validators;

	public BytesNode(List<BytesValidator> validators) {
		this.validators = List.copyOf(validators);
	}

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
		byte[] value = StringUnescaper.decodeBytes(span);
		if (value == null) {
			errors.add(path.toString(), ValidationMessages.MALFORMED_STRING);
			return;
		}
		boolean valid = true;
		for (BytesValidator validator : validators) {
			valid &= passes(validator.validateBytes(value), path, errors);
		}
		if (valid) {
			slot.set(value);
		}
	}

	@Override
	public String toString() {
		return "BytesNode";
	}
}
