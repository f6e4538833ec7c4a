package works.jsonv.schema;

import java.lang.reflect.Type;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.StringValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

public final class StringNode extends ScalarNode {
	private final List<StringValidator> validators;

	public StringNode(List<StringValidator> validators) {
		this.validators = List.copyOf(validators);
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		if (destinationType != String.class) {
			throw InvalidTypeException.wrongKind(toString(), "String", destinationType);
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
		String value = StringUnescaper.decodeString(span);
		if (value == null) {
			errors.add(path.toString(), ValidationMessages.MALFORMED_STRING);
			return;
		}
		boolean valid = true;
		for (StringValidator validator : validators) {
			valid &= passes(validator.validateString(value), path, errors);
		}
		if (valid) {
			slot.set(value);
		}
	}

	@Override
	public String toString() {
		return "StringNode";
	}
}
