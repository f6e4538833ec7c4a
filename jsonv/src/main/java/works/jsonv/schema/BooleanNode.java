package works.jsonv.schema;

import java.lang.reflect.Type;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.FALSE;
import static works.jsonv.codec.Token.TRUE;

/**
 * Parses {@code true} or {@code false} into a {@code boolean} or {@link Boolean},
 * or into a {@link String} holding the literal text.
 */
public final class BooleanNode extends ScalarNode {
	private volatile boolean asString;

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.boxed(Types.rawClass(destinationType));
		if (c == Boolean.class) {
			asString = false;
		} else if (c == String.class) {
			asString = true;
		} else {
			throw InvalidTypeException.wrongKind(toString(), "boolean or String", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == TRUE || token == FALSE;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_BOOL;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		if (asString) {
			slot.set(token.fixedRepresentation());
		} else {
			slot.set(token == TRUE);
		}
	}

	@Override
	public String toString() {
		return "BooleanNode";
	}
}
