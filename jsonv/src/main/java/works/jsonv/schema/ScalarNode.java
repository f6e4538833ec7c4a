package works.jsonv.schema;

import java.io.IOException;
import java.util.Optional;
import works.jsonv.codec.JsonScanner;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.validation.ValidationErrors;

/**
 * A node for a JSON value consisting of a single token.
 * <p>
 * A {@code null}, or a value of the wrong kind, is reported as invalid and skipped.
 */
public abstract class ScalarNode extends AbstractSchemaNode {
	@Override
	protected final void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (rejectedNull(path, scanner, errors)) {
			return;
		}
		Token next = scanner.peekToken();
		if (!accepts(next)) {
			rejectValue(wrongKindMessage(), path, scanner, errors);
			return;
		}
		scanner.readToken();
		parseToken(next, scanner.span(), path, slot, errors);
	}

	/**
	 * @return true if {@link #parseToken} can handle the given token
	 */
	protected abstract boolean accepts(Token token);

	/**
	 * @return a {@link works.jsonv.validation.ValidationMessages ValidationMessages} pattern
	 * with one placeholder for the offending value
	 */
	protected abstract String wrongKindMessage();

	/**
	 * Decodes, validates, and assigns the value.
	 * Must not read from the scanner.
	 *
	 * @param span valid only for the duration of this call
	 */
	protected abstract void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors);

	/**
	 * Records a validator's verdict.
	 *
	 * @return true if the value passed
	 */
	protected static boolean passes(Optional<String> failure, JsonPath path, ValidationErrors errors) {
		if (failure.isPresent()) {
			errors.add(path.toString(), failure.get());
			return false;
		} else {
			return true;
		}
	}
}
