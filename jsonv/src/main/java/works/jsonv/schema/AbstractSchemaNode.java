package works.jsonv.schema;

import java.io.IOException;
import java.lang.reflect.Type;
import works.jsonv.codec.JsonScanner;
import works.jsonv.codec.Token;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonContentException;
import works.jsonv.exceptions.JsonEndOfInputException;
import works.jsonv.exceptions.JsonSyntaxException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.END_TEXT;
import static works.jsonv.codec.Token.NULL;

/**
 * Takes care of the bookkeeping common to all {@link SchemaNode}s:
 * preparing only once, refusing to parse before preparation,
 * and the handling of tokens that a node can't accept.
 */
public abstract class AbstractSchemaNode implements SchemaNode {
	private volatile Type preparedType;

	@Override
	public final void prepare(Type destinationType) throws InvalidTypeException {
		synchronized (this) {
			Type existing = preparedType;
			if (existing != null) {
				if (existing.equals(destinationType)) {
					return;
				}
				throw new InvalidTypeException(this + " is already prepared for " + existing.getTypeName()
					+ " and can't also be used for " + destinationType.getTypeName());
			}
			if (Types.isUnresolved(destinationType)) {
				throw new InvalidTypeException(this + " can't be prepared for unresolved type " + destinationType.getTypeName());
			}
			prepareFor(destinationType);
			preparedType = destinationType;
		}
	}

	@Override
	public final void parse(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (preparedType == null) {
			throw new IllegalStateException(this + " has not been prepared");
		}
		parsePrepared(path, scanner, slot, errors);
	}

	/**
	 * Called at most once, with the lock held.
	 */
	protected abstract void prepareFor(Type destinationType) throws InvalidTypeException;

	protected abstract void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException;

	/**
	 * @return the type passed to {@link #prepare}, or null if not yet prepared
	 */
	protected final Type preparedType() {
		return preparedType;
	}

	/**
	 * If the next value is {@code null}, consumes it and reports it as invalid.
	 *
	 * @return true if the value was {@code null}
	 */
	protected static boolean rejectedNull(JsonPath path, JsonScanner scanner, ValidationErrors errors) throws IOException {
		if (scanner.peekToken() == NULL) {
			scanner.readToken();
			errors.add(path.toString(), ValidationMessages.MUST_NOT_BE_NULL);
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Consumes a value of the wrong kind and reports it as invalid.
	 *
	 * @param messageFormat a {@link ValidationMessages} pattern with one placeholder for the value
	 */
	protected static void rejectValue(String messageFormat, JsonPath path, JsonScanner scanner, ValidationErrors errors) throws IOException {
		String shown;
		switch (scanner.peekToken()) {
			case START_OBJECT -> {
				scanner.skipValue();
				shown = "{...}";
			}
			case START_ARRAY -> {
				scanner.skipValue();
				shown = "[...]";
			}
			default -> {
				scanner.skipValue();
				shown = scanner.span().asString();
			}
		}
		errors.add(path.toString(), String.format(messageFormat, shown));
	}

	/**
	 * Consumes the next token, which must be the given one.
	 *
	 * @throws JsonContentException if it's a different value token
	 * @throws JsonSyntaxException if it's punctuation that can't appear here
	 * @throws JsonEndOfInputException if the input has ended
	 */
	protected static void expect(Token expected, JsonScanner scanner) throws IOException {
		Token actual = scanner.readToken();
		if (actual == expected) {
			return;
		}
		String message = "Expected " + expected.describe() + " but found " + actual.describe() + " at offset " + scanner.currentOffset();
		if (actual == END_TEXT) {
			throw new JsonEndOfInputException(message);
		} else if (actual.startsValue()) {
			throw new JsonContentException(message);
		} else {
			throw new JsonSyntaxException(message);
		}
	}

	/**
	 * Consumes the next token if it's the given one.
	 *
	 * @return true if the token was the expected one
	 */
	protected static boolean nextTokenIs(Token expected, JsonScanner scanner) throws IOException {
		if (scanner.peekToken() == expected) {
			scanner.readToken();
			return true;
		} else {
			return false;
		}
	}

	/**
	 * For a token that can't be valid in the current context.
	 */
	protected static RuntimeException unexpected(Token actual, String expectation, JsonScanner scanner) {
		String message = "Expected " + expectation + " but found " + actual.describe() + " at offset " + scanner.currentOffset();
		if (actual == END_TEXT) {
			return new JsonEndOfInputException(message);
		} else {
			return new JsonSyntaxException(message);
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
