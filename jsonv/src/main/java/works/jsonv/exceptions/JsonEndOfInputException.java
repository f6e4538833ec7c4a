package works.jsonv.exceptions;

/**
 * The input ended while a value, or the rest of a value, was still expected.
 * <p>
 * {@link works.jsonv.codec.ValidatingParser} reports this to its caller as a single
 * validation record at the root path rather than rethrowing it.
 */
public final class JsonEndOfInputException extends JsonFormatException {
	public JsonEndOfInputException(String message) {
		super(message);
	}

	public JsonEndOfInputException(String message, Throwable cause) {
		super(message, cause);
	}
}
