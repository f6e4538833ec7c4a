package works.jsonv.exceptions;

/**
 * A fatal problem encountered while decoding a JSON document.
 * Unlike a {@link works.jsonv.validation.InvalidData validation record},
 * this aborts the parse immediately.
 */
public sealed abstract class JsonException extends RuntimeException permits JsonFormatException, JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(Throwable cause) {
		super(cause);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
