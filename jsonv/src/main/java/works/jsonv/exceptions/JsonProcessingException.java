package works.jsonv.exceptions;

/**
 * An unexpected error has occurred during JSON processing.
 * <p>
 * This should be thrown from code that runs during the parse itself,
 * not from code (like {@link works.jsonv.schema.SchemaNode#prepare prepare})
 * that runs before any JSON is read.
 * <p>
 * This does not indicate a problem with the input JSON, but rather that
 * something unexpected has gone wrong, such as a reflective write that the
 * destination class refused.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(Throwable cause) {
		super(cause);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
