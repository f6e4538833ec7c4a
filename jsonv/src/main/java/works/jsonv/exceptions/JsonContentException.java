package works.jsonv.exceptions;

/**
 * The JSON input does not have the structure the schema requires,
 * in a way that can't be reported as a validation error:
 * for example, an array where an object must begin.
 */
public final class JsonContentException extends JsonFormatException {
	public JsonContentException(String message) {
		super(message);
	}

	public JsonContentException(Throwable cause) {
		super(cause);
	}

	public JsonContentException(String message, Throwable cause) {
		super(message, cause);
	}
}
