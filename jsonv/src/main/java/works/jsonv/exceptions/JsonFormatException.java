package works.jsonv.exceptions;

/**
 * The JSON input can't be decoded, so no validation records could be trusted.
 * Catch this to tell a malformed request apart from one that merely
 * holds invalid values.
 */
public sealed abstract class JsonFormatException extends JsonException permits
	JsonContentException,
	JsonEndOfInputException,
	JsonSyntaxException
{
	protected JsonFormatException(String message) {
		super(message);
	}

	protected JsonFormatException(Throwable cause) {
		super(cause);
	}

	protected JsonFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
