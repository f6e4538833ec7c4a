package works.jsonv.validation;

/**
 * Thrown by a {@link works.jsonv.schema.JsonDecodable} to reject the value it was given.
 * The message becomes an {@link InvalidData} record; the parse continues.
 */
public class InvalidValueException extends Exception {
	public InvalidValueException(String message) {
		super(message);
	}

	public InvalidValueException(String message, Throwable cause) {
		super(message, cause);
	}
}
