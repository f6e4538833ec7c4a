package works.jsonv.exceptions;

import java.lang.reflect.Type;

/**
 * A schema node cannot be bound to a destination type.
 * Thrown during preparation, before any JSON is read,
 * so that configuration mistakes surface at startup.
 */
public class InvalidTypeException extends Exception {
	public InvalidTypeException(String message) {
		super(message);
	}

	public InvalidTypeException(String message, Throwable cause) {
		super(message, cause);
	}

	public static InvalidTypeException wrongKind(String nodeName, String wanted, Type actual) {
		return new InvalidTypeException(nodeName + " wants " + wanted + ", not " + actual.getTypeName());
	}
}
