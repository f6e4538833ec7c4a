package works.jsonv.codec;

/**
 * A syntactically significant element of JSON text.
 */
public enum Token {
	END_TEXT,
	NULL,
	FALSE,
	TRUE,
	NUMBER,
	START_OBJECT,
	END_OBJECT,
	START_ARRAY,
	END_ARRAY,

	/**
	 * Can be a member name or a string value.
	 * We don't distinguish at the token level.
	 */
	STRING,

	/**
	 * Separates the items of an array, or the members of an object.
	 */
	COMMA,

	/**
	 * Separates a member name from its value.
	 */
	COLON,

	ERROR;

	public static Token startingWith(int b) {
		return switch (b) {
			case -1 -> END_TEXT;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			default -> ERROR;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			case START_OBJECT -> "{";
			case END_OBJECT -> "}";
			case START_ARRAY -> "[";
			case END_ARRAY -> "]";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}

	/**
	 * @return true for tokens that can begin a JSON value
	 */
	public boolean startsValue() {
		return switch (this) {
			case NULL, FALSE, TRUE, NUMBER, STRING, START_OBJECT, START_ARRAY -> true;
			default -> false;
		};
	}

	/**
	 * A short description suitable for messages shown to the author of a JSON document.
	 */
	public String describe() {
		return switch (this) {
			case END_TEXT -> "end of input";
			case NUMBER -> "number";
			case STRING -> "string";
			case ERROR -> "invalid token";
			default -> fixedRepresentation();
		};
	}
}
