package works.jsonv.validation;

import java.math.BigDecimal;

/**
 * Text of the messages in {@link InvalidData} records.
 * These are {@link String#format} patterns unless otherwise noted.
 */
public final class ValidationMessages {
	private ValidationMessages() { }

	public static final String UNEXPECTED_END_OF_INPUT = "Unexpected end of input";
	public static final String MUST_NOT_BE_NULL = "Must not be null";
	public static final String PROPERTY_REQUIRED = "Is required";

	public static final String INVALID_INT = "Must be an integer, got value %s";
	public static final String PARSE_INT = "Error parsing integer, %s";
	public static final String INT_OUT_OF_RANGE = "Must be between %d and %d";
	public static final String INVALID_FLOAT = "Must be a number, got value %s";
	public static final String NUMBER_OUT_OF_RANGE = "Number out of range, got value %s";
	public static final String INVALID_BOOL = "Must be a boolean, got value %s";
	public static final String INVALID_STRING = "Must be a string, got value %s";
	public static final String MALFORMED_STRING = "Invalid string";
	public static final String INVALID_DATE = "Must be a date formatted as yyyy-mm-dd, got value %s";
	public static final String INVALID_DATE_TIME = "Must be a date-time formatted as yyyy-mm-ddThh:mm:ssZ, got value %s";
	public static final String ONE_OF = "Must be one of: %s";

	public static final String MIN_LEN_STR = "Must be at least %d characters long";
	public static final String MAX_LEN_STR = "Must be no more than %d characters long";
	public static final String MIN_LEN_BYTES = "Must be at least %d bytes long";
	public static final String MAX_LEN_BYTES = "Must be no more than %d bytes long";
	public static final String PATTERN_MATCH = "Must match regex pattern %s";
	public static final String MIN_LEN_ARR = "Must contain at least %d items";
	public static final String MAX_LEN_ARR = "Must contain no more than %d items";

	public static final String MAX_EX = "Must be less than %s";
	public static final String MAX = "Must be less than or equal to %s";
	public static final String MIN_EX = "Must be greater than %s";
	public static final String MIN = "Must be greater than or equal to %s";
	public static final String MULTIPLE_OF = "Must be a multiple of %s";

	/**
	 * Renders a number the way a JSON author would write it: no trailing zeros,
	 * no exponent, so {@code 5.0} is {@code 5}.
	 */
	public static String number(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}
}
