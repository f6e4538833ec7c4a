package works.jsonv.validation;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static works.jsonv.validation.ValidationMessages.number;

/**
 * Built-in validators.
 * <p>
 * Numeric bounds come in two overloads: the {@code long} ones are
 * {@link IntegerValidator}s and the {@code double} ones are {@link FloatValidator}s.
 * A whole-number literal argument selects the integer overload.
 */
public final class Validators {
	private Validators() { }

	/**
	 * Strings are measured in code points, byte arrays in bytes, and arrays in elements.
	 */
	public static LengthValidator minLength(int length) {
		if (length < 0) {
			throw new IllegalArgumentException("Minimum allowed length must be >= 0: " + length);
		}
		return new LengthValidator(length, Integer.MAX_VALUE);
	}

	/**
	 * @see #minLength
	 */
	public static LengthValidator maxLength(int length) {
		if (length < 0) {
			throw new IllegalArgumentException("Maximum allowed length must be >= 0: " + length);
		}
		return new LengthValidator(0, length);
	}

	/**
	 * Succeeds if the regex matches anywhere in the string;
	 * use {@code ^} and {@code $} to match the whole string.
	 */
	public static StringValidator pattern(String regex) {
		Pattern compiled = Pattern.compile(regex);
		return value -> compiled.matcher(value).find()
			? Optional.empty()
			: Optional.of(String.format(ValidationMessages.PATTERN_MATCH, regex));
	}

	public static IntegerValidator min(long bound) {
		return value -> (value >= bound) ? Optional.empty() : failure(ValidationMessages.MIN, Long.toString(bound));
	}

	public static IntegerValidator exclusiveMin(long bound) {
		return value -> (value > bound) ? Optional.empty() : failure(ValidationMessages.MIN_EX, Long.toString(bound));
	}

	public static IntegerValidator max(long bound) {
		return value -> (value <= bound) ? Optional.empty() : failure(ValidationMessages.MAX, Long.toString(bound));
	}

	public static IntegerValidator exclusiveMax(long bound) {
		return value -> (value < bound) ? Optional.empty() : failure(ValidationMessages.MAX_EX, Long.toString(bound));
	}

	public static IntegerValidator multipleOf(long divisor) {
		if (divisor <= 0) {
			throw new IllegalArgumentException("Divisor must be positive: " + divisor);
		}
		return value -> (value % divisor == 0) ? Optional.empty() : failure(ValidationMessages.MULTIPLE_OF, Long.toString(divisor));
	}

	public static FloatValidator min(double bound) {
		return value -> (value >= bound) ? Optional.empty() : failure(ValidationMessages.MIN, number(bound));
	}

	public static FloatValidator exclusiveMin(double bound) {
		return value -> (value > bound) ? Optional.empty() : failure(ValidationMessages.MIN_EX, number(bound));
	}

	public static FloatValidator max(double bound) {
		return value -> (value <= bound) ? Optional.empty() : failure(ValidationMessages.MAX, number(bound));
	}

	public static FloatValidator exclusiveMax(double bound) {
		return value -> (value < bound) ? Optional.empty() : failure(ValidationMessages.MAX_EX, number(bound));
	}

	/**
	 * Compares decimal representations, so that {@code 0.3} is a multiple of {@code 0.1}
	 * even though their binary approximations are not.
	 */
	public static FloatValidator multipleOf(double divisor) {
		if (!(divisor > 0) || Double.isInfinite(divisor)) {
			throw new IllegalArgumentException("Divisor must be positive and finite: " + divisor);
		}
		BigDecimal exactDivisor = BigDecimal.valueOf(divisor);
		return value -> {
			if (Double.isFinite(value) && BigDecimal.valueOf(value).remainder(exactDivisor).signum() == 0) {
				return Optional.empty();
			} else {
				return failure(ValidationMessages.MULTIPLE_OF, number(divisor));
			}
		};
	}

	private static Optional<String> failure(String format, String bound) {
		return Optional.of(String.format(format, bound));
	}

	/**
	 * A length bound that applies to every kind of value with a length.
	 */
	public static final class LengthValidator implements StringValidator, BytesValidator, SliceValidator {
		private final int min;
		private final int max;

		private LengthValidator(int min, int max) {
			this.min = min;
			this.max = max;
		}

		@Override
		public Optional<String> validateString(String value) {
			return check(value.codePointCount(0, value.length()), ValidationMessages.MIN_LEN_STR, ValidationMessages.MAX_LEN_STR);
		}

		@Override
		public Optional<String> validateBytes(byte[] value) {
			return check(value.length, ValidationMessages.MIN_LEN_BYTES, ValidationMessages.MAX_LEN_BYTES);
		}

		@Override
		public Optional<String> validateSlice(List<?> elements) {
			return check(elements.size(), ValidationMessages.MIN_LEN_ARR, ValidationMessages.MAX_LEN_ARR);
		}

		private Optional<String> check(int length, String tooShort, String tooLong) {
			if (length < min) {
				return Optional.of(String.format(tooShort, min));
			} else if (length > max) {
				return Optional.of(String.format(tooLong, max));
			} else {
				return Optional.empty();
			}
		}

		@Override
		public String toString() {
			return "LengthValidator[" + min + ", " + max + "]";
		}
	}
}
