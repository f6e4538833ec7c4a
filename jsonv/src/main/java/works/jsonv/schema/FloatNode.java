package works.jsonv.schema;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.FloatValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.NUMBER;

/**
 * Parses any JSON number into a {@code float}, {@code double}, their boxed equivalents,
 * or a {@link BigDecimal}.
 * <p>
 * Validators see the value as a {@code double}, even for {@code BigDecimal} destinations,
 * which receive the exact decimal value from the document.
 */
public final class FloatNode extends ScalarNode {
	private final List<FloatValidator> validators;
	private volatile Kind kind;

	public FloatNode(List<FloatValidator> validators) {
		this.validators = List.copyOf(validators);
	}

	private enum Kind { FLOAT, DOUBLE, BIG_DECIMAL }

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.boxed(Types.rawClass(destinationType));
		if (c == Float.class) {
			kind = Kind.FLOAT;
		} else if (c == Double.class) {
			kind = Kind.DOUBLE;
		} else if (c == BigDecimal.class) {
			kind = Kind.BIG_DECIMAL;
		} else {
			throw InvalidTypeException.wrongKind(toString(), "float, double, or BigDecimal", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == NUMBER;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_FLOAT;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		String text = span.asString();
		BigDecimal exact;
		try {
			exact = new BigDecimal(text);
		} catch (NumberFormatException e) {
			// Exponent doesn't fit in an int
			errors.add(path.toString(), String.format(ValidationMessages.NUMBER_OUT_OF_RANGE, text));
			return;
		}
		double value = exact.doubleValue();
		if (Double.isInfinite(value) || (kind == Kind.FLOAT && Float.isInfinite((float) value))) {
			errors.add(path.toString(), String.format(ValidationMessages.NUMBER_OUT_OF_RANGE, text));
			return;
		}

		boolean valid = true;
		for (FloatValidator validator : validators) {
			valid &= passes(validator.validateFloat(value), path, errors);
		}
		if (valid) {
			slot.set(switch (kind) {
				case FLOAT -> (float) value;
				case DOUBLE -> value;
				case BIG_DECIMAL -> exact;
			});
		}
	}

	@Override
	public String toString() {
		return "FloatNode";
	}
}
