package works.jsonv.schema;

import java.lang.reflect.Type;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.DateValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

/**
 * Parses a JSON string of the form {@code yyyy-mm-dd} into a {@link LocalDate}.
 */
public final class DateNode extends ScalarNode {
	static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
		.withResolverStyle(ResolverStyle.STRICT);

	private final List<DateValidator> validators;

	public DateNode(List<DateValidator> validators) {
		this.validators = List.copyOf(validators);
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		if (destinationType != LocalDate.class) {
			throw InvalidTypeException.wrongKind(toString(), "LocalDate", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == STRING;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_DATE;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		String text = StringUnescaper.decodeString(span);
		LocalDate value;
		try {
			value = LocalDate.parse(text == null ? "" : text, FORMAT);
		} catch (DateTimeParseException e) {
			errors.add(path.toString(), String.format(ValidationMessages.INVALID_DATE, span.asString()));
			return;
		}
		boolean valid = true;
		for (DateValidator validator : validators) {
			valid &= passes(validator.validateDate(value), path, errors);
		}
		if (valid) {
			slot.set(value);
		}
	}

	@Override
	public String toString() {
		return "DateNode";
	}
}
