package works.jsonv.schema;

import java.lang.reflect.Type;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.DateTimeValidator;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

/**
 * Parses an ISO 8601 date-time with an offset, like {@code 2016-03-10T23:00:00.000Z},
 * into an {@link OffsetDateTime} or an {@link Instant}.
 */
public final class DateTimeNode extends ScalarNode {
	private final List<DateTimeValidator> validators;
	private volatile boolean asInstant;

	public DateTimeNode(List<DateTimeValidator> validators) {
		this.validators = List.copyOf(validators);
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		if (destinationType == OffsetDateTime.class) {
			asInstant = false;
		} else if (destinationType == Instant.class) {
			asInstant = true;
		} else {
			throw InvalidTypeException.wrongKind(toString(), "OffsetDateTime or Instant", destinationType);
		}
	}

	@Override
	protected boolean accepts(Token token) {
		return token == STRING;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_DATE_TIME;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		String text = StringUnescaper.decodeString(span);
		OffsetDateTime value;
		try {
			value = OffsetDateTime.parse(text == null ? "" : text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
		} catch (DateTimeParseException e) {
			errors.add(path.toString(), String.format(ValidationMessages.INVALID_DATE_TIME, span.asString()));
			return;
		}
		boolean valid = true;
		for (DateTimeValidator validator : validators) {
			valid &= passes(validator.validateDateTime(value), path, errors);
		}
		if (valid) {
			slot.set(asInstant ? value.toInstant() : value);
		}
	}

	@Override
	public String toString() {
		return "DateTimeNode";
	}
}
