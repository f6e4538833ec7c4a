package works.jsonv.schema;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.STRING;

/**
 * Represents a JSON string as the enum constant with that {@link Enum#name() name}.
 */
public final class EnumByNameNode extends ScalarNode {
	private volatile Map<String, Enum<?>> constantsByName;
	private volatile String choices;

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.rawClass(destinationType);
		if (!c.isEnum()) {
			throw InvalidTypeException.wrongKind(toString(), "an enum type", destinationType);
		}
		Map<String, Enum<?>> map = new LinkedHashMap<>();
		for (Object constant : c.getEnumConstants()) {
			Enum<?> e = (Enum<?>) constant;
			map.put(e.name(), e);
		}
		constantsByName = map;
		choices = String.join(",", map.keySet());
	}

	@Override
	protected boolean accepts(Token token) {
		return token == STRING;
	}

	@Override
	protected String wrongKindMessage() {
		return ValidationMessages.INVALID_STRING;
	}

	@Override
	protected void parseToken(Token token, TokenSpan span, JsonPath path, Slot slot, ValidationErrors errors) {
		String name = StringUnescaper.decodeString(span);
		Enum<?> value = (name == null) ? null : constantsByName.get(name);
		if (value == null) {
			errors.add(path.toString(), String.format(ValidationMessages.ONE_OF, choices));
		} else {
			slot.set(value);
		}
	}

	@Override
	public String toString() {
		return "EnumByNameNode";
	}
}
