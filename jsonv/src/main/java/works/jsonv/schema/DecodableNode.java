package works.jsonv.schema;

import java.io.IOException;
import java.lang.invoke.MethodHandle;
import java.lang.reflect.Type;
import works.jsonv.codec.JsonScanner;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonProcessingException;
import works.jsonv.validation.InvalidValueException;
import works.jsonv.validation.ValidationErrors;

/**
 * Hands one complete JSON value, as raw text, to a destination that implements
 * {@link JsonDecodable}. This is the way to use destination types that the
 * built-in nodes don't know about.
 * <p>
 * An {@link InvalidValueException} from the destination becomes a validation error;
 * any other exception aborts the parse.
 */
public final class DecodableNode extends AbstractSchemaNode {
	private volatile MethodHandle constructor;

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.rawClass(destinationType);
		if (!JsonDecodable.class.isAssignableFrom(c)) {
			throw InvalidTypeException.wrongKind(toString(), "an implementation of JsonDecodable", destinationType);
		}
		constructor = Handles.constructor(c);
	}

	@Override
	public boolean fillsInPlace() {
		return true;
	}

	@Override
	public Object newDestination() {
		return Handles.construct(constructor);
	}

	@Override
	protected void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (rejectedNull(path, scanner, errors)) {
			return;
		}
		JsonDecodable target = (JsonDecodable) slot.get();
		if (target == null) {
			throw new JsonProcessingException("No destination object allocated at " + path);
		}
		byte[] json = scanner.readRawValue();
		try {
			target.decodeJson(json);
		} catch (InvalidValueException e) {
			errors.add(path.toString(), e.getMessage());
		} catch (RuntimeException e) {
			throw new JsonProcessingException("Unexpected exception from " + target.getClass().getSimpleName() + ".decodeJson", e);
		}
	}

	@Override
	public String toString() {
		return "DecodableNode";
	}
}
