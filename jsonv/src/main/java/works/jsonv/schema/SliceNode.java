package works.jsonv.schema;

import java.io.IOException;
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import works.jsonv.codec.JsonScanner;
import works.jsonv.codec.Token;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.SliceValidator;
import works.jsonv.validation.ValidationErrors;

import static java.util.Objects.requireNonNull;
import static works.jsonv.codec.Token.COMMA;
import static works.jsonv.codec.Token.END_ARRAY;
import static works.jsonv.codec.Token.START_ARRAY;

/**
 * Parses a JSON array whose elements all have the same schema
 * into a {@link List} or a Java array, including arrays of primitives.
 * <p>
 * The destination always receives a new list or array.
 * Elements that fail validation are left null, or zero for primitive arrays.
 * The validators see the whole list of elements after they've all been parsed.
 */
public final class SliceNode extends AbstractSchemaNode {
	private static final int MIN_CAPACITY = 4;

	private final SchemaNode elementNode;
	private final List<SliceValidator> validators;

	/**
	 * Null for list destinations
	 */
	private volatile Class<?> arrayComponent;

	public SliceNode(SchemaNode elementNode, List<SliceValidator> validators) {
		this.elementNode = requireNonNull(elementNode);
		this.validators = List.copyOf(validators);
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Type elementType;
		if (destinationType instanceof Class<?> c && c.isArray()) {
			arrayComponent = c.getComponentType();
			elementType = arrayComponent;
		} else if (destinationType instanceof GenericArrayType g) {
			arrayComponent = Types.rawClass(g.getGenericComponentType());
			elementType = g.getGenericComponentType();
		} else if (destinationType instanceof ParameterizedType p && p.getRawType() == List.class) {
			arrayComponent = null;
			elementType = p.getActualTypeArguments()[0];
		} else {
			throw InvalidTypeException.wrongKind(toString(), "an array or a parameterized List", destinationType);
		}
		elementNode.prepare(elementType);
	}

	/**
	 * Stores parsed elements. Serves as the {@link Slot} for the element being parsed,
	 * which is always the one at {@link #count}.
	 */
	private static final class ElementBuffer implements Slot {
		Object[] items = new Object[0];
		int count = 0;

		void startElement() {
			if (count == items.length) {
				int capacity = Math.max(MIN_CAPACITY, items.length + items.length / 2);
				items = Arrays.copyOf(items, capacity);
			}
		}

		@Override
		public Object get() {
			return items[count];
		}

		@Override
		public void set(Object value) {
			items[count] = value;
		}

		List<Object> elements() {
			return Arrays.asList(items).subList(0, count);
		}
	}

	@Override
	protected void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (rejectedNull(path, scanner, errors)) {
			return;
		}
		expect(START_ARRAY, scanner);

		ElementBuffer buffer = new ElementBuffer();
		if (!nextTokenIs(END_ARRAY, scanner)) {
			while (true) {
				buffer.startElement();
				if (elementNode.fillsInPlace() && scanner.peekToken() != Token.NULL) {
					buffer.set(elementNode.newDestination());
				}
				elementNode.parse(path.element(buffer.count), scanner, buffer, errors);
				buffer.count++;

				Token separator = scanner.readToken();
				if (separator == END_ARRAY) {
					break;
				} else if (separator != COMMA) {
					throw unexpected(separator, "',' or ']'", scanner);
				}
			}
		}

		List<Object> elements = buffer.elements();
		for (SliceValidator validator : validators) {
			validator.validateSlice(elements).ifPresent(message -> errors.add(path.toString(), message));
		}
		slot.set(finish(elements));
	}

	private Object finish(List<Object> elements) {
		Class<?> component = arrayComponent;
		if (component == null) {
			return new ArrayList<>(elements);
		}
		Object array = Array.newInstance(component, elements.size());
		for (int i = 0; i < elements.size(); i++) {
			Object element = elements.get(i);
			if (element != null) {
				Array.set(array, i, element);
			}
		}
		return array;
	}

	@Override
	public String toString() {
		return "SliceNode(" + elementNode + ")";
	}
}
