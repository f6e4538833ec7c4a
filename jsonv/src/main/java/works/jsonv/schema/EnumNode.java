package works.jsonv.schema;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import works.jsonv.codec.JsonScanner;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static java.util.Objects.requireNonNull;

/**
 * Restricts another node's values to a fixed list, compared with {@link Objects#deepEquals}.
 * <p>
 * The value is assigned only if it's one of the allowed ones,
 * except that a node that {@link SchemaNode#fillsInPlace fills in place}
 * will already have modified its destination.
 */
public final class EnumNode extends AbstractSchemaNode {
	private final SchemaNode delegate;
	private final List<Object> allowed;
	private final String message;

	public EnumNode(SchemaNode delegate, List<?> allowed) {
		this.delegate = requireNonNull(delegate);
		if (allowed.isEmpty()) {
			throw new IllegalArgumentException("Must allow at least one value");
		}
		this.allowed = List.copyOf(allowed);
		this.message = String.format(ValidationMessages.ONE_OF,
			this.allowed.stream().map(EnumNode::render).collect(Collectors.joining(",")));
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.boxed(Types.rawClass(destinationType));
		for (Object value : allowed) {
			if (!c.isInstance(value)) {
				throw new InvalidTypeException("Allowed value " + render(value) + " of " + value.getClass().getName()
					+ " can't be assigned to " + destinationType.getTypeName());
			}
		}
		delegate.prepare(destinationType);
	}

	@Override
	public boolean fillsInPlace() {
		return delegate.fillsInPlace();
	}

	@Override
	public Object newDestination() {
		return delegate.newDestination();
	}

	@Override
	protected void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		int errorsBefore = errors.size();
		Candidate candidate = new Candidate(delegate.fillsInPlace() ? slot.get() : null);
		delegate.parse(path, scanner, candidate, errors);
		if (errors.size() != errorsBefore || !candidate.assigned) {
			// Delegate rejected the value
			return;
		}
		for (Object value : allowed) {
			if (Objects.deepEquals(value, candidate.value)) {
				slot.set(candidate.value);
				return;
			}
		}
		errors.add(path.toString(), message);
	}

	private static String render(Object value) {
		if (value.getClass().isArray()) {
			String s = Arrays.deepToString(new Object[]{value});
			return s.substring(1, s.length() - 1);
		} else {
			return value.toString();
		}
	}

	/**
	 * Holds the delegate's result until we've checked it.
	 */
	private static final class Candidate implements Slot {
		Object value;
		boolean assigned;

		Candidate(Object initial) {
			this.value = initial;
			this.assigned = (initial != null);
		}

		@Override
		public Object get() {
			return value;
		}

		@Override
		public void set(Object value) {
			this.value = value;
			this.assigned = true;
		}
	}

	@Override
	public String toString() {
		return "EnumNode(" + delegate + ")";
	}
}
