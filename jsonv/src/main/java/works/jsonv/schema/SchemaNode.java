package works.jsonv.schema;

import java.io.IOException;
import java.lang.reflect.Type;
import works.jsonv.codec.JsonScanner;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonException;
import works.jsonv.validation.ValidationErrors;

/**
 * Describes how to decode and validate one JSON value into one kind of Java destination.
 * <p>
 * Nodes are built once by the application, {@link #prepare prepared} once
 * for their destination type, and then used for any number of parses,
 * possibly concurrently. A node is bound to the first type it's prepared for.
 *
 * @see Schemas
 */
public interface SchemaNode {
	/**
	 * Checks that this node can fill destinations of the given type,
	 * resolving and caching whatever it needs in order to do so,
	 * and prepares any child nodes.
	 * <p>
	 * Preparing again for the same type has no effect.
	 *
	 * @throws InvalidTypeException if this node can't fill a destination of the given type,
	 * or has already been prepared for a different type
	 */
	void prepare(Type destinationType) throws InvalidTypeException;

	/**
	 * Consumes one JSON value from {@code scanner} and assigns the result to {@code slot}.
	 * <p>
	 * Problems with the value itself are added to {@code errors}, and the value is consumed
	 * anyway so the parse can continue; in that case, the slot may be left unchanged.
	 *
	 * @param path    the location of this value, for error reporting
	 * @throws IllegalStateException if the node has not been prepared
	 * @throws JsonException if the document can't be parsed any further
	 * @throws IOException if the scanner's stream fails
	 */
	void parse(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException;

	/**
	 * Most nodes assign a new value to their slot.
	 * Nodes that return true here instead fill in the object already in the slot,
	 * which the caller must allocate using {@link #newDestination()} if the slot is empty.
	 */
	default boolean fillsInPlace() {
		return false;
	}

	/**
	 * @throws UnsupportedOperationException unless {@link #fillsInPlace()}
	 */
	default Object newDestination() {
		throw new UnsupportedOperationException(getClass().getSimpleName() + " does not fill in place");
	}
}
