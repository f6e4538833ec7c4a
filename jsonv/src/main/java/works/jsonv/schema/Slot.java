package works.jsonv.schema;

/**
 * An addressable location that a {@link SchemaNode} fills:
 * a field of an object, an element of an array, or the root of a document.
 * <p>
 * For a field of type {@link java.util.Optional}, the slot deals in the
 * contents of the optional, not the optional itself.
 */
public interface Slot {
	/**
	 * @return the current value, or null if the slot is empty
	 */
	Object get();

	void set(Object value);
}
