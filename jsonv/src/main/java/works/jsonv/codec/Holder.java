package works.jsonv.codec;

import works.jsonv.schema.Slot;

/**
 * A mutable box to hold the root value of a document,
 * for destinations that can't be filled in place, like strings and lists.
 */
public final class Holder<T> implements Slot {
	private T value;

	public Holder() {
	}

	public Holder(T initialValue) {
		this.value = initialValue;
	}

	public T value() {
		return value;
	}

	@Override
	public T get() {
		return value;
	}

	/**
	 * Only the parser calls this, after checking the value's type.
	 */
	@Override
	@SuppressWarnings("unchecked")
	public void set(Object value) {
		this.value = (T) value;
	}

	@Override
	public String toString() {
		return "Holder[" + value + "]";
	}
}
