package works.jsonv.schema;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A member of a JSON object, as declared in a {@link StructNode}.
 * <p>
 * The name selects both the JSON member and the destination field
 * (see {@link FieldResolver}), matching exactly if possible
 * and otherwise ignoring case.
 *
 * @param defaultValue assigned, without validation, when the member is absent
 */
public record Property(
	String name,
	SchemaNode node,
	Optional<Object> defaultValue
) {
	public Property {
		requireNonNull(name);
		requireNonNull(node);
		requireNonNull(defaultValue);
	}

	public static Property of(String name, SchemaNode node) {
		return new Property(name, node, Optional.empty());
	}

	/**
	 * Defaults are shared by every parse, so they should be immutable.
	 */
	public Property withDefault(Object value) {
		return new Property(name, node, Optional.of(value));
	}

	@Override
	public String toString() {
		return name + ":" + node;
	}
}
