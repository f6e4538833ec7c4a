package works.jsonv.schema;

import java.util.List;
import works.jsonv.validation.BytesValidator;
import works.jsonv.validation.DateTimeValidator;
import works.jsonv.validation.DateValidator;
import works.jsonv.validation.FloatValidator;
import works.jsonv.validation.IntegerValidator;
import works.jsonv.validation.SliceValidator;
import works.jsonv.validation.StringValidator;

/**
 * Concise factory methods for building schema trees.
 * Intended for static import:
 *
 * <pre>
 * SchemaNode schema = struct(
 *     property("name", string(minLength(1))),
 *     property("age", integer(min(0))),
 *     property("tags", slice(string(), maxLength(10))));
 * </pre>
 *
 * Each call returns a new node; a node must not be shared between
 * destinations of different types.
 */
public final class Schemas {
	private Schemas() { }

	public static IntegerNode integer(IntegerValidator... validators) {
		return new IntegerNode(List.of(validators));
	}

	public static FloatNode number(FloatValidator... validators) {
		return new FloatNode(List.of(validators));
	}

	public static BooleanNode bool() {
		return new BooleanNode();
	}

	public static StringNode string(StringValidator... validators) {
		return new StringNode(List.of(validators));
	}

	public static BytesNode bytes(BytesValidator... validators) {
		return new BytesNode(List.of(validators));
	}

	public static RawBytesNode rawBytes() {
		return new RawBytesNode();
	}

	public static DateNode date(DateValidator... validators) {
		return new DateNode(List.of(validators));
	}

	public static DateTimeNode dateTime(DateTimeValidator... validators) {
		return new DateTimeNode(List.of(validators));
	}

	public static StructNode struct(Property... properties) {
		return new StructNode(List.of(properties));
	}

	public static Property property(String name, SchemaNode node) {
		return Property.of(name, node);
	}

	public static SliceNode slice(SchemaNode elementNode, SliceValidator... validators) {
		return new SliceNode(elementNode, List.of(validators));
	}

	/**
	 * @param allowed the permitted values, each of the type the delegate produces
	 */
	public static EnumNode oneOf(SchemaNode delegate, Object... allowed) {
		return new EnumNode(delegate, List.of(allowed));
	}

	public static EnumByNameNode enumByName() {
		return new EnumByNameNode();
	}

	public static DecodableNode decodable() {
		return new DecodableNode();
	}
}
