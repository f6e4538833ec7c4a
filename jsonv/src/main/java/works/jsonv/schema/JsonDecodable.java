package works.jsonv.schema;

import works.jsonv.validation.InvalidValueException;

/**
 * A destination type that decodes its own JSON.
 * Implementations need a no-argument constructor.
 *
 * @see DecodableNode
 */
public interface JsonDecodable {
	/**
	 * @param json the complete JSON text of one value, as UTF-8
	 * @throws InvalidValueException to report the value as invalid
	 */
	void decodeJson(byte[] json) throws InvalidValueException;
}
