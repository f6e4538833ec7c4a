package works.jsonv.validation;

import static java.util.Objects.requireNonNull;

/**
 * One validation failure: a value in the document that is well-formed JSON
 * but breaks a rule of the schema.
 *
 * @param path    locates the offending value; see {@link works.jsonv.schema.JsonPath}
 * @param message suitable for display to the author of the document
 */
public record InvalidData(String path, String message) {
	public InvalidData {
		requireNonNull(path);
		requireNonNull(message);
	}

	@Override
	public String toString() {
		return path + ": " + message;
	}
}
