package works.jsonv.validation;

import java.util.Optional;

@FunctionalInterface
public interface StringValidator {
	/**
	 * @param value the decoded string, escapes already expanded
	 * @return a message describing why the value is invalid, or empty if it's valid
	 */
	Optional<String> validateString(String value);
}
