package works.jsonv.validation;

import java.util.Optional;

/**
 * Checks an integer value before it is narrowed to the width of its destination.
 */
@FunctionalInterface
public interface IntegerValidator {
	Optional<String> validateInteger(long value);
}
