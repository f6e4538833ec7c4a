package works.jsonv.validation;

import java.util.List;
import java.util.Optional;

/**
 * Checks an array as a whole, after all of its elements have been parsed.
 */
@FunctionalInterface
public interface SliceValidator {
	Optional<String> validateSlice(List<?> elements);
}
