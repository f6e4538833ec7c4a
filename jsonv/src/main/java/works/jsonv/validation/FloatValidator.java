package works.jsonv.validation;

import java.util.Optional;

@FunctionalInterface
public interface FloatValidator {
	Optional<String> validateFloat(double value);
}
