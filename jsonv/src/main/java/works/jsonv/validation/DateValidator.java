package works.jsonv.validation;

import java.time.LocalDate;
import java.util.Optional;

@FunctionalInterface
public interface DateValidator {
	Optional<String> validateDate(LocalDate value);
}
