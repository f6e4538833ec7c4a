package works.jsonv.validation;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Checks a date-time as written in the document, with its original offset,
 * even if the destination is an {@link java.time.Instant}.
 */
@FunctionalInterface
public interface DateTimeValidator {
	Optional<String> validateDateTime(OffsetDateTime value);
}
