package works.jsonv.validation;

import java.util.Optional;

@FunctionalInterface
public interface BytesValidator {
	Optional<String> validateBytes(byte[] value);
}
