package works.jsonv.codec;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type, which a class literal can't express.
 * Create an anonymous subclass:
 * {@code new TypeReference<List<String>>() {}}.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	public final Type reflectionType() {
		return ((ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}

	@Override
	public String toString() {
		return "TypeReference<" + reflectionType().getTypeName() + ">";
	}
}
