package works.jsonv.schema;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Map;
import java.util.Optional;
import works.jsonv.exceptions.InvalidTypeException;

/**
 * Helpers for {@link java.lang.reflect.Type}s of destinations.
 */
final class Types {
	private Types() { }

	private static final Map<Class<?>, Class<?>> BOXES = Map.of(
		boolean.class, Boolean.class,
		byte.class, Byte.class,
		short.class, Short.class,
		char.class, Character.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class);

	/**
	 * @throws InvalidTypeException for type variables and wildcards, which have no single class
	 */
	static Class<?> rawClass(Type type) throws InvalidTypeException {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return (Class<?>) p.getRawType();
		} else if (type instanceof GenericArrayType g) {
			return rawClass(g.getGenericComponentType()).arrayType();
		} else {
			throw new InvalidTypeException("Destination type must be concrete: " + type.getTypeName());
		}
	}

	static Class<?> boxed(Class<?> c) {
		return BOXES.getOrDefault(c, c);
	}

	/**
	 * @return the type argument of a parameterized {@code Optional},
	 * or empty if the given type is not an {@code Optional}
	 */
	static Optional<Type> optionalContents(Type type) {
		if (type instanceof ParameterizedType p && p.getRawType() == Optional.class) {
			return Optional.of(p.getActualTypeArguments()[0]);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return true if the type mentions a type variable or wildcard anywhere,
	 * meaning we can't tell what sort of values belong in it
	 */
	static boolean isUnresolved(Type type) {
		if (type instanceof Class<?>) {
			return false;
		} else if (type instanceof ParameterizedType p) {
			for (Type arg : p.getActualTypeArguments()) {
				if (isUnresolved(arg)) {
					return true;
				}
			}
			return false;
		} else if (type instanceof GenericArrayType g) {
			return isUnresolved(g.getGenericComponentType());
		} else {
			return type instanceof TypeVariable<?> || type instanceof WildcardType;
		}
	}
}
