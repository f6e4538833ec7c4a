package works.jsonv.schema;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import works.jsonv.exceptions.InvalidFieldTypeException;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonProcessingException;

import static java.lang.invoke.MethodType.methodType;

/**
 * Method handles for reaching into destination objects,
 * adapted to erased signatures so they can be invoked without knowing the types.
 */
final class Handles {
	private Handles() { }

	/**
	 * @return a handle of type {@code ()Object} that invokes the no-argument constructor
	 */
	static MethodHandle constructor(Class<?> c) throws InvalidTypeException {
		if (c.isInterface() || Modifier.isAbstract(c.getModifiers())) {
			throw new InvalidTypeException("Can't instantiate abstract type " + c.getName());
		}
		if (c.isMemberClass() && !Modifier.isStatic(c.getModifiers())) {
			throw new InvalidTypeException("Can't instantiate inner class " + c.getName() + "; it should be static");
		}
		try {
			return lookupFor(c)
				.findConstructor(c, methodType(void.class))
				.asType(methodType(Object.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new InvalidTypeException(c.getName() + " needs an accessible no-argument constructor", e);
		}
	}

	/**
	 * @return a handle of type {@code (Object)Object}
	 */
	static MethodHandle getter(Field field) throws InvalidTypeException {
		try {
			return lookupFor(field.getDeclaringClass())
				.unreflectGetter(field)
				.asType(methodType(Object.class, Object.class));
		} catch (IllegalAccessException e) {
			throw new InvalidFieldTypeException(field.getDeclaringClass(), field.getName(), "field is not accessible", e);
		}
	}

	/**
	 * @return a handle of type {@code (Object,Object)void}
	 */
	static MethodHandle setter(Field field) throws InvalidTypeException {
		if (Modifier.isFinal(field.getModifiers())) {
			throw new InvalidFieldTypeException(field.getDeclaringClass(), field.getName(), "field is final");
		}
		try {
			return lookupFor(field.getDeclaringClass())
				.unreflectSetter(field)
				.asType(methodType(void.class, Object.class, Object.class));
		} catch (IllegalAccessException e) {
			throw new InvalidFieldTypeException(field.getDeclaringClass(), field.getName(), "field is not accessible", e);
		}
	}

	static Object construct(MethodHandle constructor) {
		try {
			return (Object) constructor.invokeExact();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new JsonProcessingException("Constructor failed", e);
		}
	}

	static Object get(MethodHandle getter, Object target) {
		try {
			return (Object) getter.invokeExact(target);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new JsonProcessingException("Getter failed", e);
		}
	}

	static void set(MethodHandle setter, Object target, Object value) {
		try {
			setter.invokeExact(target, value);
		} catch (ClassCastException e) {
			throw new JsonProcessingException("Value of type " + value.getClass().getName() + " does not fit destination", e);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new JsonProcessingException("Setter failed", e);
		}
	}

	private static MethodHandles.Lookup lookupFor(Class<?> c) throws IllegalAccessException {
		return MethodHandles.privateLookupIn(c, MethodHandles.lookup());
	}
}
