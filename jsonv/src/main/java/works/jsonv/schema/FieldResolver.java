package works.jsonv.schema;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonv.exceptions.InvalidTypeException;

/**
 * Determines the fields of a class that a {@link Property} can bind to, and their names.
 * <p>
 * A class's own instance fields are at depth zero.
 * Fields inherited from a superclass, and fields of an {@link Embedded} field's class,
 * are one level deeper than the fields that bring them in.
 * Static, transient, and synthetic fields are ignored.
 * <p>
 * A field's name is its {@link JsonName} if it has one, or else its Java name.
 * When several fields have the same name, the shallowest one wins.
 * If there are several at that depth, the one with a {@link JsonName} wins;
 * if that doesn't settle it, none of them can be bound by that name.
 */
public final class FieldResolver {
	private FieldResolver() { }

	/**
	 * @param embeddingPath the {@link Embedded} fields leading from the root object
	 *                      to the object that holds {@code field}
	 * @param named         whether the name came from {@link JsonName}
	 */
	public record ResolvedField(
		String name,
		List<Field> embeddingPath,
		Field field,
		int depth,
		boolean named
	) {
		public ResolvedField {
			embeddingPath = List.copyOf(embeddingPath);
		}
	}

	/**
	 * @return the eligible fields by name, in declaration order,
	 * shallower classes first
	 * @throws InvalidTypeException if {@link Embedded} fields form a cycle
	 * or an embedded field's type is unsuitable
	 */
	public static Map<String, ResolvedField> resolve(Class<?> type) throws InvalidTypeException {
		List<ResolvedField> candidates = new ArrayList<>();
		collect(type, List.of(), 0, candidates, new HashSet<>());

		Map<String, List<ResolvedField>> byName = new LinkedHashMap<>();
		for (ResolvedField candidate : candidates) {
			byName.computeIfAbsent(candidate.name(), k -> new ArrayList<>()).add(candidate);
		}

		Map<String, ResolvedField> result = new LinkedHashMap<>();
		byName.forEach((name, fields) -> {
			ResolvedField dominant = dominantField(fields);
			if (dominant == null) {
				LOGGER.debug("{}: name \"{}\" is ambiguous among {}", type.getSimpleName(), name, fields);
			} else {
				result.put(name, dominant);
			}
		});
		return result;
	}

	private static void collect(Class<?> c, List<Field> embeddingPath, int depth, List<ResolvedField> out, Set<Class<?>> embedding) throws InvalidTypeException {
		if (!embedding.add(c)) {
			throw new InvalidTypeException("Embedded fields form a cycle through " + c.getName());
		}
		for (Field field : c.getDeclaredFields()) {
			int modifiers = field.getModifiers();
			if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
				continue;
			}
			if (field.isAnnotationPresent(Embedded.class)) {
				Class<?> embeddedType = field.getType();
				if (embeddedType.isPrimitive() || embeddedType.isArray() || embeddedType.isInterface() || embeddedType.isEnum()) {
					throw new InvalidTypeException("Embedded field " + c.getSimpleName() + "." + field.getName()
						+ " must have a class type, not " + embeddedType.getName());
				}
				List<Field> deeperPath = new ArrayList<>(embeddingPath);
				deeperPath.add(field);
				collect(embeddedType, deeperPath, depth + 1, out, embedding);
			} else {
				JsonName jsonName = field.getAnnotation(JsonName.class);
				String name = (jsonName == null) ? field.getName() : jsonName.value();
				out.add(new ResolvedField(name, embeddingPath, field, depth, jsonName != null));
			}
		}
		Class<?> superclass = c.getSuperclass();
		if (superclass != null && superclass != Object.class) {
			collect(superclass, embeddingPath, depth + 1, out, embedding);
		}
		embedding.remove(c);
	}

	/**
	 * @return the field that wins the name, or null if none does
	 */
	private static ResolvedField dominantField(List<ResolvedField> fields) {
		int minDepth = Integer.MAX_VALUE;
		for (ResolvedField f : fields) {
			minDepth = Math.min(minDepth, f.depth());
		}
		ResolvedField onlyShallowest = null;
		ResolvedField onlyNamed = null;
		int shallowCount = 0;
		int namedCount = 0;
		for (ResolvedField f : fields) {
			if (f.depth() == minDepth) {
				shallowCount++;
				onlyShallowest = f;
				if (f.named()) {
					namedCount++;
					onlyNamed = f;
				}
			}
		}
		if (shallowCount == 1) {
			return onlyShallowest;
		} else if (namedCount == 1) {
			return onlyNamed;
		} else {
			return null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldResolver.class);
}
