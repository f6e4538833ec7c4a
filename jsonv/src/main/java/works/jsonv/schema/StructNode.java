package works.jsonv.schema;

import java.io.IOException;
import java.lang.invoke.MethodHandle;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonv.codec.JsonScanner;
import works.jsonv.codec.Token;
import works.jsonv.codec.io.StringUnescaper;
import works.jsonv.exceptions.InvalidFieldTypeException;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonProcessingException;
import works.jsonv.exceptions.JsonSyntaxException;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static works.jsonv.codec.Token.COLON;
import static works.jsonv.codec.Token.COMMA;
import static works.jsonv.codec.Token.END_OBJECT;
import static works.jsonv.codec.Token.NULL;
import static works.jsonv.codec.Token.START_OBJECT;
import static works.jsonv.codec.Token.STRING;

/**
 * Parses a JSON object into the fields of an existing mutable object.
 * <p>
 * Each {@link Property} is bound to a field at preparation time.
 * Members with no matching property are skipped.
 * A property whose field has type {@link Optional} is optional;
 * all others are required unless they have a default.
 * An explicit {@code null} sets an optional field to {@link Optional#empty()}.
 * <p>
 * The destination class needs a no-argument constructor, which is used
 * to allocate objects for nested structs and {@link Embedded} fields.
 * Records and other immutable classes are not supported.
 */
public final class StructNode extends AbstractSchemaNode {
	private final List<Property> properties;
	private final boolean caseInsensitiveKeys;
	private volatile Binding binding;

	public StructNode(List<Property> properties) {
		this(properties, true);
	}

	private StructNode(List<Property> properties, boolean caseInsensitiveKeys) {
		this.properties = List.copyOf(properties);
		this.caseInsensitiveKeys = caseInsensitiveKeys;
		Set<String> names = new HashSet<>();
		for (Property p : this.properties) {
			if (!names.add(p.name())) {
				throw new IllegalArgumentException("Duplicate property name \"" + p.name() + "\"");
			}
		}
	}

	/**
	 * @return a node like this one, except that JSON member names must match
	 * property names exactly
	 */
	public StructNode withCaseSensitiveKeys() {
		return new StructNode(properties, false);
	}

	public List<Property> properties() {
		return properties;
	}

	private record Binding(
		MethodHandle constructor,
		List<BoundProperty> properties,
		Map<String, Integer> exactIndex,
		Map<String, Integer> foldedIndex
	) { }

	/**
	 * Field of an embedded object on the way to a property's field.
	 */
	private record Hop(MethodHandle getter, MethodHandle setter, MethodHandle constructor) { }

	private record BoundProperty(
		Property property,
		List<Hop> hops,
		MethodHandle getter,
		MethodHandle setter,
		boolean optional,
		boolean required
	) {
		/**
		 * @return the object that directly holds the field, allocating embedded objects as needed
		 */
		Object holderWithin(Object target) {
			Object current = target;
			for (Hop hop : hops) {
				Object next = Handles.get(hop.getter(), current);
				if (next == null) {
					next = Handles.construct(hop.constructor());
					Handles.set(hop.setter(), current, next);
				}
				current = next;
			}
			return current;
		}
	}

	private static final class FieldSlot implements Slot {
		private final BoundProperty bound;
		private final Object holder;

		FieldSlot(BoundProperty bound, Object holder) {
			this.bound = bound;
			this.holder = holder;
		}

		@Override
		public Object get() {
			Object value = Handles.get(bound.getter(), holder);
			if (bound.optional()) {
				return (value == null) ? null : ((Optional<?>) value).orElse(null);
			} else {
				return value;
			}
		}

		@Override
		public void set(Object value) {
			Handles.set(bound.setter(), holder, bound.optional() ? Optional.ofNullable(value) : value);
		}
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		Class<?> c = Types.rawClass(destinationType);
		if (c.isPrimitive() || c.isArray() || c.isInterface() || c.isEnum() || c.isRecord() || Modifier.isAbstract(c.getModifiers())) {
			throw InvalidTypeException.wrongKind(toString(), "a concrete mutable class", destinationType);
		}
		MethodHandle constructor = Handles.constructor(c);
		Map<String, FieldResolver.ResolvedField> fields = FieldResolver.resolve(c);

		List<BoundProperty> bound = new ArrayList<>();
		Map<String, Integer> exactIndex = new HashMap<>();
		Map<String, Integer> foldedIndex = new HashMap<>();
		Set<Field> boundFields = new HashSet<>();
		for (Property property : properties) {
			FieldResolver.ResolvedField resolved = fieldFor(property.name(), fields, c);
			if (!boundFields.add(resolved.field())) {
				throw new InvalidFieldTypeException(resolved.field().getDeclaringClass(), resolved.field().getName(),
					"bound to more than one property");
			}
			int index = bound.size();
			bound.add(bind(property, resolved));
			exactIndex.put(property.name(), index);
			String folded = fold(property.name());
			if (foldedIndex.containsKey(folded)) {
				// Two properties differ only in case; neither can be matched by folding
				foldedIndex.put(folded, -1);
			} else {
				foldedIndex.put(folded, index);
			}
		}
		binding = new Binding(constructor, List.copyOf(bound), Map.copyOf(exactIndex), Map.copyOf(foldedIndex));
		LOGGER.debug("Prepared {} for {}", this, destinationType.getTypeName());
	}

	private static FieldResolver.ResolvedField fieldFor(String name, Map<String, FieldResolver.ResolvedField> fields, Class<?> c) throws InvalidTypeException {
		FieldResolver.ResolvedField exact = fields.get(name);
		if (exact != null) {
			return exact;
		}
		List<FieldResolver.ResolvedField> matches = new ArrayList<>();
		fields.forEach((fieldName, field) -> {
			if (fieldName.equalsIgnoreCase(name)) {
				matches.add(field);
			}
		});
		if (matches.size() == 1) {
			return matches.get(0);
		} else if (matches.isEmpty()) {
			throw new InvalidTypeException(c.getSimpleName() + " has no field for property \"" + name + "\"");
		} else {
			throw new InvalidTypeException(c.getSimpleName() + " has several fields that could match property \"" + name + "\"");
		}
	}

	private static BoundProperty bind(Property property, FieldResolver.ResolvedField resolved) throws InvalidTypeException {
		Field field = resolved.field();
		Class<?> declaringClass = field.getDeclaringClass();
		Type fieldType = field.getGenericType();

		boolean optional = (field.getType() == Optional.class);
		Type valueType;
		if (optional) {
			valueType = Types.optionalContents(fieldType).orElseThrow(() ->
				new InvalidFieldTypeException(declaringClass, field.getName(), "Optional must have a type argument"));
			if (Types.optionalContents(valueType).isPresent()) {
				throw new InvalidFieldTypeException(declaringClass, field.getName(), "nested Optional is not supported");
			}
		} else {
			valueType = fieldType;
		}

		try {
			property.node().prepare(valueType);
		} catch (InvalidFieldTypeException e) {
			throw e;
		} catch (InvalidTypeException e) {
			throw new InvalidFieldTypeException(declaringClass, field.getName(), e.getMessage(), e);
		}

		if (property.defaultValue().isPresent()) {
			Object defaultValue = property.defaultValue().get();
			Class<?> expected = Types.boxed(Types.rawClass(valueType));
			if (!expected.isInstance(defaultValue)) {
				throw new InvalidFieldTypeException(declaringClass, field.getName(),
					"default value of type " + defaultValue.getClass().getName() + " doesn't match " + valueType.getTypeName());
			}
		}

		List<Hop> hops = new ArrayList<>();
		for (Field embedded : resolved.embeddingPath()) {
			hops.add(new Hop(Handles.getter(embedded), Handles.setter(embedded), Handles.constructor(embedded.getType())));
		}

		boolean required = !optional && property.defaultValue().isEmpty();
		return new BoundProperty(property, List.copyOf(hops), Handles.getter(field), Handles.setter(field), optional, required);
	}

	private static String fold(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	@Override
	public boolean fillsInPlace() {
		return true;
	}

	@Override
	public Object newDestination() {
		return Handles.construct(binding.constructor());
	}

	@Override
	protected void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (rejectedNull(path, scanner, errors)) {
			return;
		}
		expect(START_OBJECT, scanner);
		Object target = slot.get();
		if (target == null) {
			throw new JsonProcessingException("No destination object allocated at " + path);
		}

		Binding b = binding;
		boolean[] seen = new boolean[b.properties().size()];
		while (true) {
			Token token = scanner.readToken();
			if (token == END_OBJECT) {
				// Empty object, or a trailing comma
				break;
			} else if (token != STRING) {
				throw unexpected(token, "member name or '}'", scanner);
			}
			String key = StringUnescaper.decodeString(scanner.span());
			if (key == null) {
				throw new JsonSyntaxException("Invalid member name " + scanner.span() + " at offset " + scanner.currentOffset());
			}
			expect(COLON, scanner);

			int index = indexOf(key, b);
			if (index < 0) {
				LOGGER.trace("Skipping unknown member \"{}\" at {}", key, path);
				scanner.skipValue();
			} else {
				parseMember(b.properties().get(index), path, scanner, target, errors);
				seen[index] = true;
			}

			Token separator = scanner.readToken();
			if (separator == END_OBJECT) {
				break;
			} else if (separator != COMMA) {
				throw unexpected(separator, "',' or '}'", scanner);
			}
		}

		for (int i = 0; i < seen.length; i++) {
			if (seen[i]) {
				continue;
			}
			BoundProperty bound = b.properties().get(i);
			Optional<Object> defaultValue = bound.property().defaultValue();
			if (defaultValue.isPresent()) {
				new FieldSlot(bound, bound.holderWithin(target)).set(defaultValue.get());
			} else if (bound.required()) {
				errors.add(path.member(bound.property().name()).toString(), ValidationMessages.PROPERTY_REQUIRED);
			}
		}
	}

	private void parseMember(BoundProperty bound, JsonPath path, JsonScanner scanner, Object target, ValidationErrors errors) throws IOException {
		FieldSlot fieldSlot = new FieldSlot(bound, bound.holderWithin(target));
		if (bound.optional() && scanner.peekToken() == NULL) {
			scanner.readToken();
			fieldSlot.set(null);
			return;
		}
		SchemaNode child = bound.property().node();
		if (child.fillsInPlace() && scanner.peekToken() != NULL && fieldSlot.get() == null) {
			fieldSlot.set(child.newDestination());
		}
		child.parse(path.member(bound.property().name()), scanner, fieldSlot, errors);
	}

	private int indexOf(String key, Binding b) {
		Integer exact = b.exactIndex().get(key);
		if (exact != null) {
			return exact;
		}
		if (caseInsensitiveKeys) {
			Integer folded = b.foldedIndex().get(fold(key));
			if (folded != null) {
				return folded;
			}
		}
		return -1;
	}

	@Override
	public String toString() {
		return "StructNode" + properties;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StructNode.class);
}
