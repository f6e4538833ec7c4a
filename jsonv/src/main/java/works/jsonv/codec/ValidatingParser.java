package works.jsonv.codec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonv.codec.io.BufferedJsonScanner;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.exceptions.JsonEndOfInputException;
import works.jsonv.exceptions.JsonException;
import works.jsonv.exceptions.JsonFormatException;
import works.jsonv.exceptions.JsonSyntaxException;
import works.jsonv.schema.JsonPath;
import works.jsonv.schema.SchemaNode;
import works.jsonv.schema.Slot;
import works.jsonv.validation.InvalidData;
import works.jsonv.validation.ValidationErrors;
import works.jsonv.validation.ValidationMessages;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.jsonv.codec.Token.END_TEXT;

/**
 * Decodes JSON documents into destinations of type {@code T}, validating as it goes.
 * <p>
 * Construction prepares the schema for {@code T}, so configuration mistakes
 * surface then, before any document is read. After that, a parser can be
 * used any number of times, from any number of threads, so long as each call
 * has its own input and destination.
 * <p>
 * Each parse call has three kinds of outcome:
 * <ul>
 *     <li>
 *         it returns {@link ValidationErrors}, which are empty if the document was valid
 *         (otherwise, the destination may have been partly filled);
 *     </li>
 *     <li>
 *         it throws {@link JsonFormatException} if the document isn't usable JSON; or
 *     </li>
 *     <li>
 *         it throws the {@link IOException} from the input stream, unchanged.
 *     </li>
 * </ul>
 * An input that ends before the document does is reported as a single
 * validation error at the root path, not as an exception.
 * <p>
 * Parse calls never close the input stream.
 */
public final class ValidatingParser<T> {
	private final Type destinationType;
	private final Class<?> destinationClass;
	private final SchemaNode schema;
	private final Settings settings;

	/**
	 * @param readLength the number of bytes to request from the input stream at a time
	 * @param maxDepth   the deepest nesting of arrays and objects allowed in skipped values
	 */
	public record Settings(
		int readLength,
		int maxDepth
	) {
		public static final Settings DEFAULT = new Settings(JsonScanner.DEFAULT_READ_LENGTH, BufferedJsonScanner.DEFAULT_MAX_DEPTH);

		public Settings {
			if (readLength < 16) {
				throw new IllegalArgumentException("readLength must be at least 16: " + readLength);
			}
			if (maxDepth < 1) {
				throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
			}
		}

		public Settings withReadLength(int readLength) {
			return new Settings(readLength, maxDepth);
		}

		public Settings withMaxDepth(int maxDepth) {
			return new Settings(readLength, maxDepth);
		}
	}

	private ValidatingParser(Type destinationType, Class<?> destinationClass, SchemaNode schema, Settings settings) {
		this.destinationType = destinationType;
		this.destinationClass = destinationClass;
		this.schema = schema;
		this.settings = settings;
	}

	/**
	 * @throws IllegalArgumentException if the schema can't be prepared for the given type
	 * @see #prepare(Class, SchemaNode, Settings)
	 */
	public static <T> ValidatingParser<T> of(Class<T> type, SchemaNode schema) {
		return of(type, schema, Settings.DEFAULT);
	}

	public static <T> ValidatingParser<T> of(Class<T> type, SchemaNode schema, Settings settings) {
		try {
			return prepare(type, schema, settings);
		} catch (InvalidTypeException e) {
			throw new IllegalArgumentException("Schema does not fit " + type.getName() + ": " + e.getMessage(), e);
		}
	}

	public static <T> ValidatingParser<T> of(TypeReference<T> type, SchemaNode schema) {
		return of(type, schema, Settings.DEFAULT);
	}

	public static <T> ValidatingParser<T> of(TypeReference<T> type, SchemaNode schema, Settings settings) {
		try {
			return prepare(type, schema, settings);
		} catch (InvalidTypeException e) {
			throw new IllegalArgumentException("Schema does not fit " + type.reflectionType().getTypeName() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Like {@link #of(Class, SchemaNode)}, but reports a mismatch between the schema
	 * and the type with a checked exception.
	 */
	public static <T> ValidatingParser<T> prepare(Class<T> type, SchemaNode schema) throws InvalidTypeException {
		return prepare(type, schema, Settings.DEFAULT);
	}

	public static <T> ValidatingParser<T> prepare(Class<T> type, SchemaNode schema, Settings settings) throws InvalidTypeException {
		return prepare((Type) type, type, schema, settings);
	}

	public static <T> ValidatingParser<T> prepare(TypeReference<T> type, SchemaNode schema) throws InvalidTypeException {
		return prepare(type, schema, Settings.DEFAULT);
	}

	public static <T> ValidatingParser<T> prepare(TypeReference<T> type, SchemaNode schema, Settings settings) throws InvalidTypeException {
		Type reflectionType = type.reflectionType();
		return prepare(reflectionType, rawClass(reflectionType), schema, settings);
	}

	private static <T> ValidatingParser<T> prepare(Type type, Class<?> rawClass, SchemaNode schema, Settings settings) throws InvalidTypeException {
		requireNonNull(schema);
		requireNonNull(settings);
		schema.prepare(type);
		LOGGER.debug("Prepared {} for {}", schema, type.getTypeName());
		return new ValidatingParser<>(type, rawClass, schema, settings);
	}

	/**
	 * @throws InvalidTypeException if {@code type} is, or has as its array component,
	 * a type variable or wildcard
	 */
	private static Class<?> rawClass(Type type) throws InvalidTypeException {
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

	public Type destinationType() {
		return destinationType;
	}

	public Settings settings() {
		return settings;
	}

	/**
	 * Fills in an existing destination: an object for a {@link works.jsonv.schema.StructNode struct} schema,
	 * or a {@link List}, whose contents are replaced, for a {@link works.jsonv.schema.SliceNode slice} schema.
	 * For other schemas, use {@link #parse(InputStream, Holder)}.
	 *
	 * @throws IllegalArgumentException if the destination is not an instance of the prepared type,
	 * or can't be filled in place
	 */
	public ValidationErrors parse(InputStream input, T destination) throws IOException {
		requireNonNull(destination);
		if (!destinationClass.isInstance(destination)) {
			throw new IllegalArgumentException("Parser for " + destinationType.getTypeName()
				+ " can't fill a " + destination.getClass().getName());
		}
		if (schema.fillsInPlace()) {
			return parseInto(input, new Holder<>(destination));
		} else if (destination instanceof List<?> list) {
			Holder<Object> result = new Holder<>();
			ValidationErrors errors = parseInto(input, result);
			if (result.value() instanceof List<?> elements) {
				replaceContents(list, elements);
			}
			return errors;
		} else {
			throw new IllegalArgumentException("A " + destination.getClass().getSimpleName()
				+ " can't be filled in place; use a Holder");
		}
	}

	/**
	 * Stores the decoded value in the holder.
	 * If the schema fills in place and the holder is empty,
	 * a new destination object is allocated first.
	 */
	public ValidationErrors parse(InputStream input, Holder<T> holder) throws IOException {
		requireNonNull(holder);
		if (schema.fillsInPlace() && holder.get() == null) {
			holder.set(schema.newDestination());
		}
		return parseInto(input, holder);
	}

	public ValidationErrors parse(byte[] json, T destination) throws IOException {
		return parse(new ByteArrayInputStream(json), destination);
	}

	public ValidationErrors parse(byte[] json, Holder<T> holder) throws IOException {
		return parse(new ByteArrayInputStream(json), holder);
	}

	public ValidationErrors parse(String json, T destination) throws IOException {
		return parse(json.getBytes(UTF_8), destination);
	}

	public ValidationErrors parse(String json, Holder<T> holder) throws IOException {
		return parse(json.getBytes(UTF_8), holder);
	}

	@SuppressWarnings("unchecked")
	private static <E> void replaceContents(List<E> list, List<?> elements) {
		list.clear();
		list.addAll((List<E>) elements);
	}

	private ValidationErrors parseInto(InputStream input, Slot root) throws IOException {
		ValidationErrors errors = new ValidationErrors();
		JsonScanner scanner = new BufferedJsonScanner(input, settings.readLength(), settings.maxDepth());
		try {
			schema.parse(JsonPath.ROOT, scanner, root, errors);
			Token trailing = scanner.peekToken();
			if (trailing != END_TEXT) {
				throw new JsonSyntaxException("Unexpected " + trailing.describe() + " after the end of the document at offset " + scanner.currentOffset());
			}
		} catch (JsonEndOfInputException e) {
			LOGGER.debug("Input ended at offset {}", scanner.currentOffset(), e);
			return ValidationErrors.of(new InvalidData(JsonPath.ROOT.toString(), ValidationMessages.UNEXPECTED_END_OF_INPUT));
		} catch (JsonException e) {
			LOGGER.debug("Parse failed at offset {}", scanner.currentOffset(), e);
			throw e;
		}
		if (!errors.isEmpty()) {
			LOGGER.trace("Document has {} validation errors", errors.size());
		}
		return errors;
	}

	@Override
	public String toString() {
		return "ValidatingParser<" + destinationType.getTypeName() + ">";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidatingParser.class);
}
