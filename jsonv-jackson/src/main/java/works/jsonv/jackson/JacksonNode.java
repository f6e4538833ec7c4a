package works.jsonv.jackson;

import java.io.IOException;
import java.lang.reflect.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonv.codec.JsonScanner;
import works.jsonv.exceptions.InvalidTypeException;
import works.jsonv.schema.AbstractSchemaNode;
import works.jsonv.schema.JsonPath;
import works.jsonv.schema.Slot;
import works.jsonv.validation.ValidationErrors;

import static java.util.Objects.requireNonNull;

/**
 * Delegates one JSON value to a Jackson {@link ObjectMapper},
 * for destination types that the built-in nodes don't support
 * and that can't implement {@link works.jsonv.schema.JsonDecodable} themselves.
 * <p>
 * Anything Jackson rejects is reported as a validation error at this node's path;
 * the value has already been consumed, so the parse continues.
 * A {@code null} is rejected without consulting Jackson.
 */
public final class JacksonNode extends AbstractSchemaNode {
	private final ObjectMapper mapper;
	private volatile JavaType javaType;

	private JacksonNode(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public static JacksonNode of(ObjectMapper mapper) {
		return new JacksonNode(mapper);
	}

	/**
	 * Uses a mapper with Jackson's default configuration.
	 */
	public static JacksonNode withDefaultMapper() {
		return new JacksonNode(JsonMapper.builder().build());
	}

	@Override
	protected void prepareFor(Type destinationType) throws InvalidTypeException {
		JavaType type;
		try {
			type = mapper.getTypeFactory().constructType(destinationType);
		} catch (IllegalArgumentException e) {
			throw new InvalidTypeException("Jackson can't represent " + destinationType.getTypeName(), e);
		}
		javaType = type;
		LOGGER.debug("Prepared for {}", type);
	}

	@Override
	protected void parsePrepared(JsonPath path, JsonScanner scanner, Slot slot, ValidationErrors errors) throws IOException {
		if (rejectedNull(path, scanner, errors)) {
			return;
		}
		byte[] json = scanner.readRawValue();
		Object value;
		try {
			value = mapper.readValue(json, javaType);
		} catch (JacksonException e) {
			LOGGER.trace("Jackson rejected value at {}", path, e);
			errors.add(path.toString(), e.getOriginalMessage());
			return;
		}
		slot.set(value);
	}

	@Override
	public String toString() {
		return "JacksonNode";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonNode.class);
}
