package works.jsonv.codec.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonv.codec.JsonScanner;
import works.jsonv.codec.Token;
import works.jsonv.codec.TokenSpan;
import works.jsonv.exceptions.JsonContentException;
import works.jsonv.exceptions.JsonEndOfInputException;
import works.jsonv.exceptions.JsonSyntaxException;

import static works.jsonv.codec.Token.END_ARRAY;
import static works.jsonv.codec.Token.END_OBJECT;
import static works.jsonv.codec.Token.END_TEXT;
import static works.jsonv.codec.Token.NUMBER;
import static works.jsonv.codec.Token.STRING;

/**
 * {@link JsonScanner} that pulls fixed-size reads from an {@link InputStream}
 * into a {@link ScanBuffer}. Can process JSON text of arbitrary size;
 * the buffer grows only as needed to hold a single token (or, for
 * {@link #readRawValue()}, a single value).
 * <p>
 * Validates token syntax, but not the grammar between tokens,
 * except within {@link #skipValue()}, which checks that brackets and braces balance.
 */
public final class BufferedJsonScanner implements JsonScanner {
	public static final int DEFAULT_MAX_DEPTH = 512;

	private final ScanBuffer buffer;
	private final int maxDepth;

	/**
	 * Position of the most recent token within {@link ScanBuffer#data()},
	 * or -1 if there is no current token.
	 */
	private int spanStart = -1;
	private int spanLength = 0;

	public BufferedJsonScanner(InputStream stream, int readLength) {
		this(stream, readLength, DEFAULT_MAX_DEPTH);
	}

	public BufferedJsonScanner(InputStream stream, int readLength, int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		this.buffer = new ScanBuffer(stream, readLength);
		this.maxDepth = maxDepth;
	}

	@Override
	public Token readToken() throws IOException {
		skipWhitespace();
		spanStart = -1;
		if (!buffer.ensure(1)) {
			LOGGER.trace("readToken: end of text at offset {}", buffer.consumedCount());
			return END_TEXT;
		}
		int first = buffer.peek(0);
		Token token = Token.startingWith(first);
		switch (token) {
			case START_OBJECT, END_OBJECT, START_ARRAY, END_ARRAY, COMMA, COLON -> takeSpan(1);
			case NULL, FALSE, TRUE -> readLiteral(token);
			case STRING -> readString();
			case NUMBER -> readNumber(first);
			default -> throw new JsonSyntaxException("Unexpected character " + Util.describeByte(first) + " at offset " + buffer.consumedCount());
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("readToken: {} {}", token, span());
		}
		return token;
	}

	@Override
	public TokenSpan span() {
		if (spanStart < 0) {
			throw new IllegalStateException("No current token");
		}
		return new TokenSpan(buffer.data(), spanStart, spanLength);
	}

	@Override
	public Token peekToken() throws IOException {
		skipWhitespace();
		spanStart = -1;
		if (buffer.ensure(1)) {
			return Token.startingWith(buffer.peek(0));
		} else {
			return END_TEXT;
		}
	}

	@Override
	public void skipValue() throws IOException {
		Token first = readToken();
		switch (first) {
			case NULL, FALSE, TRUE, NUMBER, STRING -> { }
			case START_OBJECT, START_ARRAY -> skipRestOfContainer(first);
			case END_TEXT -> throw new JsonEndOfInputException("Unexpected end of input; expected a value");
			default -> throw new JsonSyntaxException("Expected a value; found " + first.describe() + " at offset " + buffer.consumedCount());
		}
	}

	/**
	 * Reads tokens until the container opened by {@code opener} is closed,
	 * checking that nested openers and closers match.
	 */
	private void skipRestOfContainer(Token opener) throws IOException {
		Deque<Token> expectedClosers = new ArrayDeque<>();
		expectedClosers.push(closerFor(opener));
		while (!expectedClosers.isEmpty()) {
			Token token = readToken();
			switch (token) {
				case START_OBJECT, START_ARRAY -> {
					if (expectedClosers.size() >= maxDepth) {
						throw new JsonContentException("Nesting deeper than " + maxDepth + " at offset " + buffer.consumedCount());
					}
					expectedClosers.push(closerFor(token));
				}
				case END_OBJECT, END_ARRAY -> {
					Token expected = expectedClosers.pop();
					if (token != expected) {
						throw new JsonSyntaxException("Expected " + expected.describe() + "; found " + token.describe() + " at offset " + buffer.consumedCount());
					}
				}
				case END_TEXT -> throw new JsonEndOfInputException("Unexpected end of input inside " + opener.describe());
				default -> { }
			}
		}
	}

	private static Token closerFor(Token opener) {
		return (opener == Token.START_OBJECT) ? END_OBJECT : END_ARRAY;
	}

	@Override
	public byte[] readRawValue() throws IOException {
		skipWhitespace();
		buffer.mark();
		try {
			skipValue();
			return Arrays.copyOfRange(buffer.data(), buffer.markPos(), buffer.readPos());
		} finally {
			buffer.clearMark();
		}
	}

	@Override
	public long currentOffset() {
		return buffer.consumedCount();
	}

	@Override
	public void close() throws IOException {
		buffer.close();
	}

	private void skipWhitespace() throws IOException {
		while (buffer.ensure(1)) {
			byte[] data = buffer.data();
			int start = buffer.readPos();
			int limit = buffer.limit();
			int pos = start;
			while (pos < limit && Util.isSpace(data[pos])) {
				pos++;
			}
			buffer.consume(pos - start);
			if (pos < limit) {
				return;
			}
		}
	}

	/**
	 * Consumes {@code length} bytes as the current token.
	 */
	private void takeSpan(int length) {
		spanStart = buffer.readPos();
		spanLength = length;
		buffer.consume(length);
	}

	private void readLiteral(Token token) throws IOException {
		String expected = token.fixedRepresentation();
		int length = expected.length();
		if (!buffer.ensure(length)) {
			// Even a partial match can't succeed; report whichever problem comes first
			int available = buffer.available();
			checkLiteralPrefix(expected, available);
			throw new JsonEndOfInputException("Unexpected end of input in the middle of '" + expected + "'");
		}
		checkLiteralPrefix(expected, length);
		takeSpan(length);
	}

	private void checkLiteralPrefix(String expected, int count) {
		for (int i = 0; i < count; i++) {
			int actual = buffer.peek(i);
			if (actual != expected.charAt(i)) {
				throw new JsonSyntaxException("Expected '" + expected + "' but found " + Util.describeByte(actual) + " at offset " + (buffer.consumedCount() + i));
			}
		}
	}

	private void readString() throws IOException {
		// Offset, relative to readPos, of the next byte to examine; the opening quote is at zero
		int offset = 1;
		while (true) {
			if (!buffer.ensure(offset + 1)) {
				throw new JsonEndOfInputException("Unexpected end of input inside string starting at offset " + buffer.consumedCount());
			}
			byte[] data = buffer.data();
			int base = buffer.readPos();
			int limit = buffer.limit();
			int pos = base + offset;
			while (pos < limit) {
				byte b = data[pos];
				if (b == '"') {
					takeSpan(pos - base + 1);
					return;
				} else if (b == '\\') {
					// The escaped byte can't terminate the string
					pos += 2;
				} else {
					pos++;
				}
			}
			offset = pos - base;
		}
	}

	private void readNumber(int first) throws IOException {
		NumberState state = NumberState.initial(first);
		int offset = 1;
		while (true) {
			int b;
			if (buffer.ensure(offset + 1)) {
				b = buffer.peek(offset);
			} else {
				b = NumberState.SENTINEL;
			}
			NumberState next = state.next(b);
			if (next == NumberState.DONE) {
				takeSpan(offset);
				return;
			}
			state = next;
			offset++;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BufferedJsonScanner.class);
}
