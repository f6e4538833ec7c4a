package works.jsonv.codec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import works.jsonv.codec.io.BufferedJsonScanner;
import works.jsonv.exceptions.JsonEndOfInputException;
import works.jsonv.exceptions.JsonSyntaxException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Pulls JSON tokens from a stream of UTF-8 bytes.
 * Knows nothing about schemas or destination types.
 * <p>
 * A scanner is created for one input and consumed until the input ends
 * or the first irrecoverable error. It is not reusable, and not thread-safe.
 * <p>
 * Three kinds of failure can occur on any read:
 * <ul>
 *     <li>
 *         the input has ended, reported as {@link Token#END_TEXT}
 *         (or {@link JsonEndOfInputException} if it ends in the middle of a token);
 *     </li>
 *     <li>
 *         the underlying stream failed, reported by rethrowing its {@link IOException}
 *         unchanged, now and on every later read; or
 *     </li>
 *     <li>
 *         the bytes are not valid JSON, reported as {@link JsonSyntaxException}.
 *     </li>
 * </ul>
 */
public interface JsonScanner extends AutoCloseable {
	int DEFAULT_READ_LENGTH = 512;

	/**
	 * @return a scanner that reads from the given stream.
	 * The stream will be closed when the scanner is closed.
	 */
	static JsonScanner create(InputStream stream) {
		return new BufferedJsonScanner(stream, DEFAULT_READ_LENGTH);
	}

	static JsonScanner create(InputStream stream, int readLength) {
		return new BufferedJsonScanner(stream, readLength);
	}

	/**
	 * @return a scanner over a complete JSON document held as UTF-8 bytes.
	 */
	static JsonScanner create(byte[] utf8Bytes) {
		return new BufferedJsonScanner(new ByteArrayInputStream(utf8Bytes), Math.max(DEFAULT_READ_LENGTH, utf8Bytes.length));
	}

	static JsonScanner create(String json) {
		return create(json.getBytes(UTF_8));
	}

	/**
	 * Skips whitespace and consumes the next token.
	 * The token's bytes are then available from {@link #span()}.
	 *
	 * @return {@link Token#END_TEXT} if the input has ended
	 * @throws JsonSyntaxException if the next bytes do not form a JSON token
	 * @throws JsonEndOfInputException if the input ends partway through a token
	 */
	Token readToken() throws IOException;

	/**
	 * The bytes of the token most recently returned by {@link #readToken()}.
	 * For strings, this includes the surrounding quotes, with escapes undecoded.
	 * <p>
	 * Valid only until the next call to any read method of this scanner.
	 */
	TokenSpan span();

	/**
	 * Identifies the kind of the next token without consuming it.
	 * Only the first byte of the token is examined,
	 * so a malformed token can still be reported as {@link Token#TRUE} and so on;
	 * the problem surfaces when it is read.
	 * <p>
	 * Invalidates the previous {@link #span()}.
	 */
	Token peekToken() throws IOException;

	/**
	 * Consumes and discards one complete JSON value:
	 * a scalar, or an entire object or array including everything nested in it.
	 *
	 * @throws JsonSyntaxException if the next token can't begin a value or
	 * the nested structure is malformed
	 */
	void skipValue() throws IOException;

	/**
	 * Like {@link #skipValue()}, but returns a copy of the value's bytes,
	 * excluding any surrounding whitespace.
	 */
	byte[] readRawValue() throws IOException;

	/**
	 * @return the number of bytes consumed so far. Useful for diagnostics.
	 */
	long currentOffset();

	@Override void close() throws IOException;
}
