package works.jsonv.codec;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A range of bytes within some array.
 * <p>
 * When returned by a {@link JsonScanner}, the array belongs to the scanner
 * and the span is valid only until the next read; call {@link #toByteArray()}
 * or {@link #asString()} to retain the contents.
 *
 * @param bytes  the backing array. Not copied.
 * @param offset index of the first byte of the span
 * @param length number of bytes in the span
 */
public record TokenSpan(
	byte[] bytes,
	int offset,
	int length
) {
	public TokenSpan {
		if (offset < 0 || length < 0 || offset + length > bytes.length) {
			throw new IndexOutOfBoundsException("Span [" + offset + ", " + (offset + length) + ") outside array of length " + bytes.length);
		}
	}

	public static TokenSpan of(byte[] bytes) {
		return new TokenSpan(bytes, 0, bytes.length);
	}

	/**
	 * @return the span without its first and last byte; for a string token, its raw contents
	 */
	public TokenSpan interior() {
		if (length < 2) {
			throw new IllegalStateException("Span too short to have an interior: " + length);
		}
		return new TokenSpan(bytes, offset + 1, length - 2);
	}

	public byte[] toByteArray() {
		return Arrays.copyOfRange(bytes, offset, offset + length);
	}

	public String asString() {
		return new String(bytes, offset, length, UTF_8);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TokenSpan other
			&& Arrays.equals(bytes, offset, offset + length, other.bytes, other.offset, other.offset + other.length);
	}

	@Override
	public int hashCode() {
		int result = 1;
		for (int i = offset; i < offset + length; i++) {
			result = 31 * result + bytes[i];
		}
		return result;
	}

	@Override
	public String toString() {
		return "|" + asString() + "|";
	}
}
