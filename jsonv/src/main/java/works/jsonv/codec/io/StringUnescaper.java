package works.jsonv.codec.io;

import java.util.Arrays;
import works.jsonv.codec.TokenSpan;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Decodes the escape sequences in a raw string token.
 * <p>
 * All methods take the token as the scanner returned it, including its quotes,
 * and return null if the contents are not a valid JSON string:
 * an unknown escape, a malformed unicode escape, an unescaped quote,
 * or an unescaped control character.
 * <p>
 * Surrogate pairs written as two unicode escapes are combined into a single code point.
 * A surrogate that is not part of a pair decodes as U+FFFD.
 */
public final class StringUnescaper {
	private static final int REPLACEMENT_CHARACTER = 0xFFFD;

	private StringUnescaper() { }

	public static String decodeString(TokenSpan token) {
		TokenSpan interior = token.interior();
		if (isPlain(interior)) {
			return interior.asString();
		}
		byte[] decoded = decodeEscapes(interior);
		return (decoded == null) ? null : new String(decoded, UTF_8);
	}

	/**
	 * @return the UTF-8 encoding of the decoded string. Never shares the token's array.
	 */
	public static byte[] decodeBytes(TokenSpan token) {
		TokenSpan interior = token.interior();
		if (isPlain(interior)) {
			return interior.toByteArray();
		}
		return decodeEscapes(interior);
	}

	/**
	 * @return true if the bytes need no decoding at all
	 */
	static boolean isPlain(TokenSpan interior) {
		byte[] bytes = interior.bytes();
		int limit = interior.offset() + interior.length();
		for (int i = interior.offset(); i < limit; i++) {
			int b = bytes[i] & 0xFF;
			if (b == '\\' || b == '"' || b < 0x20) {
				return false;
			}
		}
		return true;
	}

	private static byte[] decodeEscapes(TokenSpan interior) {
		byte[] in = interior.bytes();
		int pos = interior.offset();
		int limit = pos + interior.length();

		// Decoding never lengthens the text: the longest expansion is
		// a six-byte unicode escape becoming a three-byte UTF-8 sequence
		byte[] out = new byte[interior.length()];
		int outPos = 0;

		while (pos < limit) {
			int b = in[pos] & 0xFF;
			if (b == '"' || b < 0x20) {
				return null;
			} else if (b != '\\') {
				out[outPos++] = (byte) b;
				pos++;
				continue;
			}

			if (pos + 1 >= limit) {
				return null;
			}
			int escaped = in[pos + 1] & 0xFF;
			pos += 2;
			switch (escaped) {
				case '"', '\\', '/' -> out[outPos++] = (byte) escaped;
				case 'b' -> out[outPos++] = '\b';
				case 'f' -> out[outPos++] = '\f';
				case 'n' -> out[outPos++] = '\n';
				case 'r' -> out[outPos++] = '\r';
				case 't' -> out[outPos++] = '\t';
				case 'u' -> {
					int unit = hex4(in, pos, limit);
					if (unit < 0) {
						return null;
					}
					pos += 4;
					int codePoint;
					if (Character.isHighSurrogate((char) unit)) {
						int low = lowSurrogateAt(in, pos, limit);
						if (low >= 0) {
							codePoint = Character.toCodePoint((char) unit, (char) low);
							pos += 6;
						} else {
							codePoint = REPLACEMENT_CHARACTER;
						}
					} else if (Character.isLowSurrogate((char) unit)) {
						codePoint = REPLACEMENT_CHARACTER;
					} else {
						codePoint = unit;
					}
					outPos = encodeUtf8(codePoint, out, outPos);
				}
				default -> {
					return null;
				}
			}
		}
		return Arrays.copyOf(out, outPos);
	}

	/**
	 * @return the low surrogate encoded by a unicode escape at {@code pos}, or -1 if there isn't one
	 */
	private static int lowSurrogateAt(byte[] in, int pos, int limit) {
		if (pos + 6 > limit || in[pos] != '\\' || in[pos + 1] != 'u') {
			return -1;
		}
		int unit = hex4(in, pos + 2, limit);
		if (unit >= 0 && Character.isLowSurrogate((char) unit)) {
			return unit;
		} else {
			return -1;
		}
	}

	/**
	 * @return the value of the four hex digits at {@code pos}, or -1 if they aren't four hex digits
	 */
	private static int hex4(byte[] in, int pos, int limit) {
		if (pos + 4 > limit) {
			return -1;
		}
		int result = 0;
		for (int i = pos; i < pos + 4; i++) {
			int digit = Character.digit(in[i] & 0xFF, 16);
			if (digit < 0) {
				return -1;
			}
			result = (result << 4) | digit;
		}
		return result;
	}

	private static int encodeUtf8(int codePoint, byte[] out, int outPos) {
		if (codePoint < 0x80) {
			out[outPos++] = (byte) codePoint;
		} else if (codePoint < 0x800) {
			out[outPos++] = (byte) (0xC0 | (codePoint >> 6));
			out[outPos++] = (byte) (0x80 | (codePoint & 0x3F));
		} else if (codePoint < 0x10000) {
			out[outPos++] = (byte) (0xE0 | (codePoint >> 12));
			out[outPos++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
			out[outPos++] = (byte) (0x80 | (codePoint & 0x3F));
		} else {
			out[outPos++] = (byte) (0xF0 | (codePoint >> 18));
			out[outPos++] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
			out[outPos++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
			out[outPos++] = (byte) (0x80 | (codePoint & 0x3F));
		}
		return outPos;
	}
}
