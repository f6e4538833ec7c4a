package works.jsonv.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonv.codec.TokenSpan;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;

class StringUnescaperTest {

	@Test
	void plainString() {
		assertEquals("hello, world", decode("\"hello, world\""));
		assertEquals("", decode("\"\""));
		assertEquals("😎 ü", decode("\"😎 ü\""));
	}

	@Test
	void simpleEscapes() {
		assertEquals("\" \\ / \b \f \n \r \t", decode("\"\\\" \\\\ \\/ \\b \\f \\n \\r \\t\""));
	}

	@Test
	void unicodeEscapes() {
		assertEquals("⌘", decode("\"\\u2318\""));
		assertEquals("A", decode("\"\\u0041\""));
		assertEquals("é", decode("\"\\u00e9\""));
		assertEquals("é", decode("\"\\u00E9\""));
		assertEquals("x\u0000y", decode("\"x\\u0000y\""));
	}

	@Test
	void surrogatePair() {
		assertEquals("😎", decode("\"\\uD83D\\uDE0E\""));
		assertEquals("a😎b", decode("\"a\\ud83d\\ude0eb\""));
	}

	@Test
	void loneSurrogates() {
		assertEquals("\uFFFD", decode("\"\\uD83D\""));
		assertEquals("\uFFFDx", decode("\"\\uD83Dx\""));
		assertEquals("\uFFFD", decode("\"\\uDE0E\""));
		assertEquals("\uFFFD\uFFFD", decode("\"\\uDE0E\\uD83D\""));
		assertEquals("\uFFFDA", decode("\"\\uD83D\\u0041\""));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"\"\\x\"",
		"\"\\U0041\"",
		"\"\\u004\"",
		"\"\\u00G1\"",
		"\"trailing\\\"",
		"\"tab\tinside\"",
		"\"newline\ninside\"",
	})
	void invalidContents(String token) {
		assertNull(decode(token));
		assertNull(StringUnescaper.decodeBytes(span(token)));
	}

	@Test
	void decodeBytesCopies() {
		TokenSpan span = span("\"plain\"");
		byte[] result = StringUnescaper.decodeBytes(span);
		assertArrayEquals("plain".getBytes(UTF_8), result);
		assertNotSame(span.bytes(), result);
	}

	@Test
	void decodeBytesRespectsSpanBounds() {
		byte[] bytes = "xx\"a\\nb\"yy".getBytes(UTF_8);
		TokenSpan span = new TokenSpan(bytes, 2, bytes.length - 4);
		assertArrayEquals("a\nb".getBytes(UTF_8), StringUnescaper.decodeBytes(span));
	}

	private static String decode(String token) {
		return StringUnescaper.decodeString(span(token));
	}

	private static TokenSpan span(String token) {
		return TokenSpan.of(token.getBytes(UTF_8));
	}
}
