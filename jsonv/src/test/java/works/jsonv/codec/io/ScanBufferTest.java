package works.jsonv.codec.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanBufferTest {

	@Test
	void readLengthTooSmall() {
		InputStream stream = new ByteArrayInputStream(new byte[0]);
		assertThrows(IllegalArgumentException.class, () -> new ScanBuffer(stream, ScanBuffer.MIN_READ_LENGTH - 1));
	}

	@Test
	void compactionKeepsUnconsumedBytes() throws IOException {
		String text = "abcdefghijklmnopqrstuvwxyz".repeat(10);
		ScanBuffer buffer = new ScanBuffer(new TrickleInputStream(text, 5), ScanBuffer.MIN_READ_LENGTH);
		StringBuilder seen = new StringBuilder();
		while (buffer.ensure(1)) {
			seen.append((char) buffer.peek(0));
			buffer.consume(1);
		}
		assertEquals(text, seen.toString());
		assertEquals(text.length(), buffer.consumedCount());
		assertTrue(buffer.endOfStream());
	}

	@Test
	void markSurvivesCompaction() throws IOException {
		String text = "0123456789".repeat(20);
		ScanBuffer buffer = new ScanBuffer(new TrickleInputStream(text, 7), ScanBuffer.MIN_READ_LENGTH);
		assertTrue(buffer.ensure(10));
		buffer.consume(10);
		buffer.mark();
		assertTrue(buffer.ensure(150));
		buffer.consume(150);
		String marked = new String(buffer.data(), buffer.markPos(), buffer.readPos() - buffer.markPos(), UTF_8);
		assertEquals(text.substring(10, 160), marked);
		assertEquals(160, buffer.consumedCount());
		buffer.clearMark();
	}

	@Test
	void ensureBeyondEndOfStream() throws IOException {
		ScanBuffer buffer = new ScanBuffer(new ByteArrayInputStream("abc".getBytes(UTF_8)), ScanBuffer.MIN_READ_LENGTH);
		assertFalse(buffer.ensure(4));
		assertEquals(3, buffer.available());
		assertTrue(buffer.ensure(3));
		assertFalse(buffer.ensure(4));
	}

	@Test
	void readErrorIsSticky() throws IOException {
		FailingInputStream stream = new FailingInputStream();
		ScanBuffer buffer = new ScanBuffer(stream, ScanBuffer.MIN_READ_LENGTH);
		IOException first = assertThrows(IOException.class, () -> buffer.ensure(1));
		IOException second = assertThrows(IOException.class, () -> buffer.ensure(1));
		assertSame(first, second);
		assertEquals(1, stream.reads);
	}

	static final class FailingInputStream extends InputStream {
		int reads = 0;

		@Override
		public int read() throws IOException {
			reads++;
			throw new IOException("Simulated failure");
		}

		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			return read();
		}
	}
}
