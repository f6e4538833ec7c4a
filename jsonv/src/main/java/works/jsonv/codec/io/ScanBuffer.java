package works.jsonv.codec.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * A growable window over an {@link InputStream}.
 * <p>
 * Bytes between {@link #readPos()} and {@link #limit()} have been read from the stream
 * but not yet consumed. When more room is needed, consumed bytes are discarded by sliding
 * the unconsumed ones to the front of the array, or, when that wouldn't free a full
 * read's worth of space, by moving them into a larger array.
 * A {@link #mark() mark} pins the bytes after it so they survive compaction.
 * <p>
 * The first {@link IOException} from the stream is remembered and rethrown by every
 * later fill; the stream is never read again after failing or reaching its end.
 */
final class ScanBuffer {
	static final int MIN_READ_LENGTH = 16;

	private final InputStream stream;
	private final int readLength;
	private byte[] data;
	private int readPos = 0;
	private int limit = 0;
	private int mark = -1;

	/**
	 * Number of bytes discarded from the front of the buffer by compaction.
	 */
	private long discarded = 0;

	private IOException readError;
	private boolean endOfStream = false;

	ScanBuffer(InputStream stream, int readLength) {
		if (readLength < MIN_READ_LENGTH) {
			throw new IllegalArgumentException("Read length must be at least " + MIN_READ_LENGTH + ", got " + readLength);
		}
		this.stream = stream;
		this.readLength = readLength;
		this.data = new byte[readLength];
	}

	byte[] data() {
		return data;
	}

	int readPos() {
		return readPos;
	}

	int limit() {
		return limit;
	}

	int available() {
		return limit - readPos;
	}

	/**
	 * @param offset relative to {@link #readPos()}; caller must have {@link #ensure ensured} it's available
	 */
	int peek(int offset) {
		return data[readPos + offset] & 0xFF;
	}

	void consume(int count) {
		assert 0 <= count && count <= available();
		readPos += count;
	}

	/**
	 * Reads from the stream until at least {@code count} unconsumed bytes are buffered.
	 *
	 * @return false if the stream ended first
	 */
	boolean ensure(int count) throws IOException {
		while (available() < count) {
			if (!fill()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Pins the current read position against compaction until {@link #clearMark()}.
	 */
	void mark() {
		mark = readPos;
	}

	int markPos() {
		assert mark >= 0;
		return mark;
	}

	void clearMark() {
		mark = -1;
	}

	long consumedCount() {
		return discarded + readPos;
	}

	boolean endOfStream() {
		return endOfStream;
	}

	void close() throws IOException {
		stream.close();
	}

	private boolean fill() throws IOException {
		if (readError != null) {
			throw readError;
		}
		if (endOfStream) {
			return false;
		}

		if (data.length - limit < readLength) {
			makeRoom();
		}

		int count;
		try {
			count = stream.read(data, limit, data.length - limit);
		} catch (IOException e) {
			readError = e;
			throw e;
		}
		if (count == -1) {
			endOfStream = true;
			return false;
		}
		limit += count;
		return true;
	}

	private void makeRoom() {
		int keepFrom = (mark >= 0) ? mark : readPos;
		int used = limit - keepFrom;
		if (data.length - used >= readLength) {
			System.arraycopy(data, keepFrom, data, 0, used);
		} else {
			byte[] bigger = new byte[2 * data.length + readLength];
			System.arraycopy(data, keepFrom, bigger, 0, used);
			data = bigger;
		}
		readPos -= keepFrom;
		limit = used;
		if (mark >= 0) {
			mark -= keepFrom;
		}
		discarded += keepFrom;
	}
}
