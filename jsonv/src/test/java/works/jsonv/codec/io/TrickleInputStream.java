package works.jsonv.codec.io;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Delivers at most a few bytes per read, so that every token
 * straddles buffer refills.
 */
public class TrickleInputStream extends FilterInputStream {
	private final int maxPerRead;

	public TrickleInputStream(byte[] bytes, int maxPerRead) {
		super(new ByteArrayInputStream(bytes));
		this.maxPerRead = maxPerRead;
	}

	public TrickleInputStream(String s, int maxPerRead) {
		this(s.getBytes(UTF_8), maxPerRead);
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException {
		return super.read(b, off, Math.min(len, maxPerRead));
	}
}
