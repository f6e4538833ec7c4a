package works.jsonv.codec.io;

public class Util {
	/**
	 * JSON whitespace, per RFC 8259.
	 * This works byte-by-byte on UTF-8 text, because every byte of a multi-byte
	 * sequence has its high bit set, and no whitespace character does.
	 */
	public static boolean isSpace(int b) {
		return b == 0x20 || b == 0x09 || b == 0x0A || b == 0x0D;
	}

	public static boolean isDigit(int b) {
		return b >= '0' && b <= '9';
	}

	/**
	 * A printable rendering of a single input byte for error messages.
	 */
	public static String describeByte(int b) {
		if (b >= 0x20 && b < 0x7F) {
			return "'" + (char) b + "'";
		} else {
			return String.format("0x%02X", b & 0xFF);
		}
	}
}
