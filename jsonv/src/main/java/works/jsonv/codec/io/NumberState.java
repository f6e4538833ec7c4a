package works.jsonv.codec.io;

import works.jsonv.exceptions.JsonSyntaxException;

import static works.jsonv.codec.io.Util.isDigit;

/**
 * States of the number-literal recognizer.
 * Each state examines one byte and returns the state for the byte after it,
 * or {@link #DONE} if the byte is not part of the number.
 * Malformed literals are rejected as soon as the offending byte is seen.
 */
enum NumberState {
	/**
	 * Seen the leading minus sign
	 */
	MINUS {
		@Override
		NumberState next(int b) {
			if (b == '0') {
				return ZERO;
			} else if (isDigit(b)) {
				return INTEGER;
			} else {
				throw malformed("expected digit after '-' in number literal", b);
			}
		}
	},

	/**
	 * The integer part is a single zero
	 */
	ZERO {
		@Override
		NumberState next(int b) {
			if (b == '.') {
				return DOT;
			} else if (b == 'e' || b == 'E') {
				return EXPONENT;
			} else if (isDigit(b)) {
				throw malformed("leading zeros are not allowed in number literal", b);
			} else {
				return DONE;
			}
		}
	},

	/**
	 * Inside an integer part that began with a nonzero digit
	 */
	INTEGER {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return INTEGER;
			} else if (b == '.') {
				return DOT;
			} else if (b == 'e' || b == 'E') {
				return EXPONENT;
			} else {
				return DONE;
			}
		}
	},

	DOT {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return FRACTION;
			} else {
				throw malformed("expected digit after '.' in number literal", b);
			}
		}
	},

	FRACTION {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return FRACTION;
			} else if (b == 'e' || b == 'E') {
				return EXPONENT;
			} else {
				return DONE;
			}
		}
	},

	EXPONENT {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return EXPONENT_DIGITS;
			} else if (b == '-' || b == '+') {
				return EXPONENT_SIGN;
			} else {
				throw malformed("expected digit or sign after 'e' in number literal", b);
			}
		}
	},

	EXPONENT_SIGN {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return EXPONENT_DIGITS;
			} else {
				throw malformed("expected digit after exponent sign in number literal", b);
			}
		}
	},

	EXPONENT_DIGITS {
		@Override
		NumberState next(int b) {
			if (isDigit(b)) {
				return EXPONENT_DIGITS;
			} else {
				return DONE;
			}
		}
	},

	DONE {
		@Override
		NumberState next(int b) {
			throw new IllegalStateException("Number is already complete");
		}
	};

	/**
	 * Fed to the current state when the input ends, to force it to finish or fail.
	 */
	static final int SENTINEL = ' ';

	abstract NumberState next(int b);

	static NumberState initial(int firstByte) {
		if (firstByte == '-') {
			return MINUS;
		} else if (firstByte == '0') {
			return ZERO;
		} else if (firstByte >= '1' && firstByte <= '9') {
			return INTEGER;
		} else {
			throw new IllegalArgumentException("Not the start of a number: " + Util.describeByte(firstByte));
		}
	}

	private static JsonSyntaxException malformed(String message, int b) {
		return new JsonSyntaxException(message + "; found " + Util.describeByte(b));
	}
}
