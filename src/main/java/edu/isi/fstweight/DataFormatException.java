package edu.isi.fstweight;

/**
 * Text or binary input that doesn't form a weight, codex or transducer of the
 * expected type. The message says what was wrong and, where known, where.
 */
public class DataFormatException extends Exception {
	public DataFormatException(String message) {
		super(message);
	}
	public DataFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
