package edu.isi.fstweight;

// settings that can't work together: bad composite weight options, clashing tool flags
public class ConfigureException extends Exception {
	public ConfigureException(String message) {
		super(message);
	}
	public ConfigureException(String message, Throwable cause) {
		super(message, cause);
	}
}
