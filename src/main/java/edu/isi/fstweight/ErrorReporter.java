package edu.isi.fstweight;

/**
 * Sink for the non-fatal errors of the weight layer. Components report here and then
 * carry on with a sentinel value (a no-weight, a bad reader, an invalid comparator),
 * so the caller decides what to do about it.
 */
public interface ErrorReporter {

	void report(ErrorKind kind, String message);

	/** Writes every report to the {@link Debug} stream. */
	public static final ErrorReporter DEBUG = new ErrorReporter() {
		public void report(ErrorKind kind, String message) {
			Debug.prettyDebug("ERROR ("+kind+"): "+message);
		}
	};
}
