package edu.isi.fstweight;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Reads one composite weight back from text: readBegin, then readElement until it says
 * there's nothing more (or as many times as the weight has elements), then readEnd.
 * <p>
 * Elements are split at the separator, but only at parenthesis depth one (or zero,
 * without parentheses): a separator inside a nested composite belongs to that
 * composite and stays in the element's text, to be split again by the element's own
 * parser. There must be at least one element.
 * <p>
 * Malformed input doesn't throw. The reader reports the problem, marks itself bad and
 * refuses to read further; check {@link #isBad()} after every read. The reader keeps
 * one character of lookahead, so the character after the weight is consumed from the
 * stream. Like the writer it borrows the stream and is good for one weight only.
 */
public class CompositeWeightReader {
	private static final int EOF = -1;

	private final Reader in;
	private final CompositeWeightOptions opts;
	private final ErrorReporter reporter;

	// last character read, or EOF
	private int c;
	// whether c holds anything yet
	private boolean started = false;
	// parenthesis depth
	private int depth = 0;
	private boolean bad = false;
	private String error = null;

	public CompositeWeightReader(Reader r, CompositeWeightOptions o) {
		this(r, o, ErrorReporter.DEBUG);
	}
	public CompositeWeightReader(Reader r, CompositeWeightOptions o, ErrorReporter rep) {
		in = r;
		opts = o;
		reporter = rep;
	}

	/**
	 * Skips leading whitespace and, with parentheses, takes the open paren. A different
	 * character there is an error unless the options are lenient, in which case it is
	 * taken as the open paren whatever it is.
	 */
	public void readBegin() throws IOException {
		if (bad)
			return;
		do {
			c = in.read();
		} while (c != EOF && Character.isWhitespace(c));
		started = true;
		if (opts.hasParens()) {
			if (c != opts.getOpenParen() && !opts.isLenientOpen()) {
				fail("Open paren missing: expected '"+opts.getOpenParen()+"' but found "+describe(c)+
						". Are the weight parentheses set correctly?");
				return;
			}
			depth++;
			c = in.read();
		}
	}

	public <T> boolean readElement(ElementParser<T> parser, List<? super T> target) throws IOException {
		return readElement(parser, target, false);
	}

	/**
	 * Reads one element, parses it and adds it to <code>target</code>. When
	 * <code>last</code> is set, separators no longer end the element, which lets the
	 * final element of a weight contain the separator character unparenthesized.
	 *
	 * @return whether more elements follow; false at end of input, at whitespace, once
	 * the composite's close paren is consumed, or on an error
	 */
	public <T> boolean readElement(ElementParser<T> parser, List<? super T> target, boolean last) throws IOException {
		boolean debug = false;
		if (bad)
			return false;
		if (!started) {
			c = in.read();
			started = true;
		}
		boolean parens = opts.hasParens();
		char sep = opts.getSeparator();
		char open = opts.getOpenParen();
		char close = opts.getCloseParen();
		StringBuffer s = new StringBuffer();
		while (c != EOF && !Character.isWhitespace(c) &&
				(c != sep || depth > 1 || last) &&
				!(parens && c == close && depth == 1)) {
			s.append((char)c);
			// parentheses met before the separator must match
			if (parens && c == open) {
				depth++;
			}
			else if (parens && c == close) {
				if (depth == 0) {
					fail("Unmatched close paren. Are the weight parentheses set correctly?");
					return false;
				}
				depth--;
			}
			c = in.read();
		}
		if (s.length() == 0) {
			fail("Empty element. Are the weight parentheses set correctly?");
			return false;
		}
		if (debug) Debug.debug(debug, "Element text "+s+" at depth "+depth);
		try {
			target.add(parser.parse(s.toString()));
		}
		catch (DataFormatException e) {
			fail("Bad element \""+s+"\": "+e.getMessage());
			return false;
		}
		// skip the separator or close paren
		boolean closed = false;
		if (c != EOF && !Character.isWhitespace(c)) {
			if (parens && c == close && depth == 1) {
				depth--;
				closed = true;
			}
			c = in.read();
		}
		// running out of input here is fine; readEnd decides whether the weight was whole
		return !closed && c != EOF && !Character.isWhitespace(c);
	}

	/**
	 * Finishes the weight: with parentheses every open paren must have been closed,
	 * and nothing but whitespace or the end of input may follow.
	 */
	public void readEnd() throws IOException {
		if (bad)
			return;
		if (opts.hasParens() && depth == 1 && c == opts.getCloseParen()) {
			depth--;
			c = in.read();
		}
		if (opts.hasParens() && depth != 0) {
			fail("Missing close paren: "+depth+" left open at "+describe(c));
			return;
		}
		if (c != EOF && !Character.isWhitespace(c))
			fail("Excess character: "+describe(c)+". Are the weight parentheses set correctly?");
	}

	public boolean isBad() {
		return bad;
	}
	// what went wrong, or null
	public String getError() {
		return error;
	}
	public int getDepth() {
		return depth;
	}

	private void fail(String msg) {
		bad = true;
		error = msg;
		reporter.report(ErrorKind.PARSE, "CompositeWeightReader: "+msg);
	}

	private static String describe(int ch) {
		if (ch == EOF)
			return "end of input";
		return "'"+(char)ch+"'";
	}
}
