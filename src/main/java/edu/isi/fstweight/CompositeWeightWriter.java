package edu.isi.fstweight;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes one composite weight as text: writeBegin, then writeElement once per element,
 * then writeEnd. The writer borrows the stream and is good for one weight only. An
 * element that is itself composite is written by its own semiring, through a nested
 * writer; that only reads back when the options have parentheses.
 */
public class CompositeWeightWriter {
	private final Writer out;
	private final CompositeWeightOptions opts;
	// element position
	private int i = 0;

	public CompositeWeightWriter(Writer w, CompositeWeightOptions o) {
		out = w;
		opts = o;
	}

	// open paren, if the options have them
	public void writeBegin() throws IOException {
		if (opts.hasParens())
			out.write(opts.getOpenParen());
	}

	public <T> void writeElement(Semiring<T> sr, T comp) throws IOException {
		writeElementText(sr.print(comp));
	}
	public void writeElement(Object comp) throws IOException {
		writeElementText(comp.toString());
	}
	private void writeElementText(String s) throws IOException {
		if (i++ > 0)
			out.write(opts.getSeparator());
		out.write(s);
	}

	// close paren, if the options have them
	public void writeEnd() throws IOException {
		if (opts.hasParens())
			out.write(opts.getCloseParen());
	}
}
