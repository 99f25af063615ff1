package edu.isi.fstweight;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * How composite weights look as text: the character between elements, and optionally a
 * pair of characters around each composite. Parentheses must be set whenever composites
 * nest, or separators of different levels can't be told apart on reading.
 * <p>
 * Whoever writes some text and whoever reads it back must use equal options.
 */
public final class CompositeWeightOptions implements Serializable {

	public static final String SEPARATOR_KEY = "fst.weight.separator";
	public static final String PARENTHESES_KEY = "fst.weight.parentheses";
	public static final String LENIENT_OPEN_KEY = "fst.weight.lenient_open";

	// bundled on the classpath with the defaults below
	public static final String RESOURCE = "/fstweight.properties";

	public static final CompositeWeightOptions DEFAULT = new CompositeWeightOptions(',', false, '\0', '\0', false);

	private final char separator;
	private final boolean hasParens;
	private final char openParen;
	private final char closeParen;
	private final boolean lenientOpen;

	private CompositeWeightOptions(char sep, boolean parens, char open, char close, boolean lenient) {
		separator = sep;
		hasParens = parens;
		openParen = open;
		closeParen = close;
		lenientOpen = lenient;
	}

	// separator: exactly one character. parentheses: empty, or open then close
	public CompositeWeightOptions(String separator, String parentheses) throws ConfigureException {
		this(separator, parentheses, false);
	}
	public CompositeWeightOptions(String sep, String parens, boolean lenient) throws ConfigureException {
		if (sep == null || sep.length() != 1)
			throw new ConfigureException("Weight separator must be a single character; got \""+sep+"\"");
		if (parens == null)
			parens = "";
		if (parens.length() != 0 && parens.length() != 2)
			throw new ConfigureException("Weight parentheses must be empty or two characters; got \""+parens+"\"");
		separator = sep.charAt(0);
		hasParens = parens.length() == 2;
		openParen = hasParens ? parens.charAt(0) : '\0';
		closeParen = hasParens ? parens.charAt(1) : '\0';
		if (hasParens && (openParen == closeParen || openParen == separator || closeParen == separator))
			throw new ConfigureException("Weight separator and parentheses must all differ; got \""+sep+"\" and \""+parens+"\"");
		if (Character.isWhitespace(separator) || (hasParens && (Character.isWhitespace(openParen) || Character.isWhitespace(closeParen))))
			throw new ConfigureException("Weight separator and parentheses can't be whitespace");
		lenientOpen = lenient;
	}

	public static CompositeWeightOptions fromProperties(Properties p) throws ConfigureException {
		return new CompositeWeightOptions(p.getProperty(SEPARATOR_KEY, ","),
				p.getProperty(PARENTHESES_KEY, ""),
				Boolean.parseBoolean(p.getProperty(LENIENT_OPEN_KEY, "false")));
	}

	// the bundled settings, overridden by any system properties of the same names
	public static CompositeWeightOptions load() throws ConfigureException {
		Properties p = new Properties();
		InputStream is = CompositeWeightOptions.class.getResourceAsStream(RESOURCE);
		if (is != null) {
			try {
				try {
					p.load(is);
				}
				finally {
					is.close();
				}
			}
			catch (IOException e) {
				throw new ConfigureException("Couldn't read "+RESOURCE, e);
			}
		}
		for (String key : new String[] { SEPARATOR_KEY, PARENTHESES_KEY, LENIENT_OPEN_KEY }) {
			String v = System.getProperty(key);
			if (v != null)
				p.setProperty(key, v);
		}
		return fromProperties(p);
	}

	public char getSeparator() { return separator; }
	public boolean hasParens() { return hasParens; }
	public char getOpenParen() { return openParen; }
	public char getCloseParen() { return closeParen; }
	// whether readBegin takes the first character as the open paren without checking it
	public boolean isLenientOpen() { return lenientOpen; }

	public String getParentheses() {
		return hasParens ? ""+openParen+closeParen : "";
	}

	public boolean equals(Object o) {
		if (!(o instanceof CompositeWeightOptions))
			return false;
		CompositeWeightOptions c = (CompositeWeightOptions)o;
		return separator == c.separator && hasParens == c.hasParens &&
			openParen == c.openParen && closeParen == c.closeParen && lenientOpen == c.lenientOpen;
	}
	public int hashCode() {
		return ((separator*31 + openParen)*31 + closeParen)*4 + (hasParens ? 2 : 0) + (lenientOpen ? 1 : 0);
	}
	public String toString() {
		return "separator '"+separator+"', parentheses \""+getParentheses()+"\""+(lenientOpen ? ", lenient" : "");
	}
}
