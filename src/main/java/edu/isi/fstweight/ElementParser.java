package edu.isi.fstweight;

// turns the text of one composite element back into a value
public interface ElementParser<T> {

	T parse(String text) throws DataFormatException;

	// elements kept as their raw text
	public static final ElementParser<String> TEXT = new ElementParser<String>() {
		public String parse(String text) {
			return text;
		}
	};
}
