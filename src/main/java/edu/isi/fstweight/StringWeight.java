package edu.isi.fstweight;

import java.io.Serializable;
import java.util.Arrays;

// a sequence of positive labels, plus the two values that aren't sequences:
// the infinite string (semiring zero) and the bad string (no-weight)
public final class StringWeight implements Serializable {
	private static final int SEQUENCE=0;
	private static final int INFINITE=1;
	private static final int BAD=2;

	static final StringWeight INFINITY = new StringWeight(new int[0], INFINITE);
	static final StringWeight BAD_STRING = new StringWeight(new int[0], BAD);
	static final StringWeight EPSILON = new StringWeight(new int[0], SEQUENCE);

	private final int[] labels;
	private final int kind;

	private StringWeight(int[] l, int k) {
		labels = l;
		kind = k;
	}
	public StringWeight(int... l) {
		this(l.clone(), SEQUENCE);
	}

	public boolean isInfinity() { return kind == INFINITE; }
	public boolean isBad() { return kind == BAD; }
	public boolean isSequence() { return kind == SEQUENCE; }
	public int size() { return labels.length; }
	public int get(int i) { return labels[i]; }
	public int[] getLabels() { return labels.clone(); }

	StringWeight prefix(int n) {
		return new StringWeight(Arrays.copyOfRange(labels, 0, n), SEQUENCE);
	}
	StringWeight suffix(int n) {
		return new StringWeight(Arrays.copyOfRange(labels, labels.length-n, labels.length), SEQUENCE);
	}
	StringWeight concat(StringWeight o) {
		int[] l = Arrays.copyOf(labels, labels.length+o.labels.length);
		System.arraycopy(o.labels, 0, l, labels.length, o.labels.length);
		return new StringWeight(l, SEQUENCE);
	}
	StringWeight reversed() {
		if (kind != SEQUENCE)
			return this;
		int[] l = new int[labels.length];
		for (int i = 0; i < labels.length; i++)
			l[i] = labels[labels.length-1-i];
		return new StringWeight(l, SEQUENCE);
	}

	public boolean equals(Object o) {
		if (!(o instanceof StringWeight))
			return false;
		StringWeight w = (StringWeight)o;
		return kind == w.kind && Arrays.equals(labels, w.labels);
	}
	public int hashCode() {
		return 31*Arrays.hashCode(labels) + kind;
	}

	public String toString() {
		if (kind == INFINITE)
			return "Infinity";
		if (kind == BAD)
			return "BadString";
		if (labels.length == 0)
			return "Epsilon";
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < labels.length; i++) {
			if (i > 0)
				sb.append('_');
			sb.append(labels[i]);
		}
		return sb.toString();
	}

	public static StringWeight parse(String s) throws DataFormatException {
		if (s.equals("Infinity"))
			return INFINITY;
		if (s.equals("BadString"))
			return BAD_STRING;
		if (s.equals("Epsilon"))
			return EPSILON;
		String[] toks = s.split("_", -1);
		int[] l = new int[toks.length];
		for (int i = 0; i < toks.length; i++) {
			try {
				l[i] = Integer.parseInt(toks[i]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad label "+toks[i]+" in string weight "+s, e);
			}
			if (l[i] <= 0)
				throw new DataFormatException("Non-positive label "+l[i]+" in string weight "+s);
		}
		return new StringWeight(l, SEQUENCE);
	}

	// binary length field: the label count, or one of these for the non-sequences
	static final int INFINITE_LENGTH=-1;
	static final int BAD_LENGTH=-2;
	int binaryLength() {
		if (kind == INFINITE)
			return INFINITE_LENGTH;
		if (kind == BAD)
			return BAD_LENGTH;
		return labels.length;
	}
}
