package edu.isi.fstweight;

import java.io.Serializable;

// a single real-valued weight. NaN is reserved for the no-weight
public final class FloatWeight implements Serializable {
	private final double value;

	public FloatWeight(double v) {
		value = v;
	}
	public double getValue() {
		return value;
	}

	public boolean equals(Object o) {
		if (!(o instanceof FloatWeight))
			return false;
		double v = ((FloatWeight)o).value;
		// NaN == NaN here so that hashing stays sane; member() is what rules it out
		return v == value || (Double.isNaN(v) && Double.isNaN(value));
	}
	public int hashCode() {
		// +0 and -0 are equal so they must hash alike
		if (value == 0)
			return 0;
		return Double.hashCode(value);
	}

	public String toString() {
		if (Double.isNaN(value))
			return "BadNumber";
		if (value == Double.POSITIVE_INFINITY)
			return "Infinity";
		if (value == Double.NEGATIVE_INFINITY)
			return "-Infinity";
		if (value == Math.rint(value) && Math.abs(value) < 1e15)
			return Long.toString((long)value);
		return Double.toString(value);
	}

	public static FloatWeight parse(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equals("Infinity") || t.equals("inf"))
			return new FloatWeight(Double.POSITIVE_INFINITY);
		if (t.equals("-Infinity") || t.equals("-inf"))
			return new FloatWeight(Double.NEGATIVE_INFINITY);
		if (t.equals("BadNumber"))
			return new FloatWeight(Double.NaN);
		try {
			return new FloatWeight(Double.parseDouble(t));
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Not a number: "+s, e);
		}
	}
}
