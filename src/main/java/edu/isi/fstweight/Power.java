package edu.isi.fstweight;

// iterated product: power(w, 0) = ONE(), power(w, n) = times(power(w, n-1), w)
public class Power {
	private Power() {}

	// n is a path multiplicity, so always small. no need for squaring
	public static <W> W power(Semiring<W> sr, W w, int n) {
		if (n < 0)
			throw new IllegalArgumentException("Power: negative exponent "+n);
		W result = sr.ONE();
		for (int i = 0; i < n; i++)
			result = sr.times(result, w);
		return result;
	}
}
