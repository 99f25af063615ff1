package edu.isi.fstweight;

import java.util.Comparator;

/**
 * Strict version of the natural order: a &lt; b iff plus(a, b) == a and a != b.
 * <p>
 * The natural order is a negative partial order iff the semiring is idempotent; it is
 * total iff the semiring also has the path property. For a non-idempotent type the
 * comparator is still built, but an error is reported and {@link #isValid()} is false;
 * callers mustn't rely on its answers then.
 * <p>
 * As a {@link Comparator}, two weights neither of which is less than the other compare
 * as 0. Without the path property that can mean incomparable rather than equal.
 */
public class NaturalLess<W> implements Comparator<W> {
	private final Semiring<W> semiring;
	private final boolean valid;

	public NaturalLess(Semiring<W> sr) {
		this(sr, sr.getErrorReporter());
	}
	public NaturalLess(Semiring<W> sr, ErrorReporter reporter) {
		semiring = sr;
		valid = WeightProperties.has(sr.properties(), WeightProperties.IDEMPOTENT);
		if (!valid)
			reporter.report(ErrorKind.CONFIGURATION,
					"NaturalLess: Weight type is not idempotent: "+sr.type());
	}

	public boolean less(W a, W b) {
		return semiring.plus(a, b).equals(a) && !a.equals(b);
	}

	public int compare(W a, W b) {
		if (less(a, b))
			return -1;
		if (less(b, a))
			return 1;
		return 0;
	}

	public boolean isValid() {
		return valid;
	}
	public boolean isTotal() {
		return valid && WeightProperties.has(semiring.properties(), WeightProperties.PATH);
	}
}
