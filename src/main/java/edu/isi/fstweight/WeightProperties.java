package edu.isi.fstweight;

/**
 * Bitmask vocabulary for the algebraic laws a weight type satisfies. A type declares
 * its mask once through {@link Semiring#properties()} and algorithms trust it; nothing
 * ever tries to infer the mask from sampled values.
 */
public final class WeightProperties {

	private WeightProperties() {}

	/** For all a, b, c: times(c, plus(a, b)) = plus(times(c, a), times(c, b)). */
	public static final long LEFT_SEMIRING = 0x0000000000000001L;

	/** For all a, b, c: times(plus(a, b), c) = plus(times(a, c), times(b, c)). */
	public static final long RIGHT_SEMIRING = 0x0000000000000002L;

	public static final long SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;

	/** For all a, b: times(a, b) = times(b, a). */
	public static final long COMMUTATIVE = 0x0000000000000004L;

	/** For all a: plus(a, a) = a. */
	public static final long IDEMPOTENT = 0x0000000000000008L;

	/** For all a, b: plus(a, b) = a or plus(a, b) = b. */
	public static final long PATH = 0x0000000000000010L;

	/** A representable float near .001, the default quantization width. */
	public static final float DELTA = 1.0F / 1024.0F;

	/** Default number of distinct weights a random generator draws from. */
	public static final int NUM_RANDOM_WEIGHTS = 5;

	// names in bit order, for printing masks
	private static final String[] NAMES = { "left", "right", "commutative", "idempotent", "path" };

	public static boolean has(long props, long flags) {
		return (props & flags) == flags;
	}

	// e.g. "left|right|commutative"; "none" for an empty mask
	public static String toString(long props) {
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < NAMES.length; i++) {
			if ((props & (1L << i)) != 0) {
				if (sb.length() > 0)
					sb.append('|');
				sb.append(NAMES[i]);
			}
		}
		if (sb.length() == 0)
			return "none";
		return sb.toString();
	}
}
