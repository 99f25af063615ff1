package edu.isi.fstweight;

/**
 * Pseudo-random members of a weight type, for exercising the semiring laws. This base
 * version has nothing to generate: each call reports it and hands back the no-weight.
 * Weight types that can be sampled subclass it and return the subclass from
 * {@link Semiring#generator}.
 */
public class WeightGenerate<W> {
	protected final Semiring<W> semiring;

	public WeightGenerate(Semiring<W> sr) {
		semiring = sr;
	}

	public W generate() {
		semiring.getErrorReporter().report(ErrorKind.UNSUPPORTED,
				"WeightGenerate: No random generator for "+semiring.type());
		return semiring.NO_WEIGHT();
	}
}
