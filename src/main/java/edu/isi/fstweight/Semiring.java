package edu.isi.fstweight;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.Serializable;
import java.util.Random;

/**
 * The contract every weight type satisfies. Values of type <code>W</code> are immutable;
 * the semiring object carries the operations, the designated elements and the declared
 * properties. Subclasses do the operations.
 * <p>
 * <code>plus</code> is associative, commutative and has <code>ZERO()</code> as its identity.
 * <code>times</code> is associative with identity <code>ONE()</code>, has <code>ZERO()</code>
 * as an annihilator and distributes over <code>plus</code> on the side(s) declared in
 * {@link #properties()}.
 * <p>
 * Operations are pure, so one semiring may be shared freely across threads. Operations
 * on non-members, or with no answer in the carrier set, return <code>NO_WEIGHT()</code>
 * rather than throwing.
 */
public abstract class Semiring<W> implements ElementParser<W>, Serializable {

	private transient ErrorReporter reporter;

	public  abstract W plus(W a, W b);
	public  abstract W times(W a, W b);

	/**
	 * For all a, b, c with times(a, b) == c: divide(c, a, LEFT) is a member b' with
	 * times(a, b') == c in a left semiring; divide(c, b, RIGHT) is a member a' with
	 * times(a', b) == c in a right semiring; ANY means either, and only makes sense
	 * when the type is commutative. Returns <code>NO_WEIGHT()</code> when there's no solution.
	 */
	public abstract W divide(W c, W a, DivideType typ);

	public abstract W ZERO();
	public abstract W ONE();
	// not a member. signals an error
	public abstract W NO_WEIGHT();

	public abstract boolean member(W w);

	// canonical representative of w's delta-wide class. exact types leave w alone
	public W quantize(W w, float delta) {
		return w;
	}
	public W quantize(W w) {
		return quantize(w, WeightProperties.DELTA);
	}
	public boolean approxEqual(W a, W b, float delta) {
		return a.equals(b);
	}
	public boolean approxEqual(W a, W b) {
		return approxEqual(a, b, WeightProperties.DELTA);
	}

	// the semiring reverse weights live in. itself for two-sided semirings
	public Semiring<W> reverseSemiring() {
		return this;
	}
	// reverse(reverse(a)) = a; reverse(plus(a,b)) = plus(reverse(a), reverse(b));
	// reverse(times(a,b)) = times(reverse(b), reverse(a))
	public W reverse(W w) {
		return w;
	}

	public int hash(W w) {
		return w.hashCode();
	}

	public abstract long properties();
	public abstract String type();

	// textual form
	public abstract W parse(String text) throws DataFormatException;
	public String print(W w) {
		return w.toString();
	}

	// binary form
	public abstract W read(DataInput in) throws IOException;
	public abstract void write(W w, DataOutput out) throws IOException;

	/**
	 * Random member generator for testing the laws of this type. The default has no
	 * generator and reports as much on every call.
	 */
	public WeightGenerate<W> generator(Random rand, boolean allowZero, int numRandomWeights) {
		return new WeightGenerate<W>(this);
	}
	public WeightGenerate<W> generator(long seed) {
		return generator(new Random(seed), true, WeightProperties.NUM_RANDOM_WEIGHTS);
	}

	public ErrorReporter getErrorReporter() {
		if (reporter == null)
			return ErrorReporter.DEBUG;
		return reporter;
	}
	public void setErrorReporter(ErrorReporter r) {
		reporter = r;
	}

	// for the operations a subclass can't do on a given side
	protected W unsupportedDivide(DivideType typ) {
		getErrorReporter().report(ErrorKind.UNSUPPORTED,
				"Divide: "+typ+" division not supported by "+type());
		return NO_WEIGHT();
	}

	// semirings are interchangeable when they describe the same type
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (o == null || o.getClass() != getClass())
			return false;
		return type().equals(((Semiring<?>)o).type());
	}
	public int hashCode() {
		return type().hashCode();
	}
	public String toString() {
		return type();
	}
}
