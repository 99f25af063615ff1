package edu.isi.fstweight;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Random;

// shared machinery for semirings over reals in the negative log domain:
// times is +, zero is +INF, one is 0. subclasses pick plus
public abstract class FloatSemiring extends Semiring<FloatWeight> {

	private static final FloatWeight ZERO = new FloatWeight(Double.POSITIVE_INFINITY);
	private static final FloatWeight ONE = new FloatWeight(0);
	private static final FloatWeight NO_WEIGHT = new FloatWeight(Double.NaN);

	public FloatWeight ZERO() { return ZERO; }
	public FloatWeight ONE() { return ONE; }
	public FloatWeight NO_WEIGHT() { return NO_WEIGHT; }

	public boolean member(FloatWeight w) {
		double v = w.getValue();
		return !Double.isNaN(v) && v != Double.NEGATIVE_INFINITY;
	}

	public FloatWeight times(FloatWeight a, FloatWeight b) {
		if (!member(a) || !member(b))
			return NO_WEIGHT;
		double x = a.getValue();
		double y = b.getValue();
		if (x == Double.POSITIVE_INFINITY)
			return a;
		if (y == Double.POSITIVE_INFINITY)
			return b;
		return new FloatWeight(x+y);
	}

	// commutative, so every side is the same subtraction
	public FloatWeight divide(FloatWeight c, FloatWeight a, DivideType typ) {
		if (!member(c) || !member(a))
			return NO_WEIGHT;
		if (a.getValue() == Double.POSITIVE_INFINITY)
			return NO_WEIGHT;
		if (c.getValue() == Double.POSITIVE_INFINITY)
			return ZERO;
		return new FloatWeight(c.getValue() - a.getValue());
	}

	public FloatWeight quantize(FloatWeight w, float delta) {
		double v = w.getValue();
		if (Double.isNaN(v) || Double.isInfinite(v))
			return w;
		return new FloatWeight(Math.floor(v/delta + 0.5F) * delta);
	}

	public boolean approxEqual(FloatWeight a, FloatWeight b, float delta) {
		double x = a.getValue();
		double y = b.getValue();
		if (x == y)
			return true;
		return x <= y + delta && y <= x + delta;
	}

	public FloatWeight parse(String text) throws DataFormatException {
		return FloatWeight.parse(text);
	}

	public FloatWeight read(DataInput in) throws IOException {
		return new FloatWeight(in.readDouble());
	}
	public void write(FloatWeight w, DataOutput out) throws IOException {
		out.writeDouble(w.getValue());
	}

	public WeightGenerate<FloatWeight> generator(Random rand, boolean allowZero, int numRandomWeights) {
		return new FloatWeightGenerate(this, rand, allowZero, numRandomWeights);
	}

	// small non-negative integers, so sums and products stay exact
	static class FloatWeightGenerate extends WeightGenerate<FloatWeight> {
		private final Random rand;
		private final boolean allowZero;
		private final int numRandomWeights;
		FloatWeightGenerate(FloatSemiring sr, Random r, boolean z, int n) {
			super(sr);
			rand = r;
			allowZero = z;
			numRandomWeights = n;
		}
		public FloatWeight generate() {
			int sample = rand.nextInt(numRandomWeights + (allowZero ? 1 : 0));
			if (allowZero && sample == numRandomWeights)
				return semiring.ZERO();
			return new FloatWeight(sample);
		}
	}
}
