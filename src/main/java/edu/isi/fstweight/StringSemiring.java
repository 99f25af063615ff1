package edu.isi.fstweight;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Random;

/**
 * Label strings under concatenation. On the left side plus is the longest common prefix
 * and only left division exists; the right side mirrors that with suffixes. Neither
 * side is commutative, and reversing a weight moves it to the other side.
 */
public class StringSemiring extends Semiring<StringWeight> {

	private final DivideType side;

	public StringSemiring(DivideType s) {
		if (s == DivideType.ANY)
			throw new IllegalArgumentException("String semiring must be LEFT or RIGHT");
		side = s;
	}
	public DivideType getSide() {
		return side;
	}

	public StringWeight ZERO() { return StringWeight.INFINITY; }
	public StringWeight ONE() { return StringWeight.EPSILON; }
	public StringWeight NO_WEIGHT() { return StringWeight.BAD_STRING; }

	public boolean member(StringWeight w) {
		return !w.isBad();
	}

	public StringWeight plus(StringWeight a, StringWeight b) {
		if (!member(a) || !member(b))
			return NO_WEIGHT();
		if (a.isInfinity())
			return b;
		if (b.isInfinity())
			return a;
		int n = Math.min(a.size(), b.size());
		int i = 0;
		if (side == DivideType.LEFT) {
			while (i < n && a.get(i) == b.get(i))
				i++;
			return a.prefix(i);
		}
		while (i < n && a.get(a.size()-1-i) == b.get(b.size()-1-i))
			i++;
		return a.suffix(i);
	}

	public StringWeight times(StringWeight a, StringWeight b) {
		if (!member(a) || !member(b))
			return NO_WEIGHT();
		if (a.isInfinity() || b.isInfinity())
			return ZERO();
		return a.concat(b);
	}

	// strips a off the front (left) or the back (right) of c
	public StringWeight divide(StringWeight c, StringWeight a, DivideType typ) {
		if (typ != side)
			return unsupportedDivide(typ);
		if (!member(c) || !member(a) || a.isInfinity())
			return NO_WEIGHT();
		if (c.isInfinity())
			return ZERO();
		if (a.size() > c.size())
			return NO_WEIGHT();
		int off = side == DivideType.LEFT ? 0 : c.size() - a.size();
		for (int i = 0; i < a.size(); i++)
			if (c.get(off+i) != a.get(i))
				return NO_WEIGHT();
		if (side == DivideType.LEFT)
			return c.suffix(c.size() - a.size());
		return c.prefix(c.size() - a.size());
	}

	public Semiring<StringWeight> reverseSemiring() {
		StringSemiring r = new StringSemiring(side == DivideType.LEFT ? DivideType.RIGHT : DivideType.LEFT);
		r.setErrorReporter(getErrorReporter());
		return r;
	}
	public StringWeight reverse(StringWeight w) {
		return w.reversed();
	}

	public long properties() {
		if (side == DivideType.LEFT)
			return WeightProperties.LEFT_SEMIRING | WeightProperties.IDEMPOTENT;
		return WeightProperties.RIGHT_SEMIRING | WeightProperties.IDEMPOTENT;
	}
	public String type() {
		return side == DivideType.LEFT ? "left_string" : "right_string";
	}

	public StringWeight parse(String text) throws DataFormatException {
		return StringWeight.parse(text);
	}

	public StringWeight read(DataInput in) throws IOException {
		int n = in.readInt();
		if (n == StringWeight.INFINITE_LENGTH)
			return StringWeight.INFINITY;
		if (n == StringWeight.BAD_LENGTH)
			return StringWeight.BAD_STRING;
		if (n < 0)
			throw new IOException("Bad string weight length "+n);
		int[] l = new int[n];
		for (int i = 0; i < n; i++)
			l[i] = in.readInt();
		return new StringWeight(l);
	}
	public void write(StringWeight w, DataOutput out) throws IOException {
		out.writeInt(w.binaryLength());
		for (int i = 0; i < w.size(); i++)
			out.writeInt(w.get(i));
	}

	public WeightGenerate<StringWeight> generator(Random rand, boolean allowZero, int numRandomWeights) {
		return new StringWeightGenerate(this, rand, allowZero, numRandomWeights);
	}

	// strings shorter than numRandomWeights over the labels 1..numRandomWeights
	static class StringWeightGenerate extends WeightGenerate<StringWeight> {
		private final Random rand;
		private final boolean allowZero;
		private final int numRandomWeights;
		StringWeightGenerate(StringSemiring sr, Random r, boolean z, int n) {
			super(sr);
			rand = r;
			allowZero = z;
			numRandomWeights = n;
		}
		public StringWeight generate() {
			if (allowZero && rand.nextInt(numRandomWeights+1) == numRandomWeights)
				return semiring.ZERO();
			int[] l = new int[rand.nextInt(numRandomWeights)];
			for (int i = 0; i < l.length; i++)
				l[i] = 1 + rand.nextInt(numRandomWeights);
			return new StringWeight(l);
		}
	}
}
