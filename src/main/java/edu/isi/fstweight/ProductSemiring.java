package edu.isi.fstweight;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Cartesian product of two semirings, everything done component-wise. As text a
 * product weight is its two components joined by the separator of its options, so a
 * component that is itself a product needs options with parentheses.
 */
public class ProductSemiring<A, B> extends Semiring<PairWeight<A, B>> {

	private final Semiring<A> s1;
	private final Semiring<B> s2;
	private final CompositeWeightOptions opts;

	public ProductSemiring(Semiring<A> a, Semiring<B> b) {
		this(a, b, CompositeWeightOptions.DEFAULT);
	}
	public ProductSemiring(Semiring<A> a, Semiring<B> b, CompositeWeightOptions o) {
		s1 = a;
		s2 = b;
		opts = o;
	}

	public Semiring<A> getFirst() { return s1; }
	public Semiring<B> getSecond() { return s2; }
	public CompositeWeightOptions getOptions() { return opts; }

	public PairWeight<A, B> ZERO() { return new PairWeight<A, B>(s1.ZERO(), s2.ZERO()); }
	public PairWeight<A, B> ONE() { return new PairWeight<A, B>(s1.ONE(), s2.ONE()); }
	public PairWeight<A, B> NO_WEIGHT() { return new PairWeight<A, B>(s1.NO_WEIGHT(), s2.NO_WEIGHT()); }

	public boolean member(PairWeight<A, B> w) {
		return s1.member(w.l()) && s2.member(w.r());
	}

	public PairWeight<A, B> plus(PairWeight<A, B> a, PairWeight<A, B> b) {
		return new PairWeight<A, B>(s1.plus(a.l(), b.l()), s2.plus(a.r(), b.r()));
	}
	public PairWeight<A, B> times(PairWeight<A, B> a, PairWeight<A, B> b) {
		return new PairWeight<A, B>(s1.times(a.l(), b.l()), s2.times(a.r(), b.r()));
	}
	public PairWeight<A, B> divide(PairWeight<A, B> c, PairWeight<A, B> a, DivideType typ) {
		return new PairWeight<A, B>(s1.divide(c.l(), a.l(), typ), s2.divide(c.r(), a.r(), typ));
	}

	public PairWeight<A, B> quantize(PairWeight<A, B> w, float delta) {
		return new PairWeight<A, B>(s1.quantize(w.l(), delta), s2.quantize(w.r(), delta));
	}
	public boolean approxEqual(PairWeight<A, B> a, PairWeight<A, B> b, float delta) {
		return s1.approxEqual(a.l(), b.l(), delta) && s2.approxEqual(a.r(), b.r(), delta);
	}

	public Semiring<PairWeight<A, B>> reverseSemiring() {
		ProductSemiring<A, B> r = new ProductSemiring<A, B>(s1.reverseSemiring(), s2.reverseSemiring(), opts);
		r.setErrorReporter(getErrorReporter());
		return r;
	}
	public PairWeight<A, B> reverse(PairWeight<A, B> w) {
		return new PairWeight<A, B>(s1.reverse(w.l()), s2.reverse(w.r()));
	}

	public int hash(PairWeight<A, B> w) {
		int h1 = s1.hash(w.l());
		int h2 = s2.hash(w.r());
		return (h1 << 5) ^ (h1 >>> 27) ^ h2;
	}

	// path doesn't survive the product: (1,2) + (2,1) is neither
	public long properties() {
		return s1.properties() & s2.properties() &
			(WeightProperties.SEMIRING | WeightProperties.COMMUTATIVE | WeightProperties.IDEMPOTENT);
	}
	public String type() {
		return s1.type()+"_X_"+s2.type();
	}

	public String print(PairWeight<A, B> w) {
		StringWriter sw = new StringWriter();
		CompositeWeightWriter cw = new CompositeWeightWriter(sw, opts);
		try {
			cw.writeBegin();
			cw.writeElement(s1, w.l());
			cw.writeElement(s2, w.r());
			cw.writeEnd();
		}
		catch (IOException e) {
			// a StringWriter doesn't throw
			throw new IllegalStateException(e);
		}
		return sw.toString();
	}

	public PairWeight<A, B> parse(String text) throws DataFormatException {
		CompositeWeightReader cr = new CompositeWeightReader(new StringReader(text), opts, getErrorReporter());
		List<A> first = new ArrayList<A>(1);
		List<B> second = new ArrayList<B>(1);
		try {
			cr.readBegin();
			cr.readElement(s1, first);
			cr.readElement(s2, second, true);
			cr.readEnd();
		}
		catch (IOException e) {
			throw new DataFormatException("Couldn't read "+type()+" weight "+text, e);
		}
		if (cr.isBad())
			throw new DataFormatException("Bad "+type()+" weight \""+text+"\": "+cr.getError());
		return new PairWeight<A, B>(first.get(0), second.get(0));
	}

	public PairWeight<A, B> read(DataInput in) throws IOException {
		A a = s1.read(in);
		B b = s2.read(in);
		return new PairWeight<A, B>(a, b);
	}
	public void write(PairWeight<A, B> w, DataOutput out) throws IOException {
		s1.write(w.l(), out);
		s2.write(w.r(), out);
	}

	public WeightGenerate<PairWeight<A, B>> generator(Random rand, boolean allowZero, int numRandomWeights) {
		return new ProductWeightGenerate<A, B>(this, s1.generator(rand, allowZero, numRandomWeights),
				s2.generator(rand, allowZero, numRandomWeights));
	}

	static class ProductWeightGenerate<A, B> extends WeightGenerate<PairWeight<A, B>> {
		private final WeightGenerate<A> g1;
		private final WeightGenerate<B> g2;
		ProductWeightGenerate(ProductSemiring<A, B> sr, WeightGenerate<A> a, WeightGenerate<B> b) {
			super(sr);
			g1 = a;
			g2 = b;
		}
		public PairWeight<A, B> generate() {
			return new PairWeight<A, B>(g1.generate(), g2.generate());
		}
	}

	public boolean equals(Object o) {
		if (!super.equals(o))
			return false;
		return opts.equals(((ProductSemiring<?, ?>)o).opts);
	}
	public int hashCode() {
		return 31*super.hashCode() + opts.hashCode();
	}
}
