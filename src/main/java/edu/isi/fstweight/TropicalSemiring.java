package edu.isi.fstweight;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends FloatSemiring {
	public FloatWeight plus(FloatWeight a, FloatWeight b) {
		if (!member(a) || !member(b))
			return NO_WEIGHT();
		return a.getValue() <= b.getValue() ? a : b;
	}
	public long properties() {
		return WeightProperties.SEMIRING | WeightProperties.COMMUTATIVE |
			WeightProperties.IDEMPOTENT | WeightProperties.PATH;
	}
	public String type() {
		return "tropical";
	}

	// both types share the -log representation, so conversion keeps the value
	public static void registerConversions(WeightConvert wc) {
		TropicalSemiring trop = new TropicalSemiring();
		LogSemiring log = new LogSemiring();
		WeightConverter<FloatWeight, FloatWeight> same = new WeightConverter<FloatWeight, FloatWeight>() {
			public FloatWeight convert(FloatWeight w) {
				return w;
			}
		};
		wc.register(trop, log, same);
		wc.register(log, trop, same);
	}
}
