package edu.isi.fstweight;

// log is -log(e^-a + e^-b), +, +INF, 0: probabilities kept as negative logs
public class LogSemiring extends FloatSemiring {

	// past this gap the smaller probability can't move the sum
	static private int TOLERANCE=16;

	public FloatWeight plus(FloatWeight aw, FloatWeight bw) {
		if (!member(aw) || !member(bw))
			return NO_WEIGHT();
		double a = aw.getValue();
		double b = bw.getValue();
		if (a == Double.POSITIVE_INFINITY) return bw;
		if (b == Double.POSITIVE_INFINITY) return aw;

		double x, y;
		if ((-a) > (-b)) {
			x = -a;
			y = -b;
		}
		else {
			x = -b;
			y = -a;
		}
		// x>=y. If x>>y, estimate as x
		if (x >= y+TOLERANCE)
			return new FloatWeight(-x);

		double diff = y-x;
		double logtotal = Math.log1p(Math.exp(diff));
		return new FloatWeight(-(x + logtotal));
	}

	public long properties() {
		return WeightProperties.SEMIRING | WeightProperties.COMMUTATIVE;
	}
	public String type() {
		return "log";
	}
}
