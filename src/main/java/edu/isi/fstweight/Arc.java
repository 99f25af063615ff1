package edu.isi.fstweight;

// one transition. label 0 is epsilon
public final class Arc<W> {
	public static final int NO_LABEL = -1;

	private final int ilabel;
	private final int olabel;
	private final W weight;
	private final int nextstate;

	public Arc(int i, int o, W w, int n) {
		ilabel = i;
		olabel = o;
		weight = w;
		nextstate = n;
	}

	public int getIlabel() { return ilabel; }
	public int getOlabel() { return olabel; }
	public W getWeight() { return weight; }
	public int getNextstate() { return nextstate; }

	public boolean equals(Object o) {
		if (!(o instanceof Arc))
			return false;
		Arc<?> a = (Arc<?>)o;
		return ilabel == a.ilabel && olabel == a.olabel && nextstate == a.nextstate && weight.equals(a.weight);
	}
	public int hashCode() {
		return ((ilabel*31 + olabel)*31 + nextstate)*31 + weight.hashCode();
	}
	public String toString() {
		return ilabel+":"+olabel+"/"+weight+" -> "+nextstate;
	}
}
