package edu.isi.fstweight;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoding and decoding whole transducers with a codex. Both work in place.
 */
public class Encode {
	private Encode() {}

	/**
	 * Replaces every arc by its encoding. When weights are encoded, final weights can't
	 * stay where they are: each final state gets an arc (epsilon, epsilon, final weight),
	 * encoded like the rest, into one new superfinal state whose final weight is one.
	 */
	public static <W> void encode(Transducer<W> fst, EncodeMapper<W> mapper) {
		boolean debug = false;
		Semiring<W> sr = fst.getSemiring();
		int n = fst.getNumStates();
		for (int s = 0; s < n; s++) {
			List<Arc<W>> l = new ArrayList<Arc<W>>();
			for (Arc<W> a : fst.getArcs(s))
				l.add(mapper.encode(a));
			fst.setArcs(s, l);
		}
		if (!mapper.encodesWeights())
			return;
		int superfinal = -1;
		for (int s = 0; s < n; s++) {
			if (!fst.isFinal(s))
				continue;
			if (superfinal < 0) {
				superfinal = fst.addState();
				fst.setFinal(superfinal, sr.ONE());
				if (debug) Debug.debug(debug, "Added superfinal state "+superfinal);
			}
			fst.addArc(s, mapper.encode(new Arc<W>(0, 0, fst.getFinal(s), superfinal)));
			fst.setFinal(s, sr.ZERO());
		}
	}

	/**
	 * Replaces every arc by its decoding, then folds epsilon arcs into final states
	 * without arcs back into final weights, removing such states once nothing leads
	 * to them. That undoes the superfinal state added by {@link #encode}.
	 */
	public static <W> void decode(Transducer<W> fst, EncodeMapper<W> mapper) {
		for (int s = 0; s < fst.getNumStates(); s++) {
			List<Arc<W>> l = new ArrayList<Arc<W>>();
			for (Arc<W> a : fst.getArcs(s))
				l.add(mapper.decode(a));
			fst.setArcs(s, l);
		}
		rmFinalEpsilon(fst);
	}

	static <W> void rmFinalEpsilon(Transducer<W> fst) {
		Semiring<W> sr = fst.getSemiring();
		int n = fst.getNumStates();
		boolean[] terminal = new boolean[n];
		for (int s = 0; s < n; s++)
			terminal[s] = fst.isFinal(s) && fst.getArcs(s).isEmpty();
		boolean[] reached = new boolean[n];
		for (int s = 0; s < n; s++) {
			List<Arc<W>> kept = new ArrayList<Arc<W>>();
			W fin = fst.getFinal(s);
			for (Arc<W> a : fst.getArcs(s)) {
				int t = a.getNextstate();
				if (terminal[t] && t != s && a.getIlabel() == 0 && a.getOlabel() == 0) {
					fin = sr.plus(fin, sr.times(a.getWeight(), fst.getFinal(t)));
				}
				else {
					kept.add(a);
					reached[t] = true;
				}
			}
			fst.setArcs(s, kept);
			fst.setFinal(s, fin);
		}
		boolean[] dead = new boolean[n];
		boolean any = false;
		for (int s = 0; s < n; s++) {
			dead[s] = terminal[s] && !reached[s] && s != fst.getStart();
			any |= dead[s];
		}
		if (any)
			fst.deleteStates(dead);
	}
}
