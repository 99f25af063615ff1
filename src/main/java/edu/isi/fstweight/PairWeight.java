package edu.isi.fstweight;

import java.io.Serializable;

// a two-element composite weight. l() is the first component, r() the second
public final class PairWeight<A, B> extends Pair<A, B> implements Serializable {
	public PairWeight(A a, B b) {
		super(a, b);
	}
}
