package edu.isi.fstweight;

// which side the known factor sits on when dividing
public enum DivideType {
	// c = a * b, solve for b given a
	LEFT,
	// c = b * a, solve for b given a
	RIGHT,
	// commutative semirings only; both sides agree
	ANY
}
