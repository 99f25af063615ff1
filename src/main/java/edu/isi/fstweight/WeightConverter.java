package edu.isi.fstweight;

// one direction of conversion between two weight types
public interface WeightConverter<A, B> {
	B convert(A a);
}
