package edu.isi.fstweight;

// the three ways something in the weight layer can go wrong. none of them is fatal.
public enum ErrorKind {
	// an operation the weight type doesn't support: no converter, no generator, no quotient
	UNSUPPORTED,
	// a precondition on how a component was set up, e.g. NaturalLess over a non-idempotent type
	CONFIGURATION,
	// malformed text: unmatched parens, empty elements, unparseable values
	PARSE
}
