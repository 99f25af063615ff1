package edu.isi.fstweight;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts weights between types. Converting a type to itself (judged by
 * {@link Semiring#type()}) always gives the input back; any other pair must be
 * registered, normally by the weight types themselves (see
 * {@link TropicalSemiring#registerConversions}). Pairs nobody registered report an
 * error and yield the target's no-weight.
 */
public class WeightConvert {

	private final Map<Pair<String, String>, WeightConverter<?, ?>> converters =
		Collections.synchronizedMap(new HashMap<Pair<String, String>, WeightConverter<?, ?>>());
	private final ErrorReporter reporter;

	public WeightConvert() {
		this(ErrorReporter.DEBUG);
	}
	public WeightConvert(ErrorReporter r) {
		reporter = r;
	}

	public <A, B> void register(Semiring<A> from, Semiring<B> to, WeightConverter<A, B> c) {
		converters.put(new Pair<String, String>(from.type(), to.type()), c);
	}

	// same type name, same weights, whatever the text options of the semirings
	private static boolean sameType(Semiring<?> from, Semiring<?> to) {
		return from.type().equals(to.type());
	}

	public boolean canConvert(Semiring<?> from, Semiring<?> to) {
		return sameType(from, to) || converters.containsKey(new Pair<String, String>(from.type(), to.type()));
	}

	public <A, B> B convert(Semiring<A> from, Semiring<B> to, A w) {
		if (sameType(from, to))
			return (B)w;
		WeightConverter<A, B> c = (WeightConverter<A, B>)converters.get(new Pair<String, String>(from.type(), to.type()));
		if (c == null) {
			reporter.report(ErrorKind.UNSUPPORTED,
					"WeightConvert: Can't convert weight from \""+from.type()+"\" to \""+to.type()+"\"");
			return to.NO_WEIGHT();
		}
		return c.convert(w);
	}
}
