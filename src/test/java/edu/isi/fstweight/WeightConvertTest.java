package edu.isi.fstweight;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class WeightConvertTest {

	@Test
	public void testSelfConversionIsIdentity() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		WeightConvert wc = new WeightConvert(rep);
		TropicalSemiring sr = new TropicalSemiring();
		WeightGenerate<FloatWeight> gen = sr.generator(11);
		for (int i = 0; i < 50; i++) {
			FloatWeight w = gen.generate();
			assertSame(w, wc.convert(sr, new TropicalSemiring(), w));
		}
		StringSemiring left = new StringSemiring(DivideType.LEFT);
		StringWeight s = new StringWeight(4, 5);
		assertSame(s, wc.convert(left, new StringSemiring(DivideType.LEFT), s));
		assertTrue(wc.canConvert(left, left));
		assertEquals(0, rep.count());
	}

	@Test
	public void testProductsDifferingOnlyInTextOptions() throws Exception {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		WeightConvert wc = new WeightConvert(rep);
		ProductSemiring<FloatWeight, FloatWeight> plain =
			new ProductSemiring<FloatWeight, FloatWeight>(new TropicalSemiring(), new LogSemiring());
		ProductSemiring<FloatWeight, FloatWeight> parens = new ProductSemiring<FloatWeight, FloatWeight>(
				new TropicalSemiring(), new LogSemiring(), new CompositeWeightOptions(",", "()"));
		assertNotEquals(plain, parens);
		PairWeight<FloatWeight, FloatWeight> w =
			new PairWeight<FloatWeight, FloatWeight>(new FloatWeight(1), new FloatWeight(2));
		PairWeight<FloatWeight, FloatWeight> out = wc.convert(plain, parens, w);
		assertSame(w, out);
		assertTrue(parens.member(out));
		assertTrue(wc.canConvert(plain, parens));
		assertEquals(0, rep.count());
	}

	@Test
	public void testUnregisteredPair() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		WeightConvert wc = new WeightConvert(rep);
		StringSemiring left = new StringSemiring(DivideType.LEFT);
		StringWeight out = wc.convert(new TropicalSemiring(), left, new FloatWeight(1));
		assertEquals(left.NO_WEIGHT(), out);
		assertFalse(left.member(out));
		assertEquals(1, rep.count());
		assertEquals(ErrorKind.UNSUPPORTED, rep.kinds.get(0));
		assertEquals("WeightConvert: Can't convert weight from \"tropical\" to \"left_string\"", rep.last());
		assertFalse(wc.canConvert(new TropicalSemiring(), left));
	}

	@Test
	public void testLeftAndRightStringsAreDifferentTypes() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		WeightConvert wc = new WeightConvert(rep);
		StringWeight out = wc.convert(new StringSemiring(DivideType.LEFT), new StringSemiring(DivideType.RIGHT),
				new StringWeight(1));
		assertTrue(out.isBad());
		assertEquals(1, rep.count());
	}

	@Test
	public void testRegisteredConversions() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		WeightConvert wc = new WeightConvert(rep);
		TropicalSemiring.registerConversions(wc);
		assertTrue(wc.canConvert(new TropicalSemiring(), new LogSemiring()));
		assertTrue(wc.canConvert(new LogSemiring(), new TropicalSemiring()));
		assertEquals(new FloatWeight(2.5), wc.convert(new TropicalSemiring(), new LogSemiring(), new FloatWeight(2.5)));
		assertEquals(new FloatWeight(Double.POSITIVE_INFINITY),
				wc.convert(new LogSemiring(), new TropicalSemiring(), new FloatWeight(Double.POSITIVE_INFINITY)));
		assertEquals(0, rep.count());
	}

	@Test
	public void testCustomConverter() {
		WeightConvert wc = new WeightConvert(new RecordingErrorReporter());
		// a single-label string becomes that many units of cost
		wc.register(new StringSemiring(DivideType.LEFT), new TropicalSemiring(), new WeightConverter<StringWeight, FloatWeight>() {
			public FloatWeight convert(StringWeight s) {
				return new FloatWeight(s.size());
			}
		});
		assertEquals(new FloatWeight(3),
				wc.convert(new StringSemiring(DivideType.LEFT), new TropicalSemiring(), new StringWeight(9, 9, 9)));
	}
}
