package edu.isi.fstweight;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class WeightGenerateTest {

	@Test
	public void testDefaultGeneratorReports() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		TropicalSemiring sr = new TropicalSemiring();
		sr.setErrorReporter(rep);
		FloatWeight w = new WeightGenerate<FloatWeight>(sr).generate();
		assertFalse(sr.member(w));
		assertEquals(sr.NO_WEIGHT(), w);
		assertEquals(1, rep.count());
		assertEquals(ErrorKind.UNSUPPORTED, rep.kinds.get(0));
		assertEquals("WeightGenerate: No random generator for tropical", rep.last());
	}

	@Test
	public void testReproducible() {
		StringSemiring sr = new StringSemiring(DivideType.RIGHT);
		WeightGenerate<StringWeight> g1 = sr.generator(42);
		WeightGenerate<StringWeight> g2 = sr.generator(42);
		for (int i = 0; i < 100; i++)
			assertEquals(g1.generate(), g2.generate());
	}

	@Test
	public void testTropicalRange() {
		TropicalSemiring sr = new TropicalSemiring();
		WeightGenerate<FloatWeight> gen = sr.generator(new Random(3), false, 4);
		Set<FloatWeight> seen = new HashSet<FloatWeight>();
		for (int i = 0; i < 500; i++) {
			FloatWeight w = gen.generate();
			assertTrue(sr.member(w));
			assertNotEquals(sr.ZERO(), w);
			assertTrue(w.getValue() >= 0 && w.getValue() < 4);
			seen.add(w);
		}
		assertEquals(4, seen.size());
	}

	@Test
	public void testAllowZero() {
		LogSemiring sr = new LogSemiring();
		WeightGenerate<FloatWeight> gen = sr.generator(new Random(5), true, WeightProperties.NUM_RANDOM_WEIGHTS);
		boolean sawZero = false;
		for (int i = 0; i < 500; i++)
			sawZero |= gen.generate().equals(sr.ZERO());
		assertTrue(sawZero);
	}

	@Test
	public void testStringsAreMembers() {
		StringSemiring sr = new StringSemiring(DivideType.LEFT);
		WeightGenerate<StringWeight> gen = sr.generator(new Random(8), false, 3);
		for (int i = 0; i < 200; i++) {
			StringWeight w = gen.generate();
			assertTrue(sr.member(w));
			assertFalse(w.isInfinity());
			assertTrue(w.size() < 3);
			for (int l : w.getLabels())
				assertTrue(l >= 1 && l <= 3);
		}
	}
}
