package edu.isi.fstweight;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

public class EncodeMapperTest {

	private static final TropicalSemiring TROP = new TropicalSemiring();

	private static Arc<FloatWeight> arc(int i, int o, double w, int n) {
		return new Arc<FloatWeight>(i, o, new FloatWeight(w), n);
	}

	@Test
	public void testEncodeLabels() {
		EncodeMapper<FloatWeight> em = new EncodeMapper<FloatWeight>(TROP, EncodeMapper.ENCODE_LABELS);
		Arc<FloatWeight> a = em.encode(arc(3, 4, 1.5, 7));
		assertEquals(arc(1, 1, 1.5, 7), a);
		// same label pair, same code, whatever the weight
		assertEquals(arc(1, 1, 9, 2), em.encode(arc(3, 4, 9, 2)));
		assertEquals(arc(2, 2, 0, 0), em.encode(arc(4, 3, 0, 0)));
		assertEquals(2, em.size());
		assertEquals(arc(3, 4, 1.5, 7), em.decode(a));
	}

	@Test
	public void testEncodeWeights() {
		EncodeMapper<FloatWeight> em = new EncodeMapper<FloatWeight>(TROP, EncodeMapper.ENCODE_WEIGHTS);
		Arc<FloatWeight> a = em.encode(arc(3, 4, 1.5, 7));
		// output label untouched, weight folded into the input label
		assertEquals(new Arc<FloatWeight>(1, 4, TROP.ONE(), 7), a);
		assertEquals(2, em.encode(arc(3, 4, 2.5, 7)).getIlabel());
		assertEquals(1, em.encode(arc(3, 9, 1.5, 7)).getIlabel());
		assertEquals(arc(3, 4, 1.5, 7), em.decode(a));
	}

	@Test
	public void testEncodeBoth() {
		EncodeMapper<FloatWeight> em = new EncodeMapper<FloatWeight>(TROP,
				EncodeMapper.getFlags(true, true));
		assertTrue(em.encodesLabels());
		assertTrue(em.encodesWeights());
		Arc<FloatWeight> a = em.encode(arc(3, 4, 1.5, 7));
		assertEquals(new Arc<FloatWeight>(1, 1, TROP.ONE(), 7), a);
		assertEquals(arc(3, 4, 1.5, 7), em.decode(a));
	}

	@Test
	public void testUnknownLabel() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		EncodeMapper<FloatWeight> em = new EncodeMapper<FloatWeight>(TROP, EncodeMapper.ENCODE_LABELS, rep);
		Arc<FloatWeight> d = em.decode(arc(5, 5, 0, 1));
		assertEquals(Arc.NO_LABEL, d.getIlabel());
		assertEquals(Arc.NO_LABEL, d.getOlabel());
		assertFalse(TROP.member(d.getWeight()));
		assertEquals(1, d.getNextstate());
		assertEquals(ErrorKind.UNSUPPORTED, rep.kinds.get(0));
	}

	@Test
	public void testCodexRoundTrip() throws Exception {
		EncodeMapper<FloatWeight> em = new EncodeMapper<FloatWeight>(TROP, EncodeMapper.getFlags(true, true));
		em.encode(arc(3, 4, 1.5, 0));
		em.encode(arc(1, 1, Double.POSITIVE_INFINITY, 0));
		em.encode(arc(0, 0, 0, 0));
		StringWriter sw = new StringWriter();
		em.write(sw);
		assertEquals("codex tropical labels,weights\n1\t3\t4\t1.5\n2\t1\t1\tInfinity\n3\t0\t0\t0\n", sw.toString());

		EncodeMapper<FloatWeight> back = EncodeMapper.read(new BufferedReader(new StringReader(sw.toString())), TROP);
		assertEquals(em.getFlags(), back.getFlags());
		assertEquals(3, back.size());
		assertEquals(arc(1, 1, Double.POSITIVE_INFINITY, 5), back.decode(new Arc<FloatWeight>(2, 2, TROP.ONE(), 5)));
		// known tuples keep their codes, new ones continue the numbering
		assertEquals(1, back.encode(arc(3, 4, 1.5, 0)).getIlabel());
		assertEquals(4, back.encode(arc(3, 4, 2, 0)).getIlabel());
	}

	@Test
	public void testCompositeCodex() throws Exception {
		ProductSemiring<FloatWeight, FloatWeight> sr = new ProductSemiring<FloatWeight, FloatWeight>(
				TROP, new LogSemiring(), new CompositeWeightOptions(",", "()"));
		EncodeMapper<PairWeight<FloatWeight, FloatWeight>> em =
			new EncodeMapper<PairWeight<FloatWeight, FloatWeight>>(sr, EncodeMapper.ENCODE_WEIGHTS);
		PairWeight<FloatWeight, FloatWeight> w =
			new PairWeight<FloatWeight, FloatWeight>(new FloatWeight(1), new FloatWeight(0.25));
		em.encode(new Arc<PairWeight<FloatWeight, FloatWeight>>(1, 2, w, 0));
		StringWriter sw = new StringWriter();
		em.write(sw);
		assertEquals("codex tropical_X_log weights\n1\t1\t0\t(1,0.25)\n", sw.toString());
		EncodeMapper<PairWeight<FloatWeight, FloatWeight>> back =
			EncodeMapper.read(new BufferedReader(new StringReader(sw.toString())), sr);
		assertEquals(w, back.decode(new Arc<PairWeight<FloatWeight, FloatWeight>>(1, 2, sr.ONE(), 0)).getWeight());
	}

	@Test
	public void testBadCodex() {
		assertThrows(DataFormatException.class,
				() -> EncodeMapper.read(new BufferedReader(new StringReader("codex log labels\n")), TROP));
		assertThrows(DataFormatException.class,
				() -> EncodeMapper.read(new BufferedReader(new StringReader("")), TROP));
		assertThrows(DataFormatException.class,
				() -> EncodeMapper.read(new BufferedReader(new StringReader("codex tropical sideways\n")), TROP));
		assertThrows(DataFormatException.class,
				() -> EncodeMapper.read(new BufferedReader(new StringReader("codex tropical labels\n2\t1\t1\t0\n")), TROP));
		assertThrows(DataFormatException.class,
				() -> EncodeMapper.read(new BufferedReader(new StringReader("codex tropical labels\n1\t1\t1\t0\n2\t1\t1\t0\n")), TROP));
	}
}
