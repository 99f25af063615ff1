package edu.isi.fstweight;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;

import org.junit.jupiter.api.Test;

public class StringSemiringTest {

	private static StringWeight s(int... l) {
		return new StringWeight(l);
	}

	@Test
	public void testLeft() {
		StringSemiring sr = new StringSemiring(DivideType.LEFT);
		assertEquals(s(1, 2), sr.plus(s(1, 2, 3), s(1, 2, 4)));
		assertEquals(sr.ONE(), sr.plus(s(1), s(2)));
		assertEquals(s(1, 2, 3, 4), sr.times(s(1, 2), s(3, 4)));
		assertEquals(sr.ZERO(), sr.times(s(1), sr.ZERO()));
		assertEquals(s(5), sr.plus(sr.ZERO(), s(5)));
	}

	@Test
	public void testRight() {
		StringSemiring sr = new StringSemiring(DivideType.RIGHT);
		assertEquals(s(2, 3), sr.plus(s(1, 2, 3), s(4, 2, 3)));
		assertEquals(sr.ONE(), sr.plus(s(1), s(2)));
		assertEquals(s(1, 2, 3, 4), sr.times(s(1, 2), s(3, 4)));
		assertEquals("right_string", sr.type());
	}

	@Test
	public void testDivide() {
		RecordingErrorReporter rep = new RecordingErrorReporter();
		StringSemiring left = new StringSemiring(DivideType.LEFT);
		left.setErrorReporter(rep);
		assertEquals(s(3, 4), left.divide(s(1, 2, 3, 4), s(1, 2), DivideType.LEFT));
		assertEquals(left.ONE(), left.divide(s(1, 2), s(1, 2), DivideType.LEFT));
		// not a prefix
		assertFalse(left.member(left.divide(s(1, 2, 3), s(2), DivideType.LEFT)));
		assertFalse(left.member(left.divide(s(1), s(1, 2), DivideType.LEFT)));
		assertEquals(left.ZERO(), left.divide(left.ZERO(), s(1), DivideType.LEFT));
		assertFalse(left.member(left.divide(s(1), left.ZERO(), DivideType.LEFT)));
		assertEquals(0, rep.count());

		// the left semiring has no right division
		assertFalse(left.member(left.divide(s(1, 2), s(2), DivideType.RIGHT)));
		assertFalse(left.member(left.divide(s(1, 2), s(1), DivideType.ANY)));
		assertEquals(2, rep.count());
		assertEquals(ErrorKind.UNSUPPORTED, rep.kinds.get(0));

		StringSemiring right = new StringSemiring(DivideType.RIGHT);
		assertEquals(s(1, 2), right.divide(s(1, 2, 3, 4), s(3, 4), DivideType.RIGHT));
		assertFalse(right.member(right.divide(s(1, 2, 3), s(2), DivideType.RIGHT)));
	}

	@Test
	public void testReverse() {
		StringSemiring left = new StringSemiring(DivideType.LEFT);
		Semiring<StringWeight> right = left.reverseSemiring();
		assertEquals("right_string", right.type());
		assertEquals(left, right.reverseSemiring());
		assertEquals(s(3, 2, 1), left.reverse(s(1, 2, 3)));
		assertEquals(left.ZERO(), left.reverse(left.ZERO()));
		assertEquals(right.times(left.reverse(s(3, 4)), left.reverse(s(1, 2))), left.reverse(left.times(s(1, 2), s(3, 4))));
	}

	@Test
	public void testText() throws Exception {
		StringSemiring sr = new StringSemiring(DivideType.LEFT);
		assertEquals("1_2_3", sr.print(s(1, 2, 3)));
		assertEquals("Epsilon", sr.print(sr.ONE()));
		assertEquals("Infinity", sr.print(sr.ZERO()));
		assertEquals("BadString", sr.print(sr.NO_WEIGHT()));
		assertEquals(s(10, 20), sr.parse("10_20"));
		assertEquals(sr.ONE(), sr.parse("Epsilon"));
		assertThrows(DataFormatException.class, () -> sr.parse("1__2"));
		assertThrows(DataFormatException.class, () -> sr.parse("a_b"));
		assertThrows(DataFormatException.class, () -> sr.parse("0"));
	}

	@Test
	public void testBinary() throws Exception {
		StringSemiring sr = new StringSemiring(DivideType.RIGHT);
		StringWeight[] ws = { s(1, 2, 3), sr.ONE(), sr.ZERO(), sr.NO_WEIGHT() };
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bos);
		for (StringWeight w : ws)
			sr.write(w, out);
		DataInputStream in = new DataInputStream(new ByteArrayInputStream(bos.toByteArray()));
		for (StringWeight w : ws)
			assertEquals(w, sr.read(in));
	}

	@Test
	public void testAnySideRejected() {
		assertThrows(IllegalArgumentException.class, () -> new StringSemiring(DivideType.ANY));
	}
}
