package edu.isi.fstweight;

import gnu.trove.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * The codex: a reversible mapping from (input label, output label, weight) tuples to
 * single labels. Encoding labels folds the output label into the new label so a
 * transducer can be treated as an acceptor; encoding weights folds the weight in too
 * and leaves one behind. Labels are handed out from 1 in order of first use.
 * <p>
 * The text form is a header <code>codex TYPE FLAGS</code> followed by one
 * <code>label ilabel olabel weight</code> line per tuple, in label order.
 */
public class EncodeMapper<W> {
	public static final int ENCODE_LABELS = 0x1;
	public static final int ENCODE_WEIGHTS = 0x2;

	private final Semiring<W> semiring;
	private final int flags;
	private final ErrorReporter reporter;
	// tuple to label, and label-1 to tuple
	private final TObjectIntHashMap<Tuple<W>> encodeMap = new TObjectIntHashMap<Tuple<W>>();
	private final ArrayList<Tuple<W>> decodeList = new ArrayList<Tuple<W>>();

	public EncodeMapper(Semiring<W> sr, int f) {
		this(sr, f, sr.getErrorReporter());
	}
	public EncodeMapper(Semiring<W> sr, int f, ErrorReporter r) {
		semiring = sr;
		flags = f;
		reporter = r;
	}

	public static int getFlags(boolean labels, boolean weights) {
		return (labels ? ENCODE_LABELS : 0) | (weights ? ENCODE_WEIGHTS : 0);
	}

	public int getFlags() { return flags; }
	public Semiring<W> getSemiring() { return semiring; }
	public int size() { return decodeList.size(); }
	public boolean encodesLabels() { return (flags & ENCODE_LABELS) != 0; }
	public boolean encodesWeights() { return (flags & ENCODE_WEIGHTS) != 0; }

	public Arc<W> encode(Arc<W> arc) {
		Tuple<W> t = new Tuple<W>(semiring, arc.getIlabel(),
				encodesLabels() ? arc.getOlabel() : 0,
				encodesWeights() ? arc.getWeight() : semiring.ONE());
		int label = encode(t);
		return new Arc<W>(label,
				encodesLabels() ? label : arc.getOlabel(),
				encodesWeights() ? semiring.ONE() : arc.getWeight(),
				arc.getNextstate());
	}

	private int encode(Tuple<W> t) {
		if (encodeMap.containsKey(t))
			return encodeMap.get(t);
		decodeList.add(t);
		encodeMap.put(t, decodeList.size());
		return decodeList.size();
	}

	// an unknown label can't be decoded: reported, and given back with no labels and no weight
	public Arc<W> decode(Arc<W> arc) {
		int label = arc.getIlabel();
		if (label < 1 || label > decodeList.size()) {
			reporter.report(ErrorKind.UNSUPPORTED, "EncodeMapper: Decode failed for label "+label);
			return new Arc<W>(Arc.NO_LABEL, Arc.NO_LABEL, semiring.NO_WEIGHT(), arc.getNextstate());
		}
		Tuple<W> t = decodeList.get(label-1);
		return new Arc<W>(t.ilabel,
				encodesLabels() ? t.olabel : arc.getOlabel(),
				encodesWeights() ? t.weight : arc.getWeight(),
				arc.getNextstate());
	}

	public void write(Writer w) throws IOException {
		w.write("codex "+semiring.type()+" "+flagsToString(flags)+"\n");
		for (int i = 0; i < decodeList.size(); i++) {
			Tuple<W> t = decodeList.get(i);
			w.write((i+1)+"\t"+t.ilabel+"\t"+t.olabel+"\t"+semiring.print(t.weight)+"\n");
		}
		w.flush();
	}

	private static Pattern fieldPat = Pattern.compile("\\s+");

	public static <W> EncodeMapper<W> read(BufferedReader br, Semiring<W> sr) throws IOException, DataFormatException {
		String line = br.readLine();
		if (line == null)
			throw new DataFormatException("Empty codex");
		String[] h = fieldPat.split(line.trim());
		if (h.length != 3 || !h[0].equals("codex"))
			throw new DataFormatException("Bad codex header: "+line);
		if (!h[1].equals(sr.type()))
			throw new DataFormatException("Codex is for "+h[1]+" weights, not "+sr.type());
		EncodeMapper<W> em = new EncodeMapper<W>(sr, stringToFlags(h[2]));
		int lineno = 1;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (line.trim().length() == 0)
				continue;
			String[] f = fieldPat.split(line.trim());
			try {
				if (f.length != 4)
					throw new DataFormatException("expected 4 fields but got "+f.length);
				int label = Transducer.parseInt(f[0], "label");
				if (label != em.size()+1)
					throw new DataFormatException("expected label "+(em.size()+1)+" but got "+label);
				Tuple<W> t = new Tuple<W>(sr, Transducer.parseInt(f[1], "ilabel"),
						Transducer.parseInt(f[2], "olabel"), sr.parse(f[3]));
				if (em.encodeMap.containsKey(t))
					throw new DataFormatException("duplicate tuple "+t);
				em.encode(t);
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Codex line "+lineno+" ("+line+"): "+e.getMessage(), e);
			}
		}
		return em;
	}

	static String flagsToString(int f) {
		if (f == (ENCODE_LABELS | ENCODE_WEIGHTS))
			return "labels,weights";
		if (f == ENCODE_LABELS)
			return "labels";
		if (f == ENCODE_WEIGHTS)
			return "weights";
		return "none";
	}
	static int stringToFlags(String s) throws DataFormatException {
		if (s.equals("labels,weights"))
			return ENCODE_LABELS | ENCODE_WEIGHTS;
		if (s.equals("labels"))
			return ENCODE_LABELS;
		if (s.equals("weights"))
			return ENCODE_WEIGHTS;
		if (s.equals("none"))
			return 0;
		throw new DataFormatException("Bad codex flags "+s);
	}

	// hashed with the semiring's own hash, so equal weights always share a label
	static final class Tuple<W> {
		final int ilabel;
		final int olabel;
		final W weight;
		private final int hash;
		Tuple(Semiring<W> sr, int i, int o, W w) {
			ilabel = i;
			olabel = o;
			weight = w;
			hash = (ilabel*7853 + olabel)*7867 + sr.hash(w);
		}
		public boolean equals(Object o) {
			if (!(o instanceof Tuple))
				return false;
			Tuple<?> t = (Tuple<?>)o;
			return ilabel == t.ilabel && olabel == t.olabel && weight.equals(t.weight);
		}
		public int hashCode() {
			return hash;
		}
		public String toString() {
			return "("+ilabel+", "+olabel+", "+weight+")";
		}
	}
}
