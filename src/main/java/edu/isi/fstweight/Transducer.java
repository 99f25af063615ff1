package edu.isi.fstweight;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A mutable weighted transducer over integer labels, kept as plain adjacency lists:
 * just enough to carry arcs through encoding and decoding and to move them in and out
 * of text.
 * <p>
 * The text form has one arc per line, <code>src dst ilabel olabel [weight]</code>, and
 * one line per final state, <code>state [weight]</code>. A missing weight is the
 * semiring one. The source of the first line is the start state. Blank lines and
 * anything after a <code>%</code> are ignored.
 */
public class Transducer<W> {
	private final Semiring<W> semiring;
	private final ArrayList<ArrayList<Arc<W>>> arcs = new ArrayList<ArrayList<Arc<W>>>();
	private final ArrayList<W> finals = new ArrayList<W>();
	private int start = -1;

	public Transducer(Semiring<W> sr) {
		semiring = sr;
	}

	public Semiring<W> getSemiring() { return semiring; }

	public int addState() {
		arcs.add(new ArrayList<Arc<W>>());
		finals.add(semiring.ZERO());
		return arcs.size()-1;
	}
	public int getNumStates() {
		return arcs.size();
	}
	public int getNumArcs() {
		int n = 0;
		for (ArrayList<Arc<W>> l : arcs)
			n += l.size();
		return n;
	}

	public int getStart() { return start; }
	public void setStart(int s) {
		checkState(s);
		start = s;
	}

	public W getFinal(int s) {
		checkState(s);
		return finals.get(s);
	}
	public void setFinal(int s, W w) {
		checkState(s);
		finals.set(s, w);
	}
	public boolean isFinal(int s) {
		return !getFinal(s).equals(semiring.ZERO());
	}

	public void addArc(int s, Arc<W> a) {
		checkState(s);
		checkState(a.getNextstate());
		arcs.get(s).add(a);
	}
	public List<Arc<W>> getArcs(int s) {
		checkState(s);
		return arcs.get(s);
	}
	public void setArcs(int s, List<Arc<W>> l) {
		checkState(s);
		arcs.set(s, new ArrayList<Arc<W>>(l));
	}

	/**
	 * Removes the marked states, along with every arc into them, and renumbers the
	 * rest in order. Removing the start state leaves no start.
	 */
	public void deleteStates(boolean[] dead) {
		int[] newid = new int[arcs.size()];
		int next = 0;
		for (int s = 0; s < arcs.size(); s++)
			newid[s] = dead[s] ? -1 : next++;
		ArrayList<ArrayList<Arc<W>>> newArcs = new ArrayList<ArrayList<Arc<W>>>();
		ArrayList<W> newFinals = new ArrayList<W>();
		for (int s = 0; s < arcs.size(); s++) {
			if (dead[s])
				continue;
			ArrayList<Arc<W>> l = new ArrayList<Arc<W>>();
			for (Arc<W> a : arcs.get(s))
				if (!dead[a.getNextstate()])
					l.add(new Arc<W>(a.getIlabel(), a.getOlabel(), a.getWeight(), newid[a.getNextstate()]));
			newArcs.add(l);
			newFinals.add(finals.get(s));
		}
		arcs.clear();
		arcs.addAll(newArcs);
		finals.clear();
		finals.addAll(newFinals);
		start = start < 0 ? -1 : newid[start];
	}

	private void checkState(int s) {
		if (s < 0 || s >= arcs.size())
			throw new IndexOutOfBoundsException("No state "+s+" in a transducer of "+arcs.size()+" states");
	}

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");
	// strip comments off
	private static Pattern commentStripPat = Pattern.compile("\\s*([^%]*[^\\s%])\\s*(%.*)?");
	private static Pattern fieldPat = Pattern.compile("\\s+");

	public static <W> Transducer<W> read(BufferedReader br, Semiring<W> sr) throws IOException, DataFormatException {
		boolean debug = false;
		Transducer<W> fst = new Transducer<W>(sr);
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (commentPat.matcher(line).matches())
				continue;
			Matcher m = commentStripPat.matcher(line);
			if (!m.matches())
				throw new DataFormatException("Line "+lineno+": couldn't strip comments off of "+line);
			String[] f = fieldPat.split(m.group(1));
			if (debug) Debug.debug(debug, "Line "+lineno+" has "+f.length+" fields");
			try {
				if (f.length == 4 || f.length == 5) {
					int src = parseState(f[0]);
					int dst = parseState(f[1]);
					fst.growTo(Math.max(src, dst));
					if (fst.start < 0)
						fst.start = src;
					W w = f.length == 5 ? sr.parse(f[4]) : sr.ONE();
					fst.addArc(src, new Arc<W>(parseLabel(f[2]), parseLabel(f[3]), w, dst));
				}
				else if (f.length == 1 || f.length == 2) {
					int s = parseState(f[0]);
					fst.growTo(s);
					if (fst.start < 0)
						fst.start = s;
					fst.setFinal(s, f.length == 2 ? sr.parse(f[1]) : sr.ONE());
				}
				else
					throw new DataFormatException("expected 1, 2, 4 or 5 fields but got "+f.length);
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+lineno+" ("+line+"): "+e.getMessage(), e);
			}
		}
		return fst;
	}

	private void growTo(int s) {
		while (arcs.size() <= s)
			addState();
	}

	private static int parseState(String s) throws DataFormatException {
		int i = parseInt(s, "state");
		if (i < 0)
			throw new DataFormatException("negative state "+s);
		return i;
	}
	private static int parseLabel(String s) throws DataFormatException {
		int i = parseInt(s, "label");
		if (i < 0)
			throw new DataFormatException("negative label "+s);
		return i;
	}
	static int parseInt(String s, String what) throws DataFormatException {
		try {
			return Integer.parseInt(s);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("bad "+what+" "+s, e);
		}
	}

	// start state first, so reading the text back finds the same start
	public void write(Writer w) throws IOException {
		if (start < 0)
			return;
		writeState(w, start);
		for (int s = 0; s < arcs.size(); s++)
			if (s != start)
				writeState(w, s);
		w.flush();
	}
	private void writeState(Writer w, int s) throws IOException {
		for (Arc<W> a : arcs.get(s)) {
			w.write(s+"\t"+a.getNextstate()+"\t"+a.getIlabel()+"\t"+a.getOlabel());
			if (!a.getWeight().equals(semiring.ONE()))
				w.write("\t"+semiring.print(a.getWeight()));
			w.write("\n");
		}
		if (isFinal(s)) {
			w.write(Integer.toString(s));
			if (!getFinal(s).equals(semiring.ONE()))
				w.write("\t"+semiring.print(getFinal(s)));
			w.write("\n");
		}
	}
}
