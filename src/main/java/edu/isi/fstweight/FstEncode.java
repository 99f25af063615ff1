package edu.isi.fstweight;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// encodes transducer labels and/or weights with a codex, or decodes them again.
// usage: fstencode [options] in.fst codex [out.fst]
public class FstEncode {
	static final String VERSION = "1.0";

	// the parameters, registered on the jsap object. composite weight settings
	// default to the bundled fstweight.properties, as overridden by system properties
	private static void registerParameters(JSAP jsap, CompositeWeightOptions defaults) throws JSAPException {
		jsap.registerParameter(new Switch("help", 'h', "help", "print this help message"));
		jsap.registerParameter(new Switch("encode_labels", JSAP.NO_SHORTFLAG, "encode_labels",
				"encode output labels along with input labels"));
		jsap.registerParameter(new Switch("encode_weights", JSAP.NO_SHORTFLAG, "encode_weights",
				"encode weights"));
		jsap.registerParameter(new Switch("encode_reuse", JSAP.NO_SHORTFLAG, "encode_reuse",
				"re-use the existing codex, extending it with any new tuples"));
		jsap.registerParameter(new Switch("decode", 'd', "decode",
				"decode labels and/or weights with the codex instead of encoding"));
		jsap.registerParameter(new FlaggedOption("srtype",
				EnumeratedStringParser.getParser("tropical; log; tropical_x_log"),
				"tropical",
				true,
				'm',
				"semiring",
				"type of weights: tropical (min, +), log (negative log probabilities) or "+
				"tropical_x_log (pairs of the two, written as composite weights)"));
		jsap.registerParameter(new FlaggedOption("separator",
				StringStringParser.getParser(),
				""+defaults.getSeparator(),
				true,
				JSAP.NO_SHORTFLAG,
				"weight_separator",
				"character separating the elements of composite weights"));
		jsap.registerParameter(new FlaggedOption("parentheses",
				StringStringParser.getParser(),
				defaults.hasParens() ? defaults.getParentheses() : JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"weight_parentheses",
				"open and close characters around composite weights, if any"));
		jsap.registerParameter(new Switch("lenient_open", JSAP.NO_SHORTFLAG, "weight_lenient_open",
				"take the first character of a composite weight as its open paren without checking it"));
		jsap.registerParameter(new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8"));
		jsap.registerParameter(new Switch("time", 'T', "time", "print timing of each step"));
		jsap.registerParameter(new UnflaggedOption("infile", StringStringParser.getParser(), null, true, false,
				"transducer to read, or - for STDIN"));
		jsap.registerParameter(new UnflaggedOption("codex", StringStringParser.getParser(), null, true, false,
				"codex file: written when encoding, read when decoding or re-using"));
		jsap.registerParameter(new UnflaggedOption("outfile", StringStringParser.getParser(), null, false, false,
				"where to write the result; STDOUT if absent"));
	}

	static Semiring<?> getSemiring(String srtype, CompositeWeightOptions opts) throws ConfigureException {
		if (srtype.equals("tropical"))
			return new TropicalSemiring();
		if (srtype.equals("log"))
			return new LogSemiring();
		if (srtype.equals("tropical_x_log"))
			return new ProductSemiring<FloatWeight, FloatWeight>(new TropicalSemiring(), new LogSemiring(), opts);
		throw new ConfigureException("Unexpected semiring type: "+srtype);
	}

	// exit status: 0 on success, 1 on any problem
	public static int run(String[] argv) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		CompositeWeightOptions defaults = null;
		try {
			defaults = CompositeWeightOptions.load();
			registerParameters(jsap, defaults);
			config = jsap.parse(argv);
		}
		catch (ConfigureException e) {
			Debug.prettyDebug("Bad weight settings in "+CompositeWeightOptions.RESOURCE+" or system properties: "+e.getMessage());
			return 1;
		}
		catch (JSAPException e) {
			Debug.prettyDebug("fstencode options improperly configured: "+e.getMessage());
			return 1;
		}
		if (config.getBoolean("help")) {
			Debug.prettyDebug("Encodes transducer labels and/or weights.");
			Debug.prettyDebug("Usage: fstencode ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}
		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: fstencode ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		boolean timing = config.getBoolean("time");
		Semiring<?> sr = null;
		try {
			CompositeWeightOptions opts = new CompositeWeightOptions(config.getString("separator"),
					config.getString("parentheses", ""),
					defaults.isLenientOpen() || config.getBoolean("lenient_open"));
			sr = getSemiring(config.getString("srtype"), opts);
			if (config.getBoolean("decode") && (config.getBoolean("encode_labels") || config.getBoolean("encode_weights")))
				throw new ConfigureException("Cannot use --decode with --encode_labels or --encode_weights; the codex decides");
		}
		catch (ConfigureException e) {
			Debug.prettyDebug("fstencode options improperly configured: "+e.getMessage());
			Debug.prettyDebug("Try 'fstencode -h' for a detailed help message");
			return 1;
		}

		try {
			return process(config, sr, encoding, timing);
		}
		catch (DataFormatException e) {
			Debug.prettyDebug("Bad input: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			Debug.prettyDebug("I/O error: "+e.getMessage());
			return 1;
		}
	}

	private static <W> int process(JSAPResult config, Semiring<W> sr, String encoding, boolean timing) throws IOException, DataFormatException {
		String inName = config.getString("infile");
		String codexName = config.getString("codex");
		String outName = config.getString("outfile");

		Date readTime = new Date();
		Transducer<W> fst = null;
		BufferedReader br = openReader(inName, encoding);
		try {
			fst = Transducer.read(br, sr);
		}
		finally {
			if (!inName.equals("-"))
				br.close();
		}
		Debug.dbtime(timing, readTime, new Date(), "read "+fst.getNumStates()+" states, "+fst.getNumArcs()+" arcs");

		Date opTime = new Date();
		EncodeMapper<W> mapper = null;
		if (config.getBoolean("decode")) {
			mapper = readCodex(codexName, encoding, sr);
			Encode.decode(fst, mapper);
		}
		else {
			if (config.getBoolean("encode_reuse") && new File(codexName).exists())
				mapper = readCodex(codexName, encoding, sr);
			else
				mapper = new EncodeMapper<W>(sr, EncodeMapper.getFlags(config.getBoolean("encode_labels"),
						config.getBoolean("encode_weights")));
			Encode.encode(fst, mapper);
			Writer cw = new OutputStreamWriter(new FileOutputStream(codexName), encoding);
			try {
				mapper.write(cw);
			}
			finally {
				cw.close();
			}
		}
		Debug.dbtime(timing, opTime, new Date(), (config.getBoolean("decode") ? "decode" : "encode")+
				" with "+mapper.size()+" codex entries");

		if (outName == null) {
			Writer w = new OutputStreamWriter(System.out, encoding);
			fst.write(w);
		}
		else {
			Writer w = new OutputStreamWriter(new FileOutputStream(outName), encoding);
			try {
				fst.write(w);
			}
			finally {
				w.close();
			}
		}
		return 0;
	}

	private static <W> EncodeMapper<W> readCodex(String name, String encoding, Semiring<W> sr) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(name), encoding));
		try {
			return EncodeMapper.read(br, sr);
		}
		finally {
			br.close();
		}
	}

	private static BufferedReader openReader(String name, String encoding) throws IOException {
		if (name.equals("-"))
			return new BufferedReader(new InputStreamReader(System.in, encoding));
		return new BufferedReader(new InputStreamReader(new FileInputStream(name), encoding));
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is fstencode, version "+VERSION);
		System.exit(run(argv));
	}
}
