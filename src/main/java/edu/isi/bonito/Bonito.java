package edu.isi.bonito;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class Bonito {
	static final String VERSION = "1.0";

	// what the run does
	public enum MODE { LEXICON, RMDISAMBIG, JSON, SEGMENT, CONVERT ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (MODE m : MODE.values())
			sb.append(m.toString().toLowerCase()+" ");
		list = sb.toString();
	}
	public static MODE get(String s) throws ConfigureException {
		for (MODE m : MODE.values()) {
			if (m.toString().toLowerCase().equals(s))
				return m;
		}
		throw new ConfigureException("Invalid mode ("+s+"); valid values are "+list);
	}
	}

	// register the options, parse, and complain about combinations that make no sense
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption modeopt = new FlaggedOption("mode",
				EnumeratedStringParser.getParser("lexicon; rmdisambig; json; segment; convert"),
				"segment",
				true,
				'm',
				"mode",
				"lexicon: compile a lexicon (-i) into a text transducer written to the -o prefix. "+
				"rmdisambig: strip disambiguation symbols from a text transducer (--fst, --isyms, --osyms) "+
				"and write it to the -o prefix. json: convert a text transducer to the compact form (-o). "+
				"segment, convert: decode lines of text (-i, or stdin) with a compact transducer (-j)");
		jsap.registerParameter(modeopt);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		FlaggedOption inputopt = new FlaggedOption("input",
				FileStringParser.getParser(),
				null,
				false,
				'i',
				"input",
				"lexicon file in lexicon mode; text to decode in segment and convert modes (default stdin)");
		jsap.registerParameter(inputopt);

		FlaggedOption fstopt = new FlaggedOption("fst",
				FileStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"fst",
				"text transducer arc list");
		jsap.registerParameter(fstopt);

		FlaggedOption isymsopt = new FlaggedOption("isyms",
				FileStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"isyms",
				"input symbol table of the text transducer");
		jsap.registerParameter(isymsopt);

		FlaggedOption osymsopt = new FlaggedOption("osyms",
				FileStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"osyms",
				"output symbol table of the text transducer");
		jsap.registerParameter(osymsopt);

		Switch stripsw = new Switch("strip",
				JSAP.NO_SHORTFLAG,
				"strip-disambig",
				"in json mode, relabel disambiguation symbols of the text transducer to epsilon");
		jsap.registerParameter(stripsw);

		FlaggedOption jsonopt = new FlaggedOption("json",
				FileStringParser.getParser(),
				null,
				false,
				'j',
				"json",
				"compact transducer used by segment and convert");
		jsap.registerParameter(jsonopt);

		FlaggedOption outopt = new FlaggedOption("output",
				StringStringParser.getParser(),
				null,
				false,
				'o',
				"output",
				"prefix of the .fst.txt, .isyms.txt and .osyms.txt files written in lexicon and "+
				"rmdisambig modes; file written in json mode; decoded text in segment and convert "+
				"modes (default stdout)");
		jsap.registerParameter(outopt);

		FlaggedOption unkopt = new FlaggedOption("unknown",
				EnumeratedStringParser.getParser("output; ignore; fail"),
				"fail",
				true,
				'u',
				"unknown",
				"what the compiled lexicon does with unknown input: output copies it, ignore drops it, "+
				"fail rejects the whole input");
		jsap.registerParameter(unkopt);

		FlaggedOption disopt = new FlaggedOption("disambig",
				FileStringParser.getParser(),
				null,
				false,
				'd',
				"disambig",
				"in lexicon mode, also write the lexicon with its disambiguation symbols here");
		jsap.registerParameter(disopt);

		FlaggedOption beamopt = new FlaggedOption("beam",
				IntegerStringParser.getParser(),
				""+Decoder.DEFAULT_BEAM_SIZE,
				true,
				'b',
				"beam",
				"number of hypotheses kept per input symbol when decoding");
		jsap.registerParameter(beamopt);

		Switch csw = new Switch("check",
				'c',
				"check",
				"print the number of states, arcs and symbols of the transducer built or read");
		jsap.registerParameter(csw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"print timing information for operations at or below this level");
		jsap.registerParameter(timeopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help"))
			return config;

		MODE mode = MODE.get(config.getString("mode"));
		switch (mode) {
		case LEXICON:
			if (!config.contains("input") || !config.contains("output"))
				throw new ConfigureException("lexicon mode needs a lexicon (-i) and an output prefix (-o)");
			break;
		case RMDISAMBIG:
		case JSON:
			if (!config.contains("fst") || !config.contains("isyms") || !config.contains("osyms"))
				throw new ConfigureException(mode.toString().toLowerCase()+" mode needs --fst, --isyms and --osyms");
			if (!config.contains("output"))
				throw new ConfigureException(mode.toString().toLowerCase()+" mode needs an output (-o)");
			break;
		case SEGMENT:
		case CONVERT:
			if (!config.contains("json"))
				throw new ConfigureException(mode.toString().toLowerCase()+" mode needs a compact transducer (-j)");
			break;
		}
		if (config.contains("disambig") && mode != MODE.LEXICON)
			throw new ConfigureException("-d only makes sense in lexicon mode");
		if (config.getInt("beam") < 1)
			throw new ConfigureException("Beam size must be positive");
		return config;
	}

	private static BufferedReader open(File f, String encoding) throws FileNotFoundException, IOException {
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	private static Writer create(String name, String encoding) throws IOException {
		return new OutputStreamWriter(new FileOutputStream(name), encoding);
	}

	// compile a lexicon to text files
	static void compileLexicon(JSAPResult config, String encoding)
	throws ConfigureException, DataFormatException, IOException {
		Date start = new Date();
		String prefix = config.getString("output");
		BufferedReader br = open(config.getFile("input"), encoding);
		Lexicon lex = Lexicon.read(br);
		br.close();
		Debug.dbtime(1, start, "read lexicon");

		start = new Date();
		MutableFst fst = new MutableFst();
		Lexicon disambig = LexiconCompiler.compile(lex, fst, config.getString("unknown"));
		Debug.dbtime(1, start, "compile lexicon");
		writeText(fst, prefix, encoding);
		if (config.contains("disambig")) {
			Writer w = create(config.getFile("disambig").getPath(), encoding);
			disambig.write(w);
			w.close();
		}
		if (config.getBoolean("check"))
			Debug.prettyDebug(fst.getInfo());
	}

	private static MutableFst readText(JSAPResult config, String encoding, boolean strip)
	throws DataFormatException, IOException {
		BufferedReader isymr = open(config.getFile("isyms"), encoding);
		BufferedReader osymr = open(config.getFile("osyms"), encoding);
		BufferedReader fstr = open(config.getFile("fst"), encoding);
		try {
			return FstTextFormat.read(isymr, osymr, fstr, strip);
		}
		finally {
			isymr.close();
			osymr.close();
			fstr.close();
		}
	}

	// text transducer in, same transducer without disambiguation symbols out
	static void stripDisambig(JSAPResult config, String encoding) throws DataFormatException, IOException {
		MutableFst fst = readText(config, encoding, true);
		writeText(fst, config.getString("output"), encoding);
		if (config.getBoolean("check"))
			Debug.prettyDebug(fst.getInfo());
	}

	static void convertToJson(JSAPResult config, String encoding) throws DataFormatException, IOException {
		Date start = new Date();
		MutableFst fst = readText(config, encoding, config.getBoolean("strip"));
		Writer w = create(config.getString("output"), encoding);
		try {
			fst.toFst().writeJson(w);
		}
		finally {
			w.close();
		}
		Debug.dbtime(1, start, "convert to compact form");
		if (config.getBoolean("check"))
			Debug.prettyDebug(fst.getInfo());
	}

	private static void writeText(MutableFst fst, String prefix, String encoding)
	throws DataFormatException, IOException {
		Writer fstw = create(prefix+".fst.txt", encoding);
		Writer isymw = create(prefix+".isyms.txt", encoding);
		Writer osymw = create(prefix+".osyms.txt", encoding);
		try {
			fst.writeText(fstw, isymw, osymw);
		}
		finally {
			fstw.close();
			isymw.close();
			osymw.close();
		}
	}

	// decode each line of the input, one result line per input line
	static void decodeLines(MODE mode, JSAPResult config, String encoding)
	throws DataFormatException, UnusualConditionException, IOException {
		Date start = new Date();
		BufferedReader jr = open(config.getFile("json"), encoding);
		Fst fst = Fst.readJson(jr);
		jr.close();
		Debug.dbtime(1, start, "read transducer");
		if (config.getBoolean("check"))
			Debug.prettyDebug("FST info:\n\t"+fst.getNumStates()+" states\n\t"+fst.getNumArcs()+" arcs");

		Decoder decoder = new Decoder(fst, config.getInt("beam"));
		Segmenter segmenter = new Segmenter(decoder);
		Converter converter = new Converter(decoder);
		BufferedReader br = config.contains("input") ?
				open(config.getFile("input"), encoding) :
				new BufferedReader(new InputStreamReader(System.in, encoding));
		Writer w = config.contains("output") ?
				create(config.getString("output"), encoding) :
				new OutputStreamWriter(System.out, encoding);
		start = new Date();
		String line;
		while ((line = br.readLine()) != null) {
			if (mode == MODE.SEGMENT) {
				List<String> words = segmenter.segment(line);
				StringBuffer sb = new StringBuffer();
				for (String word : words) {
					if (sb.length() > 0)
						sb.append(' ');
					sb.append(word);
				}
				w.write(sb.toString()+"\n");
			}
			else
				w.write(converter.convert(line)+"\n");
		}
		w.flush();
		if (config.contains("output"))
			w.close();
		br.close();
		Debug.dbtime(1, start, "decode");
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is Bonito, version "+VERSION);

		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		MODE mode = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			if (config.success() && !config.getBoolean("help")) {
				encoding = config.getString("encoding");
				Debug.setEncoding(encoding);
				if (config.contains("time"))
					Debug.setDbLevel(config.getInt("time"));
				mode = MODE.get(config.getString("mode"));
			}
		}
		catch (JSAPException e) {
			System.err.println("Bonito options improperly configured: "+e.getMessage());
			System.err.println("Try 'bonito -h' for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("Bonito options improperly configured: "+e.getMessage());
			System.err.println("Try 'bonito -h' for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: bonito ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: " + errs.next());
			Debug.prettyDebug("Usage: bonito ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		// 2) Do the work
		try {
			switch (mode) {
			case LEXICON:
				compileLexicon(config, encoding);
				break;
			case RMDISAMBIG:
				stripDisambig(config, encoding);
				break;
			case JSON:
				convertToJson(config, encoding);
				break;
			default:
				decodeLines(mode, config, encoding);
			}
		}
		catch (ConfigureException e) {
			System.err.println("Bonito options improperly configured: "+e.getMessage());
			System.exit(1);
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading input file: "+e.getMessage());
			System.exit(1);
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition while decoding: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			System.exit(1);
		}
		Debug.dbtime(1, startTime, "total");
	}
}
