package edu.isi.bonito;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeMap;

/**
 * Ordered list of lexicon entries. The text form is one entry per line:
 * "word probability symbol1 ... symbolN", with weight = -ln(probability).
 */
public class Lexicon implements Iterable<LexiconEntry> {
	private ArrayList<LexiconEntry> entries;

	public Lexicon() {
		entries = new ArrayList<LexiconEntry>();
	}

	public Lexicon(List<LexiconEntry> entries) {
		this.entries = new ArrayList<LexiconEntry>(entries);
	}

	public void add(LexiconEntry e) {
		entries.add(e);
	}

	public LexiconEntry get(int i) {
		return entries.get(i);
	}

	public int size() {
		return entries.size();
	}

	public List<LexiconEntry> getEntries() {
		return Collections.unmodifiableList(entries);
	}

	public Iterator<LexiconEntry> iterator() {
		return getEntries().iterator();
	}

	/** smallest entry weight, or ONE for an empty lexicon */
	public double getMinWeight() {
		Semiring sr = TropicalSemiring.INSTANCE;
		if (entries.isEmpty())
			return sr.ONE();
		double min = sr.ZERO();
		for (LexiconEntry e : entries)
			min = sr.plus(min, e.getWeight());
		return min;
	}

	/**
	 * Copy with an identity entry for every input symbol that can't be read on its own,
	 * at the unknown-word weight, added in label order. Lets a converter pass through
	 * characters that only occur inside longer words.
	 */
	public Lexicon addInputSelfLoops() {
		boolean debug = false;
		ArrayList<Symbol> single = new ArrayList<Symbol>();
		for (LexiconEntry e : entries)
			if (e.getSymbols().size() == 1)
				single.add(e.getSymbols().get(0));
		TreeMap<String, Symbol> missing = new TreeMap<String, Symbol>();
		for (LexiconEntry e : entries)
			for (Symbol s : e.getSymbols())
				if (!s.isDisambig() && !s.isEpsilon() && !s.isUnknown() && !single.contains(s))
					missing.put(s.getLabel(), s);
		double w = LexiconCompiler.unknownWeight(this);
		Lexicon ret = new Lexicon(entries);
		for (String label : missing.keySet()) {
			ArrayList<Symbol> syms = new ArrayList<Symbol>();
			syms.add(missing.get(label));
			ret.add(new LexiconEntry(label, syms, w));
		}
		if (debug) Debug.debug(debug, "Added "+missing.size()+" self-loop entries");
		return ret;
	}

	public static Lexicon read(BufferedReader br) throws IOException, DataFormatException {
		Semiring sr = TropicalSemiring.INSTANCE;
		Lexicon lex = new Lexicon();
		int lineno = 0;
		String line;
		while ((line = br.readLine()) != null) {
			lineno++;
			String trimmed = line.trim();
			if (trimmed.length() == 0)
				continue;
			String[] fields = trimmed.split("\\s+");
			if (fields.length < 3)
				throw new DataFormatException("Line "+lineno+": expected 'word probability symbols...' but got '"+trimmed+"'");
			double prob;
			try {
				prob = Double.parseDouble(fields[1]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+lineno+": bad probability '"+fields[1]+"'", e);
			}
			if (!(prob > 0) || Double.isInfinite(prob))
				throw new DataFormatException("Line "+lineno+": probability must be positive, got "+fields[1]);
			ArrayList<Symbol> syms = new ArrayList<Symbol>();
			for (int i = 2; i < fields.length; i++)
				syms.add(Symbol.parse(fields[i]));
			lex.add(new LexiconEntry(fields[0], syms, sr.convertFromReal(prob)));
		}
		return lex;
	}

	public void write(Writer w) throws IOException {
		Semiring sr = TropicalSemiring.INSTANCE;
		for (LexiconEntry e : entries) {
			w.write(e.getWord()+" "+sr.convertToReal(e.getWeight()));
			for (Symbol s : e.getSymbols())
				w.write(" "+s.getLabel());
			w.write("\n");
		}
		w.flush();
	}
}
