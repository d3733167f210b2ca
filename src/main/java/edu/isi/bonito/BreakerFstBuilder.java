package edu.isi.bonito;

import java.io.IOException;

/**
 * Builds the transducer that copies words and writes &lt;break&gt; after each one. Runs of
 * unknown symbols are captured and broken as one word; whitespace becomes a bare break.
 * Composed after a lexicon transducer it turns the lexicon's word output into segments.
 */
public class BreakerFstBuilder {
	// escaped whitespace symbols
	static final String[] SPACES = { "\\s", "\\t", "\\r", "\\n" };

	public static final double DEFAULT_UNKNOWN_WEIGHT = 1.0;

	public static void build(SymbolTable words, FstWriter w) throws DataFormatException, IOException {
		build(words, w, DEFAULT_UNKNOWN_WEIGHT);
	}

	/**
	 * @param words the vocabulary; reserved and marker symbols in it are skipped
	 * @param unknownWeight cost of starting a run of unknown symbols
	 */
	public static void build(SymbolTable words, FstWriter w, double unknownWeight) throws DataFormatException, IOException {
		boolean debug = false;
		Symbol brk = Symbol.text(Symbol.BREAK);
		Symbol capture = Symbol.text(Symbol.CAPTURE);
		int afterWord = w.createState();
		int ids[] = words.ids();
		int count = 0;
		for (int i = 0; i < ids.length; i++) {
			Symbol sym = words.get(ids[i]);
			if (sym.isSpecial() || isSpace(sym))
				continue;
			w.addArc(0, afterWord, sym, sym, 0);
			count++;
		}
		w.addArc(afterWord, 0, Symbol.epsilon(), brk, 0);

		int unknown = w.createState();
		w.addArc(0, unknown, Symbol.unknown(), capture, unknownWeight);
		w.addArc(unknown, unknown, Symbol.unknown(), capture, 0);
		w.addArc(unknown, 0, Symbol.epsilon(), brk, 0);

		for (int i = 0; i < SPACES.length; i++)
			w.addArc(0, 0, Symbol.text(SPACES[i]), brk, 0);

		w.setFinal(0, 0);
		w.finish();
		if (debug) Debug.debug(debug, "Breaker copies "+count+" words");
	}

	private static boolean isSpace(Symbol sym) {
		for (int i = 0; i < SPACES.length; i++)
			if (SPACES[i].equals(sym.getLabel()))
				return true;
		return false;
	}
}
