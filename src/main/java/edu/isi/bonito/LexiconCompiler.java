package edu.isi.bonito;

import gnu.trove.TObjectIntHashMap;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;

/**
 * Compiles a lexicon into a trie-shaped transducer that reads an entry's symbols and writes
 * its word. Entries are disambiguated first so that the result can be determinized.
 */
public class LexiconCompiler {

	// unknown input costs this much more than the cheapest entry: -ln(0.1)
	public static final double UNKNOWN_PENALTY = -Math.log(0.1);

	/** weight of unknown-symbol arcs for this lexicon */
	public static double unknownWeight(Lexicon lex) {
		return TropicalSemiring.INSTANCE.times(lex.getMinWeight(), UNKNOWN_PENALTY);
	}

	/**
	 * Append disambiguation symbols so that no spelling equals or is a proper prefix of
	 * another. A spelling that is a prefix of another entry's, or that occurs more than once,
	 * gets #1 the first time it is seen and #2, #3... on each repeat. Other entries are
	 * returned unchanged.
	 */
	public static Lexicon addDisambig(Lexicon lex) {
		boolean debug = false;
		HashSet<List<Symbol>> prefixes = new HashSet<List<Symbol>>();
		HashSet<List<Symbol>> seen = new HashSet<List<Symbol>>();
		HashSet<List<Symbol>> ambiguous = new HashSet<List<Symbol>>();
		for (LexiconEntry e : lex) {
			List<Symbol> syms = e.getSymbols();
			for (int i = 1; i < syms.size(); i++)
				prefixes.add(syms.subList(0, i));
			if (!seen.add(syms))
				ambiguous.add(syms);
		}

		TObjectIntHashMap counters = new TObjectIntHashMap();
		Lexicon ret = new Lexicon();
		for (LexiconEntry e : lex) {
			List<Symbol> syms = e.getSymbols();
			if (counters.containsKey(syms)) {
				int k = counters.get(syms)+1;
				counters.put(syms, k);
				ret.add(e.append(Symbol.disambig(k)));
			}
			else if (prefixes.contains(syms) || ambiguous.contains(syms)) {
				counters.put(syms, 1);
				ret.add(e.append(Symbol.disambig(1)));
			}
			else
				ret.add(e);
		}
		if (debug) Debug.debug(debug, counters.size()+" spellings needed disambiguation");
		return ret;
	}

	// output markers the decoder interprets
	private static boolean isMarker(String word) {
		return word.equals(Symbol.CAPTURE) || word.equals(Symbol.CAPTURE_EPS) || word.equals(Symbol.BREAK);
	}

	public static Lexicon compile(Lexicon lex, FstWriter w, String policy)
	throws ConfigureException, DataFormatException, IOException {
		return compile(lex, w, UnknownPolicy.get(policy));
	}

	/**
	 * Write the lexicon transducer. Each entry is a path out of state 0 and back into it,
	 * with the word and the entry weight on the first arc. State 0 is final. Depending on
	 * the policy, state 0 also gets an unknown-symbol self-loop.
	 * Nothing is written if any entry is malformed.
	 * @return the disambiguated lexicon
	 */
	public static Lexicon compile(Lexicon lex, FstWriter w, UnknownPolicy policy)
	throws DataFormatException, IOException {
		boolean debug = false;
		Semiring sr = TropicalSemiring.INSTANCE;
		for (int i = 0; i < lex.size(); i++) {
			LexiconEntry e = lex.get(i);
			if (e.getWord() == null || e.getWord().length() == 0)
				throw new DataFormatException("Lexicon entry "+i+" has an empty word");
			if (e.getSymbols().isEmpty())
				throw new DataFormatException("Lexicon entry "+i+" ("+e.getWord()+") has no symbols");
			if (Symbol.isSpecial(e.getWord()) && !isMarker(e.getWord()))
				throw new DataFormatException("Lexicon entry "+i+" has unescaped reserved word "+e.getWord());
			for (Symbol s : e.getSymbols())
				if (s.isEpsilon() || s.isUnknown() || s.isDisambig())
					throw new DataFormatException("Lexicon entry "+i+" ("+e.getWord()+") spells with reserved symbol "+s);
		}

		Lexicon disambig = addDisambig(lex);
		for (LexiconEntry e : disambig) {
			List<Symbol> syms = e.getSymbols();
			int state = 0;
			for (int i = 0; i < syms.size(); i++) {
				int dest = i == syms.size()-1 ? 0 : w.createState();
				if (i == 0)
					w.addArc(state, dest, syms.get(i), Symbol.text(e.getWord()), e.getWeight());
				else
					w.addArc(state, dest, syms.get(i), Symbol.epsilon(), sr.ONE());
				state = dest;
			}
			if (debug) Debug.debug(debug, "Added "+e);
		}

		Symbol marker = policy.getMarker();
		if (marker != null)
			w.addArc(0, 0, Symbol.unknown(), marker, unknownWeight(lex));
		w.setFinal(0, sr.ONE());
		w.finish();
		return disambig;
	}
}
