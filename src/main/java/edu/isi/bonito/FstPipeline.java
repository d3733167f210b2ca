package edu.isi.bonito;

import java.io.IOException;
import java.util.Date;

/**
 * Lexicon to decodable transducer: compile, determinize, drop the disambiguation
 * symbols, remove epsilons, minimize. The graph algebra comes from an {@link FstToolkit}.
 */
public class FstPipeline {
	private final FstToolkit toolkit;

	public FstPipeline(FstToolkit toolkit) {
		this.toolkit = toolkit;
	}

	public MutableFst build(Lexicon lex, UnknownPolicy policy)
	throws DataFormatException, UnusualConditionException, IOException {
		boolean debug = false;
		Date start = new Date();
		MutableFst fst = new MutableFst();
		LexiconCompiler.compile(lex, fst, policy);
		Debug.dbtime(1, start, "compile lexicon");
		if (debug) Debug.debug(debug, fst.getInfo());

		start = new Date();
		fst = toolkit.determinize(fst);
		Debug.dbtime(1, start, "determinize");

		fst = fst.removeDisambig();

		start = new Date();
		fst = toolkit.removeEpsilon(fst);
		Debug.dbtime(1, start, "remove epsilons");

		start = new Date();
		fst = toolkit.minimize(fst, true);
		Debug.dbtime(1, start, "minimize");
		return fst;
	}

	/**
	 * A converter transducer: every symbol that only occurs inside longer entries passes
	 * through on its own, and unknown input after any word is copied to the output.
	 */
	public MutableFst buildConverter(Lexicon lex)
	throws DataFormatException, UnusualConditionException, IOException {
		Lexicon full = lex.addInputSelfLoops();
		MutableFst fst = build(full, UnknownPolicy.FAIL);
		fst.addUnknownLoops(LexiconCompiler.unknownWeight(full));
		return fst;
	}

	/**
	 * A segmenter transducer: the lexicon transducer composed with a breaker over its
	 * words. A run of unknown input is copied out as one more segment.
	 */
	public MutableFst buildSegmenter(Lexicon lex)
	throws DataFormatException, UnusualConditionException, IOException {
		MutableFst words = build(lex, UnknownPolicy.FAIL);
		MutableFst breaker = new MutableFst(words.getOutputSymbols().copy(), new SymbolTable());
		BreakerFstBuilder.build(words.getOutputSymbols(), breaker);
		MutableFst fst = toolkit.compose(words, breaker);

		Symbol capture = Symbol.text(Symbol.CAPTURE);
		int unknown = fst.createState();
		fst.addArc(0, unknown, Symbol.unknown(), capture, LexiconCompiler.unknownWeight(lex));
		fst.addArc(unknown, unknown, Symbol.unknown(), capture, 0);
		fst.addArc(unknown, 0, Symbol.epsilon(), Symbol.text(Symbol.BREAK), 0);
		return fst;
	}
}
