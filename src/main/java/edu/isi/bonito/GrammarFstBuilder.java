package edu.isi.bonito;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a grammar into a transducer. Each class is a sub-graph from the state it is
 * entered at to a fresh exit state; its rules run in parallel and join the exit through
 * epsilon arcs carrying their weights. Class references expand in place, so the class
 * graph must be acyclic; repetition is expressed with the REPEAT flag.
 */
public class GrammarFstBuilder {
	private Grammar grammar;
	private FstWriter w;

	public GrammarFstBuilder(Grammar grammar, FstWriter w) {
		this.grammar = grammar;
		this.w = w;
	}

	public static void build(Grammar grammar, FstWriter w) throws DataFormatException, IOException {
		new GrammarFstBuilder(grammar, w).build();
	}

	// write the whole transducer; its exit state is the single final state
	public void build() throws DataFormatException, IOException {
		boolean debug = false;
		int last = buildClass(grammar.getRoot(), new ArrayList<String>(), 0);
		w.setFinal(last, TropicalSemiring.INSTANCE.ONE());
		w.finish();
		if (debug) Debug.debug(debug, "Grammar "+grammar.getRoot()+" ends at state "+last);
	}

	private int buildClass(String name, List<String> history, int src) throws DataFormatException, IOException {
		if (history.contains(name)) {
			StringBuffer sb = new StringBuffer();
			for (String h : history)
				sb.append(h+" -> ");
			sb.append(name);
			throw new DataFormatException("Reference cycle in grammar: "+sb);
		}
		List<GrammarRule> rules = grammar.getRules(name);
		if (rules == null)
			throw new DataFormatException("Undefined grammar class <"+name+">");
		ArrayList<String> path = new ArrayList<String>(history);
		path.add(name);

		int dest = w.createState();
		for (GrammarRule r : rules) {
			double weight = grammar.getWeight(r);
			int start = src;
			if (r.getFlag() == GrammarRule.Flag.REPEAT) {
				// enter the loop once, paying the rule weight
				start = w.createState();
				w.addArc(src, start, Symbol.epsilon(), Symbol.epsilon(), weight);
				weight = TropicalSemiring.INSTANCE.ONE();
			}
			int state = start;
			for (GrammarToken t : r.getTokens())
				state = buildToken(t, path, state);
			if (r.getFlag() == GrammarRule.Flag.REPEAT) {
				w.addArc(state, start, Symbol.epsilon(), Symbol.epsilon(), TropicalSemiring.INSTANCE.ONE());
				state = start;
			}
			w.addArc(state, dest, Symbol.epsilon(), Symbol.epsilon(), weight);
			if (r.getFlag() == GrammarRule.Flag.OPTIONAL)
				w.addArc(src, dest, Symbol.epsilon(), Symbol.epsilon(), weight);
		}
		return dest;
	}

	private int buildToken(GrammarToken t, List<String> history, int src) throws DataFormatException, IOException {
		int state = src;
		switch (t.getType()) {
		case SYMBOL:
			for (String ch : characters(t.getValue())) {
				int next = w.createState();
				Symbol sym = Symbol.text(Symbol.escape(ch));
				w.addArc(state, next, sym, sym, 0);
				state = next;
			}
			return state;
		case INPUT_SYMBOL:
			for (String ch : characters(t.getValue())) {
				int next = w.createState();
				w.addArc(state, next, Symbol.text(Symbol.escape(ch)), Symbol.epsilon(), 0);
				state = next;
			}
			return state;
		case OUTPUT_SYMBOL: {
			int next = w.createState();
			w.addArc(state, next, Symbol.epsilon(), Symbol.text(Symbol.escape(t.getValue())), 0);
			return next;
		}
		default:
			return buildClass(t.getValue(), history, state);
		}
	}

	// one string per code point
	static List<String> characters(String s) {
		ArrayList<String> ret = new ArrayList<String>();
		int i = 0;
		while (i < s.length()) {
			int n = Character.charCount(s.codePointAt(i));
			ret.add(s.substring(i, i+n));
			i += n;
		}
		return ret;
	}
}
