package edu.isi.bonito;

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedList;
import java.util.List;

/**
 * Beam search over a transducer: find the cheapest path that reads the input sequence and
 * return what it writes. Input symbols are escaped before lookup; symbols missing from the
 * input table follow unknown arcs, and their text is captured for the &lt;capture&gt; markers
 * on the output side.
 * <p>
 * The transducer must not contain epsilon cycles of zero total weight, since closure over
 * such a cycle never terminates. Disambiguation input symbols must be removed first; the
 * constructor rejects a transducer that still has them. Input length is not capped here. A decoder keeps no
 * per-call state, so one instance may serve several threads.
 */
public class Decoder {
	public static final int DEFAULT_BEAM_SIZE = 8;

	private final Fst fst;
	private final int beamSize;
	private final Semiring sr;

	// a node in the search lattice
	private static class Token {
		final int state;
		final Symbol output;
		final double cost;
		final Token prev;
		// literal input read by an unknown arc, else null
		final String capture;

		Token(int state, Symbol output, double cost, Token prev, String capture) {
			this.state = state;
			this.output = output;
			this.cost = cost;
			this.prev = prev;
			this.capture = capture;
		}

		public String toString() {
			return "Token("+state+", "+output+", cost="+cost+")";
		}
	}

	private static final Comparator<Token> BY_COST = new Comparator<Token>() {
		public int compare(Token a, Token b) {
			return Double.compare(a.cost, b.cost);
		}
	};

	public Decoder(Fst fst) {
		this(fst, DEFAULT_BEAM_SIZE);
	}

	public Decoder(Fst fst, int beamSize) {
		if (beamSize < 1)
			throw new IllegalArgumentException("Beam size must be positive, got "+beamSize);
		if (fst.hasDisambig())
			throw new IllegalArgumentException("Transducer still has disambiguation input symbols; remove them before decoding");
		this.fst = fst;
		this.beamSize = beamSize;
		this.sr = TropicalSemiring.INSTANCE;
	}

	public int getBeamSize() {
		return beamSize;
	}

	/** decode one symbol per code point of text */
	public List<String> decodeString(String text) throws UnusualConditionException {
		ArrayList<String> symbols = new ArrayList<String>();
		int i = 0;
		while (i < text.length()) {
			int cp = text.codePointAt(i);
			int n = Character.charCount(cp);
			symbols.add(text.substring(i, i+n));
			i += n;
		}
		return decode(symbols);
	}

	/**
	 * Output of the best path reading inputs, or an empty list if no path survives.
	 * @throws UnusualConditionException if the best path writes an unexpected special symbol
	 * or its capture markers don't match its unknown arcs
	 */
	public List<String> decode(List<String> inputs) throws UnusualConditionException {
		boolean debug = false;
		for (String s : inputs)
			if (s == null || s.length() == 0)
				throw new IllegalArgumentException("Empty input symbol");

		List<Token> beam = new ArrayList<Token>();
		beam.add(new Token(0, Symbol.epsilon(), sr.ONE(), null, null));
		for (String input : inputs) {
			beam = prune(beam);
			beam = closure(beam);
			beam = step(beam, input);
			if (debug) Debug.debug(debug, "After "+input+": "+beam);
			if (beam.isEmpty())
				return Collections.emptyList();
		}
		beam = finish(beam);
		if (beam.isEmpty())
			return Collections.emptyList();
		return output(best(beam));
	}

	// keep the beamSize cheapest tokens, ordered by cost; ties keep their beam order
	List<Token> prune(List<Token> beam) {
		ArrayList<Token> kept;
		if (beam.size() <= beamSize)
			kept = new ArrayList<Token>(beam);
		else {
			// max-heap of the cheapest beamSize costs; its top is the cutoff
			FixedPrioritiesPriorityQueue<Token> heap = new FixedPrioritiesPriorityQueue<Token>();
			for (Token t : beam) {
				heap.add(t, t.cost);
				if (heap.size() > beamSize)
					heap.removeFirst();
			}
			double cutoff = heap.getPriority();
			int ties = beamSize;
			for (Token t : beam)
				if (t.cost < cutoff)
					ties--;
			kept = new ArrayList<Token>(beamSize);
			for (Token t : beam) {
				if (t.cost < cutoff)
					kept.add(t);
				else if (t.cost == cutoff && ties > 0) {
					kept.add(t);
					ties--;
				}
			}
		}
		Collections.sort(kept, BY_COST);
		return kept;
	}

	// every token plus everything reachable from it over epsilon input arcs, breadth first
	List<Token> closure(List<Token> beam) {
		ArrayDeque<Token> queue = new ArrayDeque<Token>(beam);
		ArrayList<Token> ret = new ArrayList<Token>();
		while (!queue.isEmpty()) {
			Token t = queue.removeFirst();
			ret.add(t);
			for (Arc a : fst.arcs(t.state, Symbol.EPS_ID))
				queue.addLast(new Token(a.getDest(), a.getOutput(), sr.times(t.cost, a.getWeight()), t, null));
		}
		return ret;
	}

	// read one input symbol
	List<Token> step(List<Token> beam, String input) {
		Symbol sym = Symbol.text(Symbol.escape(input));
		int label;
		String capture = null;
		if (fst.hasInput(sym))
			label = fst.inputLabel(sym);
		else {
			label = Symbol.UNK_ID;
			capture = input;
		}
		ArrayList<Token> ret = new ArrayList<Token>();
		for (Token t : beam)
			for (Arc a : fst.arcs(t.state, label))
				ret.add(new Token(a.getDest(), a.getOutput(), sr.times(t.cost, a.getWeight()), t, capture));
		return ret;
	}

	// close over epsilons, then keep final tokens with their final weight added
	List<Token> finish(List<Token> beam) {
		ArrayList<Token> ret = new ArrayList<Token>();
		for (Token t : closure(beam)) {
			if (!fst.finalWeight(t.state).isPresent())
				continue;
			double w = fst.finalWeight(t.state).getAsDouble();
			ret.add(new Token(t.state, t.output, sr.times(t.cost, w), t.prev, t.capture));
		}
		return ret;
	}

	// cheapest token; the first one seen wins ties
	Token best(List<Token> beam) {
		Token best = null;
		for (Token t : beam)
			if (best == null || sr.better(t.cost, best.cost))
				best = t;
		return best;
	}

	// walk back from the best token, then interpret the output markers
	List<String> output(Token last) throws UnusualConditionException {
		LinkedList<Token> path = new LinkedList<Token>();
		for (Token t = last; t != null; t = t.prev)
			path.addFirst(t);
		LinkedList<String> captures = new LinkedList<String>();
		for (Token t : path)
			if (t.capture != null)
				captures.addLast(t.capture);

		ArrayList<String> ret = new ArrayList<String>();
		for (Token t : path) {
			Symbol out = t.output;
			if (out.isEpsilon() || out.isDisambig())
				continue;
			String label = out.getLabel();
			if (label.equals(Symbol.CAPTURE)) {
				if (captures.isEmpty())
					throw new UnusualConditionException("More "+Symbol.CAPTURE+" markers than captured symbols in decoded path");
				ret.add(captures.removeFirst());
			}
			else if (label.equals(Symbol.CAPTURE_EPS)) {
				if (captures.isEmpty())
					throw new UnusualConditionException("More "+Symbol.CAPTURE_EPS+" markers than captured symbols in decoded path");
				captures.removeFirst();
			}
			else if (label.equals(Symbol.BREAK))
				ret.add(label);
			else if (out.isSpecial())
				throw new UnusualConditionException("unexpected output symbol "+label);
			else
				ret.add(Symbol.unescape(label));
		}
		if (!captures.isEmpty())
			throw new UnusualConditionException(captures.size()+" captured symbols have no capture marker in decoded path");
		return ret;
	}
}
