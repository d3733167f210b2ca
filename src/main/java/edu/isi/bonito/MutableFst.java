package edu.isi.bonito;

import gnu.trove.TIntDoubleHashMap;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * In-memory transducer under construction. Compilers write into it through {@link FstWriter};
 * external toolkits transform it; {@link #toFst()} freezes it for decoding.
 */
public class MutableFst implements FstWriter {
	private SymbolTable isyms;
	private SymbolTable osyms;
	// arcs leaving each state, in insertion order
	private ArrayList<ArrayList<Arc>> states;
	private TIntDoubleHashMap finals;

	public MutableFst() {
		this(new SymbolTable(), new SymbolTable());
	}

	public MutableFst(SymbolTable isyms, SymbolTable osyms) {
		this.isyms = isyms;
		this.osyms = osyms;
		states = new ArrayList<ArrayList<Arc>>();
		states.add(new ArrayList<Arc>());
		finals = new TIntDoubleHashMap();
	}

	public SymbolTable getInputSymbols() {
		return isyms;
	}
	public SymbolTable getOutputSymbols() {
		return osyms;
	}

	public int createState() {
		states.add(new ArrayList<Arc>());
		return states.size()-1;
	}

	// make sure states 0..s exist
	public void ensureState(int s) {
		if (s < 0)
			throw new IllegalArgumentException("Negative state "+s);
		while (states.size() <= s)
			states.add(new ArrayList<Arc>());
	}

	private void checkState(int s) {
		if (s < 0 || s >= states.size())
			throw new IllegalArgumentException("State "+s+" was never created");
	}

	public void addArc(int src, int dest, Symbol in, Symbol out, double weight) throws DataFormatException {
		checkState(src);
		checkState(dest);
		isyms.getOrAdd(in);
		osyms.getOrAdd(out);
		states.get(src).add(new Arc(src, dest, in, out, weight));
	}

	public void setFinal(int state, double weight) {
		checkState(state);
		finals.put(state, weight);
	}

	public void finish() {
	}

	public int getNumStates() {
		return states.size();
	}

	public int getNumArcs() {
		int n = 0;
		for (ArrayList<Arc> arcs : states)
			n += arcs.size();
		return n;
	}

	public List<Arc> getArcs(int state) {
		checkState(state);
		return Collections.unmodifiableList(states.get(state));
	}

	public OptionalDouble getFinalWeight(int state) {
		if (!finals.containsKey(state))
			return OptionalDouble.empty();
		return OptionalDouble.of(finals.get(state));
	}

	/** final states, ascending */
	public int[] getFinalStates() {
		int[] f = finals.keys();
		Arrays.sort(f);
		return f;
	}

	/**
	 * A copy in which every disambiguation label becomes epsilon and the disambiguation
	 * symbols are gone from both tables.
	 */
	public MutableFst removeDisambig() throws DataFormatException {
		boolean debug = false;
		MutableFst ret = new MutableFst(isyms.withoutDisambig(), osyms.withoutDisambig());
		ret.ensureState(states.size()-1);
		int changed = 0;
		for (ArrayList<Arc> arcs : states) {
			for (Arc a : arcs) {
				Symbol in = a.getInput();
				Symbol out = a.getOutput();
				if (in.isDisambig()) {
					in = Symbol.epsilon();
					changed++;
				}
				if (out.isDisambig())
					out = Symbol.epsilon();
				ret.addArc(a.getSource(), a.getDest(), in, out, a.getWeight());
			}
		}
		int[] f = getFinalStates();
		for (int i = 0; i < f.length; i++)
			ret.setFinal(f[i], finals.get(f[i]));
		if (debug) Debug.debug(debug, "Relabeled "+changed+" disambiguation arcs");
		return ret;
	}

	/**
	 * Let unknown input restart the transducer: every final state gets an arc back to the
	 * start state reading unknown and writing the captured text.
	 */
	public void addUnknownLoops(double weight) throws DataFormatException {
		int[] f = getFinalStates();
		for (int i = 0; i < f.length; i++)
			addArc(f[i], 0, Symbol.unknown(), Symbol.text(Symbol.CAPTURE), weight);
	}

	public Fst toFst() {
		return new Fst(this);
	}

	/** replay this transducer into another writer, keeping state ids */
	public void writeTo(FstWriter w) throws DataFormatException, IOException {
		for (int i = 1; i < states.size(); i++)
			w.createState();
		for (ArrayList<Arc> arcs : states)
			for (Arc a : arcs)
				w.addArc(a.getSource(), a.getDest(), a.getInput(), a.getOutput(), a.getWeight());
		int[] f = getFinalStates();
		for (int i = 0; i < f.length; i++)
			w.setFinal(f[i], finals.get(f[i]));
		w.finish();
	}

	// text arc list plus both symbol tables, ids preserved
	public void writeText(Writer fst, Writer isymw, Writer osymw) throws DataFormatException, IOException {
		writeTo(new TextFstWriter(fst, isymw, osymw, isyms.copy(), osyms.copy()));
	}

	// summary in the manner of the rule set checks
	public String getInfo() {
		int eps = 0;
		int epsOut = 0;
		for (ArrayList<Arc> arcs : states) {
			for (Arc a : arcs) {
				if (a.getInput().isEpsilon())
					eps++;
				if (a.getOutput().isEpsilon())
					epsOut++;
			}
		}
		StringBuffer sb = new StringBuffer();
		sb.append("FST info:\n");
		sb.append("\t"+getNumStates()+" states\n");
		sb.append("\t"+finals.size()+" final states\n");
		sb.append("\t"+getNumArcs()+" arcs\n");
		sb.append("\t"+eps+" input epsilon arcs\n");
		sb.append("\t"+epsOut+" output epsilon arcs\n");
		sb.append("\t"+(isyms.size()-2)+" input symbols\n");
		sb.append("\t"+(osyms.size()-2)+" output symbols\n");
		return sb.toString();
	}
}
