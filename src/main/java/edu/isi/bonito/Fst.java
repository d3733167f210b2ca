package edu.isi.bonito;

import gnu.trove.TIntDoubleHashMap;
import gnu.trove.TIntObjectHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Immutable weighted transducer used for decoding. Arcs are indexed per state by input label
 * id; nothing changes after construction, so one instance may be shared by any number of
 * decoders. Derived transducers are always new instances.
 */
public class Fst {
	private final SymbolTable isyms;
	private final SymbolTable osyms;
	// for each state, input label id -> unmodifiable list of arcs
	private final TIntObjectHashMap[] index;
	// for each state, all arcs in their original order
	private final ArrayList<List<Arc>> arcs;
	private final TIntDoubleHashMap finals;
	private final int numArcs;

	Fst(MutableFst m) {
		isyms = m.getInputSymbols().copy();
		isyms.setReadOnly(true);
		osyms = m.getOutputSymbols().copy();
		osyms.setReadOnly(true);
		int n = m.getNumStates();
		index = new TIntObjectHashMap[n];
		arcs = new ArrayList<List<Arc>>(n);
		int count = 0;
		for (int s = 0; s < n; s++) {
			List<Arc> stateArcs = m.getArcs(s);
			TIntObjectHashMap byLabel = new TIntObjectHashMap();
			for (Arc a : stateArcs) {
				int label = isyms.find(a.getInput());
				ArrayList<Arc> l = (ArrayList<Arc>)byLabel.get(label);
				if (l == null) {
					l = new ArrayList<Arc>();
					byLabel.put(label, l);
				}
				l.add(a);
			}
			int[] labels = byLabel.keys();
			for (int i = 0; i < labels.length; i++)
				byLabel.put(labels[i], Collections.unmodifiableList((List<Arc>)byLabel.get(labels[i])));
			index[s] = byLabel;
			arcs.add(Collections.unmodifiableList(new ArrayList<Arc>(stateArcs)));
			count += stateArcs.size();
		}
		numArcs = count;
		finals = new TIntDoubleHashMap();
		int[] f = m.getFinalStates();
		for (int i = 0; i < f.length; i++)
			finals.put(f[i], m.getFinalWeight(f[i]).getAsDouble());
	}

	public int getNumStates() {
		return index.length;
	}

	public int getNumArcs() {
		return numArcs;
	}

	/** id of sym in the input table. Reserved symbols always map to their reserved ids */
	public int inputLabel(Symbol sym) {
		if (sym.getReservedId() >= 0)
			return sym.getReservedId();
		return isyms.find(sym);
	}

	/** output symbol for an id, or null */
	public Symbol outputSymbol(int id) {
		return osyms.get(id);
	}

	/** true if some input label is a disambiguation symbol */
	public boolean hasDisambig() {
		return isyms.hasDisambig();
	}

	public boolean hasInput(Symbol sym) {
		return isyms.contains(sym);
	}

	/** arcs leaving state that read the label with this id; empty if there are none */
	public List<Arc> arcs(int state, int label) {
		if (state < 0 || state >= index.length || label < 0)
			return Collections.emptyList();
		List<Arc> l = (List<Arc>)index[state].get(label);
		if (l == null)
			return Collections.emptyList();
		return l;
	}

	public List<Arc> arcs(int state, Symbol in) {
		return arcs(state, inputLabel(in));
	}

	/** every arc leaving state */
	public List<Arc> arcs(int state) {
		if (state < 0 || state >= arcs.size())
			return Collections.emptyList();
		return arcs.get(state);
	}

	/** final weight of state; empty if state is not final */
	public OptionalDouble finalWeight(int state) {
		if (!finals.containsKey(state))
			return OptionalDouble.empty();
		return OptionalDouble.of(finals.get(state));
	}

	public int[] getFinalStates() {
		int[] f = finals.keys();
		Arrays.sort(f);
		return f;
	}

	// copies, so callers can't alter this transducer's tables
	public SymbolTable getInputSymbols() {
		return isyms.copy();
	}
	public SymbolTable getOutputSymbols() {
		return osyms.copy();
	}

	public MutableFst toMutable() throws DataFormatException {
		MutableFst m = new MutableFst(isyms.copy(), osyms.copy());
		m.ensureState(index.length-1);
		for (int s = 0; s < arcs.size(); s++)
			for (Arc a : arcs.get(s))
				m.addArc(a.getSource(), a.getDest(), a.getInput(), a.getOutput(), a.getWeight());
		int[] f = getFinalStates();
		for (int i = 0; i < f.length; i++)
			m.setFinal(f[i], finals.get(f[i]));
		return m;
	}

	/** new transducer with disambiguation labels relabeled to epsilon */
	public Fst removeDisambig() throws DataFormatException {
		return toMutable().removeDisambig().toFst();
	}

	public static Fst readText(BufferedReader isymr, BufferedReader osymr, BufferedReader fstr, boolean stripDisambig)
	throws IOException, DataFormatException {
		return FstTextFormat.read(isymr, osymr, fstr, stripDisambig).toFst();
	}

	public static Fst readJson(Reader r) throws IOException, DataFormatException {
		return FstJsonFormat.read(r);
	}

	public void writeJson(Writer w) throws IOException {
		FstJsonFormat.write(this, w);
	}
}
