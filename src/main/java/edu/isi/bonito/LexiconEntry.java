package edu.isi.bonito;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One lexicon line: a word, the input symbols that spell it and a tropical weight.
 * The word is kept as an escaped output label.
 */
public class LexiconEntry {
	private final String word;
	private final List<Symbol> symbols;
	private final double weight;

	public LexiconEntry(String word, List<Symbol> symbols, double weight) {
		this.word = word;
		this.symbols = Collections.unmodifiableList(new ArrayList<Symbol>(symbols));
		this.weight = weight;
	}

	// labels are parsed, so "#2" is a disambiguation symbol and "\#2" is text
	public static LexiconEntry of(String word, double weight, String... labels) {
		ArrayList<Symbol> syms = new ArrayList<Symbol>();
		for (String l : labels)
			syms.add(Symbol.parse(l));
		return new LexiconEntry(word, syms, weight);
	}

	public String getWord() {
		return word;
	}
	public List<Symbol> getSymbols() {
		return symbols;
	}
	public double getWeight() {
		return weight;
	}

	/** same entry with sym appended to its spelling */
	public LexiconEntry append(Symbol sym) {
		ArrayList<Symbol> syms = new ArrayList<Symbol>(symbols);
		syms.add(sym);
		return new LexiconEntry(word, syms, weight);
	}

	public String toString() {
		StringBuffer sb = new StringBuffer(word+" "+weight);
		for (Symbol s : symbols)
			sb.append(" "+s.getLabel());
		return sb.toString();
	}

	public int hashCode() {
		return (word.hashCode()*31+symbols.hashCode())*31+Double.valueOf(weight).hashCode();
	}

	public boolean equals(Object o) {
		if (!(o instanceof LexiconEntry))
			return false;
		LexiconEntry e = (LexiconEntry)o;
		return word.equals(e.word) && symbols.equals(e.symbols) && Double.compare(weight, e.weight) == 0;
	}
}
