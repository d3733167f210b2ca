package edu.isi.bonito;

/**
 * Structural marker #n appended to lexicon entries so the compiled transducer can be
 * determinized. Always projects to epsilon on the output side.
 */
public class DisambigSymbol extends Symbol {
	private final int index;

	public DisambigSymbol(int index) {
		if (index < 0)
			throw new IllegalArgumentException("Negative disambiguation index "+index);
		if (index > Integer.MAX_VALUE - DISAMBIG_BASE)
			throw new IllegalArgumentException("Disambiguation index "+index+" out of range");
		this.index = index;
	}

	public int getIndex() {
		return index;
	}

	public String getLabel() { return "#"+index; }
	public int getReservedId() { return DISAMBIG_BASE+index; }
	public boolean isDisambig() { return true; }

	public int hashCode() { return DISAMBIG_BASE+index; }
	public boolean equals(Object o) {
		if (!(o instanceof DisambigSymbol))
			return false;
		return index == ((DisambigSymbol)o).index;
	}

	// n for labels of the form #n, -1 otherwise
	static int parseIndex(String label) {
		if (label.length() < 2 || label.charAt(0) != '#')
			return -1;
		for (int i = 1; i < label.length(); i++) {
			char c = label.charAt(i);
			if (c < '0' || c > '9')
				return -1;
		}
		if (label.length() > 10)
			return -1;
		long n = Long.parseLong(label.substring(1));
		if (n > Integer.MAX_VALUE - DISAMBIG_BASE)
			return -1;
		return (int)n;
	}
}
