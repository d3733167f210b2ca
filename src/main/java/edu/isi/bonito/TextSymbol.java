package edu.isi.bonito;

// an ordinary label, stored escaped
public class TextSymbol extends Symbol {
	private final String label;

	public TextSymbol(String label) {
		if (label == null || label.length() == 0)
			throw new IllegalArgumentException("Empty symbol; use Symbol.epsilon() instead");
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public int hashCode() {
		return label.hashCode();
	}

	public boolean equals(Object o) {
		if (!(o instanceof TextSymbol))
			return false;
		return label.equals(((TextSymbol)o).label);
	}
}
