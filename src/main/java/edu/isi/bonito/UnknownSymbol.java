package edu.isi.bonito;

// matches any input symbol that is not in the input table
public class UnknownSymbol extends Symbol {
	UnknownSymbol() {}

	public String getLabel() { return UNK_NAME; }
	public int getReservedId() { return UNK_ID; }
	public boolean isUnknown() { return true; }

	public int hashCode() { return UNK_ID; }
	public boolean equals(Object o) {
		return o instanceof UnknownSymbol;
	}
}
