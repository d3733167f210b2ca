package edu.isi.bonito;

// consumes and produces nothing
public class EpsilonSymbol extends Symbol {
	EpsilonSymbol() {}

	public String getLabel() { return EPS_NAME; }
	public int getReservedId() { return EPS_ID; }
	public boolean isEpsilon() { return true; }

	public int hashCode() { return EPS_ID; }
	public boolean equals(Object o) {
		return o instanceof EpsilonSymbol;
	}
}
