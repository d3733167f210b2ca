package edu.isi.bonito;

// one weighted transition. weights are tropical: lower is better
public class Arc {
	private final int src;
	private final int dest;
	private final Symbol in;
	private final Symbol out;
	private final double weight;

	public Arc(int src, int dest, Symbol in, Symbol out, double weight) {
		this.src = src;
		this.dest = dest;
		this.in = in;
		this.out = out;
		this.weight = weight;
	}

	public int getSource() { return src; }
	public int getDest() { return dest; }
	public Symbol getInput() { return in; }
	public Symbol getOutput() { return out; }
	public double getWeight() { return weight; }

	public String toString() {
		return src+" -> "+dest+" "+in+":"+out+" / "+weight;
	}

	public int hashCode() {
		return ((src*31+dest)*31+in.hashCode())*31+out.hashCode();
	}

	public boolean equals(Object o) {
		if (!(o instanceof Arc))
			return false;
		Arc a = (Arc)o;
		return src == a.src && dest == a.dest && in.equals(a.in) && out.equals(a.out) &&
			Double.compare(weight, a.weight) == 0;
	}
}
