package edu.isi.bonito;
import java.io.Serializable;

// how path weights combine. Subclasses do the operations
public abstract class Semiring implements Serializable {
	// choice between two paths
	public abstract double plus(double a, double b);
	// extension of a path
	public abstract double times(double a, double b);
	// true if a is strictly preferable to b
	public abstract boolean better(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	// probabilities in, internal weights out
	public abstract double convertFromReal(double a);
	public abstract double convertToReal(double a);
}
