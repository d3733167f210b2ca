package edu.isi.bonito;

// tropical is min, +, +INF, 0. weights are negative log probabilities
public class TropicalSemiring extends Semiring {
	public static final TropicalSemiring INSTANCE = new TropicalSemiring();

	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		return a+b;
	}
	public boolean better(double a, double b) {
		return a < b;
	}
	public double ZERO() {
		return Double.POSITIVE_INFINITY;
	}
	public double ONE() {
		return 0;
	}
	// 0.0 - x so that probability 1 gives 0.0 rather than -0.0
	public double convertFromReal(double a) {
		return 0.0 - Math.log(a);
	}
	public double convertToReal(double a) {
		return Math.exp(-a);
	}
}
