package edu.isi.bonito;

import java.io.IOException;

/**
 * Sink for transducer construction. State 0, the start state, always exists; compilers
 * call {@link #createState()} for every other state they need.
 */
public interface FstWriter {
	/** a new state id */
	public int createState();

	/**
	 * @throws DataFormatException if a symbol can't be encoded, e.g. it is missing from a
	 * read-only symbol table
	 */
	public void addArc(int src, int dest, Symbol in, Symbol out, double weight) throws DataFormatException, IOException;

	public void setFinal(int state, double weight) throws IOException;

	/** flush whatever the backend holds. Nothing may be written afterwards */
	public void finish() throws IOException;
}
