package edu.isi.bonito;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes a transducer in the text arc-list form: "src dest ilabel olabel weight" per arc and
 * "state weight" per final state, as they arrive. The input and output symbol tables go to
 * their own writers when the transducer is finished.
 */
public class TextFstWriter implements FstWriter {
	private Writer fstw;
	private Writer isymw;
	private Writer osymw;
	private SymbolTable isyms;
	private SymbolTable osyms;
	private int numStates;
	private boolean finished;

	public TextFstWriter(Writer fst, Writer isyms, Writer osyms) {
		this(fst, isyms, osyms, new SymbolTable(), new SymbolTable());
	}

	// write against existing tables. read-only tables make unseen symbols an error
	public TextFstWriter(Writer fst, Writer isymw, Writer osymw, SymbolTable isyms, SymbolTable osyms) {
		this.fstw = fst;
		this.isymw = isymw;
		this.osymw = osymw;
		this.isyms = isyms;
		this.osyms = osyms;
		numStates = 1;
		finished = false;
	}

	public SymbolTable getInputSymbols() {
		return isyms;
	}
	public SymbolTable getOutputSymbols() {
		return osyms;
	}

	private void checkOpen() {
		if (finished)
			throw new IllegalStateException("TextFstWriter already finished");
	}

	private void checkState(int s) {
		if (s < 0 || s >= numStates)
			throw new IllegalArgumentException("State "+s+" was never created");
	}

	public int createState() {
		checkOpen();
		return numStates++;
	}

	public void addArc(int src, int dest, Symbol in, Symbol out, double weight) throws DataFormatException, IOException {
		checkOpen();
		checkState(src);
		checkState(dest);
		int ilabel = isyms.getOrAdd(in);
		int olabel = osyms.getOrAdd(out);
		fstw.write(src+" "+dest+" "+ilabel+" "+olabel+" "+weight+"\n");
	}

	public void setFinal(int state, double weight) throws IOException {
		checkOpen();
		checkState(state);
		fstw.write(state+" "+weight+"\n");
	}

	public void finish() throws IOException {
		checkOpen();
		finished = true;
		isyms.write(isymw);
		osyms.write(osymw);
		fstw.flush();
		isymw.flush();
		osymw.flush();
	}
}
