package edu.isi.bonito;

import java.io.BufferedReader;
import java.io.IOException;

// reader for the text arc-list interchange form. TextFstWriter and MutableFst.writeText produce it
public class FstTextFormat {

	/**
	 * Read a transducer from its arc list and its two symbol tables. Arc lines are
	 * "src dest ilabel olabel [weight]", final state lines are "state [weight]"; missing
	 * weights are 0.
	 * @param stripDisambig accept disambiguation symbols and relabel them to epsilon.
	 * Otherwise ids in the disambiguation range are an error.
	 */
	public static MutableFst read(BufferedReader isymr, BufferedReader osymr, BufferedReader fstr, boolean stripDisambig)
	throws IOException, DataFormatException {
		boolean debug = false;
		SymbolTable isyms;
		SymbolTable osyms;
		try {
			isyms = SymbolTable.read(isymr, stripDisambig);
		}
		catch (DataFormatException e) {
			throw new DataFormatException("Input symbol table: "+e.getMessage(), e);
		}
		try {
			osyms = SymbolTable.read(osymr, stripDisambig);
		}
		catch (DataFormatException e) {
			throw new DataFormatException("Output symbol table: "+e.getMessage(), e);
		}
		MutableFst fst = new MutableFst(isyms, osyms);
		int lineno = 0;
		String line;
		while ((line = fstr.readLine()) != null) {
			lineno++;
			String trimmed = line.trim();
			if (trimmed.length() == 0)
				continue;
			String[] fields = trimmed.split("\\s+");
			try {
				if (fields.length == 4 || fields.length == 5) {
					int src = parseState(fields[0]);
					int dest = parseState(fields[1]);
					Symbol in = lookup(isyms, fields[2], "input");
					Symbol out = lookup(osyms, fields[3], "output");
					double w = fields.length == 5 ? Double.parseDouble(fields[4]) : 0;
					fst.ensureState(Math.max(src, dest));
					fst.addArc(src, dest, in, out, w);
				}
				else if (fields.length == 1 || fields.length == 2) {
					int s = parseState(fields[0]);
					double w = fields.length == 2 ? Double.parseDouble(fields[1]) : 0;
					fst.ensureState(s);
					fst.setFinal(s, w);
				}
				else
					throw new DataFormatException("expected arc or final state but got "+fields.length+" fields");
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+lineno+": bad number in '"+trimmed+"'", e);
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+lineno+": "+e.getMessage()+" in '"+trimmed+"'", e);
			}
		}
		if (debug) Debug.debug(debug, "Read "+fst.getNumStates()+" states and "+fst.getNumArcs()+" arcs");
		if (stripDisambig)
			return fst.removeDisambig();
		return fst;
	}

	private static int parseState(String s) throws DataFormatException {
		int state = Integer.parseInt(s);
		if (state < 0)
			throw new DataFormatException("negative state "+state);
		return state;
	}

	private static Symbol lookup(SymbolTable t, String s, String side) throws DataFormatException {
		int id = Integer.parseInt(s);
		Symbol sym = t.get(id);
		if (sym == null)
			throw new DataFormatException("unknown "+side+" label id "+id);
		return sym;
	}
}
