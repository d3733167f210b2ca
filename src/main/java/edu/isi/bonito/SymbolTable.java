package edu.isi.bonito;

import gnu.trove.TIntObjectHashMap;
import gnu.trove.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;

/**
 * Bijection between symbols and non-negative ids. Ids 0 and 1 always hold epsilon and
 * unknown, disambiguation symbol #n always has id {@link Symbol#DISAMBIG_BASE}+n, and every
 * other symbol gets the next free id. A read-only table refuses new symbols.
 */
public class SymbolTable {

	private TObjectIntHashMap symToId;
	private TIntObjectHashMap idToSym;
	private int nextId;
	private boolean readOnly;

	public SymbolTable() {
		symToId = new TObjectIntHashMap();
		idToSym = new TIntObjectHashMap();
		nextId = 2;
		readOnly = false;
		put(Symbol.epsilon(), Symbol.EPS_ID);
		put(Symbol.unknown(), Symbol.UNK_ID);
	}

	private void put(Symbol sym, int id) {
		symToId.put(sym, id);
		idToSym.put(id, sym);
		if (id < Symbol.DISAMBIG_BASE && id >= nextId)
			nextId = id+1;
	}

	/** id of sym, or -1 if it isn't in the table */
	public int find(Symbol sym) {
		if (!symToId.containsKey(sym))
			return -1;
		return symToId.get(sym);
	}

	public boolean contains(Symbol sym) {
		return symToId.containsKey(sym);
	}

	/** the symbol with this id, or null */
	public Symbol get(int id) {
		return (Symbol)idToSym.get(id);
	}

	/** id of sym, assigning one if needed */
	public int getOrAdd(Symbol sym) throws DataFormatException {
		if (symToId.containsKey(sym))
			return symToId.get(sym);
		if (readOnly)
			throw new DataFormatException("Symbol "+sym+" not in read-only symbol table");
		int id = sym.isDisambig() ? sym.getReservedId() : nextId;
		put(sym, id);
		return id;
	}

	public boolean isReadOnly() {
		return readOnly;
	}
	public void setReadOnly(boolean b) {
		readOnly = b;
	}

	public int size() {
		return idToSym.size();
	}

	/** all ids, ascending */
	public int[] ids() {
		int[] ids = idToSym.keys();
		Arrays.sort(ids);
		return ids;
	}

	public boolean hasDisambig() {
		int[] ids = idToSym.keys();
		for (int i = 0; i < ids.length; i++)
			if (ids[i] >= Symbol.DISAMBIG_BASE)
				return true;
		return false;
	}

	public SymbolTable copy() {
		SymbolTable t = new SymbolTable();
		int[] ids = ids();
		for (int i = 0; i < ids.length; i++)
			t.put(get(ids[i]), ids[i]);
		t.readOnly = readOnly;
		return t;
	}

	/** a copy with every disambiguation symbol removed */
	public SymbolTable withoutDisambig() {
		SymbolTable t = new SymbolTable();
		int[] ids = ids();
		for (int i = 0; i < ids.length; i++)
			if (!get(ids[i]).isDisambig())
				t.put(get(ids[i]), ids[i]);
		t.readOnly = readOnly;
		return t;
	}

	// one "symbol id" line per entry, in id order
	public void write(Writer w) throws IOException {
		int[] ids = ids();
		for (int i = 0; i < ids.length; i++)
			w.write(get(ids[i]).getLabel()+" "+ids[i]+"\n");
	}

	/**
	 * Bind sym to id while loading a stored table, checking reserved names and ids.
	 * Returns false for the reserved entries, which every table already has.
	 */
	boolean define(Symbol sym, int id, boolean allowDisambig) throws DataFormatException {
		if (id < 0)
			throw new DataFormatException("negative symbol id "+id);
		if (id == Symbol.EPS_ID) {
			if (!sym.isEpsilon())
				throw new DataFormatException("id 0 is reserved for "+Symbol.EPS_NAME+", got "+sym);
			return false;
		}
		if (id == Symbol.UNK_ID) {
			if (!sym.isUnknown())
				throw new DataFormatException("id 1 is reserved for "+Symbol.UNK_NAME+", got "+sym);
			return false;
		}
		if (sym.isEpsilon() || sym.isUnknown())
			throw new DataFormatException("reserved symbol "+sym+" at id "+id);
		if (sym.isDisambig()) {
			if (!allowDisambig)
				throw new DataFormatException("disambiguation symbol "+sym+" must be stripped first");
			if (id != sym.getReservedId())
				throw new DataFormatException("disambiguation symbol "+sym+" must have id "+sym.getReservedId());
		}
		else if (sym.getLabel().charAt(0) == '#')
			throw new DataFormatException("unescaped reserved character in symbol "+sym);
		else if (id >= Symbol.DISAMBIG_BASE)
			throw new DataFormatException("id "+id+" of "+sym+" is in the disambiguation range");
		if (idToSym.containsKey(id))
			throw new DataFormatException("duplicate symbol id "+id);
		if (symToId.containsKey(sym))
			throw new DataFormatException("duplicate symbol "+sym);
		put(sym, id);
		return true;
	}

	/**
	 * Read a table of "symbol id" lines. The result is read-only.
	 * @param allowDisambig if false, ids in the disambiguation range are rejected
	 */
	public static SymbolTable read(BufferedReader br, boolean allowDisambig) throws IOException, DataFormatException {
		boolean debug = false;
		SymbolTable t = new SymbolTable();
		boolean sawEps = false;
		boolean sawUnk = false;
		int lineno = 0;
		String line;
		while ((line = br.readLine()) != null) {
			lineno++;
			String trimmed = line.trim();
			if (trimmed.length() == 0)
				continue;
			String[] fields = trimmed.split("\\s+");
			if (fields.length != 2)
				throw new DataFormatException("Line "+lineno+": expected 'symbol id' but got '"+trimmed+"'");
			try {
				int id = Integer.parseInt(fields[1]);
				Symbol sym = Symbol.parse(fields[0]);
				t.define(sym, id, allowDisambig);
				if (id == Symbol.EPS_ID)
					sawEps = true;
				else if (id == Symbol.UNK_ID)
					sawUnk = true;
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+lineno+": bad symbol id '"+fields[1]+"'", e);
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
			}
		}
		if (!sawEps)
			throw new DataFormatException("Symbol table lacks "+Symbol.EPS_NAME+" at id 0");
		if (!sawUnk)
			throw new DataFormatException("Symbol table lacks "+Symbol.UNK_NAME+" at id 1");
		if (debug) Debug.debug(debug, "Read "+t.size()+" symbols");
		t.readOnly = true;
		return t;
	}
}
