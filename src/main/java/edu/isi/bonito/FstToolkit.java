package edu.isi.bonito;

/**
 * Graph algebra provided by an external finite-state library. Every operation returns a
 * new transducer and leaves its arguments alone.
 */
public interface FstToolkit {
	public MutableFst determinize(MutableFst fst) throws UnusualConditionException;

	/** @param allowNondeterministic minimize even if fst is not deterministic */
	public MutableFst minimize(MutableFst fst, boolean allowNondeterministic) throws UnusualConditionException;

	public MutableFst removeEpsilon(MutableFst fst) throws UnusualConditionException;

	public MutableFst compose(MutableFst a, MutableFst b) throws UnusualConditionException;
}
