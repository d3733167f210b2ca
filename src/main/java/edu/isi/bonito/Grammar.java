package edu.isi.bonito;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Rules grouped by class, plus the root class. Anonymous classes for grouped
 * sub-expressions get names from this grammar's own counter.
 */
public class Grammar {
	private final LinkedHashMap<String, List<GrammarRule>> rules;
	private final String root;
	private int anonymous;

	public Grammar(String root) {
		this.root = root;
		rules = new LinkedHashMap<String, List<GrammarRule>>();
		anonymous = 0;
	}

	public Grammar(String root, List<GrammarRule> rules) {
		this(root);
		for (GrammarRule r : rules)
			add(r);
	}

	public void add(GrammarRule r) {
		List<GrammarRule> l = rules.get(r.getClassName());
		if (l == null) {
			l = new ArrayList<GrammarRule>();
			rules.put(r.getClassName(), l);
		}
		l.add(r);
	}

	/** a class name not used in this grammar yet */
	public String newClassName() {
		String name;
		do {
			name = "_"+(++anonymous);
		} while (rules.containsKey(name));
		return name;
	}

	public String getRoot() {
		return root;
	}

	public Set<String> getClassNames() {
		return Collections.unmodifiableSet(rules.keySet());
	}

	/** rules of a class, or null if it has none */
	public List<GrammarRule> getRules(String className) {
		List<GrammarRule> l = rules.get(className);
		return l == null ? null : Collections.unmodifiableList(l);
	}

	/** -ln of the rule's probability relative to the other rules of its class */
	public double getWeight(GrammarRule r) {
		double sum = 0;
		for (GrammarRule o : rules.get(r.getClassName()))
			sum += o.getProb();
		return TropicalSemiring.INSTANCE.convertFromReal(r.getProb()/sum);
	}
}
