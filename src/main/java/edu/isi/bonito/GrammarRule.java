package edu.isi.bonito;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * class ::= tokens, with an optional repetition flag and a relative probability. The
 * probabilities of a class's rules are normalized when the grammar is compiled.
 */
public class GrammarRule {
	public enum Flag { NONE, REPEAT, OPTIONAL }

	private final String className;
	private final List<GrammarToken> tokens;
	private final Flag flag;
	private final double prob;

	public GrammarRule(String className, List<GrammarToken> tokens, Flag flag, double prob) {
		if (className == null || className.length() == 0)
			throw new IllegalArgumentException("Rule without class name");
		if (!(prob > 0))
			throw new IllegalArgumentException("Rule probability must be positive, got "+prob);
		this.className = className;
		this.tokens = Collections.unmodifiableList(new ArrayList<GrammarToken>(tokens));
		this.flag = flag;
		this.prob = prob;
	}

	public GrammarRule(String className, Flag flag, GrammarToken... tokens) {
		this(className, Arrays.asList(tokens), flag, 1.0);
	}

	public GrammarRule(String className, GrammarToken... tokens) {
		this(className, Arrays.asList(tokens), Flag.NONE, 1.0);
	}

	public String getClassName() { return className; }
	public List<GrammarToken> getTokens() { return tokens; }
	public Flag getFlag() { return flag; }
	public double getProb() { return prob; }

	public String toString() {
		StringBuffer sb = new StringBuffer("<"+className+"> ::=");
		for (GrammarToken t : tokens)
			sb.append(" "+t);
		if (flag == Flag.REPEAT)
			sb.append(" *");
		else if (flag == Flag.OPTIONAL)
			sb.append(" ?");
		return sb.toString();
	}
}
