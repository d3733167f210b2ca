package edu.isi.bonito;

// one item on the right-hand side of a grammar rule
public class GrammarToken {
	public enum Type {
		// text read and written character by character
		SYMBOL,
		// text read character by character, nothing written
		INPUT_SYMBOL,
		// one word written, nothing read
		OUTPUT_SYMBOL,
		// reference to another class
		CLASS
	}

	private final Type type;
	private final String value;

	public GrammarToken(Type type, String value) {
		if (value == null || value.length() == 0)
			throw new IllegalArgumentException("Empty "+type+" token");
		this.type = type;
		this.value = value;
	}

	public static GrammarToken symbol(String text) {
		return new GrammarToken(Type.SYMBOL, text);
	}
	public static GrammarToken input(String text) {
		return new GrammarToken(Type.INPUT_SYMBOL, text);
	}
	public static GrammarToken output(String word) {
		return new GrammarToken(Type.OUTPUT_SYMBOL, word);
	}
	public static GrammarToken ref(String className) {
		return new GrammarToken(Type.CLASS, className);
	}

	public Type getType() {
		return type;
	}
	public String getValue() {
		return value;
	}

	public String toString() {
		switch (type) {
		case SYMBOL: return "\""+value+"\"";
		case INPUT_SYMBOL: return "\""+value+"\":_";
		case OUTPUT_SYMBOL: return "_:\""+value+"\"";
		default: return "<"+value+">";
		}
	}
}
