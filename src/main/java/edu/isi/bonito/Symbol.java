package edu.isi.bonito;

/**
 * A transducer label. Text symbols carry their label in escaped form; epsilon, unknown and
 * disambiguation symbols are reserved and live at fixed ids in every {@link SymbolTable}.
 * Symbols are compared by value.
 */
public abstract class Symbol {

	public static final String EPS_NAME = "<eps>";
	public static final String UNK_NAME = "<unk>";
	// output markers produced by compiled transducers and interpreted by the decoder
	public static final String CAPTURE = "<capture>";
	public static final String CAPTURE_EPS = "<capture_eps>";
	public static final String BREAK = "<break>";

	public static final int EPS_ID = 0;
	public static final int UNK_ID = 1;
	// disambiguation symbol #n always has id DISAMBIG_BASE+n
	public static final int DISAMBIG_BASE = 10000000;

	private static final EpsilonSymbol EPS = new EpsilonSymbol();
	private static final UnknownSymbol UNK = new UnknownSymbol();

	/** the label as written in symbol tables and lexicons */
	public abstract String getLabel();

	/** the id this symbol has in every table, or -1 for text symbols */
	public int getReservedId() {
		return -1;
	}

	public boolean isEpsilon() { return false; }
	public boolean isUnknown() { return false; }
	public boolean isDisambig() { return false; }

	/** true if the label starts with a reserved character */
	public boolean isSpecial() {
		return isSpecial(getLabel());
	}

	public String toString() {
		return getLabel();
	}

	public static Symbol epsilon() {
		return EPS;
	}
	public static Symbol unknown() {
		return UNK;
	}
	public static Symbol disambig(int n) {
		return new DisambigSymbol(n);
	}
	/** a text symbol with an already escaped label */
	public static Symbol text(String label) {
		return new TextSymbol(label);
	}

	/**
	 * maps reserved names (<eps>, <unk>, #n) to their symbols and
	 * everything else to a text symbol
	 */
	public static Symbol parse(String label) {
		if (label == null || label.length() == 0)
			throw new IllegalArgumentException("Empty symbol; use Symbol.epsilon() instead");
		if (label.equals(EPS_NAME))
			return EPS;
		if (label.equals(UNK_NAME))
			return UNK;
		int n = DisambigSymbol.parseIndex(label);
		if (n >= 0)
			return new DisambigSymbol(n);
		return new TextSymbol(label);
	}

	public static boolean isSpecial(String label) {
		if (label.length() == 0)
			return false;
		char c = label.charAt(0);
		return c == '<' || c == '#';
	}

	// encode arbitrary text as a label that can't be confused with a reserved name
	public static String escape(String text) {
		StringBuffer sb = new StringBuffer(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '\\': sb.append("\\\\"); break;
			case '<': sb.append("\\<"); break;
			case '>': sb.append("\\>"); break;
			case '#': sb.append("\\#"); break;
			case ' ': sb.append("\\s"); break;
			case '\t': sb.append("\\t"); break;
			case '\n': sb.append("\\n"); break;
			case '\r': sb.append("\\r"); break;
			default: sb.append(c);
			}
		}
		return sb.toString();
	}

	// inverse of escape. unrecognized sequences and a trailing backslash are kept as is
	public static String unescape(String label) {
		StringBuffer sb = new StringBuffer(label.length());
		int i = 0;
		while (i < label.length()) {
			char c = label.charAt(i);
			if (c != '\\' || i+1 == label.length()) {
				sb.append(c);
				i++;
				continue;
			}
			char n = label.charAt(i+1);
			switch (n) {
			case '\\': sb.append('\\'); break;
			case '<': sb.append('<'); break;
			case '>': sb.append('>'); break;
			case '#': sb.append('#'); break;
			case 's': sb.append(' '); break;
			case 't': sb.append('\t'); break;
			case 'n': sb.append('\n'); break;
			case 'r': sb.append('\r'); break;
			default: sb.append(c).append(n);
			}
			i += 2;
		}
		return sb.toString();
	}
}
