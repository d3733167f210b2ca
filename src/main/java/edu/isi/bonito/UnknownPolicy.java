package edu.isi.bonito;

// what a compiled lexicon does with input symbols it has never seen
public enum UnknownPolicy {
	// copy the unknown input to the output
	OUTPUT("output", Symbol.CAPTURE),
	// consume it silently
	IGNORE("ignore", Symbol.CAPTURE_EPS),
	// no unknown arc; decoding dies on unknown input
	FAIL("fail", null);

	private final String label;
	private final String marker;

	private UnknownPolicy(String name, String marker) {
		this.label = name;
		this.marker = marker;
	}

	public String getName() {
		return label;
	}

	/** output symbol of the unknown arc, or null if there is none */
	public Symbol getMarker() {
		return marker == null ? null : Symbol.text(marker);
	}

	private static final String list;
	public static String getList() { return list; }
	static {
		StringBuffer sb = new StringBuffer();
		for (UnknownPolicy p : UnknownPolicy.values())
			sb.append(p.label+" ");
		list = sb.toString().trim();
	}

	public static UnknownPolicy get(String s) throws ConfigureException {
		for (UnknownPolicy p : UnknownPolicy.values())
			if (p.label.equals(s))
				return p;
		throw new ConfigureException("Invalid unknown symbol policy ("+s+"); valid values are "+list);
	}
}
