package edu.isi.bonito;

/** Rewrites text through a transducer, e.g. from one script to another. */
public class Converter {
	private final Decoder decoder;

	public Converter(Fst fst) {
		this(new Decoder(fst));
	}

	public Converter(Decoder decoder) {
		this.decoder = decoder;
	}

	// empty if the text can't be decoded
	public String convert(String text) throws UnusualConditionException {
		StringBuffer sb = new StringBuffer();
		for (String s : decoder.decodeString(text))
			sb.append(s);
		return sb.toString();
	}
}
