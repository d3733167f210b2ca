package edu.isi.bonito;

import java.util.ArrayList;
import java.util.List;

/**
 * Word segmentation with a transducer that copies its input and writes &lt;break&gt; between
 * words.
 */
public class Segmenter {
	private final Decoder decoder;

	public Segmenter(Fst fst) {
		this(new Decoder(fst));
	}

	public Segmenter(Decoder decoder) {
		this.decoder = decoder;
	}

	/** words of text, or an empty list if it can't be decoded */
	public List<String> segment(String text) throws UnusualConditionException {
		ArrayList<String> words = new ArrayList<String>();
		StringBuffer sb = new StringBuffer();
		for (String s : decoder.decodeString(text)) {
			if (s.equals(Symbol.BREAK)) {
				if (sb.length() > 0)
					words.add(sb.toString());
				sb.setLength(0);
			}
			else
				sb.append(s);
		}
		if (sb.length() > 0)
			words.add(sb.toString());
		return words;
	}
}
