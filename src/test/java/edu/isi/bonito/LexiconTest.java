package edu.isi.bonito;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Test;

public class LexiconTest {

	private static Lexicon read(String s) throws Exception {
		return Lexicon.read(new BufferedReader(new StringReader(s)));
	}

	@Test
	public void readsEntries() throws Exception {
		Lexicon lex = read("hi 0.5 h i\n\nhello 1 h e l l o\n");
		assertEquals(2, lex.size());
		LexiconEntry hi = lex.get(0);
		assertEquals("hi", hi.getWord());
		assertEquals(-Math.log(0.5), hi.getWeight(), 1e-12);
		assertEquals(2, hi.getSymbols().size());
		assertEquals(Symbol.text("i"), hi.getSymbols().get(1));
		assertEquals(0.0, lex.get(1).getWeight(), 0);
		assertEquals(0.0, lex.getMinWeight(), 0);
	}

	@Test
	public void writtenLexiconReadsBack() throws Exception {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("fo", 0.25, "f", "o", "#1"));
		lex.add(LexiconEntry.of("\\#0", 3.0, "\\<eps\\>"));
		StringWriter w = new StringWriter();
		lex.write(w);
		Lexicon back = read(w.toString());
		assertEquals(2, back.size());
		for (int i = 0; i < lex.size(); i++) {
			assertEquals(lex.get(i).getWord(), back.get(i).getWord());
			assertEquals(lex.get(i).getSymbols(), back.get(i).getSymbols());
			assertEquals(lex.get(i).getWeight(), back.get(i).getWeight(), 1e-9);
		}
		assertEquals(Symbol.disambig(1), back.get(0).getSymbols().get(2));
	}

	@Test
	public void rejectsMalformedLines() throws Exception {
		String[] bad = { "hi 0.5\n", "hi x h i\n", "hi 0 h i\n", "hi -1 h i\n" };
		for (String s : bad) {
			try {
				read(s);
				fail("accepted "+s);
			}
			catch (DataFormatException e) {
				// expected
			}
		}
	}

	@Test
	public void emptyLexiconHasZeroMinWeight() {
		assertEquals(0.0, new Lexicon().getMinWeight(), 0);
	}

	@Test
	public void selfLoopsCoverSymbolsWithoutSingleEntries() {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("头发", 1.0, "頭", "髮"));
		lex.add(LexiconEntry.of("发", 2.0, "發"));
		lex.add(LexiconEntry.of("头", 1.5, "頭"));
		Lexicon full = lex.addInputSelfLoops();
		assertEquals(3, lex.size());
		assertEquals(4, full.size());
		LexiconEntry added = full.get(3);
		assertEquals("髮", added.getWord());
		assertEquals(1, added.getSymbols().size());
		assertEquals(Symbol.text("髮"), added.getSymbols().get(0));
		assertEquals(1.0 - Math.log(0.1), added.getWeight(), 1e-12);
	}
}
