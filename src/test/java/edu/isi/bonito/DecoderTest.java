package edu.isi.bonito;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class DecoderTest {

	private static Lexicon hiHello() {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("hi", -0.69, "h", "i"));
		lex.add(LexiconEntry.of("hello", -0.36, "h", "e", "l", "l", "o"));
		return lex;
	}

	private static Fst compile(Lexicon lex, UnknownPolicy p) throws Exception {
		MutableFst m = new MutableFst();
		LexiconCompiler.compile(lex, m, p);
		return m.removeDisambig().toFst();
	}

	// compile through the text form, the way lexicons reach decoders on disk
	private static Fst compileText(Lexicon lex, UnknownPolicy p) throws Exception {
		StringWriter arcs = new StringWriter();
		StringWriter isyms = new StringWriter();
		StringWriter osyms = new StringWriter();
		LexiconCompiler.compile(lex, new TextFstWriter(arcs, isyms, osyms), p);
		return Fst.readText(new BufferedReader(new StringReader(isyms.toString())),
				new BufferedReader(new StringReader(osyms.toString())),
				new BufferedReader(new StringReader(arcs.toString())), true);
	}

	@Test
	public void unknownOutputCopiesUnknownSymbols() throws Exception {
		Decoder d = new Decoder(compileText(hiHello(), UnknownPolicy.OUTPUT));
		assertEquals(Arrays.asList("hi", "b", "a", "r"), d.decodeString("hibar"));
		assertEquals(Arrays.asList("hello", "hi"), d.decodeString("hellohi"));
	}

	@Test
	public void unknownIgnoreDropsUnknownSymbols() throws Exception {
		Decoder d = new Decoder(compileText(hiHello(), UnknownPolicy.IGNORE));
		assertEquals(Arrays.asList("hi"), d.decodeString("hibar"));
	}

	@Test
	public void unknownFailKillsTheBeam() throws Exception {
		Decoder d = new Decoder(compile(hiHello(), UnknownPolicy.FAIL));
		assertEquals(Collections.emptyList(), d.decodeString("hibar"));
		assertEquals(Arrays.asList("hi"), d.decodeString("hi"));
		// known symbols that can't continue a path also fail
		assertEquals(Collections.emptyList(), d.decodeString("he"));
	}

	@Test
	public void emptyInputDecodesToNothing() throws Exception {
		Decoder d = new Decoder(compile(hiHello(), UnknownPolicy.FAIL));
		assertEquals(Collections.emptyList(), d.decode(Collections.<String>emptyList()));
	}

	@Test
	public void escapedEntryDecodesLiteralReservedText() throws Exception {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("\\#0", 0, "\\<eps\\>", "\\#1"));
		Decoder d = new Decoder(compileText(lex, UnknownPolicy.FAIL));
		assertEquals(Arrays.asList("#0"), d.decode(Arrays.asList("<eps>", "#1")));
	}

	@Test
	public void concatenationsOfEntriesDecodeToTheirWords() throws Exception {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("fo", 1.0, "f", "o"));
		lex.add(LexiconEntry.of("foo", 1.0, "f", "o", "o"));
		lex.add(LexiconEntry.of("bar", 2.0, "f", "o", "o"));
		lex.add(LexiconEntry.of("x", 0.5, "x"));
		Decoder d = new Decoder(compile(lex, UnknownPolicy.FAIL));
		assertEquals(Arrays.asList("foo", "fo"), d.decodeString("foofo"));
		assertEquals(Arrays.asList("fo", "fo"), d.decodeString("fofo"));
		assertEquals(Arrays.asList("x", "foo", "x"), d.decodeString("xfoox"));
		assertEquals(Arrays.asList("fo", "x", "fo"), d.decodeString("foxfo"));
	}

	@Test
	public void grammarRepetition() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarRule.Flag.REPEAT,
				GrammarToken.input("hi"), GrammarToken.output("hello")));
		MutableFst m = new MutableFst();
		GrammarFstBuilder.build(g, m);
		Decoder d = new Decoder(m.toFst());
		assertEquals(Arrays.asList("hello", "hello", "hello"), d.decodeString("hihihi"));
		assertEquals(Collections.emptyList(), d.decodeString("hih"));
	}

	@Test
	public void beamSizeOneFollowsTheCheapestPrefix() throws Exception {
		// the cheap first step leads nowhere; only a wider beam finds "ab"
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("A", 0.1, "a"));
		lex.add(LexiconEntry.of("AB", 5.0, "a", "b"));
		Fst fst = compile(lex, UnknownPolicy.FAIL);
		assertEquals(Arrays.asList("AB"), new Decoder(fst, 2).decodeString("ab"));
		assertEquals(Collections.emptyList(), new Decoder(fst, 1).decodeString("ab"));
	}

	@Test
	public void outputMarkersPassOrFail() throws Exception {
		MutableFst m = new MutableFst();
		int s = m.createState();
		m.addArc(0, s, Symbol.text("a"), Symbol.text("x"), 0);
		m.addArc(s, 0, Symbol.epsilon(), Symbol.text(Symbol.BREAK), 0);
		m.addArc(0, 0, Symbol.text("c"), Symbol.text(Symbol.CAPTURE), 0);
		m.addArc(0, 0, Symbol.text("d"), Symbol.text("<oops>"), 0);
		m.addArc(0, 0, Symbol.text("e"), Symbol.unknown(), 0);
		m.addArc(0, 0, Symbol.unknown(), Symbol.epsilon(), 0);
		m.setFinal(0, 0);
		Decoder d = new Decoder(m.toFst());
		assertEquals(Arrays.asList("x", Symbol.BREAK, "x", Symbol.BREAK), d.decodeString("aa"));
		String[] bad = { "c", "d", "e", "z" };
		for (String in : bad) {
			try {
				d.decodeString(in);
				fail("decoded "+in);
			}
			catch (UnusualConditionException e) {
				// expected
			}
		}
	}

	@Test
	public void decoderIsReusable() throws Exception {
		Decoder d = new Decoder(compile(hiHello(), UnknownPolicy.OUTPUT));
		for (int i = 0; i < 3; i++)
			assertEquals(Arrays.asList("hi", "z"), d.decodeString("hiz"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyInputSymbolRejected() throws Exception {
		new Decoder(compile(hiHello(), UnknownPolicy.FAIL)).decode(Arrays.asList("h", ""));
	}

	@Test(expected = IllegalArgumentException.class)
	public void beamMustBePositive() throws Exception {
		new Decoder(compile(hiHello(), UnknownPolicy.FAIL), 0);
	}

	@Test
	public void disambiguationMustBeRemovedFirst() throws Exception {
		Lexicon lex = new Lexicon();
		lex.add(LexiconEntry.of("a", 0, "a"));
		lex.add(LexiconEntry.of("ab", 0, "a", "b"));
		MutableFst m = new MutableFst();
		LexiconCompiler.compile(lex, m, UnknownPolicy.FAIL);
		try {
			new Decoder(m.toFst());
			fail("decoder accepted disambiguation symbols");
		}
		catch (IllegalArgumentException e) {
			// expected
		}
		assertTrue(new Decoder(m.removeDisambig().toFst()).decodeString("aab").size() == 2);
	}
}
