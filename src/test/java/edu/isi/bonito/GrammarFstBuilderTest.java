package edu.isi.bonito;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class GrammarFstBuilderTest {

	private static Decoder decoder(Grammar g) throws Exception {
		MutableFst m = new MutableFst();
		GrammarFstBuilder.build(g, m);
		return new Decoder(m.toFst());
	}

	@Test
	public void repeatedSymbolText() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarRule.Flag.REPEAT, GrammarToken.symbol("hi")));
		StringWriter fst = new StringWriter();
		StringWriter isyms = new StringWriter();
		StringWriter osyms = new StringWriter();
		GrammarFstBuilder.build(g, new TextFstWriter(fst, isyms, osyms));
		assertEquals("0 2 0 0 0.0\n2 3 2 2 0.0\n3 4 3 3 0.0\n4 2 0 0 0.0\n2 1 0 0 0.0\n1 0.0\n", fst.toString());
		assertEquals("<eps> 0\n<unk> 1\nh 2\ni 3\n", isyms.toString());
	}

	@Test
	public void symbolsCopyThemselves() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarRule.Flag.REPEAT, GrammarToken.symbol("hi")));
		Decoder d = decoder(g);
		assertEquals(Arrays.asList("h", "i", "h", "i"), d.decodeString("hihi"));
		assertEquals(Collections.emptyList(), d.decodeString("hh"));
	}

	@Test
	public void optionalClassMayBeSkipped() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarToken.symbol("a"), GrammarToken.ref("tail")));
		g.add(new GrammarRule("tail", GrammarRule.Flag.OPTIONAL, GrammarToken.input("x"), GrammarToken.output("X")));
		Decoder d = decoder(g);
		assertEquals(Arrays.asList("a"), d.decodeString("a"));
		assertEquals(Arrays.asList("a", "X"), d.decodeString("ax"));
		assertEquals(Collections.emptyList(), d.decodeString("axx"));
	}

	@Test
	public void alternativesAreWeightedByProbability() throws Exception {
		Grammar g = new Grammar("root");
		GrammarRule rare = new GrammarRule("root", Arrays.asList(GrammarToken.input("a"), GrammarToken.output("rare")),
				GrammarRule.Flag.NONE, 1);
		GrammarRule common = new GrammarRule("root", Arrays.asList(GrammarToken.input("a"), GrammarToken.output("common")),
				GrammarRule.Flag.NONE, 3);
		g.add(rare);
		g.add(common);
		assertEquals(-Math.log(0.25), g.getWeight(rare), 1e-9);
		assertEquals(-Math.log(0.75), g.getWeight(common), 1e-9);
		assertEquals(Arrays.asList("common"), decoder(g).decodeString("a"));
	}

	@Test
	public void outputWordsAreEscaped() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarToken.input("n"), GrammarToken.output("#1 <b>")));
		assertEquals(Arrays.asList("#1 <b>"), decoder(g).decodeString("n"));
	}

	@Test
	public void referenceCycleIsAnError() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarToken.symbol("a"), GrammarToken.ref("loop")));
		g.add(new GrammarRule("loop", GrammarToken.ref("root")));
		try {
			GrammarFstBuilder.build(g, new MutableFst());
			fail("built a cyclic grammar");
		}
		catch (DataFormatException e) {
			assertEquals("Reference cycle in grammar: root -> loop -> root", e.getMessage());
		}
	}

	@Test
	public void undefinedClassIsAnError() throws Exception {
		Grammar g = new Grammar("root");
		g.add(new GrammarRule("root", GrammarToken.ref("missing")));
		try {
			GrammarFstBuilder.build(g, new MutableFst());
			fail("built a grammar with an undefined class");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().contains("missing"));
		}
	}

	@Test
	public void newClassNamesSkipTakenOnes() {
		Grammar g = new Grammar("root");
		assertEquals("_1", g.newClassName());
		g.add(new GrammarRule("_2", GrammarToken.symbol("a")));
		assertEquals("_3", g.newClassName());
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyTokenRejected() {
		GrammarToken.symbol("");
	}
}
