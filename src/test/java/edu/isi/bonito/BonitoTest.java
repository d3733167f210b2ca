package edu.isi.bonito;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

public class BonitoTest {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static JSAPResult parse(String... argv) throws Exception {
		return Bonito.processParameters(new JSAP(), argv);
	}

	private File write(String name, String text) throws IOException {
		File f = tmp.newFile(name);
		Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8);
		w.write(text);
		w.close();
		return f;
	}

	private File copyResource(String name) throws IOException {
		File f = new File(tmp.getRoot(), name);
		InputStream in = getClass().getResourceAsStream("/wordseg/"+name);
		try {
			Files.copy(in, f.toPath());
		}
		finally {
			in.close();
		}
		return f;
	}

	private static String read(File f) throws IOException {
		return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
	}

	@Test
	public void defaults() throws Exception {
		JSAPResult config = parse("-j", "x.json");
		assertTrue(config.success());
		assertEquals("segment", config.getString("mode"));
		assertEquals("fail", config.getString("unknown"));
		assertEquals(Decoder.DEFAULT_BEAM_SIZE, config.getInt("beam"));
		assertFalse(config.getBoolean("strip"));
	}

	@Test(expected = ConfigureException.class)
	public void lexiconModeNeedsOutput() throws Exception {
		parse("-m", "lexicon", "-i", "lex.txt");
	}

	@Test(expected = ConfigureException.class)
	public void jsonModeNeedsSymbolTables() throws Exception {
		parse("-m", "json", "--fst", "a.fst.txt", "-o", "a.json");
	}

	@Test(expected = ConfigureException.class)
	public void decodingNeedsTransducer() throws Exception {
		parse("-m", "convert");
	}

	@Test(expected = ConfigureException.class)
	public void disambigOutputOnlyInLexiconMode() throws Exception {
		parse("-j", "x.json", "-d", "lex.disambig");
	}

	@Test(expected = ConfigureException.class)
	public void beamMustBePositive() throws Exception {
		parse("-j", "x.json", "-b", "0");
	}

	@Test
	public void badModeFailsToParse() throws Exception {
		assertFalse(parse("-m", "dance").success());
	}

	@Test
	public void modeNames() throws Exception {
		assertEquals(Bonito.MODE.RMDISAMBIG, Bonito.MODE.get("rmdisambig"));
		try {
			Bonito.MODE.get("dance");
			fail("accepted an unknown mode");
		}
		catch (ConfigureException e) {
			assertTrue(e.getMessage().contains(Bonito.MODE.getList()));
		}
	}

	@Test
	public void lexiconToConverter() throws Exception {
		File lex = write("lex.txt", "头发 1.0 頭 髮\n头 0.5 頭\n");
		String prefix = new File(tmp.getRoot(), "lex").getPath();
		File disambig = new File(tmp.getRoot(), "lex.disambig.txt");
		Bonito.compileLexicon(parse("-m", "lexicon", "-i", lex.getPath(), "-o", prefix, "-u", "output",
				"-d", disambig.getPath()), "utf-8");
		assertTrue(new File(prefix+".fst.txt").exists());
		assertTrue(read(new File(prefix+".isyms.txt")).contains("#1 10000001\n"));
		assertTrue(read(disambig).contains("#1"));

		String stripped = new File(tmp.getRoot(), "nodis").getPath();
		Bonito.stripDisambig(parse("-m", "rmdisambig", "--fst", prefix+".fst.txt", "--isyms", prefix+".isyms.txt",
				"--osyms", prefix+".osyms.txt", "-o", stripped), "utf-8");
		assertFalse(read(new File(stripped+".isyms.txt")).contains("#1"));

		File json = new File(tmp.getRoot(), "lex.json");
		Bonito.convertToJson(parse("-m", "json", "--fst", prefix+".fst.txt", "--isyms", prefix+".isyms.txt",
				"--osyms", prefix+".osyms.txt", "--strip-disambig", "-o", json.getPath()), "utf-8");

		File in = write("in.txt", "頭髮很多\n頭\n");
		File out = new File(tmp.getRoot(), "out.txt");
		JSAPResult config = parse("-m", "convert", "-j", json.getPath(), "-i", in.getPath(), "-o", out.getPath());
		Bonito.decodeLines(Bonito.MODE.CONVERT, config, "utf-8");
		assertEquals("头发很多\n头\n", read(out));
	}

	@Test(expected = DataFormatException.class)
	public void jsonModeWithoutStripRejectsDisambig() throws Exception {
		File lex = write("lex.txt", "头发 1.0 頭 髮\n头 0.5 頭\n");
		String prefix = new File(tmp.getRoot(), "lex").getPath();
		Bonito.compileLexicon(parse("-m", "lexicon", "-i", lex.getPath(), "-o", prefix), "utf-8");
		File json = new File(tmp.getRoot(), "lex.json");
		Bonito.convertToJson(parse("-m", "json", "--fst", prefix+".fst.txt", "--isyms", prefix+".isyms.txt",
				"--osyms", prefix+".osyms.txt", "-o", json.getPath()), "utf-8");
	}

	@Test
	public void segmentLines() throws Exception {
		File fst = copyResource("wordseg.fst.txt");
		File isyms = copyResource("wordseg.isyms.txt");
		File osyms = copyResource("wordseg.osyms.txt");
		File json = new File(tmp.getRoot(), "wordseg.json");
		Bonito.convertToJson(parse("-m", "json", "--fst", fst.getPath(), "--isyms", isyms.getPath(),
				"--osyms", osyms.getPath(), "-o", json.getPath()), "utf-8");

		File in = write("in.txt", "南京市长江大桥\n南京\n");
		File out = new File(tmp.getRoot(), "out.txt");
		Bonito.decodeLines(Bonito.MODE.SEGMENT, parse("-j", json.getPath(), "-i", in.getPath(), "-o", out.getPath()),
				"utf-8");
		assertEquals("南京市 长江大桥\n南京\n", read(out));
	}
}
