package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.io.StringWriter;

import org.junit.Test;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

public class MGParseTest {

	private static JSAPResult parse(String... argv) throws Exception {
		return MGParse.processParameters(new JSAP(), argv);
	}

	@Test
	public void defaults() throws Exception {
		JSAPResult config = parse("lex.json", "corpus.json");
		assertTrue(config.success());
		assertEquals("lex.json", config.getFile("lexicon").getName());
		assertEquals("utf-8", config.getString("encoding"));
		ParseOptions o = MGParse.getOptions(config);
		assertTrue(o.includePF());
		assertTrue(o.includeLF());
		assertFalse(o.extractAll());
		assertEquals(10, o.getMaxParses());
		assertSame(ShortestMoveLocality.INSTANCE, o.getLocality());
		assertEquals(Fixtures.bounds(6, 6, 4), MGParse.getBounds(config));
		assertEquals("C_declarative", o.getSentenceRoot(SentenceType.DECLARATIVE));
		assertEquals("C_question", o.getSentenceRoot(SentenceType.QUESTION));
	}

	@Test
	public void sentenceRoots() throws Exception {
		ParseOptions o = MGParse.getOptions(parse("--declarative-root", "C", "--question-root", "Cq",
				"lex.json", "corpus.json"));
		assertEquals("C", o.getSentenceRoot(SentenceType.DECLARATIVE));
		assertEquals("Cq", o.getSentenceRoot(SentenceType.QUESTION));
		assertEquals("Cq", MGParse.fitTo(o, Fixtures.pfOnly("left")).getSentenceRoot(SentenceType.QUESTION));
	}

	@Test
	public void flags() throws Exception {
		JSAPResult config = parse("-a", "-k", "3", "--no-lf", "-E", "2", "-m", "1", "-M", "0",
				"--locality", "none", "--timeout", "500", "lex.json", "corpus.json");
		assertTrue(config.success());
		ParseOptions o = MGParse.getOptions(config);
		assertTrue(o.extractAll());
		assertEquals(3, o.getMaxParses());
		assertFalse(o.includeLF());
		assertEquals(500, o.getTimeoutMillis());
		assertSame(NoLocality.INSTANCE, o.getLocality());
		assertEquals(Fixtures.bounds(2, 1, 0), MGParse.getBounds(config));
	}

	@Test(expected = ConfigurationException.class)
	public void bothFamiliesOff() throws Exception {
		parse("--no-pf", "--no-lf", "lex.json", "corpus.json");
	}

	@Test(expected = ConfigurationException.class)
	public void unknownLocality() throws Exception {
		MGParse.getOptions(parse("--locality", "phase", "lex.json", "corpus.json"));
	}

	@Test
	public void missingFiles() throws Exception {
		assertFalse(parse("-a").success());
	}

	@Test
	public void fitToCondition() throws Exception {
		ParseOptions all = new ParseOptions().setExtractAll(true).setMaxParses(4);
		ParseOptions fitted = MGParse.fitTo(all, Fixtures.pfOnly("left", "John"));
		assertTrue(fitted.includePF());
		assertFalse(fitted.includeLF());
		assertTrue(fitted.extractAll());
		assertEquals(4, fitted.getMaxParses());
	}

	@Test
	public void reportResults() throws Exception {
		InterfaceCondition ic = Fixtures.pfOnly("left", "John");
		ParseResult r = MGParser.parse(Fixtures.headMovement(), ic, new ParseOptions().setIncludeLF(false),
				Fixtures.bounds(1, 0, 1));
		StringWriter w = new StringWriter();
		MGParse.report(w, 1, r);
		String out = w.toString();
		assertTrue(out.startsWith("# 1: "));
		assertTrue(out.contains("SAT\n"));
		assertTrue(out.contains("yield: left John"));
		assertTrue(out.contains("HEAD_MOVE"));
	}
}
