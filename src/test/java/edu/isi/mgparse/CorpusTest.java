package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.io.Reader;
import java.io.StringReader;
import java.util.Arrays;

import org.junit.Test;

public class CorpusTest {

	@Test
	public void tokenize() {
		assertEquals(Arrays.asList("John", "fears", "her"), InterfaceCondition.tokenize("  John fears  her . "));
		assertEquals(Arrays.asList("who", "left"), InterfaceCondition.tokenize("who left?"));
		assertTrue(InterfaceCondition.tokenize(" . ").isEmpty());
	}

	@Test
	public void sentenceType() throws Exception {
		assertEquals(SentenceType.DECLARATIVE, SentenceType.of("John fears her . "));
		assertEquals(SentenceType.QUESTION, SentenceType.of("who left?"));
		assertNull(SentenceType.of("John left"));
		assertEquals(SentenceType.QUESTION, Fixtures.condition("{\"PF\": \"left John ?\"}").getSentenceType());
		// a token list carries no punctuation
		assertNull(Fixtures.condition("{\"PF\": [\"left\", \"John\"]}").getSentenceType());
		InterfaceCondition explicit = Fixtures.condition("{\"PF\": \"left John .\", \"sentence_type\": \"question\"}");
		assertEquals(SentenceType.QUESTION, explicit.getSentenceType());
		assertEquals(Arrays.asList("left", "John"), explicit.getPf());
	}

	@Test(expected = DataFormatException.class)
	public void badSentenceType() throws DataFormatException {
		Fixtures.condition("{\"PF\": \"left John\", \"sentence_type\": \"exclamation\"}");
	}

	@Test
	public void agreements() throws Exception {
		InterfaceCondition ic = Fixtures.condition("{\"LF\": {\"relations\": [{\"pred\": \"left\", \"subj\": \"John\"}], " +
				"\"agree\": [{\"pred\": \"left\", \"subj\": \"John\"}, {\"pred\": \"T\", \"subj\": \"John\"}]}}");
		assertEquals(2, ic.getLf().getAgreements().size());
		assertTrue(ic.getLf().getAgreements().contains(new Agreement("left", "John")));
		// agreeing names become words of an LF-only parse
		assertEquals(Arrays.asList("left", "John", "T"), ic.getLf().words());
	}

	@Test(expected = DataFormatException.class)
	public void agreementWithoutSubject() throws DataFormatException {
		Fixtures.condition("{\"LF\": {\"relations\": [{\"pred\": \"left\", \"subj\": \"John\"}], " +
				"\"agree\": [{\"pred\": \"left\"}]}}");
	}

	@Test
	public void readCorpus() throws Exception {
		Reader r = Fixtures.resource("corpus.json");
		Corpus c;
		try {
			c = Corpus.read(r);
		}
		finally {
			r.close();
		}
		assertEquals(3, c.size());

		InterfaceCondition first = c.getInputSequence().get(0);
		assertEquals(6, first.getPf().size());
		assertTrue(first.hasLf());
		assertEquals(Fixtures.relclauseFacts(), first.getLf().getFacts());
		assertEquals("C", first.getLf().getRoot());
		assertEquals("D", first.getLf().getCategories().get("John"));
		assertEquals(SentenceType.DECLARATIVE, first.getSentenceType());

		InterfaceCondition second = c.getInputSequence().get(1);
		assertEquals(Arrays.asList("John", "fears", "her"), second.getPf());
		assertFalse(second.hasLf());
		assertNull(second.getSentenceType());

		InterfaceCondition third = c.getInputSequence().get(2);
		assertFalse(third.hasPf());
		assertEquals(Arrays.asList("fears", "John", "her"), third.getLf().words());
		assertNull(third.getLf().getRoot());
	}

	@Test(expected = DataFormatException.class)
	public void noInputSequence() throws DataFormatException {
		Corpus.read(new StringReader("{\"sentences\": []}"));
	}

	@Test(expected = DataFormatException.class)
	public void emptyCondition() throws DataFormatException {
		Corpus.read(new StringReader("{\"input_sequence\": [{}]}"));
	}

	@Test(expected = DataFormatException.class)
	public void relationWithoutRoles() throws DataFormatException {
		Corpus.read(new StringReader("{\"input_sequence\": [{\"LF\": {\"relations\": [{\"pred\": \"left\"}]}}]}"));
	}

	@Test(expected = DataFormatException.class)
	public void malformed() throws DataFormatException {
		Corpus.read(new StringReader("{\"input_sequence\": ["));
	}
}
