package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.junit.Test;

public class LexicalItemTest {

	private static List<Feature> feats(String... fs) throws LexiconException {
		List<Feature> ret = new ArrayList<Feature>();
		for (String f : fs)
			ret.add(Lexicon.parseFeature(f));
		return ret;
	}

	private static LexicalItem item(String pf, String... fs) throws LexiconException {
		return new LexicalItem("x", pf, feats(fs), null);
	}

	@Test
	public void shapes() throws LexiconException {
		LexicalItem crel = item(null, "=V", "+wh", "~Crel");
		assertTrue(crel.isCovert());
		assertEquals(2, crel.getGoalIndex());
		assertEquals("Crel", crel.getCategory());
		assertFalse(crel.isRootCapable());
		assertEquals(0, crel.numLicensees());

		LexicalItem who = item("who", "~D", "-wh");
		assertEquals(0, who.getGoalIndex());
		assertEquals(1, who.numLicensees());

		LexicalItem c = item("", "<=V", "C");
		assertTrue(c.isCovert());
		assertTrue(c.isRootCapable());
		assertTrue(c.triggersHeadMovement());
		assertEquals("ε::<=V C", c.toString());
	}

	@Test(expected = LexiconException.class)
	public void licenseeBeforeSelectee() throws LexiconException {
		item("who", "-wh", "~D");
	}

	@Test(expected = LexiconException.class)
	public void probeAfterSelectee() throws LexiconException {
		item("a", "~D", "=N");
	}

	@Test(expected = LexiconException.class)
	public void noGoal() throws LexiconException {
		item("a", "=N", "+k");
	}

	@Test(expected = LexiconException.class)
	public void leadingLicensor() throws LexiconException {
		item("a", "+k", "~D");
	}

	@Test(expected = LexiconException.class)
	public void lateHeadMovement() throws LexiconException {
		item("a", "=D", "<=V", "~T");
	}

	@Test(expected = LexiconException.class)
	public void categoryNotLast() throws LexiconException {
		item("a", "C", "-k");
	}

	@Test(expected = LexiconException.class)
	public void roleOnNonSelector() throws LexiconException {
		TreeMap<Integer, String> roles = new TreeMap<Integer, String>();
		roles.put(1, "agent");
		new LexicalItem("x", "v", feats("=D", "~V"), new Denotation(Denotation.Kind.PREDICATE, "v", roles));
	}

	@Test
	public void semanticName() throws LexiconException {
		TreeMap<Integer, String> roles = new TreeMap<Integer, String>();
		roles.put(0, "obj");
		LexicalItem fears = new LexicalItem("fears1", "fears", feats("=D", "~V"),
				new Denotation(Denotation.Kind.PREDICATE, "fear", roles));
		assertEquals("fear", fears.getSemanticName());
		assertEquals("obj", fears.getDenotation().getRole(0));
		assertNull(fears.getDenotation().getRole(1));
		assertEquals("her", item("her", "~D").getSemanticName());
	}
}
