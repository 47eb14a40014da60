package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import org.junit.Test;

public class MGParserTest {

	private static final ParseOptions PF_ONLY = new ParseOptions().setIncludeLF(false);

	@Test
	public void relativeClause() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions(), Fixtures.bounds(6, 6, 4));
		assertEquals(SolveStatus.SAT, r.getStatus());
		assertEquals(1, r.size());
		Derivation d = r.getFirst();
		assertEquals("John fears everyone who knows her", d.getYieldString());
		assertEquals(Fixtures.relclauseFacts(), d.getFacts());
		assertEquals(1, d.numMovements());
		assertEquals(0, d.numHeadMovements());
		assertEquals(2, d.numCovert());

		// the root is the unchecked category
		LexicalItem root = null;
		for (LexicalUsage u : d.getUsage())
			if (u.getSlot() == d.getRoot().getSlot())
				root = u.getItem();
		assertEquals("C", root.getId());

		// every feature but the root category is consumed exactly once
		int features = 0;
		for (LexicalUsage u : d.getUsage())
			features += u.getItem().numFeatures();
		assertEquals(features-1, 2*d.getChecks().size());
		Set<String> consumed = new HashSet<String>();
		for (FeatureCheck c : d.getChecks()) {
			assertTrue(consumed.add(c.getProbeSlot()+"."+c.getProbeIndex()));
			assertTrue(consumed.add(c.getGoalSlot()+"."+c.getGoalIndex()));
		}

		FeatureCheck move = null;
		for (FeatureCheck c : d.getChecks())
			if (c.getOperation() == FeatureCheck.Operation.MOVE)
				move = c;
		assertEquals("wh", move.getProbe().getName());
		assertEquals("who", d.getUsage().get(move.getGoalSlot()).getItem().getId());
		assertTrue(d.report().contains("knows(obj=her)"));
	}

	@Test
	public void noMovementAllowed() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions(), Fixtures.bounds(6, 0, 4));
		assertEquals(SolveStatus.UNSAT, r.getStatus());
		assertNull(r.getFirst());
		assertEquals(0, r.size());
	}

	@Test
	public void largerBoundsKeepDerivations() throws Exception {
		InterfaceCondition ic = Fixtures.relclauseCondition();
		BoundParameters tight = Fixtures.bounds(2, 1, 0);
		BoundParameters loose = Fixtures.bounds(4, 3, 2);
		assertTrue(loose.dominates(tight));
		assertTrue(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), tight).isSat());
		assertTrue(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), loose).isSat());
		// one covert item is not enough for both complementizers
		assertFalse(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), Fixtures.bounds(1, 1, 0)).isSat());
	}

	@Test
	public void withoutLocality() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions().setLocality(NoLocality.INSTANCE), Fixtures.bounds(2, 1, 0));
		assertTrue(r.isSat());
		assertEquals("John fears everyone who knows her", r.getFirst().getYieldString());
	}

	@Test
	public void shortestMoveRulesOutCompetingMovers() throws Exception {
		// both a and b wait on -wh when C's first +wh is checked
		InterfaceCondition ic = Fixtures.pfOnly("a", "b", "v");
		BoundParameters b = Fixtures.bounds(1, 2, 0);
		ParseResult free = MGParser.parse(Fixtures.twoMovers(), ic,
				new ParseOptions().setIncludeLF(false).setLocality(NoLocality.INSTANCE), b);
		assertEquals(SolveStatus.SAT, free.getStatus());
		assertEquals(2, free.getFirst().numMovements());
		assertEquals("a b v", free.getFirst().getYieldString());
		ParseResult smc = MGParser.parse(Fixtures.twoMovers(), ic,
				new ParseOptions().setIncludeLF(false).setLocality(ShortestMoveLocality.INSTANCE), b);
		assertEquals(SolveStatus.UNSAT, smc.getStatus());
		assertEquals(0, smc.size());
	}

	@Test
	public void timeoutIsNotFailure() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions().setTimeoutMillis(1), Fixtures.bounds(6, 6, 4));
		assertEquals(SolveStatus.TIMEOUT, r.getStatus());
		assertEquals(SolveStatus.TIMEOUT, r.getStoppedBy());
		assertFalse(r.isSat());
		assertNull(r.getFirst());
	}

	@Test
	public void timeoutStopsEnumeration() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions().setExtractAll(true).setTimeoutMillis(1), Fixtures.bounds(6, 6, 4));
		assertEquals(SolveStatus.TIMEOUT, r.getStoppedBy());
		// nothing found before the first call ran out
		assertEquals(SolveStatus.TIMEOUT, r.getStatus());
		assertEquals(0, r.size());
	}

	@Test
	public void sentenceTypeFixesRoot() throws Exception {
		String lf = "\"LF\": {\"relations\": [{\"pred\": \"left\", \"subj\": \"John\"}]}";
		BoundParameters b = Fixtures.bounds(1, 0, 0);
		ParseResult decl = MGParser.parse(Fixtures.sentenceTypes(),
				Fixtures.condition("{\"PF\": \"left John .\", "+lf+"}"), new ParseOptions(), b);
		assertTrue(decl.isSat());
		assertEquals("Cdecl", covertItem(decl.getFirst()));
		ParseResult quest = MGParser.parse(Fixtures.sentenceTypes(),
				Fixtures.condition("{\"PF\": \"left John ?\", "+lf+"}"), new ParseOptions(), b);
		assertTrue(quest.isSat());
		assertEquals("Cq", covertItem(quest.getFirst()));
		// a root named by the LF wins over the punctuation
		ParseResult named = MGParser.parse(Fixtures.sentenceTypes(),
				Fixtures.condition("{\"PF\": \"left John .\", \"LF\": {\"root\": \"C_question\", " +
						"\"relations\": [{\"pred\": \"left\", \"subj\": \"John\"}]}}"), new ParseOptions(), b);
		assertEquals("Cq", covertItem(named.getFirst()));
		// no item has the category a declarative is mapped to
		ParseResult remapped = MGParser.parse(Fixtures.sentenceTypes(),
				Fixtures.condition("{\"PF\": \"left John .\", "+lf+"}"),
				new ParseOptions().setSentenceRoot(SentenceType.DECLARATIVE, "T"), b);
		assertEquals(SolveStatus.UNSAT, remapped.getStatus());
	}

	@Test
	public void sentenceTypeNeedsLF() throws Exception {
		// a structural condition: off with the LF family
		ParseResult r = MGParser.parse(Fixtures.sentenceTypes(),
				Fixtures.condition("{\"PF\": \"left John ?\"}"), PF_ONLY, Fixtures.bounds(1, 0, 0));
		assertTrue(r.isSat());
	}

	private static String covertItem(Derivation d) {
		for (LexicalUsage u : d.getUsage())
			if (u.isCovert())
				return u.getItem().getId();
		return null;
	}

	@Test
	public void agreement() throws Exception {
		InterfaceCondition ic = agreeing("fears", "John");
		assertTrue(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), Fixtures.bounds(2, 1, 0)).isSat());
		// John is selected by fears, not by knows
		assertEquals(SolveStatus.UNSAT, MGParser.parse(Fixtures.relclause(), agreeing("knows", "John"),
				new ParseOptions(), Fixtures.bounds(2, 1, 0)).getStatus());
		assertEquals(SolveStatus.UNSAT, MGParser.parse(Fixtures.relclause(), agreeing("fears", "Mary"),
				new ParseOptions(), Fixtures.bounds(2, 1, 0)).getStatus());
	}

	private static InterfaceCondition agreeing(String pred, String subj) {
		return new InterfaceCondition(InterfaceCondition.tokenize("John fears everyone who knows her"),
				new LogicalForm(Fixtures.relclauseFacts(), "C", null, Collections.singleton(new Agreement(pred, subj))));
	}

	@Test
	public void wrongLogicalForm() throws Exception {
		Set<LFFact> facts = new LinkedHashSet<LFFact>();
		facts.add(new LFFact("fears", "subj", "everyone"));
		facts.add(new LFFact("fears", "obj", "John"));
		facts.add(new LFFact("knows", "subj", "who"));
		facts.add(new LFFact("knows", "obj", "her"));
		InterfaceCondition ic = new InterfaceCondition(
				InterfaceCondition.tokenize("John fears everyone who knows her"), new LogicalForm(facts));
		assertEquals(SolveStatus.UNSAT,
				MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), Fixtures.bounds(2, 1, 0)).getStatus());
	}

	@Test
	public void wrongCategory() throws Exception {
		InterfaceCondition ic = new InterfaceCondition(
				InterfaceCondition.tokenize("John fears everyone who knows her"),
				new LogicalForm(Fixtures.relclauseFacts(), "C", Collections.singletonMap("John", "V")));
		assertFalse(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), Fixtures.bounds(2, 1, 0)).isSat());
	}

	@Test
	public void wrongRoot() throws Exception {
		InterfaceCondition ic = new InterfaceCondition(
				InterfaceCondition.tokenize("John fears everyone who knows her"),
				new LogicalForm(Fixtures.relclauseFacts(), "T", null));
		assertFalse(MGParser.parse(Fixtures.relclause(), ic, new ParseOptions(), Fixtures.bounds(2, 1, 0)).isSat());
	}

	@Test
	public void pfOnly() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.relclause(), Fixtures.pfOnly("John", "fears", "her"),
				PF_ONLY, Fixtures.bounds(2, 0, 0));
		assertTrue(r.isSat());
		assertEquals("John fears her", r.getFirst().getYieldString());
	}

	@Test
	public void lfOnly() throws Exception {
		Set<LFFact> facts = new LinkedHashSet<LFFact>();
		facts.add(new LFFact("fears", "subj", "John"));
		facts.add(new LFFact("fears", "obj", "her"));
		InterfaceCondition ic = new InterfaceCondition(null, new LogicalForm(facts, "C", null));
		ParseResult r = MGParser.parse(Fixtures.relclause(), ic,
				new ParseOptions().setIncludePF(false), Fixtures.bounds(2, 0, 0));
		assertTrue(r.isSat());
		assertEquals("John fears her", r.getFirst().getYieldString());
		assertEquals(facts, r.getFirst().getFacts());
	}

	@Test
	public void headMovementOrder() throws Exception {
		BoundParameters b = Fixtures.bounds(1, 0, 1);
		assertTrue(MGParser.parse(Fixtures.headMovement(), Fixtures.pfOnly("left", "John"), PF_ONLY, b).isSat());
		assertEquals(SolveStatus.UNSAT,
				MGParser.parse(Fixtures.headMovement(), Fixtures.pfOnly("John", "left"), PF_ONLY, b).getStatus());
		// the trigger is there but head movement is not allowed
		assertFalse(MGParser.parse(Fixtures.headMovement(), Fixtures.pfOnly("left", "John"), PF_ONLY,
				Fixtures.bounds(1, 0, 0)).isSat());
	}

	@Test
	public void allDerivations() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.ambiguous(), Fixtures.pfOnly("left", "John"),
				new ParseOptions().setIncludeLF(false).setExtractAll(true), Fixtures.bounds(3, 0, 0));
		assertEquals(SolveStatus.SAT, r.getStatus());
		assertEquals(SolveStatus.UNSAT, r.getStoppedBy());
		assertEquals(2, r.size());
		assertFalse(r.getDerivations().get(0).canonicalKey().equals(r.getDerivations().get(1).canonicalKey()));
		Set<String> roots = new HashSet<String>();
		for (Derivation d : r.getDerivations()) {
			assertEquals("left John", d.getYieldString());
			for (LexicalUsage u : d.getUsage())
				if (u.isCovert())
					roots.add(u.getItem().getId());
		}
		assertEquals(2, roots.size());
	}

	@Test
	public void maxParses() throws Exception {
		ParseResult r = MGParser.parse(Fixtures.ambiguous(), Fixtures.pfOnly("left", "John"),
				new ParseOptions().setIncludeLF(false).setExtractAll(true).setMaxParses(1), Fixtures.bounds(3, 0, 0));
		assertEquals(1, r.size());
		assertEquals(SolveStatus.SAT, r.getStoppedBy());
	}

	@Test
	public void firstParseIsStable() throws Exception {
		InterfaceCondition ic = Fixtures.pfOnly("left", "John");
		ParseOptions o = new ParseOptions().setIncludeLF(false);
		Derivation a = MGParser.parse(Fixtures.ambiguous(), ic, o, Fixtures.bounds(3, 0, 0)).getFirst();
		Derivation b = MGParser.parse(Fixtures.ambiguous(), ic, o, Fixtures.bounds(3, 0, 0)).getFirst();
		assertEquals(a, b);
		assertEquals(a.canonicalKey(), b.canonicalKey());
	}

	@Test
	public void extraItems() throws Exception {
		// the only root of the lexicon is pronounced, and not in the sentence
		Lexicon bare = Fixtures.lexiconFromString(
				"{\"left\": {\"pf\": \"left\", \"features\": [\"=D\", \"~V\"]}, " +
				"\"John\": {\"pf\": \"John\", \"features\": [\"~D\"]}, " +
				"\"that\": {\"pf\": \"that\", \"features\": [\"=V\", \"C\"]}}");
		InterfaceCondition ic = Fixtures.pfOnly("left", "John");
		assertFalse(MGParser.parse(bare, ic, PF_ONLY, Fixtures.bounds(2, 0, 1)).isSat());
		LexicalItem hm = new LexicalItem("Cv", null,
				Arrays.asList(Lexicon.parseFeature("<=V"), Lexicon.parseFeature("C")), null);
		ParseResult r = MGParser.parse(bare, ic, Collections.singletonList(hm), PF_ONLY, Fixtures.bounds(2, 0, 1));
		assertTrue(r.isSat());
		assertEquals(1, r.getFirst().numHeadMovements());
		assertEquals("left John", r.getFirst().getYieldString());
	}

	@Test(expected = ConfigurationException.class)
	public void neitherFamily() throws Exception {
		MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(),
				new ParseOptions().setIncludePF(false).setIncludeLF(false), Fixtures.bounds(2, 1, 0));
	}

	@Test(expected = BoundExceededException.class)
	public void tooManySlots() throws Exception {
		MGParser.parse(Fixtures.relclause(), Fixtures.relclauseCondition(), new ParseOptions(),
				Fixtures.bounds(DerivationSchema.MAX_SLOTS, 1, 0));
	}

	@Test(expected = LexiconException.class)
	public void uncheckableExtra() throws Exception {
		LexicalItem top = new LexicalItem("Top", null,
				Arrays.asList(Lexicon.parseFeature("=V"), Lexicon.parseFeature("+q"), Lexicon.parseFeature("Top")), null);
		MGParser.parse(Fixtures.ambiguous(), Fixtures.pfOnly("left", "John"), Collections.singletonList(top),
				PF_ONLY, Fixtures.bounds(2, 0, 0));
	}

	@Test(expected = LexiconException.class)
	public void unknownWord() throws Exception {
		MGParser.parse(Fixtures.relclause(), Fixtures.pfOnly("Mary", "fears", "her"), PF_ONLY, Fixtures.bounds(2, 0, 0));
	}
}
