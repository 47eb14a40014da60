package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class DerivationExtractorTest {

	private static final ParseOptions PF_ONLY = new ParseOptions().setIncludeLF(false);

	private Formula formula;
	private Assignment model;

	private Derivation headMovement() throws Exception {
		InterfaceCondition ic = Fixtures.pfOnly("left", "John");
		formula = Fixtures.formula(Fixtures.headMovement(), ic, PF_ONLY, Fixtures.bounds(1, 0, 1));
		SolverSession s = new SolverSession(formula, 0);
		model = s.solveOne().getAssignment();
		s.close();
		return new DerivationExtractor(formula.getSchema(), ic, PF_ONLY).extract(model);
	}

	@Test
	public void headMovementTree() throws Exception {
		Derivation d = headMovement();
		assertEquals("left John", d.getYieldString());
		assertEquals(1, d.numHeadMovements());
		assertEquals(0, d.numMovements());
		assertEquals(1, d.numCovert());
		assertEquals(2, d.getChecks().size());

		DerivationNode root = d.getRoot();
		assertTrue(root instanceof DerivationNode.HeadMove);
		DerivationNode.Lexical c = (DerivationNode.Lexical)((DerivationNode.HeadMove)root).getHead();
		assertEquals("C", c.getItem().getId());
		assertEquals("left", c.getIncoming().getId());
		assertEquals(0, c.getIncomingSlot());

		List<DerivationNode> nodes = new java.util.ArrayList<DerivationNode>();
		root.collect(nodes);
		boolean movedHead = false;
		for (DerivationNode n : nodes)
			if (n instanceof DerivationNode.Lexical && ((DerivationNode.Lexical)n).isHeadMoved())
				movedHead = ((DerivationNode.Lexical)n).getMovedTo() == c.getSlot();
		assertTrue(movedHead);
		assertEquals("[hmove:V left_1-ε::<=V C [merge:D t_1::=D ~V John::~D]]", d.toBracketString());
	}

	@Test
	public void checksNameTheirOperation() throws Exception {
		Derivation d = headMovement();
		int merges = 0;
		for (FeatureCheck c : d.getChecks()) {
			assertTrue(c.getProbe().checks(c.getGoal()));
			assertTrue(c.getTime() > 0);
			if (c.getOperation() == FeatureCheck.Operation.MERGE)
				merges++;
		}
		assertEquals(1, merges);
	}

	// a model whose partner function is broken must not become a derivation
	@Test(expected = InconsistentModelException.class)
	public void brokenPartners() throws Exception {
		headMovement();
		int[] items = new int[model.numSlots()];
		int[] partners = new int[model.numNodes()];
		int[] times = new int[model.numNodes()];
		for (int i = 0; i < items.length; i++)
			items[i] = model.getItem(i);
		for (int v = 0; v < partners.length; v++) {
			partners[v] = v;
			times[v] = model.getTime(v);
		}
		new DerivationExtractor(formula.getSchema(), Fixtures.pfOnly("left", "John"), PF_ONLY)
			.extract(new Assignment(items, partners, times));
	}

	@Test(expected = InconsistentModelException.class)
	public void wrongSize() throws Exception {
		headMovement();
		new DerivationExtractor(formula.getSchema(), Fixtures.pfOnly("left", "John"), PF_ONLY)
			.extract(new Assignment(new int[1], new int[1], new int[1]));
	}
}
