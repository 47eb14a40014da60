package edu.isi.mgparse;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class DerivationSchemaTest {

	private DerivationSchema hm(int empty) throws Exception {
		Lexicon lex = Fixtures.headMovement();
		return new DerivationSchema(lex.relevantTo(Arrays.asList("left", "John"), null),
				Arrays.asList("left", "John"), true, Fixtures.bounds(empty, 0, 1));
	}

	@Test
	public void layout() throws Exception {
		DerivationSchema s = hm(2);
		assertEquals(2, s.numOvert());
		assertEquals(2, s.numCovert());
		assertEquals(4, s.numSlots());
		assertEquals(2, s.width());
		assertEquals(8, s.numNodes());
		assertEquals(5, s.node(2, 1));
		assertEquals(2, s.slotOf(5));
		assertEquals(1, s.positionOf(5));
		assertTrue(s.isOvert(1));
		assertFalse(s.isOvert(2));
		assertEquals("John", s.word(1));
		assertNull(s.word(2));
	}

	@Test
	public void candidates() throws Exception {
		DerivationSchema s = hm(2);
		assertEquals(3, s.unused());
		assertNull(s.item(s.unused()));
		assertEquals(1, s.candidates(0).length);
		assertEquals("left", s.item(s.candidates(0)[0]).getId());
		// covert slots: the covert C or nothing
		assertEquals(2, s.candidates(3).length);
		assertEquals(s.unused(), s.candidates(3)[1]);
		assertNull(s.featureAt(s.unused(), 0));
		// John has a single feature
		assertNull(s.featureAt(s.candidates(1)[0], 1));
		assertTrue(s.canReceiveHead(2));
		assertFalse(s.canReceiveHead(0));
	}

	@Test
	public void codes() throws Exception {
		DerivationSchema s = hm(1);
		Feature d = new Feature("D", Polarity.SELECTEE);
		int c = s.code(d);
		assertEquals(Polarity.SELECTEE.code(), s.typeOf(c));
		assertEquals(s.label("D"), s.labelOf(c));
		assertEquals("D", s.labelName(s.label("D")));
		assertEquals(0, s.label("wh"));
		assertEquals(0, s.code(null));
		assertTrue(s.canBe(s.node(2, 1), Polarity.CATEGORY));
		assertTrue(s.canBeEmpty(s.node(2, 1)));
		assertFalse(s.canBeEmpty(s.node(0, 1)));
	}

	@Test
	public void partners() throws Exception {
		DerivationSchema s = hm(1);
		// =D of left can only take John's ~D
		assertEquals(1, s.possiblePartners(s.node(0, 0)).length);
		assertEquals(s.node(1, 0), s.possiblePartners(s.node(0, 0))[0]);
		// ~V of left: the covert selector, never itself
		int[] pv = s.possiblePartners(s.node(0, 1));
		assertEquals(1, pv.length);
		assertEquals(s.node(2, 0), pv[0]);
		// a node that may be empty may be its own partner
		int[] pe = s.possiblePartners(s.node(1, 1));
		assertEquals(s.node(1, 1), pe[0]);
	}

	@Test(expected = BoundExceededException.class)
	public void capacity() throws Exception {
		hm(DerivationSchema.MAX_SLOTS - 1);
	}

	@Test(expected = LexiconException.class)
	public void unknownWord() throws Exception {
		Lexicon lex = Fixtures.headMovement();
		new DerivationSchema(lex, Arrays.asList("Mary", "left"), true, Fixtures.bounds(1, 0, 0));
	}

	@Test
	public void lfNames() throws Exception {
		Lexicon lex = Fixtures.relclause();
		DerivationSchema s = new DerivationSchema(lex.relevantTo(null, null),
				Arrays.asList("fears", "John", "her"), false, Fixtures.bounds(2, 0, 0));
		assertFalse(s.hasPfWords());
		assertEquals("fears", s.item(s.candidates(0)[0]).getId());
		assertEquals("her", s.item(s.candidates(2)[0]).getId());
	}
}
