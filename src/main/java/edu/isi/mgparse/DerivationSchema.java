package edu.isi.mgparse;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The finite search space of one parse, as a flat index-addressed table.
 *
 * Slots 0..n-1 are overt: slot i hosts an item for word i. Slots n..n+E-1 are
 * covert, E the bound on empty items; a covert slot holds a covert item or the
 * pseudo-item {@link #unused()}. Every slot owns K feature nodes, K the longest
 * feature sequence among the candidates, and node (i, j) has flat index i*K+j.
 * All sizes are fixed here, before any constraint is generated.
 */
public class DerivationSchema {

	// largest number of slots the engine will host
	public static final int MAX_SLOTS = 64;

	private final List<LexicalItem> items;
	private final List<String> words;
	private final boolean pfWords;
	private final BoundParameters bounds;
	private final int numOvert;
	private final int numSlots;
	private final int width;
	private final int[][] candidates;

	// feature names, 1-based so 0 can mean "no feature"
	private final TObjectIntHashMap<String> labels;
	private final List<String> labelNames;

	/**
	 * @param lex the relevant lexicon
	 * @param words overt words, one slot each
	 * @param pfWords true if words are PF tokens (matched on pf), false if they are
	 *        LF names (matched on denotation name)
	 */
	public DerivationSchema(Lexicon lex, List<String> words, boolean pfWords, BoundParameters bounds)
	throws BoundExceededException, LexiconException {
		boolean debug = false;
		this.items = lex.getItems();
		this.words = Collections.unmodifiableList(new ArrayList<String>(words));
		this.pfWords = pfWords;
		this.bounds = bounds;
		numOvert = words.size();
		numSlots = numOvert + bounds.getMaxNumEmptyLexicalItems();
		if (numSlots > MAX_SLOTS)
			throw new BoundExceededException(numOvert+" overt items and "+bounds.getMaxNumEmptyLexicalItems()+
					" empty items exceed the schema capacity of "+MAX_SLOTS+" slots");

		candidates = new int[numSlots][];
		int w = 1;
		for (int i = 0; i < numOvert; i++) {
			TIntArrayList cands = new TIntArrayList();
			for (int x = 0; x < items.size(); x++) {
				LexicalItem li = items.get(x);
				if (li.isCovert())
					continue;
				String key = pfWords ? li.getPf() : li.getSemanticName();
				if (words.get(i).equals(key))
					cands.add(x);
			}
			if (cands.isEmpty())
				throw new LexiconException("No lexical item for "+(pfWords ? "word " : "LF name ")+words.get(i));
			candidates[i] = cands.toArray();
		}
		TIntArrayList covert = new TIntArrayList();
		for (int x = 0; x < items.size(); x++)
			if (items.get(x).isCovert())
				covert.add(x);
		covert.add(unused());
		for (int i = numOvert; i < numSlots; i++)
			candidates[i] = covert.toArray();

		for (int i = 0; i < numSlots; i++)
			for (int x : candidates[i])
				if (x != unused())
					w = Math.max(w, items.get(x).numFeatures());
		width = w;

		labels = new TObjectIntHashMap<String>();
		labelNames = new ArrayList<String>();
		labelNames.add(null);
		for (LexicalItem li : items)
			for (Feature f : li.getFeatures())
				labelId(f.getName());
		if (debug) Debug.debug(debug, numSlots+" slots of width "+width+", "+labelNames.size()+" labels");
	}

	private int labelId(String name) {
		if (!labels.containsKey(name)) {
			labels.put(name, labelNames.size());
			labelNames.add(name);
		}
		return labels.get(name);
	}

	// SIZES AND INDEXING

	public int numOvert() { return numOvert; }
	public int numCovert() { return numSlots - numOvert; }
	public int numSlots() { return numSlots; }
	// feature nodes per slot
	public int width() { return width; }
	public int numNodes() { return numSlots*width; }
	public int node(int slot, int j) { return slot*width + j; }
	public int slotOf(int node) { return node / width; }
	public int positionOf(int node) { return node % width; }
	public boolean isOvert(int slot) { return slot < numOvert; }

	public BoundParameters getBounds() { return bounds; }
	public List<String> getWords() { return words; }
	public boolean hasPfWords() { return pfWords; }
	public String word(int slot) { return slot < numOvert ? words.get(slot) : null; }

	// ITEMS

	public List<LexicalItem> getItems() { return items; }
	public int numItems() { return items.size(); }
	// index of the "no item" value of covert slots
	public int unused() { return items.size(); }
	public LexicalItem item(int x) { return x == unused() ? null : items.get(x); }
	public int[] candidates(int slot) { return candidates[slot]; }

	// feature j of item x, or null past the end / for an unused slot
	public Feature featureAt(int x, int j) {
		if (x == unused())
			return null;
		LexicalItem li = items.get(x);
		return j < li.numFeatures() ? li.getFeature(j) : null;
	}

	// LABELS AND CODES

	public int numLabels() { return labelNames.size(); }
	// 0 if the name is no feature of the lexicon
	public int label(String name) { return labels.containsKey(name) ? labels.get(name) : 0; }
	public String labelName(int id) { return labelNames.get(id); }

	// type*numLabels + label; 0 for no feature
	public int code(Feature f) {
		if (f == null)
			return 0;
		return f.getPolarity().code()*numLabels() + label(f.getName());
	}
	public int code(Polarity p, int label) { return p.code()*numLabels() + label; }
	public int maxCode() { return (Polarity.CATEGORY.code()+1)*numLabels() - 1; }
	public int typeOf(int code) { return code / numLabels(); }
	public int labelOf(int code) { return code % numLabels(); }

	// codes node may carry, over all candidates of its slot
	public Set<Integer> possibleCodes(int node) {
		if (codeCache == null)
			codeCache = new ArrayList<Set<Integer>>();
		while (codeCache.size() <= node) {
			int v = codeCache.size();
			Set<Integer> s = new HashSet<Integer>();
			for (int x : candidates[slotOf(v)])
				s.add(code(featureAt(x, positionOf(v))));
			codeCache.add(Collections.unmodifiableSet(s));
		}
		return codeCache.get(node);
	}
	private List<Set<Integer>> codeCache = null;
	public boolean canBe(int node, Polarity p) {
		for (int c : possibleCodes(node))
			if (typeOf(c) == p.code())
				return true;
		return false;
	}
	public boolean canBeEmpty(int node) {
		return possibleCodes(node).contains(0);
	}

	/**
	 * Nodes node could be checked against: nodes of other slots carrying a
	 * complementary feature with the same name, plus node itself when it may
	 * carry no checkable feature. Sorted.
	 */
	public int[] possiblePartners(int node) {
		Set<Integer> mine = possibleCodes(node);
		TIntArrayList ret = new TIntArrayList();
		int slot = slotOf(node);
		for (int w = 0; w < numNodes(); w++) {
			if (w == node) {
				if (mine.contains(0) || canBe(node, Polarity.CATEGORY))
					ret.add(w);
				continue;
			}
			if (slotOf(w) == slot)
				continue;
			if (compatible(mine, possibleCodes(w)))
				ret.add(w);
		}
		return ret.toArray();
	}
	private boolean compatible(Set<Integer> a, Set<Integer> b) {
		for (int ca : a) {
			if (ca == 0)
				continue;
			Polarity pa = Polarity.values()[typeOf(ca)-1];
			if (pa.complement() == null)
				continue;
			if (b.contains(code(pa.complement(), labelOf(ca))))
				return true;
		}
		return false;
	}

	// true if some candidate of slot triggers head movement
	public boolean canReceiveHead(int slot) {
		for (int x : candidates[slot])
			if (x != unused() && items.get(x).triggersHeadMovement())
				return true;
		return false;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(numSlots+" slots ("+numOvert+" overt), "+width+" nodes each, bounds "+bounds+"\n");
		for (int i = 0; i < numSlots; i++) {
			sb.append(i+"\t"+(isOvert(i) ? words.get(i) : LexicalItem.EPSILON)+"\t");
			for (int x : candidates[i])
				sb.append(x == unused() ? "- " : items.get(x).getId()+" ");
			sb.append("\n");
		}
		return sb.toString();
	}
}
