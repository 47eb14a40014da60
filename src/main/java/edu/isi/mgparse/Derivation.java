package edu.isi.mgparse;

import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An extracted derivation: the tree, every feature check that built it, the
 * lexical instances it uses and the LF facts it composes. Immutable and owned by
 * the caller; nothing refers back to the solver that produced it.
 */
public class Derivation {
	private final DerivationNode root;
	private final List<FeatureCheck> checks;
	private final List<LexicalUsage> usage;
	private final Set<LFFact> facts;
	private final List<String> yield;
	// moved constituents, numbered left to right
	private final TIntIntHashMap index;

	public Derivation(DerivationNode root, List<FeatureCheck> checks, List<LexicalUsage> usage, Set<LFFact> facts) {
		this.root = root;
		this.checks = Collections.unmodifiableList(new ArrayList<FeatureCheck>(checks));
		this.usage = Collections.unmodifiableList(new ArrayList<LexicalUsage>(usage));
		this.facts = Collections.unmodifiableSet(new LinkedHashSet<LFFact>(facts));
		List<String> y = new ArrayList<String>();
		root.yield(y);
		this.yield = Collections.unmodifiableList(y);
		index = numberMoved(root);
	}

	private static TIntIntHashMap numberMoved(DerivationNode root) {
		List<DerivationNode> nodes = new ArrayList<DerivationNode>();
		root.collect(nodes);
		TIntHashSet moved = new TIntHashSet();
		for (DerivationNode n : nodes) {
			if (n instanceof DerivationNode.Trace)
				moved.add(n.getSlot());
			else if (n instanceof DerivationNode.Lexical && ((DerivationNode.Lexical)n).isHeadMoved())
				moved.add(n.getSlot());
		}
		TIntIntHashMap ret = new TIntIntHashMap();
		for (DerivationNode n : nodes) {
			int slot = -1;
			if (n instanceof DerivationNode.Trace)
				slot = n.getSlot();
			else if (n instanceof DerivationNode.Lexical && ((DerivationNode.Lexical)n).isHeadMoved())
				slot = n.getSlot();
			else if (n instanceof DerivationNode.Move || n instanceof DerivationNode.Merge) {
				DerivationNode arg = ((DerivationNode.Operation)n).getArg();
				if (!(arg instanceof DerivationNode.Trace) && moved.contains(arg.getSlot()))
					slot = arg.getSlot();
			}
			if (slot >= 0 && !ret.containsKey(slot))
				ret.put(slot, ret.size()+1);
		}
		return ret;
	}

	public DerivationNode getRoot() { return root; }
	public List<FeatureCheck> getChecks() { return checks; }
	public List<LexicalUsage> getUsage() { return usage; }
	public Set<LFFact> getFacts() { return facts; }

	// pronounced forms in linear order
	public List<String> yield() { return yield; }

	public String getYieldString() {
		StringBuffer sb = new StringBuffer();
		for (String w : yield) {
			if (sb.length() > 0)
				sb.append(" ");
			sb.append(w);
		}
		return sb.toString();
	}

	public int numMovements() {
		int n = 0;
		for (FeatureCheck c : checks)
			if (c.getOperation() == FeatureCheck.Operation.MOVE)
				n++;
		return n;
	}
	public int numHeadMovements() {
		int n = 0;
		for (FeatureCheck c : checks)
			if (c.getOperation() == FeatureCheck.Operation.HEAD_MOVE)
				n++;
		return n;
	}
	public int numCovert() {
		int n = 0;
		for (LexicalUsage u : usage)
			if (u.isCovert())
				n++;
		return n;
	}

	// labelled bracketing; leaves are pf::features, traces t_k
	public String toBracketString() {
		StringBuffer sb = new StringBuffer();
		root.bracket(sb, index, false);
		return sb.toString();
	}

	// the same tree over item identifiers, with covert slot numbers left out:
	// two derivations are the same iff their keys are equal
	public String canonicalKey() {
		StringBuffer sb = new StringBuffer();
		root.bracket(sb, index, true);
		return sb.toString();
	}

	public boolean equals(Object o) {
		if (!(o instanceof Derivation))
			return false;
		return canonicalKey().equals(((Derivation)o).canonicalKey());
	}
	public int hashCode() { return canonicalKey().hashCode(); }

	// multi-line report: yield, tree, lexical instances, checks, facts
	public String report() {
		StringBuffer sb = new StringBuffer();
		sb.append("yield: "+getYieldString()+"\n");
		sb.append("tree: "+toBracketString()+"\n");
		sb.append("lexical items:\n");
		for (LexicalUsage u : usage)
			sb.append("\t"+u+"\n");
		sb.append("checks:\n");
		for (FeatureCheck c : checks)
			sb.append("\t"+c+"\n");
		if (!facts.isEmpty())
			sb.append("facts: "+facts+"\n");
		return sb.toString();
	}

	public String toString() { return toBracketString(); }
}
