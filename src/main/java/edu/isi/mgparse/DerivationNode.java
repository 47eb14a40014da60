package edu.isi.mgparse;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of an extracted derivation tree: a lexical leaf, a trace, or one of the
 * three structure building operations. Children are kept in linear order.
 * Traces and moved heads are printed with an index shared by the moved
 * constituent's landing site.
 */
public abstract class DerivationNode {

	// slot whose projection this is
	public abstract int getSlot();

	// constituents in linear order
	public abstract List<DerivationNode> getChildren();

	// append pronounced forms, left to right
	public abstract void yield(List<String> out);

	abstract void bracket(StringBuffer sb, TIntIntHashMap index, boolean key);

	// pre-order over the tree, left to right
	void collect(List<DerivationNode> out) {
		out.add(this);
		for (DerivationNode c : getChildren())
			c.collect(out);
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		bracket(sb, new TIntIntHashMap(), false);
		return sb.toString();
	}

	// the lexical item of a slot. may have lost its head to, or received one from, another head
	public static class Lexical extends DerivationNode {
		private final int slot;
		private final LexicalItem item;
		private final int movedTo;
		private final LexicalItem incoming;
		private final int incomingSlot;

		// movedTo: receiving slot or -1. incoming: the head that moved here from incomingSlot, or null
		public Lexical(int slot, LexicalItem item, int movedTo, LexicalItem incoming, int incomingSlot) {
			this.slot = slot;
			this.item = item;
			this.movedTo = movedTo;
			this.incoming = incoming;
			this.incomingSlot = incomingSlot;
		}
		public int getSlot() { return slot; }
		public LexicalItem getItem() { return item; }
		public boolean isHeadMoved() { return movedTo >= 0; }
		public int getMovedTo() { return movedTo; }
		public LexicalItem getIncoming() { return incoming; }
		public int getIncomingSlot() { return incomingSlot; }
		public List<DerivationNode> getChildren() { return Collections.emptyList(); }

		public void yield(List<String> out) {
			if (movedTo >= 0)
				return;
			if (incoming != null && !incoming.isCovert())
				out.add(incoming.getPf());
			if (!item.isCovert())
				out.add(item.getPf());
		}

		void bracket(StringBuffer sb, TIntIntHashMap index, boolean key) {
			if (key) {
				sb.append(item.getId());
				if (!item.isCovert())
					sb.append("@"+slot);
				if (movedTo >= 0)
					sb.append("_"+index.get(slot));
				return;
			}
			if (movedTo >= 0) {
				sb.append("t_"+index.get(slot)+item.toString().substring(item.getPfString().length()));
				return;
			}
			if (incoming != null)
				sb.append(incoming.getPfString()+"_"+index.get(incomingSlot)+"-");
			sb.append(item.toString());
		}
	}

	// a moved constituent's original position
	public static class Trace extends DerivationNode {
		private final int slot;
		public Trace(int slot) { this.slot = slot; }
		public int getSlot() { return slot; }
		public List<DerivationNode> getChildren() { return Collections.emptyList(); }
		public void yield(List<String> out) { }
		void bracket(StringBuffer sb, TIntIntHashMap index, boolean key) {
			sb.append("t_"+index.get(slot));
		}
	}

	// common shape of the binary operations: a head projection and the phrase its feature took
	public static abstract class Operation extends DerivationNode {
		protected final DerivationNode head;
		protected final DerivationNode arg;
		protected final FeatureCheck check;

		protected Operation(DerivationNode head, DerivationNode arg, FeatureCheck check) {
			this.head = head;
			this.arg = arg;
			this.check = check;
		}
		public int getSlot() { return head.getSlot(); }
		public DerivationNode getHead() { return head; }
		public DerivationNode getArg() { return arg; }
		public FeatureCheck getCheck() { return check; }
		// true if the argument follows the head
		public abstract boolean argFollows();
		protected abstract String label();

		public List<DerivationNode> getChildren() {
			List<DerivationNode> ret = new ArrayList<DerivationNode>();
			if (argFollows()) {
				ret.add(head);
				ret.add(arg);
			}
			else {
				ret.add(arg);
				ret.add(head);
			}
			return ret;
		}

		public void yield(List<String> out) {
			for (DerivationNode c : getChildren())
				c.yield(out);
		}

		void bracket(StringBuffer sb, TIntIntHashMap index, boolean key) {
			sb.append("["+label()+":"+check.getProbe().getName());
			for (DerivationNode c : getChildren()) {
				sb.append(" ");
				c.bracket(sb, index, key);
				if (c == arg && !(arg instanceof Trace) && !(this instanceof HeadMove) && index.containsKey(arg.getSlot()))
					sb.append("_"+index.get(arg.getSlot()));
			}
			sb.append("]");
		}
	}

	// first selector: complement to the right. later selectors: specifier to the left
	public static class Merge extends Operation {
		public Merge(DerivationNode head, DerivationNode arg, FeatureCheck check) {
			super(head, arg, check);
		}
		public boolean argFollows() { return check.getProbeIndex() == 0; }
		protected String label() { return "merge"; }
	}

	// merge of a complement whose head moves into this head
	public static class HeadMove extends Operation {
		public HeadMove(DerivationNode head, DerivationNode arg, FeatureCheck check) {
			super(head, arg, check);
		}
		public boolean argFollows() { return true; }
		protected String label() { return "hmove"; }
	}

	// a licensee-bearing phrase from inside the projection lands to the left
	public static class Move extends Operation {
		public Move(DerivationNode head, DerivationNode arg, FeatureCheck check) {
			super(head, arg, check);
		}
		public boolean argFollows() { return false; }
		protected String label() { return "move"; }
	}
}
