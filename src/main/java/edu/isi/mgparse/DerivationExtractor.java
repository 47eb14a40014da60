package edu.isi.mgparse;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a satisfying {@link Assignment} into a {@link Derivation}. Everything the
 * constraints promise is checked again on the way; a violation means the
 * encoding is wrong and raises {@link InconsistentModelException}.
 */
public class DerivationExtractor {
	private final DerivationSchema schema;
	private final InterfaceCondition ic;
	private final ParseOptions options;

	public DerivationExtractor(DerivationSchema schema, InterfaceCondition ic, ParseOptions options) {
		this.schema = schema;
		this.ic = ic;
		this.options = options;
	}

	public Derivation extract(Assignment a) {
		return new Walk(a).run();
	}

	// state of one extraction
	private class Walk {
		private final Assignment a;
		private final int N;
		private final LexicalItem[] items;
		private final DerivationNode[] built;
		private final boolean[] visiting;
		private final boolean[] placed;
		private final int[] movedTo;
		private final List<FeatureCheck> checks = new ArrayList<FeatureCheck>();

		Walk(Assignment a) {
			this.a = a;
			N = schema.numSlots();
			items = new LexicalItem[N];
			built = new DerivationNode[N];
			visiting = new boolean[N];
			placed = new boolean[N];
			movedTo = new int[N];
			Arrays.fill(movedTo, -1);
		}

		Derivation run() {
			boolean debug = false;
			if (a.numSlots() != N || a.numNodes() != schema.numNodes())
				throw new InconsistentModelException("Model of "+a.numSlots()+" slots does not fit a schema of "+N);
			for (int i = 0; i < N; i++) {
				int x = a.getItem(i);
				boolean ok = false;
				for (int c : schema.candidates(i))
					ok |= c == x;
				if (!ok)
					throw new InconsistentModelException("Slot "+i+" holds item "+x+", which is not a candidate");
				items[i] = schema.item(x);
			}
			checkPartners();
			checkTimes();
			findHeadMovement();

			int root = -1;
			for (int i = 0; i < N; i++) {
				if (items[i] == null || !items[i].isRootCapable())
					continue;
				if (root >= 0)
					throw new InconsistentModelException("Two roots: slots "+root+" and "+i);
				root = i;
			}
			if (root < 0)
				throw new InconsistentModelException("No root");
			placed[root] = true;
			DerivationNode tree = build(root);

			List<LexicalUsage> usage = new ArrayList<LexicalUsage>();
			for (int i = 0; i < N; i++) {
				if (items[i] == null)
					continue;
				if (!placed[i])
					throw new InconsistentModelException("Slot "+i+" ("+items[i]+") is not part of the tree");
				usage.add(new LexicalUsage(i, items[i]));
			}
			if (numMoves() > schema.getBounds().getMaxNumMovements())
				throw new InconsistentModelException(numMoves()+" movements exceed the bound");

			Set<LFFact> facts = compose();
			Derivation d = new Derivation(tree, checks, usage, facts);
			if (options.includePF() && ic.hasPf() && !d.yield().equals(ic.getPf()))
				throw new InconsistentModelException("Yield "+d.yield()+" differs from PF target "+ic.getPf());
			if (options.includeLF() && ic.hasLf())
				checkLF(d, root);
			if (debug) Debug.debug(debug, d.report());
			return d;
		}

		// involution over complementary features of equal name in different slots
		private void checkPartners() {
			for (int v = 0; v < schema.numNodes(); v++) {
				Feature fv = feature(v);
				int p = a.getPartner(v);
				if (p < 0 || p >= schema.numNodes() || a.getPartner(p) != v)
					throw new InconsistentModelException("Partner of node "+v+" is not an involution");
				if (fv == null || fv.getPolarity() == Polarity.CATEGORY) {
					if (p != v)
						throw new InconsistentModelException("Unchecked node "+v+" has partner "+p);
					continue;
				}
				if (p == v)
					throw new InconsistentModelException("Feature "+fv+" of slot "+schema.slotOf(v)+" is never checked");
				Feature fp = feature(p);
				if (fp == null || !fv.checks(fp))
					throw new InconsistentModelException(fv+" at node "+v+" paired with "+fp+" at node "+p);
				if (schema.slotOf(p) == schema.slotOf(v))
					throw new InconsistentModelException("Slot "+schema.slotOf(v)+" checks its own feature "+fv);
			}
		}

		// features checked in order; partners checked together
		private void checkTimes() {
			for (int i = 0; i < N; i++) {
				if (items[i] == null)
					continue;
				int last = 0;
				for (int j = 0; j < items[i].numFeatures(); j++) {
					int v = schema.node(i, j);
					if (feature(v).getPolarity() == Polarity.CATEGORY)
						continue;
					int t = a.getTime(v);
					if (t <= last)
						throw new InconsistentModelException("Feature "+j+" of slot "+i+" checked at "+t+", not after "+last);
					if (a.getTime(a.getPartner(v)) != t)
						throw new InconsistentModelException("Node "+v+" and its partner are checked at different times");
					last = t;
				}
			}
		}

		private void findHeadMovement() {
			int n = 0;
			for (int i = 0; i < N; i++) {
				if (items[i] == null || !items[i].triggersHeadMovement())
					continue;
				int c = schema.slotOf(a.getPartner(schema.node(i, 0)));
				movedTo[c] = i;
				n++;
			}
			if (n > schema.getBounds().getMaxNumHeadMovements())
				throw new InconsistentModelException(n+" head movements exceed the bound");
			for (int c = 0; c < N; c++) {
				if (movedTo[c] < 0)
					continue;
				if (items[c].triggersHeadMovement())
					throw new InconsistentModelException("Head of slot "+c+" moves after receiving a head");
				if (items[c].numLicensees() > 0)
					throw new InconsistentModelException("Head of slot "+c+" moves but its phrase has licensees");
			}
		}

		private Feature feature(int v) {
			LexicalItem li = items[schema.slotOf(v)];
			int j = schema.positionOf(v);
			if (li == null || j >= li.numFeatures())
				return null;
			return li.getFeature(j);
		}

		// the maximal projection of slot h
		private DerivationNode build(int h) {
			if (built[h] != null)
				return built[h];
			if (visiting[h])
				throw new InconsistentModelException("Slot "+h+" contains itself");
			visiting[h] = true;
			LexicalItem li = items[h];
			LexicalItem incoming = null;
			int from = -1;
			if (li.triggersHeadMovement()) {
				from = schema.slotOf(a.getPartner(schema.node(h, 0)));
				incoming = items[from];
			}
			DerivationNode cur = new DerivationNode.Lexical(h, li, movedTo[h], incoming, from);
			TIntArrayList inside = new TIntArrayList();
			for (int b = 0; b < li.getGoalIndex(); b++) {
				int v = schema.node(h, b);
				int p = a.getPartner(v);
				int c = schema.slotOf(p);
				int l = schema.positionOf(p);
				Feature probe = li.getFeature(b);
				FeatureCheck.Operation op;
				if (probe.getPolarity() == Polarity.LICENSOR) {
					op = FeatureCheck.Operation.MOVE;
					if (!inside.contains(c))
						throw new InconsistentModelException("Slot "+h+" attracts slot "+c+", which is not inside its projection");
				}
				else
					op = b == 0 && probe.isHeadMovement() ? FeatureCheck.Operation.HEAD_MOVE : FeatureCheck.Operation.MERGE;
				FeatureCheck check = new FeatureCheck(op, h, b, probe, c, l, items[c].getFeature(l), a.getTime(v));
				checks.add(check);
				DerivationNode arg = land(c, l);
				if (op == FeatureCheck.Operation.MOVE)
					cur = new DerivationNode.Move(cur, arg, check);
				else {
					if (op == FeatureCheck.Operation.HEAD_MOVE)
						cur = new DerivationNode.HeadMove(cur, arg, check);
					else
						cur = new DerivationNode.Merge(cur, arg, check);
					inside.add(c);
					inside.addAll(contents(c));
				}
			}
			visiting[h] = false;
			built[h] = cur;
			return cur;
		}

		// what a goal of slot c at position l leaves: the whole phrase at its last goal, else a trace
		private DerivationNode land(int c, int l) {
			if (l < items[c].numFeatures()-1)
				return new DerivationNode.Trace(c);
			if (placed[c])
				throw new InconsistentModelException("Slot "+c+" lands twice");
			placed[c] = true;
			return build(c);
		}

		// slots inside the full projection of c
		private TIntArrayList contents(int c) {
			TIntArrayList ret = new TIntArrayList();
			LexicalItem li = items[c];
			for (int b = 0; b < li.getGoalIndex(); b++) {
				if (li.getFeature(b).getPolarity() != Polarity.SELECTOR)
					continue;
				int k = schema.slotOf(a.getPartner(schema.node(c, b)));
				if (k == c || ret.contains(k))
					throw new InconsistentModelException("Slot "+c+" contains itself or slot "+k+" twice");
				ret.add(k);
				ret.addAll(contents(k));
			}
			return ret;
		}

		private int numMoves() {
			int n = 0;
			for (FeatureCheck c : checks)
				if (c.getOperation() == FeatureCheck.Operation.MOVE)
					n++;
			return n;
		}

		// LF

		private String[] events;
		private String[] referents;

		private int complement(int h) {
			LexicalItem li = items[h];
			if (li.getFeature(0).getPolarity() != Polarity.SELECTOR)
				return -1;
			return schema.slotOf(a.getPartner(schema.node(h, 0)));
		}

		private void denote(int h) {
			if (events[h] != null || referents[h] != null || visiting[h])
				return;
			visiting[h] = true;
			Denotation d = items[h].getDenotation();
			int c = complement(h);
			if (c >= 0)
				denote(c);
			String evC = c >= 0 ? events[c] : null;
			String refC = c >= 0 ? referents[c] : null;
			switch (d.getKind()) {
			case ENTITY: referents[h] = d.getName(); break;
			case PREDICATE: events[h] = d.getName(); break;
			case ROLE: events[h] = evC; break;
			default: events[h] = evC; referents[h] = refC; break;
			}
			visiting[h] = false;
		}

		// facts from every role-bearing selector whose event and argument are known
		private Set<LFFact> compose() {
			events = new String[N];
			referents = new String[N];
			Arrays.fill(visiting, false);
			for (int h = 0; h < N; h++)
				if (items[h] != null)
					denote(h);
			Set<LFFact> ret = new TreeSet<LFFact>();
			for (FeatureCheck c : checks) {
				if (c.getProbe().getPolarity() != Polarity.SELECTOR)
					continue;
				String role = items[c.getProbeSlot()].getDenotation().getRole(c.getProbeIndex());
				if (role == null)
					continue;
				String ev = events[c.getProbeSlot()];
				String arg = referents[c.getGoalSlot()];
				if (ev == null || arg == null) {
					if (options.includeLF())
						throw new InconsistentModelException("Role "+role+" of slot "+c.getProbeSlot()+" has no "+
								(ev == null ? "event" : "argument"));
					continue;
				}
				ret.add(new LFFact(ev, role, arg));
			}
			return ret;
		}

		private void checkLF(Derivation d, int root) {
			LogicalForm lf = ic.getLf();
			if (!new LinkedHashSet<LFFact>(lf.getFacts()).equals(d.getFacts()))
				throw new InconsistentModelException("Composed facts "+d.getFacts()+" differ from LF target "+lf.getFacts());
			String want = lf.getRoot();
			if (want == null && ic.getSentenceType() != null)
				want = options.getSentenceRoot(ic.getSentenceType());
			if (want != null && !want.equals(items[root].getCategory()))
				throw new InconsistentModelException("Root category "+items[root].getCategory()+" is not "+want);
			for (Agreement ag : lf.getAgreements()) {
				boolean found = false;
				for (FeatureCheck c : d.getChecks()) {
					if (c.getProbeSlot() < schema.numOvert() && c.getGoalSlot() < schema.numOvert() &&
							ag.getPred().equals(schema.word(c.getProbeSlot())) &&
							ag.getSubj().equals(schema.word(c.getGoalSlot())))
						found = true;
				}
				if (!found)
					throw new InconsistentModelException("No check realizes "+ag);
			}
			for (int i = 0; i < schema.numOvert(); i++) {
				String cat = lf.getCategories().get(schema.word(i));
				if (cat != null && !cat.equals(items[i].getCategory()))
					throw new InconsistentModelException("Word "+schema.word(i)+" has category "+
							items[i].getCategory()+", not "+cat);
			}
		}
	}
}
