package edu.isi.mgparse;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.constraints.extension.Tuples;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * Translates a {@link DerivationSchema} and an {@link InterfaceCondition} into a
 * constraint problem. Families:
 * <ul>
 * <li>structure: lexical choice per slot, feature codes per node, checking
 *     partners (an involution pairing complementary features of equal name),
 *     derivation times (strictly increasing along a slot, shared by partners),
 *     a single root, the movement and head movement bounds;</li>
 * <li>containment: which slots sit inside a head's projection after each of its
 *     features, from which movement is restricted to contained slots;</li>
 * <li>locality: whatever the {@link LocalityPolicy} of the options posts;</li>
 * <li>PF (toggle): spans over string positions for heads, projections and landing sites;</li>
 * <li>LF (toggle): events and referents per slot, the facts produced by role-bearing selectors,
 *     the root category (from the LF or the sentence type), word categories and agreement.</li>
 * </ul>
 * Assembly is pure: each call builds a fresh {@link Formula}.
 */
public class ConstraintAssembler {

	private final ParseOptions options;

	public ConstraintAssembler(ParseOptions options) {
		this.options = options;
	}

	public Formula assemble(DerivationSchema schema, InterfaceCondition ic) throws ConfigurationException {
		boolean debug = false;
		options.validate(ic);
		if (options.includePF() && !schema.hasPfWords())
			throw new ConfigurationException("PF constraints need a schema built over PF tokens");
		Date start = new Date();
		Formula f = new Formula(schema, ic, options);
		structure(f);
		containment(f);
		movement(f);
		headMovement(f);
		options.getLocality().impose(f);
		if (options.includePF())
			phonology(f);
		if (options.includeLF())
			semantics(f);
		Debug.dbtime(2, start, "assembled "+f);
		if (debug) Debug.debug(debug, f.toString());
		return f;
	}

	// STRUCTURE

	private void structure(Formula f) {
		boolean debug = false;
		DerivationSchema s = f.schema;
		Model m = f.model;
		int N = s.numSlots();
		int K = s.width();
		int V = s.numNodes();
		int I = s.numItems();

		f.item = new IntVar[N];
		f.used = new BoolVar[N];
		for (int i = 0; i < N; i++) {
			int[] cands = s.candidates(i);
			f.item[i] = cands.length == 1 ? m.intVar(cands[0]) : m.intVar("item_"+i, cands);
			if (s.isOvert(i))
				f.used[i] = f.TRUE;
			else if (cands.length == 1)
				f.used[i] = f.FALSE;
			else
				f.used[i] = m.arithm(f.item[i], "!=", s.unused()).reify();
		}

		// feature code and polarity of position j for every item; the unused item has none
		int[][] codeTab = new int[K][I+1];
		int[][] typeTab = new int[K][I+1];
		for (int j = 0; j < K; j++) {
			for (int x = 0; x < I; x++) {
				Feature ft = s.featureAt(x, j);
				codeTab[j][x] = s.code(ft);
				typeTab[j][x] = ft == null ? Polarity.NONE : ft.getPolarity().code();
			}
		}

		f.code = new IntVar[V];
		f.type = new IntVar[V];
		f.partner = new IntVar[V];
		f.time = new IntVar[V];
		f.active = new BoolVar[V];
		f.isSelector = new BoolVar[V];
		f.isSelectee = new BoolVar[V];
		f.isLicensor = new BoolVar[V];
		f.isLicensee = new BoolVar[V];
		f.isCategory = new BoolVar[V];
		f.partnerSlot = new IntVar[V];
		// no check chain is longer than the number of checks
		int horizon = V/2 + 1;
		for (int v = 0; v < V; v++) {
			int i = s.slotOf(v);
			int j = s.positionOf(v);
			int[] codes = sorted(s.possibleCodes(v));
			TIntHashSet typeset = new TIntHashSet();
			for (int c : codes)
				typeset.add(s.typeOf(c));
			int[] types = typeset.toArray();
			Arrays.sort(types);
			if (codes.length == 1) {
				f.code[v] = m.intVar(codes[0]);
			}
			else {
				f.code[v] = m.intVar("code_"+i+"_"+j, codes);
				m.element(f.code[v], codeTab[j], f.item[i]).post();
			}
			if (types.length == 1) {
				f.type[v] = m.intVar(types[0]);
			}
			else {
				f.type[v] = m.intVar("type_"+i+"_"+j, types);
				m.element(f.type[v], typeTab[j], f.item[i]).post();
			}
			f.isSelector[v] = is(f, v, Polarity.SELECTOR);
			f.isSelectee[v] = is(f, v, Polarity.SELECTEE);
			f.isLicensor[v] = is(f, v, Polarity.LICENSOR);
			f.isLicensee[v] = is(f, v, Polarity.LICENSEE);
			f.isCategory[v] = is(f, v, Polarity.CATEGORY);
			boolean canCheck = f.isSelector[v] != f.FALSE || f.isSelectee[v] != f.FALSE ||
				f.isLicensor[v] != f.FALSE || f.isLicensee[v] != f.FALSE;
			if (!canCheck)
				f.active[v] = f.FALSE;
			else
				f.active[v] = m.member(f.type[v], new int[] {Polarity.SELECTOR.code(), Polarity.SELECTEE.code(),
						Polarity.LICENSOR.code(), Polarity.LICENSEE.code()}).reify();

			int[] pp = s.possiblePartners(v);
			// a node that must be checked but has no candidate partner: self, which the pair table forbids
			if (pp.length == 0)
				pp = new int[] {v};
			f.partner[v] = pp.length == 1 ? m.intVar(pp[0]) : m.intVar("partner_"+i+"_"+j, pp);
			f.time[v] = canCheck ? m.intVar("time_"+i+"_"+j, 0, horizon) : f.ZERO;

			if (f.isSelector[v] != f.FALSE || f.isLicensor[v] != f.FALSE) {
				TIntHashSet pslots = new TIntHashSet();
				for (int w : pp)
					pslots.add(s.slotOf(w));
				int[] ps = pslots.toArray();
				Arrays.sort(ps);
				f.partnerSlot[v] = ps.length == 1 ? m.intVar(ps[0]) : m.intVar("pslot_"+i+"_"+j, ps);
			}
		}

		int[] slotTab = new int[V];
		for (int w = 0; w < V; w++)
			slotTab[w] = s.slotOf(w);
		for (int v = 0; v < V; v++) {
			IntVar p = f.partner[v];
			if (f.partnerSlot[v] != null && !f.partnerSlot[v].isInstantiated())
				m.element(f.partnerSlot[v], slotTab, p).post();
			if (p.isInstantiatedTo(v)) {
				// never checked: must carry no checkable feature
				if (f.active[v] != f.FALSE)
					m.arithm(f.active[v], "=", 0).post();
				continue;
			}
			// involution: partner of partner is v
			m.element(m.intVar(v), f.partner, p, 0).post();
			// complementary features of equal name, or unchecked
			TIntHashSet pcodes = new TIntHashSet();
			for (int w = p.getLB(); w <= p.getUB(); w = p.nextValue(w))
				pcodes.addAll(s.possibleCodes(w));
			int[] pc = pcodes.toArray();
			Arrays.sort(pc);
			IntVar codeP = m.intVar("codeP_"+v, pc);
			m.element(codeP, f.code, p, 0).post();
			m.table(new IntVar[] {f.code[v], codeP}, checkingPairs(s, v)).post();
			if (f.active[v] == f.FALSE) {
				m.arithm(p, "=", v).post();
				continue;
			}
			m.arithm(p, "!=", v).reifyWith(f.active[v]);
			// derivation time: positive iff checked, shared with the partner
			m.arithm(f.time[v], ">", 0).reifyWith(f.active[v]);
			m.element(f.time[v], f.time, p, 0).post();
		}
		// features of a slot are checked in order
		for (int i = 0; i < N; i++) {
			for (int j = 0; j+1 < K; j++) {
				int v = s.node(i, j);
				if (f.active[v+1] == f.FALSE)
					continue;
				m.ifThen(f.active[v+1], m.arithm(f.time[v], "<", f.time[v+1]));
			}
		}

		// exactly one unchecked category: the root
		List<BoolVar> cats = new ArrayList<BoolVar>();
		for (int v = 0; v < V; v++)
			if (f.isCategory[v] != f.FALSE)
				cats.add(f.isCategory[v]);
		if (cats.isEmpty())
			m.falseConstraint().post();
		else
			m.sum(cats.toArray(new BoolVar[cats.size()]), "=", 1).post();

		// per name, as many probes as goals
		for (int l = 1; l < s.numLabels(); l++) {
			balance(f, Polarity.SELECTOR, Polarity.SELECTEE, l);
			balance(f, Polarity.LICENSOR, Polarity.LICENSEE, l);
		}

		// every active licensee is one movement
		List<BoolVar> licensees = new ArrayList<BoolVar>();
		for (int v = 0; v < V; v++)
			if (f.isLicensee[v] != f.FALSE)
				licensees.add(f.isLicensee[v]);
		if (!licensees.isEmpty())
			m.sum(licensees.toArray(new BoolVar[licensees.size()]), "<=", s.getBounds().getMaxNumMovements()).post();

		// head movement triggers
		int[] hmTab = new int[I+1];
		for (int x = 0; x < I; x++)
			hmTab[x] = s.item(x).triggersHeadMovement() ? 1 : 0;
		f.receives = new BoolVar[N];
		List<BoolVar> receivers = new ArrayList<BoolVar>();
		for (int i = 0; i < N; i++) {
			if (!s.canReceiveHead(i)) {
				f.receives[i] = f.FALSE;
				continue;
			}
			f.receives[i] = m.boolVar("recv_"+i);
			m.element(f.receives[i], hmTab, f.item[i]).post();
			receivers.add(f.receives[i]);
		}
		if (!receivers.isEmpty())
			m.sum(receivers.toArray(new BoolVar[receivers.size()]), "<=", s.getBounds().getMaxNumHeadMovements()).post();

		// covert slots sorted by item; unused, the largest index, sorts last
		for (int i = s.numOvert(); i+1 < N; i++)
			m.arithm(f.item[i], "<=", f.item[i+1]).post();
		if (debug) Debug.debug(debug, "Structure: "+f);
	}

	// type test for node v, constant false where no candidate allows p
	private static BoolVar is(Formula f, int v, Polarity p) {
		if (!f.schema.canBe(v, p))
			return f.FALSE;
		return f.model.arithm(f.type[v], "=", p.code()).reify();
	}

	// allowed (code, partner code) pairs for node v
	private static Tuples checkingPairs(DerivationSchema s, int v) {
		Tuples t = new Tuples(true);
		for (int c : s.possibleCodes(v)) {
			if (c == 0) {
				t.add(0, 0);
				continue;
			}
			Polarity p = Polarity.values()[s.typeOf(c)-1];
			if (p == Polarity.CATEGORY)
				t.add(c, c);
			else
				t.add(c, s.code(p.complement(), s.labelOf(c)));
		}
		return t;
	}

	private static void balance(Formula f, Polarity probe, Polarity goal, int label) {
		DerivationSchema s = f.schema;
		Model m = f.model;
		int pc = s.code(probe, label);
		int gc = s.code(goal, label);
		List<IntVar> pv = new ArrayList<IntVar>();
		List<IntVar> gv = new ArrayList<IntVar>();
		for (int v = 0; v < s.numNodes(); v++) {
			if (s.possibleCodes(v).contains(pc))
				pv.add(f.code[v]);
			if (s.possibleCodes(v).contains(gc))
				gv.add(f.code[v]);
		}
		if (pv.isEmpty() && gv.isEmpty())
			return;
		IntVar np = count(m, pc, pv, "n"+probe.getPrefix()+label);
		IntVar ng = count(m, gc, gv, "n"+goal.getPrefix()+label);
		m.arithm(np, "=", ng).post();
	}
	private static IntVar count(Model m, int code, List<IntVar> vars, String name) {
		if (vars.isEmpty())
			return m.intVar(0);
		IntVar n = m.intVar(name, 0, vars.size());
		m.count(code, vars.toArray(new IntVar[vars.size()]), n).post();
		return n;
	}

	// CONTAINMENT

	/**
	 * inside[a][b][k] holds iff slot k is dominated by slot a's projection once
	 * feature b of a is checked. A selector at (a,b) adds its partner slot and
	 * everything that slot's full projection contains; other features add nothing.
	 * The selection structure is acyclic, so the equations have one solution.
	 */
	private void containment(Formula f) {
		DerivationSchema s = f.schema;
		Model m = f.model;
		int N = s.numSlots();
		int K = s.width();
		BoolVar[] nothing = new BoolVar[N];
		Arrays.fill(nothing, f.FALSE);
		f.inside = new BoolVar[N][K][];
		f.partnerIs = new BoolVar[s.numNodes()][];
		for (int a = 0; a < N; a++) {
			for (int b = 0; b < K; b++) {
				BoolVar[] prev = b == 0 ? nothing : f.inside[a][b-1];
				if (f.isSelector[s.node(a, b)] == f.FALSE) {
					f.inside[a][b] = prev;
					continue;
				}
				BoolVar[] row = new BoolVar[N];
				for (int k = 0; k < N; k++)
					row[k] = k == a ? f.FALSE : m.boolVar("in_"+a+"_"+b+"_"+k);
				f.inside[a][b] = row;
			}
		}
		// column k of the final rows: does slot s's whole projection contain k
		BoolVar[][] full = new BoolVar[N][N];
		for (int k = 0; k < N; k++)
			for (int a = 0; a < N; a++)
				full[k][a] = f.inside[a][K-1][k];

		for (int a = 0; a < N; a++) {
			for (int b = 0; b < K; b++) {
				int v = s.node(a, b);
				if (f.isSelector[v] == f.FALSE)
					continue;
				BoolVar[] prev = b == 0 ? nothing : f.inside[a][b-1];
				BoolVar[] row = f.inside[a][b];
				IntVar ps = f.partnerSlot[v];
				f.partnerIs[v] = new BoolVar[N];
				for (int k = 0; k < N; k++) {
					if (k == a || !ps.contains(k))
						f.partnerIs[v][k] = f.FALSE;
					else
						f.partnerIs[v][k] = m.arithm(ps, "=", k).reify();
				}
				for (int k = 0; k < N; k++) {
					if (k == a)
						continue;
					BoolVar deep = m.boolVar("deep_"+v+"_"+k);
					m.element(deep, full[k], ps, 0).post();
					BoolVar reach = m.boolVar("reach_"+v+"_"+k);
					m.max(reach, new BoolVar[] {f.partnerIs[v][k], deep}).post();
					BoolVar added = m.boolVar("add_"+v+"_"+k);
					m.min(added, new BoolVar[] {f.isSelector[v], reach}).post();
					m.max(row[k], new BoolVar[] {prev[k], added}).post();
				}
			}
		}
	}

	// a licensor attracts a slot already inside its head's projection
	private void movement(Formula f) {
		DerivationSchema s = f.schema;
		Model m = f.model;
		for (int a = 0; a < s.numSlots(); a++) {
			for (int b = 0; b < s.width(); b++) {
				int v = s.node(a, b);
				if (f.isLicensor[v] == f.FALSE)
					continue;
				if (b == 0) {
					m.arithm(f.isLicensor[v], "=", 0).post();
					continue;
				}
				BoolVar in = m.boolVar("attract_"+v);
				m.element(in, f.inside[a][b-1], f.partnerSlot[v], 0).post();
				m.arithm(f.isLicensor[v], "<=", in).post();
			}
		}
	}

	// the complement's head moves into a receiving head; no chains, and a moved head has no licensees
	private void headMovement(Formula f) {
		DerivationSchema s = f.schema;
		Model m = f.model;
		int N = s.numSlots();
		List<List<BoolVar>> sources = new ArrayList<List<BoolVar>>();
		for (int c = 0; c < N; c++)
			sources.add(new ArrayList<BoolVar>());
		for (int a = 0; a < N; a++) {
			if (f.receives[a] == f.FALSE)
				continue;
			int v = s.node(a, 0);
			for (int c = 0; c < N; c++) {
				if (f.partnerIs[v][c] == f.FALSE)
					continue;
				sources.get(c).add(m.and(f.receives[a], f.partnerIs[v][c]).reify());
			}
		}
		f.headMoved = new BoolVar[N];
		for (int c = 0; c < N; c++) {
			List<BoolVar> lits = sources.get(c);
			if (lits.isEmpty()) {
				f.headMoved[c] = f.FALSE;
				continue;
			}
			f.headMoved[c] = m.boolVar("moved_"+c);
			m.max(f.headMoved[c], lits.toArray(new BoolVar[lits.size()])).post();
			m.arithm(f.receives[c], "+", f.headMoved[c], "<=", 1).post();
			for (int l = 0; l < s.width(); l++) {
				int w = s.node(c, l);
				if (f.isLicensee[w] != f.FALSE)
					m.arithm(f.headMoved[c], "+", f.isLicensee[w], "<=", 1).post();
			}
		}
	}

	// PF

	/**
	 * Spans [lo, hi] over positions 0..n. Overt slot i is pronounced at [i, i+1]; a
	 * covert slot at an empty span. A head span is the slot's own form, empty when
	 * the head moved away, or the moved-in head followed by the own form. A first
	 * selector puts its complement right of the head; later selectors and licensors
	 * put specifiers and movers left of the projection. A goal lands with the
	 * slot's full projection when it is the slot's last feature and as an empty
	 * trace otherwise. The root spans [0, n].
	 */
	private void phonology(Formula f) {
		DerivationSchema s = f.schema;
		Model m = f.model;
		int N = s.numSlots();
		int K = s.width();
		int V = s.numNodes();
		int n = s.numOvert();

		f.pfLo = new IntVar[N];
		f.pfHi = new IntVar[N];
		for (int i = 0; i < N; i++) {
			if (s.isOvert(i)) {
				f.pfLo[i] = m.intVar(i);
				f.pfHi[i] = m.intVar(i+1);
				continue;
			}
			IntVar p = m.intVar("pf_"+i, 0, n);
			f.pfLo[i] = p;
			f.pfHi[i] = p;
			if (f.used[i] != f.TRUE)
				unless(f, f.used[i], m.arithm(p, "=", 0));
		}

		f.headLo = new IntVar[N];
		f.headHi = new IntVar[N];
		for (int a = 0; a < N; a++) {
			BoolVar recv = f.receives[a];
			BoolVar moved = f.headMoved[a];
			if (recv == f.FALSE && moved == f.FALSE) {
				f.headLo[a] = f.pfLo[a];
				f.headHi[a] = f.pfHi[a];
				continue;
			}
			IntVar lo = m.intVar("headLo_"+a, 0, n);
			IntVar hi = m.intVar("headHi_"+a, 0, n);
			f.headLo[a] = lo;
			f.headHi[a] = hi;
			m.arithm(lo, "<=", hi).post();
			BoolVar plain = m.arithm(recv, "+", moved, "=", 0).reify();
			m.ifThen(plain, m.and(m.arithm(lo, "=", f.pfLo[a]), m.arithm(hi, "=", f.pfHi[a])));
			if (moved != f.FALSE)
				when(f, moved, m.arithm(lo, "=", hi));
			if (recv != f.FALSE) {
				IntVar ps = f.partnerSlot[s.node(a, 0)];
				IntVar srcLo = m.intVar("srcLo_"+a, 0, n);
				IntVar srcHi = m.intVar("srcHi_"+a, 0, n);
				m.element(srcLo, f.pfLo, ps, 0).post();
				m.element(srcHi, f.pfHi, ps, 0).post();
				m.ifThen(recv, m.and(m.arithm(lo, "=", srcLo), m.arithm(srcHi, "=", f.pfLo[a]),
						m.arithm(hi, "=", f.pfHi[a])));
			}
		}

		// landing spans are needed before projections exist
		f.landLo = new IntVar[V];
		f.landHi = new IntVar[V];
		for (int v = 0; v < V; v++) {
			if (f.isSelectee[v] == f.FALSE && f.isLicensee[v] == f.FALSE) {
				f.landLo[v] = f.ZERO;
				f.landHi[v] = f.ZERO;
				continue;
			}
			f.landLo[v] = m.intVar("landLo_"+v, 0, n);
			f.landHi[v] = m.intVar("landHi_"+v, 0, n);
			m.arithm(f.landLo[v], "<=", f.landHi[v]).post();
		}

		f.maxLo = new IntVar[N];
		f.maxHi = new IntVar[N];
		for (int a = 0; a < N; a++) {
			IntVar lo = f.headLo[a];
			IntVar hi = f.headHi[a];
			for (int b = 0; b < K; b++) {
				int v = s.node(a, b);
				boolean sel = f.isSelector[v] != f.FALSE;
				boolean lic = f.isLicensor[v] != f.FALSE;
				if (!sel && !lic)
					continue;
				BoolVar probe;
				if (sel && lic)
					probe = m.arithm(f.isSelector[v], "+", f.isLicensor[v], "=", 1).reify();
				else
					probe = sel ? f.isSelector[v] : f.isLicensor[v];
				IntVar cLo = m.intVar("cLo_"+v, 0, n);
				IntVar cHi = m.intVar("cHi_"+v, 0, n);
				m.element(cLo, f.landLo, f.partner[v], 0).post();
				m.element(cHi, f.landHi, f.partner[v], 0).post();
				IntVar nlo = m.intVar("curLo_"+v, 0, n);
				IntVar nhi = m.intVar("curHi_"+v, 0, n);
				if (b == 0)
					m.ifThen(probe, m.and(m.arithm(nlo, "=", lo), m.arithm(nhi, "=", cHi), m.arithm(hi, "=", cLo)));
				else
					m.ifThen(probe, m.and(m.arithm(nlo, "=", cLo), m.arithm(nhi, "=", hi), m.arithm(cHi, "=", lo)));
				m.ifThen(probe.not(), m.and(m.arithm(nlo, "=", lo), m.arithm(nhi, "=", hi)));
				m.arithm(nlo, "<=", nhi).post();
				lo = nlo;
				hi = nhi;
			}
			f.maxLo[a] = lo;
			f.maxHi[a] = hi;
		}

		for (int v = 0; v < V; v++) {
			if (f.landLo[v] == f.ZERO)
				continue;
			int a = s.slotOf(v);
			int j = s.positionOf(v);
			BoolVar goal;
			if (f.isSelectee[v] != f.FALSE && f.isLicensee[v] != f.FALSE)
				goal = m.arithm(f.isSelectee[v], "+", f.isLicensee[v], "=", 1).reify();
			else
				goal = f.isSelectee[v] != f.FALSE ? f.isSelectee[v] : f.isLicensee[v];
			BoolVar last;
			if (j+1 == K)
				last = f.TRUE;
			else if (!s.canBeEmpty(v+1))
				last = f.FALSE;
			else
				last = m.arithm(f.code[v+1], "=", 0).reify();
			BoolVar fin = m.and(goal, last).reify();
			BoolVar trace = m.and(goal, last.not()).reify();
			m.ifThen(fin, m.and(m.arithm(f.landLo[v], "=", f.maxLo[a]), m.arithm(f.landHi[v], "=", f.maxHi[a])));
			m.ifThen(trace, m.arithm(f.landLo[v], "=", f.landHi[v]));
			m.ifThen(goal.not(), m.and(m.arithm(f.landLo[v], "=", 0), m.arithm(f.landHi[v], "=", 0)));
		}

		for (int v = 0; v < V; v++) {
			if (f.isCategory[v] == f.FALSE)
				continue;
			int a = s.slotOf(v);
			m.ifThen(f.isCategory[v], m.and(m.arithm(f.maxLo[a], "=", 0), m.arithm(f.maxHi[a], "=", n)));
		}
	}

	// LF

	/**
	 * Every slot gets an event and a referent (name ids, 0 for none). Entities
	 * refer to themselves, predicates introduce their own event, role heads take
	 * the event of their complement, transparent heads pass both up. A selector
	 * with a role produces the fact (event of head, role, referent of the selected
	 * phrase); produced facts must be target facts, and every target fact must be
	 * produced.
	 */
	private void semantics(Formula f) {
		boolean debug = false;
		DerivationSchema s = f.schema;
		LogicalForm lf = f.ic.getLf();
		Model m = f.model;
		int N = s.numSlots();
		int K = s.width();
		int I = s.numItems();

		TObjectIntHashMap<String> names = new TObjectIntHashMap<String>();
		TObjectIntHashMap<String> roles = new TObjectIntHashMap<String>();
		for (LexicalItem li : s.getItems()) {
			intern(names, li.getDenotation().getName());
			for (String r : li.getDenotation().getRoles().values())
				intern(roles, r);
		}
		for (LFFact fact : lf.getFacts()) {
			intern(names, fact.getPred());
			intern(names, fact.getArg());
			intern(roles, fact.getRole());
		}
		int E = names.size()+1;
		int R = roles.size()+1;

		// kind per item; the unused item gets a kind of its own
		int unusedKind = Denotation.Kind.values().length;
		int[] kindTab = new int[I+1];
		int[] ownTab = new int[I+1];
		kindTab[I] = unusedKind;
		for (int x = 0; x < I; x++) {
			Denotation d = s.item(x).getDenotation();
			kindTab[x] = d.getKind().ordinal();
			ownTab[x] = d.getName() == null ? 0 : names.get(d.getName());
		}

		f.event = new IntVar[N+1];
		f.referent = new IntVar[N+1];
		for (int a = 0; a < N; a++) {
			f.event[a] = m.intVar("event_"+a, 0, E-1);
			f.referent[a] = m.intVar("ref_"+a, 0, E-1);
		}
		f.event[N] = f.ZERO;
		f.referent[N] = f.ZERO;

		for (int a = 0; a < N; a++) {
			IntVar itm = f.item[a];
			IntVar own = m.intVar("own_"+a, 0, E-1);
			m.element(own, ownTab, itm).post();
			int v0 = s.node(a, 0);
			IntVar compl;
			if (f.isSelector[v0] == f.FALSE) {
				compl = m.intVar(N);
			}
			else {
				compl = m.intVar("compl_"+a, 0, N);
				m.ifThen(f.isSelector[v0], m.arithm(compl, "=", f.partnerSlot[v0]));
				if (f.isSelector[v0] != f.TRUE)
					unless(f, f.isSelector[v0], m.arithm(compl, "=", N));
			}
			IntVar evC = m.intVar("evC_"+a, 0, E-1);
			IntVar refC = m.intVar("refC_"+a, 0, E-1);
			m.element(evC, f.event, compl, 0).post();
			m.element(refC, f.referent, compl, 0).post();

			TIntHashSet kinds = new TIntHashSet();
			for (int x : s.candidates(a))
				kinds.add(kindTab[x]);
			IntVar kind = null;
			if (kinds.size() > 1) {
				int[] ks = kinds.toArray();
				Arrays.sort(ks);
				kind = m.intVar("kind_"+a, ks);
				m.element(kind, kindTab, itm).post();
			}
			for (int k : kinds.toArray()) {
				Constraint c;
				if (k == Denotation.Kind.ENTITY.ordinal())
					c = m.and(m.arithm(f.referent[a], "=", own), m.arithm(f.event[a], "=", 0));
				else if (k == Denotation.Kind.PREDICATE.ordinal())
					c = m.and(m.arithm(f.event[a], "=", own), m.arithm(f.referent[a], "=", 0));
				else if (k == Denotation.Kind.ROLE.ordinal())
					c = m.and(m.arithm(f.event[a], "=", evC), m.arithm(f.referent[a], "=", 0));
				else if (k == Denotation.Kind.TRANSPARENT.ordinal())
					c = m.and(m.arithm(f.event[a], "=", evC), m.arithm(f.referent[a], "=", refC));
				else
					c = m.and(m.arithm(f.event[a], "=", 0), m.arithm(f.referent[a], "=", 0));
				if (kind == null)
					c.post();
				else
					m.ifThen(m.arithm(kind, "=", k).reify(), c);
			}
		}

		// target fact codes, plus every role-less code
		TIntHashSet allowed = new TIntHashSet();
		TIntArrayList targets = new TIntArrayList();
		for (LFFact fact : lf.getFacts()) {
			int c = names.get(fact.getPred())*R*E + roles.get(fact.getRole())*E + names.get(fact.getArg());
			allowed.add(c);
			targets.add(c);
		}
		for (int ev = 0; ev < E; ev++)
			for (int arg = 0; arg < E; arg++)
				allowed.add(ev*R*E + arg);
		int[] allowedArr = allowed.toArray();
		Arrays.sort(allowedArr);

		List<IntVar> facts = new ArrayList<IntVar>();
		for (int a = 0; a < N; a++) {
			for (int b = 0; b < K; b++) {
				int v = s.node(a, b);
				if (f.isSelector[v] == f.FALSE)
					continue;
				int[] roleTab = new int[I+1];
				boolean any = false;
				for (int x = 0; x < I; x++) {
					Feature ft = s.featureAt(x, b);
					String r = s.item(x).getDenotation().getRole(b);
					if (ft != null && ft.getPolarity() == Polarity.SELECTOR && r != null) {
						roleTab[x] = roles.get(r);
						any = true;
					}
				}
				if (!any)
					continue;
				IntVar role = m.intVar("role_"+v, 0, R-1);
				m.element(role, roleTab, f.item[a]).post();
				IntVar arg = m.intVar("arg_"+v, 0, E-1);
				m.element(arg, f.referent, f.partnerSlot[v], 0).post();
				IntVar fc = m.intVar("fact_"+v, 0, E*R*E-1);
				m.scalar(new IntVar[] {f.event[a], role, arg}, new int[] {R*E, E, 1}, "=", fc).post();
				m.member(fc, allowedArr).post();
				facts.add(fc);
			}
		}
		f.factCodes = facts.toArray(new IntVar[facts.size()]);
		for (int i = 0; i < targets.size(); i++) {
			if (f.factCodes.length == 0) {
				m.falseConstraint().post();
				break;
			}
			m.count(targets.get(i), f.factCodes, m.intVar("cover_"+i, 1, f.factCodes.length)).post();
		}

		// an LF root wins over the sentence type
		String root = lf.getRoot();
		if (root == null && f.ic.getSentenceType() != null)
			root = options.getSentenceRoot(f.ic.getSentenceType());
		if (root != null) {
			int rootCode = s.code(Polarity.CATEGORY, s.label(root));
			for (int v = 0; v < s.numNodes(); v++)
				if (f.isCategory[v] != f.FALSE)
					m.ifThen(f.isCategory[v], m.arithm(f.code[v], "=", rootCode));
		}
		for (Map.Entry<String, String> cat : lf.getCategories().entrySet()) {
			for (int i = 0; i < s.numOvert(); i++) {
				if (!cat.getKey().equals(s.word(i)))
					continue;
				TIntArrayList ok = new TIntArrayList();
				for (int x : s.candidates(i))
					if (cat.getValue().equals(s.item(x).getCategory()))
						ok.add(x);
				if (ok.isEmpty())
					m.falseConstraint().post();
				else
					m.member(f.item[i], ok.toArray()).post();
			}
		}
		for (Agreement ag : lf.getAgreements())
			agreement(f, ag);
		if (debug) Debug.debug(debug, E-1+" names, "+(R-1)+" roles, "+facts.size()+" fact positions");
	}

	// some overt slot of the predicate word has a probe whose partner is an overt slot of the subject word
	private static void agreement(Formula f, Agreement ag) {
		boolean debug = false;
		DerivationSchema s = f.schema;
		Model m = f.model;
		List<BoolVar> ways = new ArrayList<BoolVar>();
		for (int i = 0; i < s.numOvert(); i++) {
			if (!ag.getPred().equals(s.word(i)))
				continue;
			for (int j = 0; j < s.numOvert(); j++) {
				if (j == i || !ag.getSubj().equals(s.word(j)))
					continue;
				for (int b = 0; b < s.width(); b++) {
					int v = s.node(i, b);
					if (f.partnerSlot[v] == null || !f.partnerSlot[v].contains(j))
						continue;
					if (f.isSelector[v] == f.FALSE && f.isLicensor[v] == f.FALSE)
						continue;
					BoolVar probe = m.arithm(f.isSelector[v], "+", f.isLicensor[v], ">=", 1).reify();
					BoolVar there = m.arithm(f.partnerSlot[v], "=", j).reify();
					ways.add(m.and(probe, there).reify());
				}
			}
		}
		if (ways.isEmpty())
			m.falseConstraint().post();
		else
			m.or(ways.toArray(new BoolVar[ways.size()])).post();
		if (debug) Debug.debug(debug, ag+": "+ways.size()+" ways");
	}

	private static void intern(TObjectIntHashMap<String> map, String s) {
		if (s != null && !map.containsKey(s))
			map.put(s, map.size()+1);
	}

	// post c when b holds; b may be a constant. Callers skip building c when b
	// is constantly false, since an unposted constraint is reported by the model.
	private static void when(Formula f, BoolVar b, Constraint c) {
		if (b == f.FALSE)
			return;
		if (b == f.TRUE)
			c.post();
		else
			f.model.ifThen(b, c);
	}
	// post c when b does not hold
	private static void unless(Formula f, BoolVar b, Constraint c) {
		if (b == f.TRUE)
			return;
		if (b == f.FALSE)
			c.post();
		else
			f.model.ifThen(b.not(), c);
	}

	private static int[] sorted(Set<Integer> s) {
		int[] ret = new int[s.size()];
		int i = 0;
		for (int x : s)
			ret[i++] = x;
		Arrays.sort(ret);
		return ret;
	}
}
