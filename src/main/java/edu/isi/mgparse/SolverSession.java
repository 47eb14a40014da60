package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.Solver;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.search.SearchState;
import org.chocosolver.solver.search.strategy.Search;
import org.chocosolver.solver.variables.IntVar;

/**
 * One parse request's hold on the solver. Owns its {@link Formula}; must not be
 * shared between threads. {@link #solveOne} may be called any number of times;
 * {@link #solveAll} adds blocking clauses, so the formula it leaves behind is no
 * longer the one that was assembled. Call {@link #close} when done.
 */
public class SolverSession {

	// largest number of covert slot relabelings blocked per model
	static final int MAX_RELABELINGS = 720;

	private Formula formula;
	private final long timeoutMillis;
	private int numBlocked = 0;

	// per solver call; 0 or less means no limit
	public SolverSession(Formula formula, long timeoutMillis) {
		this.formula = formula;
		this.timeoutMillis = timeoutMillis;
	}

	public Formula getFormula() { return formula; }
	public int getNumBlocked() { return numBlocked; }

	public SolveResult solveOne() {
		return solve();
	}

	// lazy enumeration of at most maxCount distinct models
	public ModelIterator solveAll(int maxCount) {
		return new ModelIterator(maxCount);
	}

	public void close() {
		if (formula != null)
			formula.getModel().getSolver().removeAllStopCriteria();
		formula = null;
	}

	private Solver prepare() {
		if (formula == null)
			throw new IllegalStateException("Solver session already closed");
		Solver solver = formula.getModel().getSolver();
		solver.reset();
		return solver;
	}

	private SolveResult solve() {
		boolean debug = false;
		Solver solver = prepare();
		Model m = formula.getModel();
		solver.setSearch(Search.inputOrderLBSearch(formula.item),
				Search.minDomLBSearch(formula.partner),
				Search.inputOrderLBSearch(formula.time),
				Search.inputOrderLBSearch(m.retrieveIntVars(true)));
		solver.removeAllStopCriteria();
		if (timeoutMillis > 0)
			solver.limitTime(timeoutMillis);
		Date start = new Date();
		boolean found;
		try {
			found = solver.solve();
		}
		catch (org.chocosolver.solver.exception.SolverException e) {
			throw new SolverException("Constraint backend failed: "+e.getMessage(), e);
		}
		Debug.dbtime(2, start, "solver call");
		if (found) {
			Assignment a = snapshot();
			if (debug) Debug.debug(debug, "Model: "+a);
			return new SolveResult(SolveStatus.SAT, a);
		}
		if (solver.getSearchState() == SearchState.STOPPED)
			return new SolveResult(SolveStatus.TIMEOUT, null);
		return new SolveResult(SolveStatus.UNSAT, null);
	}

	private Assignment snapshot() {
		int[] items = values(formula.item);
		int[] partners = values(formula.partner);
		int[] times = values(formula.time);
		return new Assignment(items, partners, times);
	}
	private static int[] values(IntVar[] vars) {
		int[] ret = new int[vars.length];
		for (int i = 0; i < vars.length; i++) {
			if (!vars[i].isInstantiated())
				throw new SolverException("Solution leaves "+vars[i].getName()+" uninstantiated");
			ret[i] = vars[i].getValue();
		}
		return ret;
	}

	/**
	 * Forbid a and every model that differs from it only by the numbering of
	 * covert slots holding the same item. Only items and partners are blocked:
	 * derivation times are an encoding artifact.
	 */
	public void block(Assignment a) {
		boolean debug = false;
		prepare();
		DerivationSchema s = formula.getSchema();
		// used covert slots grouped by item
		Map<Integer, List<Integer>> groups = new LinkedHashMap<Integer, List<Integer>>();
		for (int i = s.numOvert(); i < s.numSlots(); i++) {
			if (a.getItem(i) == s.unused())
				continue;
			if (!groups.containsKey(a.getItem(i)))
				groups.put(a.getItem(i), new ArrayList<Integer>());
			groups.get(a.getItem(i)).add(i);
		}
		List<int[]> relabelings = new ArrayList<int[]>();
		int[] ident = new int[s.numSlots()];
		for (int i = 0; i < ident.length; i++)
			ident[i] = i;
		relabelings.add(ident);
		for (List<Integer> group : groups.values()) {
			if (group.size() < 2)
				continue;
			List<int[]> perms = permutations(group.size());
			List<int[]> next = new ArrayList<int[]>();
			for (int[] base : relabelings) {
				for (int[] p : perms) {
					if (next.size() >= MAX_RELABELINGS)
						break;
					int[] sigma = base.clone();
					for (int x = 0; x < group.size(); x++)
						sigma[group.get(x)] = base[group.get(p[x])];
					next.add(sigma);
				}
			}
			relabelings = next;
		}
		if (relabelings.size() >= MAX_RELABELINGS)
			Debug.prettyDebug("Warning: blocking only "+relabelings.size()+" relabelings of a model; duplicates are left to the caller");
		for (int[] sigma : relabelings)
			blockRelabeled(a, sigma);
		if (debug) Debug.debug(debug, "Blocked "+relabelings.size()+" relabelings of "+a);
	}

	private void blockRelabeled(Assignment a, int[] sigma) {
		DerivationSchema s = formula.getSchema();
		Model m = formula.getModel();
		List<Constraint> lits = new ArrayList<Constraint>();
		for (int i = 0; i < s.numSlots(); i++) {
			if (!literal(m, formula.item[sigma[i]], a.getItem(i), lits))
				return;
		}
		for (int v = 0; v < s.numNodes(); v++) {
			int sv = s.node(sigma[s.slotOf(v)], s.positionOf(v));
			int p = a.getPartner(v);
			int sp = s.node(sigma[s.slotOf(p)], s.positionOf(p));
			if (!literal(m, formula.partner[sv], sp, lits))
				return;
		}
		if (lits.isEmpty())
			m.falseConstraint().post();
		else
			m.or(lits.toArray(new Constraint[lits.size()])).post();
		numBlocked++;
	}
	// add var != val to lits. false if the literal is constantly true, so the clause needs no posting
	private static boolean literal(Model m, IntVar var, int val, List<Constraint> lits) {
		if (var.isInstantiated())
			return var.getValue() == val;
		if (!var.contains(val))
			return false;
		lits.add(m.arithm(var, "!=", val));
		return true;
	}

	// all permutations of 0..n-1, in lexicographic order
	static List<int[]> permutations(int n) {
		List<int[]> ret = new ArrayList<int[]>();
		int[] p = new int[n];
		for (int i = 0; i < n; i++)
			p[i] = i;
		while (true) {
			ret.add(p.clone());
			if (ret.size() >= MAX_RELABELINGS)
				return ret;
			int i = n-2;
			while (i >= 0 && p[i] >= p[i+1])
				i--;
			if (i < 0)
				return ret;
			int j = n-1;
			while (p[j] <= p[i])
				j--;
			int t = p[i]; p[i] = p[j]; p[j] = t;
			for (int lo = i+1, hi = n-1; lo < hi; lo++, hi--) {
				t = p[lo]; p[lo] = p[hi]; p[hi] = t;
			}
		}
	}

	/**
	 * Solve, yield, block, solve again. Each call to hasNext may block on the
	 * solver. Ends on UNSAT, on a timeout, or after maxCount models; {@link #getStatus}
	 * tells which.
	 */
	public class ModelIterator implements Iterator<Assignment> {
		private final int maxCount;
		private int count = 0;
		private Assignment next = null;
		private Assignment toBlock = null;
		private SolveStatus status = null;

		ModelIterator(int maxCount) {
			this.maxCount = maxCount;
		}

		public boolean hasNext() {
			if (next != null)
				return true;
			if (status != null)
				return false;
			if (count >= maxCount) {
				status = SolveStatus.SAT;
				return false;
			}
			if (toBlock != null) {
				block(toBlock);
				toBlock = null;
			}
			SolveResult r = solve();
			if (r.getStatus() != SolveStatus.SAT) {
				status = r.getStatus();
				return false;
			}
			next = r.getAssignment();
			return true;
		}

		public Assignment next() {
			if (!hasNext())
				throw new NoSuchElementException();
			Assignment ret = next;
			next = null;
			toBlock = ret;
			count++;
			return ret;
		}

		public void remove() {
			throw new UnsupportedOperationException("Models cannot be removed");
		}

		// null while running; SAT if stopped at the count, else UNSAT or TIMEOUT
		public SolveStatus getStatus() { return status; }
		public int getCount() { return count; }
	}
}
