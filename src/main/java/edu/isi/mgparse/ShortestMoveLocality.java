package edu.isi.mgparse;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;

/**
 * The shortest move constraint: when a licensor +f of slot a is checked at time t,
 * no other slot inside a's projection may have a licensee -f pending at t. A
 * licensee is pending when the feature before it was checked before t and it is
 * itself checked after t.
 */
public class ShortestMoveLocality extends LocalityPolicy {
	public static final ShortestMoveLocality INSTANCE = new ShortestMoveLocality();

	private ShortestMoveLocality() { }

	public String getName() { return "shortest-move"; }

	public void impose(Formula f) {
		boolean debug = false;
		DerivationSchema s = f.schema;
		Model m = f.model;
		int posted = 0;
		for (int a = 0; a < s.numSlots(); a++) {
			for (int b = 1; b < s.width(); b++) {
				int u = s.node(a, b);
				if (f.isLicensor[u] == f.FALSE)
					continue;
				BoolVar[] inside = f.inside[a][b-1];
				for (int k = 0; k < s.numSlots(); k++) {
					if (k == a || inside[k] == f.FALSE)
						continue;
					for (int l = 1; l < s.width(); l++) {
						int w = s.node(k, l);
						if (f.isLicensee[w] == f.FALSE || !shareLabel(s, u, w))
							continue;
						BoolVar same = m.arithm(f.code[w], "-", f.code[u], "=", s.numLabels()).reify();
						BoolVar started = m.arithm(f.time[w-1], "<", f.time[u]).reify();
						BoolVar waiting = m.arithm(f.time[u], "<", f.time[w]).reify();
						m.sum(new BoolVar[] {f.isLicensor[u], inside[k], f.isLicensee[w], same, started, waiting}, "<=", 5).post();
						posted++;
					}
				}
			}
		}
		if (debug) Debug.debug(debug, "Posted "+posted+" shortest move constraints");
	}

	// some licensor code of u and licensee code of w have the same label
	private static boolean shareLabel(DerivationSchema s, int u, int w) {
		for (int c : s.possibleCodes(u)) {
			if (s.typeOf(c) == Polarity.LICENSOR.code() &&
					s.possibleCodes(w).contains(s.code(Polarity.LICENSEE, s.labelOf(c))))
				return true;
		}
		return false;
	}
}
