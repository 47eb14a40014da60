package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one parse: SAT with one or more derivations, UNSAT, or TIMEOUT. When
 * all parses were asked for, {@link #getStoppedBy} says why enumeration ended:
 * SAT at the count cap, UNSAT when no further derivation exists, TIMEOUT when a
 * solver call ran out of time (derivations found before are kept).
 */
public class ParseResult {
	private final InterfaceCondition ic;
	private final SolveStatus status;
	private final SolveStatus stoppedBy;
	private final List<Derivation> derivations;

	public ParseResult(InterfaceCondition ic, SolveStatus status, SolveStatus stoppedBy, List<Derivation> derivations) {
		this.ic = ic;
		this.status = status;
		this.stoppedBy = stoppedBy;
		this.derivations = Collections.unmodifiableList(new ArrayList<Derivation>(derivations));
	}

	public InterfaceCondition getInterfaceCondition() { return ic; }
	public SolveStatus getStatus() { return status; }
	public SolveStatus getStoppedBy() { return stoppedBy; }
	public boolean isSat() { return status == SolveStatus.SAT; }
	public List<Derivation> getDerivations() { return derivations; }
	public int size() { return derivations.size(); }
	// null unless SAT
	public Derivation getFirst() { return derivations.isEmpty() ? null : derivations.get(0); }

	public String toString() {
		return status+(derivations.size() > 1 ? " ("+derivations.size()+" derivations)" : "");
	}
}
