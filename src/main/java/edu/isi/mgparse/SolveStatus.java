package edu.isi.mgparse;

// outcome of one solver call. UNSAT and TIMEOUT are ordinary results, not errors:
// TIMEOUT says nothing about whether a derivation exists
public enum SolveStatus {
	SAT, UNSAT, TIMEOUT;

	public boolean isSat() { return this == SAT; }
}
