package edu.isi.mgparse;

// status of a solver call, with the model when it is SAT
public class SolveResult {
	private final SolveStatus status;
	private final Assignment assignment;

	public SolveResult(SolveStatus status, Assignment assignment) {
		this.status = status;
		this.assignment = assignment;
	}
	public SolveStatus getStatus() { return status; }
	// null unless SAT
	public Assignment getAssignment() { return assignment; }

	public String toString() { return status.toString(); }
}
