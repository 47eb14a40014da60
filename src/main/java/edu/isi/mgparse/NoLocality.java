package edu.isi.mgparse;

// movement is bounded only by containment: any licensee inside the licensor's projection may move
public class NoLocality extends LocalityPolicy {
	public static final NoLocality INSTANCE = new NoLocality();

	private NoLocality() { }

	public String getName() { return "none"; }

	public void impose(Formula f) {
		boolean debug = false;
		if (debug) Debug.debug(debug, "No locality constraints on "+f);
	}
}
