package edu.isi.mgparse;

// agree(pred, subj): the head pronounced pred checks a feature of the phrase headed by subj,
// by selecting it or by attracting it
public class Agreement {
	private final String pred;
	private final String subj;

	public Agreement(String pred, String subj) {
		this.pred = pred;
		this.subj = subj;
	}
	public String getPred() { return pred; }
	public String getSubj() { return subj; }

	public boolean equals(Object o) {
		if (!(o instanceof Agreement))
			return false;
		Agreement a = (Agreement)o;
		return pred.equals(a.pred) && subj.equals(a.subj);
	}
	public int hashCode() {
		return pred.hashCode()*31 + subj.hashCode();
	}
	public String toString() { return "agree("+pred+", "+subj+")"; }
}
