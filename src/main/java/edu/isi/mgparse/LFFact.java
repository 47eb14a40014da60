package edu.isi.mgparse;

// one predicate-argument relation: pred(role=arg)
public class LFFact implements Comparable<LFFact> {
	private final String pred;
	private final String role;
	private final String arg;

	public LFFact(String pred, String role, String arg) {
		this.pred = pred;
		this.role = role;
		this.arg = arg;
	}
	public String getPred() { return pred; }
	public String getRole() { return role; }
	public String getArg() { return arg; }

	public boolean equals(Object o) {
		if (!(o instanceof LFFact))
			return false;
		LFFact f = (LFFact)o;
		return pred.equals(f.pred) && role.equals(f.role) && arg.equals(f.arg);
	}
	public int hashCode() {
		return (pred.hashCode()*31 + role.hashCode())*31 + arg.hashCode();
	}
	public int compareTo(LFFact f) {
		return toString().compareTo(f.toString());
	}
	public String toString() { return pred+"("+role+"="+arg+")"; }
}
