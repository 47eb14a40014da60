package edu.isi.mgparse;

// the locality condition on movement. Subclasses post their constraints on an assembled formula
public abstract class LocalityPolicy {

	public abstract String getName();

	// add the policy's constraints. called once, after containment and movement are in place
	public abstract void impose(Formula f);

	// not a static field: subclass instances are not built yet while this class initializes
	private static LocalityPolicy[] known() {
		return new LocalityPolicy[] { ShortestMoveLocality.INSTANCE, NoLocality.INSTANCE };
	}

	public static String getList() {
		StringBuffer sb = new StringBuffer();
		for (LocalityPolicy p : known())
			sb.append(p.getName()+" ");
		return sb.toString().trim();
	}

	public static LocalityPolicy get(String s) throws ConfigurationException {
		for (LocalityPolicy p : known()) {
			if (p.getName().equals(s))
				return p;
		}
		throw new ConfigurationException("Invalid locality policy ("+s+"); valid values are "+getList());
	}

	public String toString() { return getName(); }
}
