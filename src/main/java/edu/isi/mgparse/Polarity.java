package edu.isi.mgparse;

// the five kinds of syntactic feature. a probe (selector, licensor) is checked by
// the head that carries it; a goal (selectee, licensee) is checked on the phrase
// that carries it. the category feature marks a root-capable item and is never checked
public enum Polarity {
	SELECTOR("selector", "="),
	SELECTEE("selectee", "~"),
	LICENSOR("licensor", "+"),
	LICENSEE("licensee", "-"),
	CATEGORY("category", "");

	private static final String list;
	static {
		StringBuffer sb = new StringBuffer();
		for (Polarity p : Polarity.values())
			sb.append(p.label+" ");
		list = sb.toString().trim();
	}

	private final String label;
	private final String prefix;
	Polarity(String label, String prefix) {
		this.label = label;
		this.prefix = prefix;
	}
	public String getLabel() { return label; }
	public String getPrefix() { return prefix; }

	// code used by the constraint encoding. 0 is reserved for "no feature"
	public int code() { return ordinal()+1; }
	public static final int NONE = 0;

	public boolean isProbe() { return this == SELECTOR || this == LICENSOR; }
	public boolean isGoal() { return this == SELECTEE || this == LICENSEE; }

	// the polarity this one is checked against
	public Polarity complement() {
		switch (this) {
		case SELECTOR: return SELECTEE;
		case SELECTEE: return SELECTOR;
		case LICENSOR: return LICENSEE;
		case LICENSEE: return LICENSOR;
		default: return null;
		}
	}

	public static Polarity get(String s) throws LexiconException {
		for (Polarity p : Polarity.values()) {
			if (p.label.equals(s))
				return p;
		}
		throw new LexiconException("Invalid polarity ("+s+"); valid values are "+list);
	}
}
