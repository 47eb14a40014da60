package edu.isi.mgparse;

/**
 * The three bounds that size the derivation schema. Raising any of them can only
 * add derivations: a derivation found at bounds B is still valid at any bounds
 * that {@link #dominates dominate} B.
 */
public class BoundParameters {
	private final int maxNumEmptyLexicalItems;
	private final int maxNumMovements;
	private final int maxNumHeadMovements;

	public BoundParameters(int maxNumEmptyLexicalItems, int maxNumMovements, int maxNumHeadMovements)
	throws ConfigurationException {
		if (maxNumEmptyLexicalItems < 0 || maxNumMovements < 0 || maxNumHeadMovements < 0)
			throw new ConfigurationException("Bounds must be non-negative: empty="+maxNumEmptyLexicalItems+
					" movements="+maxNumMovements+" head movements="+maxNumHeadMovements);
		this.maxNumEmptyLexicalItems = maxNumEmptyLexicalItems;
		this.maxNumMovements = maxNumMovements;
		this.maxNumHeadMovements = maxNumHeadMovements;
	}

	public int getMaxNumEmptyLexicalItems() { return maxNumEmptyLexicalItems; }
	public int getMaxNumMovements() { return maxNumMovements; }
	public int getMaxNumHeadMovements() { return maxNumHeadMovements; }

	// pointwise at least as large as b
	public boolean dominates(BoundParameters b) {
		return maxNumEmptyLexicalItems >= b.maxNumEmptyLexicalItems &&
			maxNumMovements >= b.maxNumMovements &&
			maxNumHeadMovements >= b.maxNumHeadMovements;
	}

	public boolean equals(Object o) {
		if (!(o instanceof BoundParameters))
			return false;
		BoundParameters b = (BoundParameters)o;
		return dominates(b) && b.dominates(this);
	}
	public int hashCode() {
		return (maxNumEmptyLexicalItems*31 + maxNumMovements)*31 + maxNumHeadMovements;
	}
	public String toString() {
		return "{empty="+maxNumEmptyLexicalItems+", movements="+maxNumMovements+
			", head movements="+maxNumHeadMovements+"}";
	}
}
