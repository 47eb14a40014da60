package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An entry of the lexicon: a feature sequence, a phonological form (null for
 * covert items) and a denotation. Immutable. A derivation uses instances of an
 * item; the same item may fill several slots or none.
 *
 * A well-formed sequence is zero or more probes (selectors, licensors) followed
 * either by one selectee and zero or more licensees, or by a single category
 * feature, which makes the item a possible root.
 */
public class LexicalItem {

	public static final String EPSILON = "ε";

	private final String id;
	private final String pf;
	private final List<Feature> features;
	private final Denotation denotation;

	// index of the selectee or category feature
	private final int goalIndex;

	public LexicalItem(String id, String pf, List<Feature> features, Denotation denotation) throws LexiconException {
		this.id = id;
		if (pf == null || pf.length() == 0 || pf.equals(EPSILON))
			this.pf = null;
		else
			this.pf = pf;
		this.features = Collections.unmodifiableList(new ArrayList<Feature>(features));
		this.denotation = denotation == null ? Denotation.NONE : denotation;
		goalIndex = validate();
	}

	// check the sequence shape; return the position of the selectee/category
	private int validate() throws LexiconException {
		if (id == null || id.length() == 0)
			throw new LexiconException("Lexical item without identifier");
		if (features.isEmpty())
			throw new LexiconException("Item "+id+" has no features");
		int goal = -1;
		for (int i = 0; i < features.size(); i++) {
			Feature f = features.get(i);
			if (f.getName() == null || (f.getName().length() == 0 && f.getPolarity() != Polarity.CATEGORY))
				throw new LexiconException("Item "+id+" has an unnamed feature at position "+i);
			if (f.isHeadMovement() && (i != 0 || f.getPolarity() != Polarity.SELECTOR))
				throw new LexiconException("Item "+id+": only a first selector may trigger head movement ("+f+")");
			if (goal < 0) {
				if (f.getPolarity().isProbe()) {
					if (i == 0 && f.getPolarity() == Polarity.LICENSOR)
						throw new LexiconException("Item "+id+" starts with a licensor; nothing could move to it");
					continue;
				}
				if (f.getPolarity() == Polarity.LICENSEE)
					throw new LexiconException("Item "+id+" has licensee "+f+" before its selectee");
				goal = i;
				if (f.getPolarity() == Polarity.CATEGORY && i != features.size()-1)
					throw new LexiconException("Item "+id+": category feature "+f+" must come last");
			}
			else if (f.getPolarity() != Polarity.LICENSEE)
				throw new LexiconException("Item "+id+": "+f+" follows the selectee; only licensees may");
		}
		if (goal < 0)
			throw new LexiconException("Item "+id+" has neither a selectee nor a category feature");
		for (Map.Entry<Integer, String> role : denotation.getRoles().entrySet()) {
			int idx = role.getKey();
			if (idx < 0 || idx >= features.size() || features.get(idx).getPolarity() != Polarity.SELECTOR)
				throw new LexiconException("Item "+id+": role "+role.getValue()+" is attached to "+idx+", which is not a selector");
			if (role.getValue() == null || role.getValue().length() == 0)
				throw new LexiconException("Item "+id+" has an empty role name at "+idx);
		}
		if ((denotation.getKind() == Denotation.Kind.ENTITY || denotation.getKind() == Denotation.Kind.PREDICATE) &&
				denotation.getName() == null)
			throw new LexiconException("Item "+id+": "+denotation.getKind()+" denotation needs a name");
		return goal;
	}

	public String getId() { return id; }
	public String getPf() { return pf; }
	public boolean isCovert() { return pf == null; }
	public List<Feature> getFeatures() { return features; }
	public int numFeatures() { return features.size(); }
	public Feature getFeature(int i) { return features.get(i); }
	public Denotation getDenotation() { return denotation; }

	public int getGoalIndex() { return goalIndex; }
	public boolean isRootCapable() { return features.get(goalIndex).getPolarity() == Polarity.CATEGORY; }
	// selectee label, or the category of a root-capable item
	public String getCategory() { return features.get(goalIndex).getName(); }
	public int numLicensees() { return features.size()-goalIndex-1; }
	public boolean triggersHeadMovement() { return features.get(0).isHeadMovement(); }

	// the word this item contributes to an LF: denotation name, else pf
	public String getSemanticName() {
		if (denotation.getName() != null)
			return denotation.getName();
		return pf;
	}

	public String getPfString() { return pf == null ? EPSILON : pf; }

	// pf::features, with an optional marker before feature at position dot
	public String toString(int dot) {
		StringBuffer sb = new StringBuffer(getPfString()+"::");
		for (int i = 0; i < features.size(); i++) {
			if (i > 0)
				sb.append(" ");
			if (i == dot)
				sb.append("·");
			sb.append(features.get(i));
		}
		return sb.toString();
	}
	public String toString() { return toString(-1); }
}
