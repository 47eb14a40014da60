package edu.isi.mgparse;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

// the semantic contribution of a lexical item. roles are attached to selector
// features by index: checking selector i on phrase p yields the fact
// (event of this head, role i, referent of p)
public class Denotation {

	public enum Kind {
		// refers to an individual; no event
		ENTITY,
		// introduces an event of the named predicate
		PREDICATE,
		// assigns roles to the event of its complement
		ROLE,
		// passes event and referent of its complement up unchanged
		TRANSPARENT;

		public static Kind get(String s) throws LexiconException {
			if (s.equals("entity"))
				return ENTITY;
			if (s.equals("predicate"))
				return PREDICATE;
			if (s.equals("role"))
				return ROLE;
			if (s.equals("transparent"))
				return TRANSPARENT;
			throw new LexiconException("Invalid denotation type ("+s+"); valid values are entity predicate role transparent");
		}
	}

	public static final Denotation NONE = new Denotation(Kind.TRANSPARENT, null, new TreeMap<Integer, String>());

	private final Kind kind;
	private final String name;
	private final Map<Integer, String> roles;

	public Denotation(Kind kind, String name, Map<Integer, String> roles) {
		this.kind = kind;
		this.name = name;
		this.roles = Collections.unmodifiableMap(new TreeMap<Integer, String>(roles));
	}
	public Kind getKind() { return kind; }
	// entity or predicate name; null for role and transparent heads
	public String getName() { return name; }
	public Map<Integer, String> getRoles() { return roles; }
	public String getRole(int featureIndex) { return roles.get(featureIndex); }

	public String toString() {
		StringBuffer sb = new StringBuffer(kind.toString().toLowerCase());
		if (name != null)
			sb.append(":"+name);
		if (!roles.isEmpty())
			sb.append(roles);
		return sb.toString();
	}
}
