package edu.isi.mgparse;

// a (name, polarity) pair. selectors may additionally trigger head movement
public class Feature {
	private final String name;
	private final Polarity polarity;
	private final boolean headMovement;

	public Feature(String name, Polarity polarity) {
		this(name, polarity, false);
	}
	public Feature(String name, Polarity polarity, boolean headMovement) {
		this.name = name;
		this.polarity = polarity;
		this.headMovement = headMovement;
	}
	public String getName() { return name; }
	public Polarity getPolarity() { return polarity; }
	public boolean isHeadMovement() { return headMovement; }

	// true if this and f can be consumed together by one merge or move
	public boolean checks(Feature f) {
		return polarity.complement() == f.polarity && name.equals(f.name);
	}

	public boolean equals(Object o) {
		if (!(o instanceof Feature))
			return false;
		Feature f = (Feature)o;
		return polarity == f.polarity && headMovement == f.headMovement && name.equals(f.name);
	}
	public int hashCode() {
		return (name.hashCode()*31 + polarity.hashCode())*2 + (headMovement ? 1 : 0);
	}
	// MG notation: =x <=x ~x +x -x x
	public String toString() {
		return (headMovement ? "<" : "")+polarity.getPrefix()+name;
	}
}
