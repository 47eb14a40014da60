package edu.isi.mgparse;

// a lexical item instance placed in a derivation
public class LexicalUsage {
	private final int slot;
	private final LexicalItem item;

	public LexicalUsage(int slot, LexicalItem item) {
		this.slot = slot;
		this.item = item;
	}
	public int getSlot() { return slot; }
	public LexicalItem getItem() { return item; }
	public boolean isCovert() { return item.isCovert(); }

	public String toString() {
		return slot+"\t"+item.getId()+"\t"+(item.isCovert() ? "covert" : "overt")+"\t"+item;
	}
}
