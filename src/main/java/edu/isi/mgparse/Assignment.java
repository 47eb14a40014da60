package edu.isi.mgparse;

import java.util.Arrays;

/**
 * Snapshot of a satisfying model, restricted to the decision variables: the
 * item chosen for each slot, the checking partner of each node, and the time
 * each node is checked. Independent of the solver once taken.
 */
public class Assignment {
	private final int[] items;
	private final int[] partners;
	private final int[] times;

	public Assignment(int[] items, int[] partners, int[] times) {
		this.items = items.clone();
		this.partners = partners.clone();
		this.times = times.clone();
	}

	public int getItem(int slot) { return items[slot]; }
	public int getPartner(int node) { return partners[node]; }
	public int getTime(int node) { return times[node]; }
	public int numSlots() { return items.length; }
	public int numNodes() { return partners.length; }

	public boolean equals(Object o) {
		if (!(o instanceof Assignment))
			return false;
		Assignment a = (Assignment)o;
		return Arrays.equals(items, a.items) && Arrays.equals(partners, a.partners) && Arrays.equals(times, a.times);
	}
	public int hashCode() {
		return (Arrays.hashCode(items)*31 + Arrays.hashCode(partners))*31 + Arrays.hashCode(times);
	}
	public String toString() {
		return "items="+Arrays.toString(items)+" partners="+Arrays.toString(partners)+" times="+Arrays.toString(times);
	}
}
