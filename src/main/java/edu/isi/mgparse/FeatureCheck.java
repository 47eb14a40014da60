package edu.isi.mgparse;

// one pair of features consumed together: a probe on a head and a goal on the phrase it takes
public class FeatureCheck {

	public enum Operation { MERGE, MOVE, HEAD_MOVE }

	private final Operation operation;
	private final int probeSlot;
	private final int probeIndex;
	private final Feature probe;
	private final int goalSlot;
	private final int goalIndex;
	private final Feature goal;
	private final int time;

	public FeatureCheck(Operation operation, int probeSlot, int probeIndex, Feature probe,
			int goalSlot, int goalIndex, Feature goal, int time) {
		this.operation = operation;
		this.probeSlot = probeSlot;
		this.probeIndex = probeIndex;
		this.probe = probe;
		this.goalSlot = goalSlot;
		this.goalIndex = goalIndex;
		this.goal = goal;
		this.time = time;
	}

	public Operation getOperation() { return operation; }
	public int getProbeSlot() { return probeSlot; }
	public int getProbeIndex() { return probeIndex; }
	public Feature getProbe() { return probe; }
	public int getGoalSlot() { return goalSlot; }
	public int getGoalIndex() { return goalIndex; }
	public Feature getGoal() { return goal; }
	// derivation step; checks with smaller times happen first
	public int getTime() { return time; }

	public String toString() {
		return operation+" "+probe+"@"+probeSlot+"."+probeIndex+" "+goal+"@"+goalSlot+"."+goalIndex;
	}
}
