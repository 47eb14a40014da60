package edu.isi.mgparse;

import java.util.EnumMap;

// toggles and limits of one parse request. bounds are kept separately in BoundParameters
public class ParseOptions {
	private boolean includePF = true;
	private boolean includeLF = true;
	private boolean extractAll = false;
	private int maxParses = 10;
	private long timeoutMillis = 0;
	private LocalityPolicy locality = ShortestMoveLocality.INSTANCE;
	private final EnumMap<SentenceType, String> sentenceRoots = new EnumMap<SentenceType, String>(SentenceType.class);

	public boolean includePF() { return includePF; }
	public boolean includeLF() { return includeLF; }
	public boolean extractAll() { return extractAll; }
	public int getMaxParses() { return maxParses; }
	// per solver call; 0 or less means no limit
	public long getTimeoutMillis() { return timeoutMillis; }
	public LocalityPolicy getLocality() { return locality; }
	// root category demanded by a sentence type when the LF names no root
	public String getSentenceRoot(SentenceType t) {
		return sentenceRoots.containsKey(t) ? sentenceRoots.get(t) : t.getDefaultRoot();
	}

	public ParseOptions setIncludePF(boolean b) { includePF = b; return this; }
	public ParseOptions setIncludeLF(boolean b) { includeLF = b; return this; }
	public ParseOptions setExtractAll(boolean b) { extractAll = b; return this; }
	public ParseOptions setMaxParses(int k) { maxParses = k; return this; }
	public ParseOptions setTimeoutMillis(long t) { timeoutMillis = t; return this; }
	public ParseOptions setLocality(LocalityPolicy p) { locality = p; return this; }
	public ParseOptions setSentenceRoot(SentenceType t, String category) { sentenceRoots.put(t, category); return this; }

	// die on combinations that would leave the schema under-constrained or without a target
	public void validate(InterfaceCondition ic) throws ConfigurationException {
		if (!includePF && !includeLF)
			throw new ConfigurationException("Cannot disable both PF and LF constraints");
		if (ic == null || (!ic.hasPf() && !ic.hasLf()))
			throw new ConfigurationException("Interface condition has neither a PF nor an LF target");
		if (includePF && !ic.hasPf())
			throw new ConfigurationException("PF constraints requested but the interface condition has no PF target");
		if (includeLF && !ic.hasLf())
			throw new ConfigurationException("LF constraints requested but the interface condition has no LF target");
		if (ic.hasPf() && ic.getPf().isEmpty())
			throw new ConfigurationException("PF target is empty");
		if (!ic.hasPf() && ic.getLf().words().isEmpty())
			throw new ConfigurationException("LF-only parse needs at least one relation");
		if (maxParses < 1)
			throw new ConfigurationException("Number of parses to extract must be positive, not "+maxParses);
		if (locality == null)
			throw new ConfigurationException("No locality policy");
		for (SentenceType t : SentenceType.values()) {
			String root = getSentenceRoot(t);
			if (root == null || root.length() == 0)
				throw new ConfigurationException("No root category for "+t.getLabel()+" sentences");
		}
	}

	public String toString() {
		return "{PF="+includePF+", LF="+includeLF+", all="+extractAll+", max="+maxParses+
			", timeout="+timeoutMillis+", locality="+locality.getName()+"}";
	}
}
