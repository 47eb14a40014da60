package edu.isi.mgparse;

// type of a sentence, read off its final punctuation. decides the root category
// when the LF does not name one
public enum SentenceType {
	DECLARATIVE("declarative", ".", "C_declarative"),
	QUESTION("question", "?", "C_question");

	private static final String list;
	static {
		StringBuffer sb = new StringBuffer();
		for (SentenceType t : SentenceType.values())
			sb.append(t.label+" ");
		list = sb.toString().trim();
	}

	private final String label;
	private final String punctuation;
	private final String defaultRoot;
	SentenceType(String label, String punctuation, String defaultRoot) {
		this.label = label;
		this.punctuation = punctuation;
		this.defaultRoot = defaultRoot;
	}
	public String getLabel() { return label; }
	public String getPunctuation() { return punctuation; }
	// root category used unless ParseOptions maps this type elsewhere
	public String getDefaultRoot() { return defaultRoot; }

	// null if the sentence ends in neither . nor ?
	public static SentenceType of(String sentence) {
		String s = sentence.trim();
		for (SentenceType t : SentenceType.values()) {
			if (s.endsWith(t.punctuation))
				return t;
		}
		return null;
	}

	public static SentenceType get(String s) throws DataFormatException {
		for (SentenceType t : SentenceType.values()) {
			if (t.label.equals(s))
				return t;
		}
		throw new DataFormatException("Invalid sentence type ("+s+"); valid values are "+list);
	}
}
