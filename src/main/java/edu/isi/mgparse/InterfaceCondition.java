package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

// a PF target (token sequence), an LF target, or both, with the sentence type
// when the PF was given as a punctuated sentence
public class InterfaceCondition {
	private final List<String> pf;
	private final LogicalForm lf;
	private final SentenceType sentenceType;

	public InterfaceCondition(List<String> pf, LogicalForm lf, SentenceType sentenceType) {
		this.pf = pf == null ? null : Collections.unmodifiableList(new ArrayList<String>(pf));
		this.lf = lf;
		this.sentenceType = sentenceType;
	}
	public InterfaceCondition(List<String> pf, LogicalForm lf) {
		this(pf, lf, null);
	}

	public List<String> getPf() { return pf; }
	public LogicalForm getLf() { return lf; }
	public boolean hasPf() { return pf != null; }
	public boolean hasLf() { return lf != null; }
	// may be null
	public SentenceType getSentenceType() { return sentenceType; }

	// split on whitespace; a final . or ? is punctuation, not a token. See SentenceType.of
	public static List<String> tokenize(String sentence) {
		String s = sentence.trim();
		if (s.endsWith(".") || s.endsWith("?"))
			s = s.substring(0, s.length()-1).trim();
		List<String> ret = new ArrayList<String>();
		if (s.length() == 0)
			return ret;
		for (String tok : s.split("\\s+"))
			ret.add(tok);
		return ret;
	}

	// {"PF": [...] or "a sentence .", "LF": {...}, "sentence_type": "question"}
	// an explicit sentence_type wins over the punctuation of a PF sentence
	public static InterfaceCondition fromJson(JsonElement e) throws DataFormatException {
		if (!e.isJsonObject())
			throw new DataFormatException("Interface condition must be a json object: "+e);
		JsonObject o = e.getAsJsonObject();
		List<String> pf = null;
		SentenceType type = null;
		if (o.has("PF") && !o.get("PF").isJsonNull()) {
			JsonElement p = o.get("PF");
			if (p.isJsonArray()) {
				pf = new ArrayList<String>();
				for (JsonElement t : p.getAsJsonArray())
					pf.add(LogicalForm.string(t, "PF token"));
			}
			else {
				String sentence = LogicalForm.string(p, "PF");
				pf = tokenize(sentence);
				type = SentenceType.of(sentence);
			}
		}
		if (o.has("sentence_type") && !o.get("sentence_type").isJsonNull())
			type = SentenceType.get(LogicalForm.string(o.get("sentence_type"), "sentence_type"));
		LogicalForm lf = null;
		if (o.has("LF") && !o.get("LF").isJsonNull())
			lf = LogicalForm.fromJson(o.get("LF"));
		if (pf == null && lf == null)
			throw new DataFormatException("Interface condition has neither PF nor LF: "+e);
		return new InterfaceCondition(pf, lf, type);
	}

	public String toString() {
		return "PF="+pf+" LF="+lf+(sentenceType == null ? "" : " "+sentenceType.getLabel());
	}
}
