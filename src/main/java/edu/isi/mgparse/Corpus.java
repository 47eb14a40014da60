package edu.isi.mgparse;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

// the input_sequence of interface conditions read from a corpus file
public class Corpus {
	private final List<InterfaceCondition> inputSequence;

	public Corpus(List<InterfaceCondition> ics) {
		inputSequence = Collections.unmodifiableList(new ArrayList<InterfaceCondition>(ics));
	}
	public List<InterfaceCondition> getInputSequence() { return inputSequence; }
	public int size() { return inputSequence.size(); }

	public static Corpus read(Reader r) throws DataFormatException {
		JsonElement root;
		try {
			root = JsonParser.parseReader(r);
		}
		catch (JsonParseException e) {
			throw new DataFormatException("Malformed corpus json: "+e.getMessage(), e);
		}
		if (!root.isJsonObject() || !root.getAsJsonObject().has("input_sequence"))
			throw new DataFormatException("Corpus must be an object with an input_sequence field");
		JsonObject o = root.getAsJsonObject();
		if (!o.get("input_sequence").isJsonArray())
			throw new DataFormatException("input_sequence must be an array");
		List<InterfaceCondition> ics = new ArrayList<InterfaceCondition>();
		for (JsonElement e : o.getAsJsonArray("input_sequence"))
			ics.add(InterfaceCondition.fromJson(e));
		return new Corpus(ics);
	}
}
