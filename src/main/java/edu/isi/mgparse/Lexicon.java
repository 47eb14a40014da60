package edu.isi.mgparse;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * Immutable mapping from identifier to {@link LexicalItem}, in file order.
 *
 * File format: a json object whose keys are item identifiers and whose values are
 * <pre>
 * { "pf": "fears",
 *   "features": [ {"name": "D", "polarity": "selector"}, {"name": "V", "polarity": "selectee"} ],
 *   "sem": {"type": "predicate", "name": "fears", "roles": {"0": "obj"}} }
 * </pre>
 * A feature may also be written in MG notation ("=D", "&lt;=V", "~V", "+wh", "-wh",
 * or a bare name for a category). A missing or empty pf marks a covert item.
 */
public class Lexicon {

	private final LinkedHashMap<String, LexicalItem> items;

	public Lexicon(Collection<LexicalItem> entries) throws LexiconException {
		items = new LinkedHashMap<String, LexicalItem>();
		for (LexicalItem li : entries) {
			if (items.containsKey(li.getId()))
				throw new LexiconException("Duplicate lexical item identifier "+li.getId());
			items.put(li.getId(), li);
		}
	}

	public LexicalItem get(String id) { return items.get(id); }
	public boolean contains(String id) { return items.containsKey(id); }
	public int size() { return items.size(); }
	public List<LexicalItem> getItems() {
		return Collections.unmodifiableList(new ArrayList<LexicalItem>(items.values()));
	}

	// overt items pronounced as word
	public List<LexicalItem> itemsFor(String word) {
		List<LexicalItem> ret = new ArrayList<LexicalItem>();
		for (LexicalItem li : items.values())
			if (word.equals(li.getPf()))
				ret.add(li);
		return ret;
	}

	// overt items whose denotation (or pf) names word
	public List<LexicalItem> itemsDenoting(String word) {
		List<LexicalItem> ret = new ArrayList<LexicalItem>();
		for (LexicalItem li : items.values())
			if (!li.isCovert() && word.equals(li.getSemanticName()))
				ret.add(li);
		return ret;
	}

	/**
	 * The part of the lexicon a parse needs: overt items pronounced as one of the
	 * words (all overt items if words is null), every covert item, and the extra
	 * items, which are appended after the lexicon's own.
	 * @throws LexiconException if an extra item clashes with an identifier, or has
	 * a feature nothing in the lexicon or the extras can check
	 */
	public Lexicon relevantTo(Collection<String> words, Collection<LexicalItem> extras) throws LexiconException {
		boolean debug = false;
		Set<String> wordset = words == null ? null : new HashSet<String>(words);
		List<LexicalItem> kept = new ArrayList<LexicalItem>();
		for (LexicalItem li : items.values()) {
			if (li.isCovert() || wordset == null || wordset.contains(li.getPf()))
				kept.add(li);
		}
		// extras answer to the whole lexicon, as items read from a file do
		if (extras != null) {
			checkFeatureNames(items.values(), extras);
			kept.addAll(extras);
		}
		if (debug) Debug.debug(debug, "Kept "+kept.size()+" of "+items.size()+" items");
		return new Lexicon(kept);
	}

	// every probe needs a goal of the same name somewhere, and vice versa
	public void checkFeatureNames() throws LexiconException {
		checkFeatureNames(items.values(), items.values());
	}

	// features of subjects against those of pool and subjects together
	private static void checkFeatureNames(Collection<LexicalItem> pool, Collection<LexicalItem> subjects)
	throws LexiconException {
		Set<String> seen = new HashSet<String>();
		for (LexicalItem li : pool)
			for (Feature f : li.getFeatures())
				seen.add(f.getPolarity()+" "+f.getName());
		for (LexicalItem li : subjects)
			for (Feature f : li.getFeatures())
				seen.add(f.getPolarity()+" "+f.getName());
		for (LexicalItem li : subjects) {
			for (Feature f : li.getFeatures()) {
				Polarity comp = f.getPolarity().complement();
				if (comp != null && !seen.contains(comp+" "+f.getName()))
					throw new LexiconException("Item "+li.getId()+": feature "+f+" can never be checked; no "+
							comp.getLabel()+" named "+f.getName()+" in the lexicon");
			}
		}
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (LexicalItem li : items.values())
			sb.append(li.getId()+"\t"+li+"\n");
		return sb.toString();
	}

	// READING

	public static Lexicon read(Reader r) throws LexiconException {
		List<LexicalItem> entries = new ArrayList<LexicalItem>();
		Set<String> ids = new HashSet<String>();
		try {
			JsonReader jr = new JsonReader(r);
			if (jr.peek() != JsonToken.BEGIN_OBJECT)
				throw new LexiconException("Lexicon must be a json object from identifier to entry");
			jr.beginObject();
			while (jr.hasNext()) {
				String id = jr.nextName();
				// a JsonObject would silently keep the last of two equal keys
				if (!ids.add(id))
					throw new LexiconException("Duplicate lexical item identifier "+id);
				JsonElement entry = JsonParser.parseReader(jr);
				entries.add(readItem(id, entry));
			}
			jr.endObject();
		}
		catch (IOException e) {
			throw new LexiconException("Could not read lexicon: "+e.getMessage(), e);
		}
		catch (JsonParseException e) {
			throw new LexiconException("Malformed lexicon json: "+e.getMessage(), e);
		}
		catch (IllegalStateException e) {
			throw new LexiconException("Malformed lexicon json: "+e.getMessage(), e);
		}
		Lexicon lex = new Lexicon(entries);
		lex.checkFeatureNames();
		return lex;
	}

	// one entry. also used for ad hoc items given as json
	public static LexicalItem readItem(String id, JsonElement entry) throws LexiconException {
		if (!entry.isJsonObject())
			throw new LexiconException("Entry "+id+" is not a json object");
		JsonObject obj = entry.getAsJsonObject();
		String pf = null;
		if (obj.has("pf") && !obj.get("pf").isJsonNull())
			pf = readString(obj.get("pf"), id, "pf");
		if (!obj.has("features") || !obj.get("features").isJsonArray())
			throw new LexiconException("Entry "+id+" needs a features array");
		List<Feature> feats = new ArrayList<Feature>();
		for (JsonElement fe : obj.getAsJsonArray("features"))
			feats.add(readFeature(id, fe));
		Denotation den = null;
		if (obj.has("sem") && !obj.get("sem").isJsonNull())
			den = readDenotation(id, obj.get("sem"), pf);
		return new LexicalItem(id, pf, feats, den);
	}

	static Feature readFeature(String id, JsonElement fe) throws LexiconException {
		if (fe.isJsonPrimitive())
			return parseFeature(readString(fe, id, "feature"));
		if (!fe.isJsonObject())
			throw new LexiconException("Entry "+id+": feature descriptor must be an object or a string");
		JsonObject fo = fe.getAsJsonObject();
		if (!fo.has("name") || !fo.has("polarity"))
			throw new LexiconException("Entry "+id+": feature descriptor needs name and polarity");
		String name = readString(fo.get("name"), id, "name");
		Polarity pol = Polarity.get(readString(fo.get("polarity"), id, "polarity"));
		boolean hm = false;
		if (fo.has("head_movement")) {
			JsonElement h = fo.get("head_movement");
			if (!h.isJsonPrimitive() || !h.getAsJsonPrimitive().isBoolean())
				throw new LexiconException("Entry "+id+": head_movement must be true or false");
			hm = h.getAsBoolean();
		}
		return new Feature(name, pol, hm);
	}

	// MG notation for a single feature
	public static Feature parseFeature(String s) throws LexiconException {
		if (s.startsWith("<="))
			return new Feature(nonEmpty(s.substring(2), s), Polarity.SELECTOR, true);
		if (s.startsWith("="))
			return new Feature(nonEmpty(s.substring(1), s), Polarity.SELECTOR);
		if (s.startsWith("~"))
			return new Feature(nonEmpty(s.substring(1), s), Polarity.SELECTEE);
		if (s.startsWith("+"))
			return new Feature(nonEmpty(s.substring(1), s), Polarity.LICENSOR);
		if (s.startsWith("-"))
			return new Feature(nonEmpty(s.substring(1), s), Polarity.LICENSEE);
		return new Feature(nonEmpty(s, s), Polarity.CATEGORY);
	}
	private static String nonEmpty(String name, String whole) throws LexiconException {
		if (name.length() == 0)
			throw new LexiconException("Feature "+whole+" has no name");
		return name;
	}

	private static Denotation readDenotation(String id, JsonElement se, String pf) throws LexiconException {
		if (!se.isJsonObject())
			throw new LexiconException("Entry "+id+": sem must be an object");
		JsonObject so = se.getAsJsonObject();
		if (!so.has("type"))
			throw new LexiconException("Entry "+id+": sem needs a type");
		Denotation.Kind kind = Denotation.Kind.get(readString(so.get("type"), id, "type"));
		String name = null;
		if (so.has("name"))
			name = readString(so.get("name"), id, "name");
		else if (kind == Denotation.Kind.ENTITY || kind == Denotation.Kind.PREDICATE)
			name = pf;
		Map<Integer, String> roles = new TreeMap<Integer, String>();
		if (so.has("roles")) {
			if (!so.get("roles").isJsonObject())
				throw new LexiconException("Entry "+id+": roles must map feature positions to role names");
			for (Map.Entry<String, JsonElement> e : so.getAsJsonObject("roles").entrySet()) {
				int idx;
				try {
					idx = Integer.parseInt(e.getKey());
				}
				catch (NumberFormatException nfe) {
					throw new LexiconException("Entry "+id+": role position "+e.getKey()+" is not a number", nfe);
				}
				roles.put(idx, readString(e.getValue(), id, "role"));
			}
		}
		return new Denotation(kind, name, roles);
	}

	static String readString(JsonElement e, String id, String field) throws LexiconException {
		if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString())
			throw new LexiconException("Entry "+id+": "+field+" must be a string");
		return e.getAsString();
	}

	// convenience for json arrays of strings
	static List<String> readStrings(JsonArray a, String id, String field) throws LexiconException {
		List<String> ret = new ArrayList<String>();
		for (JsonElement e : a)
			ret.add(readString(e, id, field));
		return ret;
	}
}
