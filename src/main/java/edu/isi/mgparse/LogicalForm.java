package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * LF target of an interface condition: a set of predicate-argument facts, an
 * optional root category, optional category restrictions on overt words, and
 * agreement relations between overt words.
 *
 * Json form:
 * <pre>
 * {"root": "C",
 *  "relations": [{"pred": "fears", "subj": "John", "obj": "everyone"}],
 *  "categories": {"John": "D"},
 *  "agree": [{"pred": "fears", "subj": "John"}]}
 * </pre>
 * Every key of a relation other than "pred" is a role.
 */
public class LogicalForm {
	private final Set<LFFact> facts;
	private final String root;
	private final Map<String, String> categories;
	private final Set<Agreement> agreements;

	public LogicalForm(Set<LFFact> facts, String root, Map<String, String> categories, Set<Agreement> agreements) {
		this.facts = Collections.unmodifiableSet(new LinkedHashSet<LFFact>(facts));
		this.root = root;
		this.categories = Collections.unmodifiableMap(categories == null ?
				new LinkedHashMap<String, String>() : new LinkedHashMap<String, String>(categories));
		this.agreements = Collections.unmodifiableSet(agreements == null ?
				new LinkedHashSet<Agreement>() : new LinkedHashSet<Agreement>(agreements));
	}
	public LogicalForm(Set<LFFact> facts, String root, Map<String, String> categories) {
		this(facts, root, categories, null);
	}
	public LogicalForm(Set<LFFact> facts) {
		this(facts, null, null);
	}

	public Set<LFFact> getFacts() { return facts; }
	public String getRoot() { return root; }
	public Map<String, String> getCategories() { return categories; }
	public Set<Agreement> getAgreements() { return agreements; }

	// predicate, argument and agreeing names in order of first mention
	public List<String> words() {
		Set<String> ret = new LinkedHashSet<String>();
		for (LFFact f : facts) {
			ret.add(f.getPred());
			ret.add(f.getArg());
		}
		for (Agreement a : agreements) {
			ret.add(a.getPred());
			ret.add(a.getSubj());
		}
		return new ArrayList<String>(ret);
	}

	public static LogicalForm fromJson(JsonElement e) throws DataFormatException {
		if (!e.isJsonObject())
			throw new DataFormatException("LF must be a json object");
		JsonObject o = e.getAsJsonObject();
		Set<LFFact> facts = new LinkedHashSet<LFFact>();
		if (o.has("relations")) {
			if (!o.get("relations").isJsonArray())
				throw new DataFormatException("LF relations must be an array");
			for (JsonElement re : o.getAsJsonArray("relations")) {
				if (!re.isJsonObject())
					throw new DataFormatException("LF relation must be an object: "+re);
				JsonObject ro = re.getAsJsonObject();
				String pred = string(ro.get("pred"), "pred");
				int roles = 0;
				for (Map.Entry<String, JsonElement> entry : ro.entrySet()) {
					if (entry.getKey().equals("pred"))
						continue;
					facts.add(new LFFact(pred, entry.getKey(), string(entry.getValue(), entry.getKey())));
					roles++;
				}
				if (roles == 0)
					throw new DataFormatException("LF relation for "+pred+" names no role");
			}
		}
		String root = null;
		if (o.has("root"))
			root = string(o.get("root"), "root");
		Map<String, String> cats = new LinkedHashMap<String, String>();
		if (o.has("categories")) {
			if (!o.get("categories").isJsonObject())
				throw new DataFormatException("LF categories must map words to categories");
			for (Map.Entry<String, JsonElement> entry : o.getAsJsonObject("categories").entrySet())
				cats.put(entry.getKey(), string(entry.getValue(), entry.getKey()));
		}
		Set<Agreement> agree = new LinkedHashSet<Agreement>();
		if (o.has("agree")) {
			if (!o.get("agree").isJsonArray())
				throw new DataFormatException("LF agree must be an array");
			for (JsonElement ae : o.getAsJsonArray("agree")) {
				if (!ae.isJsonObject())
					throw new DataFormatException("LF agreement must be an object: "+ae);
				JsonObject ao = ae.getAsJsonObject();
				agree.add(new Agreement(string(ao.get("pred"), "agree pred"), string(ao.get("subj"), "agree subj")));
			}
		}
		return new LogicalForm(facts, root, cats, agree);
	}

	static String string(JsonElement e, String field) throws DataFormatException {
		if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString())
			throw new DataFormatException("Expected a string for "+field);
		return e.getAsString();
	}

	public String toString() {
		StringBuffer sb = new StringBuffer(facts.toString());
		if (root != null)
			sb.append(" root="+root);
		if (!categories.isEmpty())
			sb.append(" categories="+categories);
		for (Agreement a : agreements)
			sb.append(" "+a);
		return sb.toString();
	}
}
