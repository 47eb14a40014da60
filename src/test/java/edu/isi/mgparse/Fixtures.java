package edu.isi.mgparse;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import com.google.gson.JsonParser;

// lexicons and targets shared by the tests
class Fixtures {

	static Reader resource(String name) throws Exception {
		InputStream is = Fixtures.class.getResourceAsStream("/"+name);
		if (is == null)
			throw new IllegalArgumentException("No test resource "+name);
		return new InputStreamReader(is, "utf-8");
	}

	static Lexicon lexicon(String name) throws Exception {
		Reader r = resource(name);
		try {
			return Lexicon.read(r);
		}
		finally {
			r.close();
		}
	}

	static Lexicon lexiconFromString(String json) throws LexiconException {
		return Lexicon.read(new StringReader(json));
	}

	static Lexicon relclause() throws Exception { return lexicon("relclause-lexicon.json"); }
	static Lexicon headMovement() throws Exception { return lexicon("hm-lexicon.json"); }
	static Lexicon ambiguous() throws Exception { return lexicon("ambiguous-lexicon.json"); }
	static Lexicon sentenceTypes() throws Exception { return lexicon("sentence-type-lexicon.json"); }

	// two wh movers under one head that attracts both
	static Lexicon twoMovers() throws LexiconException {
		return lexiconFromString(
				"{\"a\": {\"pf\": \"a\", \"features\": [\"~D\", \"-wh\"]}, " +
				"\"b\": {\"pf\": \"b\", \"features\": [\"~D\", \"-wh\"]}, " +
				"\"v\": {\"pf\": \"v\", \"features\": [\"=D\", \"=D\", \"~V\"]}, " +
				"\"C\": {\"features\": [\"=V\", \"+wh\", \"+wh\", \"C\"]}}");
	}

	static InterfaceCondition condition(String json) throws DataFormatException {
		return InterfaceCondition.fromJson(JsonParser.parseString(json));
	}

	static Set<LFFact> relclauseFacts() {
		Set<LFFact> facts = new LinkedHashSet<LFFact>();
		facts.add(new LFFact("fears", "subj", "John"));
		facts.add(new LFFact("fears", "obj", "everyone"));
		facts.add(new LFFact("knows", "subj", "who"));
		facts.add(new LFFact("knows", "obj", "her"));
		return facts;
	}

	static InterfaceCondition relclauseCondition() {
		return new InterfaceCondition(
				InterfaceCondition.tokenize("John fears everyone who knows her"),
				new LogicalForm(relclauseFacts(), "C", null));
	}

	static InterfaceCondition pfOnly(String... words) {
		return new InterfaceCondition(Arrays.asList(words), null);
	}

	// the schema and formula MGParser would build for ic
	static Formula formula(Lexicon lex, InterfaceCondition ic, ParseOptions options, BoundParameters bounds)
	throws Exception {
		boolean pfWords = ic.hasPf();
		java.util.List<String> words = pfWords ? ic.getPf() : ic.getLf().words();
		DerivationSchema schema = new DerivationSchema(lex.relevantTo(pfWords ? words : null, null), words, pfWords, bounds);
		return new ConstraintAssembler(options).assemble(schema, ic);
	}

	static BoundParameters bounds(int empty, int movements, int headMovements) throws ConfigurationException {
		return new BoundParameters(empty, movements, headMovements);
	}
}
