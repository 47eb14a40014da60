package edu.isi.mgparse;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The parse operation: lexicon, interface condition, extra items, toggles and
 * bounds in; zero, one or many derivations out. Each call builds its own schema,
 * formula and solver session, so independent calls may run on different threads.
 */
public class MGParser {

	public static ParseResult parse(Lexicon lexicon, InterfaceCondition ic, ParseOptions options, BoundParameters bounds)
	throws ConfigurationException, LexiconException, BoundExceededException {
		return parse(lexicon, ic, null, options, bounds);
	}

	/**
	 * @param extras ad hoc items added to the relevant lexicon; may be null
	 * @throws ConfigurationException on toggles that do not fit the interface condition
	 * @throws LexiconException if a PF token has no lexical item, or extras clash with the lexicon
	 * @throws BoundExceededException if the schema would exceed its capacity
	 */
	public static ParseResult parse(Lexicon lexicon, InterfaceCondition ic, List<LexicalItem> extras,
			ParseOptions options, BoundParameters bounds)
	throws ConfigurationException, LexiconException, BoundExceededException {
		boolean debug = false;
		options.validate(ic);
		Date start = new Date();
		// without a PF target, one overt slot per name of the LF
		boolean pfWords = ic.hasPf();
		List<String> words = pfWords ? ic.getPf() : ic.getLf().words();
		Lexicon relevant = lexicon.relevantTo(pfWords ? words : null, extras);
		DerivationSchema schema = new DerivationSchema(relevant, words, pfWords, bounds);
		Debug.dbtime(1, start, "built schema");
		if (debug) Debug.debug(debug, schema.toString());

		Date preAssemble = new Date();
		Formula formula = new ConstraintAssembler(options).assemble(schema, ic);
		Debug.dbtime(1, preAssemble, "assembled formula");
		DerivationExtractor extractor = new DerivationExtractor(schema, ic, options);
		SolverSession session = new SolverSession(formula, options.getTimeoutMillis());
		try {
			List<Derivation> found = new ArrayList<Derivation>();
			Date preSolve = new Date();
			if (!options.extractAll()) {
				SolveResult r = session.solveOne();
				Debug.dbtime(1, preSolve, "solved: "+r.getStatus());
				if (r.getStatus() == SolveStatus.SAT)
					found.add(extractor.extract(r.getAssignment()));
				return new ParseResult(ic, r.getStatus(), r.getStatus(), found);
			}
			SolverSession.ModelIterator models = session.solveAll(options.getMaxParses());
			Set<String> keys = new HashSet<String>();
			while (models.hasNext()) {
				Derivation d = extractor.extract(models.next());
				if (keys.add(d.canonicalKey()))
					found.add(d);
				else if (debug) Debug.debug(debug, "Duplicate derivation "+d.canonicalKey());
			}
			Debug.dbtime(1, preSolve, "enumerated "+found.size()+" derivations, stopped by "+models.getStatus());
			SolveStatus status = found.isEmpty() ? models.getStatus() : SolveStatus.SAT;
			return new ParseResult(ic, status, models.getStatus(), found);
		}
		finally {
			session.close();
			Debug.dbtime(1, start, "parse of "+ic);
		}
	}
}
