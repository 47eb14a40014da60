package edu.isi.mgparse;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class MGParse {
	// version number. change this when updating mgparse!
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigurationException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA INPUT

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// OPTIONS REGARDING THE CONSTRAINTS

		Switch nopfsw = new Switch("nopf",
				JSAP.NO_SHORTFLAG,
				"no-pf",
				"don't constrain derivations by the PF target. The PF tokens still choose the overt items.");
		jsap.registerParameter(nopfsw);

		Switch nolfsw = new Switch("nolf",
				JSAP.NO_SHORTFLAG,
				"no-lf",
				"don't constrain derivations by the LF target. Cannot be used with --no-pf");
		jsap.registerParameter(nolfsw);

		FlaggedOption localityopt = new FlaggedOption("locality",
				StringStringParser.getParser(),
				"shortest-move",
				true,
				JSAP.NO_SHORTFLAG,
				"locality",
				"locality condition on movement, one of: "+LocalityPolicy.getList()+
				". shortest-move lets a licensor attract only the one mover with a matching licensee");
		jsap.registerParameter(localityopt);

		FlaggedOption declopt = new FlaggedOption("declroot",
				StringStringParser.getParser(),
				SentenceType.DECLARATIVE.getDefaultRoot(),
				true,
				JSAP.NO_SHORTFLAG,
				"declarative-root",
				"root category of a sentence ending in '.' when its LF names no root");
		jsap.registerParameter(declopt);

		FlaggedOption questopt = new FlaggedOption("questroot",
				StringStringParser.getParser(),
				SentenceType.QUESTION.getDefaultRoot(),
				true,
				JSAP.NO_SHORTFLAG,
				"question-root",
				"root category of a sentence ending in '?' when its LF names no root");
		jsap.registerParameter(questopt);

		// OPTIONS REGARDING THE BOUNDS

		FlaggedOption emptyopt = new FlaggedOption("empty",
				IntegerStringParser.getParser(),
				"6",
				true,
				'E',
				"empty",
				"maximum number of empty (covert) lexical items in a derivation");
		jsap.registerParameter(emptyopt);

		FlaggedOption moveopt = new FlaggedOption("movements",
				IntegerStringParser.getParser(),
				"6",
				true,
				'm',
				"movements",
				"maximum number of movements in a derivation");
		jsap.registerParameter(moveopt);

		FlaggedOption hmoveopt = new FlaggedOption("headmovements",
				IntegerStringParser.getParser(),
				"4",
				true,
				'M',
				"head-movements",
				"maximum number of head movements in a derivation");
		jsap.registerParameter(hmoveopt);

		FlaggedOption timeoutopt = new FlaggedOption("timeout",
				LongStringParser.getParser(),
				"0",
				true,
				JSAP.NO_SHORTFLAG,
				"timeout",
				"milliseconds allowed per solver call; 0 means no limit. A timed-out parse is reported as "+
				"TIMEOUT, not as a failure to parse");
		jsap.registerParameter(timeoutopt);

		// OPTIONS REGARDING THE DATA THAT IS OUTPUT

		Switch allsw = new Switch("all",
				'a',
				"all",
				"extract all parses (up to -k) instead of the first one found");
		jsap.registerParameter(allsw);

		FlaggedOption kopt = new FlaggedOption("maxparses",
				IntegerStringParser.getParser(),
				"10",
				true,
				'k',
				"max-parses",
				"with -a, stop after <maxparses> distinct derivations");
		jsap.registerParameter(kopt);

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
				"Print timing information to stderr at a variety of levels: 0+ for "+
				"total operation, 1+ for each parse stage, 2+ for each solver call");
		jsap.registerParameter(timeopt);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA OUTPUT

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write derivations to. If absent, writing is done "+
					"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption lexopt = new UnflaggedOption("lexicon",
				FileStringParser.getParser(),
				null,
				true,
				false,
				"lexicon json file: an object from item identifier to pf, features and sem");
		jsap.registerParameter(lexopt);

		UnflaggedOption corpusopt = new UnflaggedOption("corpus",
				FileStringParser.getParser(),
				null,
				true,
				false,
				"corpus json file: an object whose input_sequence lists interface conditions, each with a PF "+
				"and/or an LF");
		jsap.registerParameter(corpusopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success()) {
			if (config.getBoolean("nopf") && config.getBoolean("nolf"))
				throw new ConfigurationException("Cannot use --no-pf with --no-lf");
			if (config.getInt("maxparses") < 1)
				throw new ConfigurationException("-k must be positive");
			if (config.getInt("empty") < 0 || config.getInt("movements") < 0 || config.getInt("headmovements") < 0)
				throw new ConfigurationException("Bounds (-E, -m, -M) cannot be negative");
		}
		return config;
	}

	// toggles from a successful parameter parse
	static ParseOptions getOptions(JSAPResult config) throws ConfigurationException {
		return new ParseOptions().
			setIncludePF(!config.getBoolean("nopf")).
			setIncludeLF(!config.getBoolean("nolf")).
			setExtractAll(config.getBoolean("all")).
			setMaxParses(config.getInt("maxparses")).
			setTimeoutMillis(config.getLong("timeout")).
			setLocality(LocalityPolicy.get(config.getString("locality"))).
			setSentenceRoot(SentenceType.DECLARATIVE, config.getString("declroot")).
			setSentenceRoot(SentenceType.QUESTION, config.getString("questroot"));
	}

	static BoundParameters getBounds(JSAPResult config) throws ConfigurationException {
		return new BoundParameters(config.getInt("empty"), config.getInt("movements"), config.getInt("headmovements"));
	}

	// a condition without the target a toggle asks for is parsed without that family
	static ParseOptions fitTo(ParseOptions options, InterfaceCondition ic) {
		ParseOptions ret = new ParseOptions().
			setIncludePF(options.includePF() && ic.hasPf()).
			setIncludeLF(options.includeLF() && ic.hasLf()).
			setExtractAll(options.extractAll()).
			setMaxParses(options.getMaxParses()).
			setTimeoutMillis(options.getTimeoutMillis()).
			setLocality(options.getLocality());
		for (SentenceType t : SentenceType.values())
			ret.setSentenceRoot(t, options.getSentenceRoot(t));
		return ret;
	}

	// write the results of one interface condition
	static void report(Writer w, int num, ParseResult result) throws IOException {
		w.write("# "+num+": "+result.getInterfaceCondition()+"\n");
		w.write(result.getStatus()+"\n");
		int i = 0;
		for (Derivation d : result.getDerivations()) {
			i++;
			w.write("## derivation "+i+"\n");
			w.write(d.report());
		}
		if (result.getDerivations().size() > 1 && result.getStoppedBy() == SolveStatus.SAT)
			w.write("(stopped at "+result.getDerivations().size()+" derivations)\n");
		if (result.getDerivations().size() > 0 && result.getStoppedBy() == SolveStatus.TIMEOUT)
			w.write("(enumeration timed out)\n");
		w.write("\n");
		w.flush();
	}

	private static BufferedReader open(File f, String encoding) throws FileNotFoundException, IOException {
		boolean debug = false;
		if (debug) Debug.debug(debug, "Reading from "+f.getName());
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	public static void main(String argv[]) throws Exception {
		boolean debug = false;

		Debug.prettyDebug("This is MGParse, version "+VERSION);

		Date startTime = new Date();
		// parameter processor and configuration settings
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		ParseOptions options = null;
		BoundParameters bounds = null;
		File outfile = null;

		// 1) Set up all parameters. Die on bad combinations.

		try {
			config = processParameters(jsap, argv);
			if (config.success()) {
				encoding = config.getString("encoding");
				Debug.setEncoding(encoding);
				if (config.contains("time"))
					Debug.setDbLevel(config.getInt("time"));
				options = getOptions(config);
				bounds = getBounds(config);
				outfile = config.getFile("outfile");
			}
		}
		catch (JSAPException e) {
			System.err.println("MGParse options improperly configured: "+e.getMessage());
			System.err.println("Try 'mgparse -h` for a detailed help message");
			System.exit(1);
		}
		catch (ConfigurationException e) {
			System.err.println("MGParse options improperly configured: "+e.getMessage());
			System.err.println("Try 'mgparse -h` for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: mgparse ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator();
			errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: mgparse ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		// 2) Read the lexicon and the corpus

		Lexicon lexicon = null;
		Corpus corpus = null;
		try {
			Date preLoadTime = new Date();
			BufferedReader lbr = open(config.getFile("lexicon"), encoding);
			try {
				lexicon = Lexicon.read(lbr);
			}
			finally {
				lbr.close();
			}
			BufferedReader cbr = open(config.getFile("corpus"), encoding);
			try {
				corpus = Corpus.read(cbr);
			}
			finally {
				cbr.close();
			}
			Debug.dbtime(1, preLoadTime, "read "+lexicon.size()+" items and "+corpus.size()+" interface conditions");
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			System.exit(1);
		}
		catch (LexiconException e) {
			System.err.println("Invalid lexicon: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading corpus: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			System.exit(1);
		}

		// 3) Parse each interface condition and write what was found

		Writer w = null;
		try {
			if (outfile != null)
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			else
				w = new OutputStreamWriter(System.out, encoding);
			List<InterfaceCondition> ics = corpus.getInputSequence();
			int sat = 0;
			for (int i = 0; i < ics.size(); i++) {
				InterfaceCondition ic = ics.get(i);
				if (debug) Debug.debug(debug, "Parsing "+ic);
				ParseResult result = MGParser.parse(lexicon, ic, fitTo(options, ic), bounds);
				if (result.isSat())
					sat++;
				report(w, i+1, result);
			}
			w.close();
			Debug.prettyDebug(sat+" of "+ics.size()+" interface conditions have a derivation");
			Debug.dbtime(0, startTime, "total operation");
		}
		catch (FileNotFoundException e) {
			System.err.println("Output file could not be opened: "+e.getMessage());
			System.exit(1);
		}
		catch (ConfigurationException e) {
			System.err.println("Options do not fit the corpus: "+e.getMessage());
			System.exit(1);
		}
		catch (LexiconException e) {
			System.err.println("Lexicon cannot host the corpus: "+e.getMessage());
			System.exit(1);
		}
		catch (BoundExceededException e) {
			System.err.println("Bounds too large for the parser: "+e.getMessage());
			System.exit(1);
		}
		catch (Exception e) {
			System.err.println("Throwing generic exception of type "+e.getClass().toString());
			StackTraceElement elements[] = e.getStackTrace();
			int n = elements.length;
			for (int i = 0; i < n; i++) {
				System.err.println(e.toString()+": "+elements[i].getFileName() + ":"
						+ elements[i].getLineNumber()
						+ ">> "
						+ elements[i].getMethodName() + "()");
			}
			System.exit(-1);
		}
	}
}
