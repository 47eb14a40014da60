package edu.isi.mgparse;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * An assembled constraint problem over one {@link DerivationSchema} and one
 * interface condition. Owned by exactly one solver session; not thread safe.
 *
 * Variables are indexed by slot or by flat node index. Arrays of optional
 * variables hold null where the schema rules the variable out statically.
 */
public class Formula {
	final DerivationSchema schema;
	final InterfaceCondition ic;
	final ParseOptions options;
	final Model model;

	final BoolVar TRUE;
	final BoolVar FALSE;
	final IntVar ZERO;

	// per slot
	IntVar[] item;
	BoolVar[] used;
	// receives a head by head movement / its head moved away
	BoolVar[] receives;
	BoolVar[] headMoved;

	// per node
	IntVar[] type;
	IntVar[] code;
	IntVar[] partner;
	IntVar[] time;
	BoolVar[] active;
	// slot of the partner; only for nodes that can be probes
	IntVar[] partnerSlot;
	BoolVar[] isSelector;
	BoolVar[] isLicensor;
	BoolVar[] isSelectee;
	BoolVar[] isLicensee;
	BoolVar[] isCategory;

	// inside[a][b][k]: slot k is part of slot a's projection once feature b of a is checked.
	// inside[a][b] may alias inside[a][b-1] when node (a,b) cannot be a selector
	BoolVar[][][] inside;
	// partnerIs[v][k]: node v's partner lies in slot k (selector-capable nodes only)
	BoolVar[][] partnerIs;

	// PF spans, present when PF constraints are assembled. land spans are per node
	IntVar[] pfLo, pfHi, headLo, headHi, maxLo, maxHi, landLo, landHi;

	// LF, present when LF constraints are assembled. one extra entry (constant 0) for "no complement"
	IntVar[] event, referent;
	IntVar[] factCodes;

	Formula(DerivationSchema schema, InterfaceCondition ic, ParseOptions options) {
		this.schema = schema;
		this.ic = ic;
		this.options = options;
		model = new Model("mg-derivation");
		TRUE = model.boolVar(true);
		FALSE = model.boolVar(false);
		ZERO = model.intVar(0);
	}

	public Model getModel() { return model; }
	public DerivationSchema getSchema() { return schema; }
	public InterfaceCondition getInterfaceCondition() { return ic; }
	public ParseOptions getOptions() { return options; }

	public IntVar[] getItemVars() { return item; }
	public IntVar[] getPartnerVars() { return partner; }
	public IntVar[] getTimeVars() { return time; }
	public IntVar[] getCodeVars() { return code; }
	public BoolVar[] getLicensorVars() { return isLicensor; }
	public BoolVar[] getLicenseeVars() { return isLicensee; }
	public BoolVar[][][] getInsideVars() { return inside; }

	// variables that determine the derivation a model stands for: lexical choice and checking pairs
	public IntVar[] projection() {
		IntVar[] ret = new IntVar[item.length+partner.length];
		System.arraycopy(item, 0, ret, 0, item.length);
		System.arraycopy(partner, 0, ret, item.length, partner.length);
		return ret;
	}

	public String toString() {
		return "Formula over "+schema.numSlots()+" slots: "+model.getNbVars()+" variables, "+
			model.getNbCstrs()+" constraints";
	}
}
