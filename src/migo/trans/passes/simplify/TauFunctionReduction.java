package migo.trans.passes.simplify;

import migo.model.Program;

/**
 * Deletes every function whose behaviour is equivalent to inaction and
 * rewrites each call or spawn of such a function into tau.
 */
public interface TauFunctionReduction {
	void reduce(Program program, TauFunctionExclusion exclusion);
}
