package migo.trans.passes.simplify;

import migo.model.Program;

/**
 * Neutralises every call or spawn whose target is not a function of the program.
 */
public interface DeadCallRemoval {
	void remove(Program program);
}
