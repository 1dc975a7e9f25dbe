package migo.trans.passes.simplify;

import migo.model.Function;
import migo.model.Program;

/**
 * Deletes every function that root cannot reach through call and spawn edges.
 */
public interface UnusedFunctionRemoval {
	void remove(Program program, Function root);
}
