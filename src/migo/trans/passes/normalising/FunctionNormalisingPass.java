package migo.trans.passes.normalising;

import migo.model.Function;
import migo.model.stmt.TauStatement;

/**
 * Makes every function well formed for rendering: an empty body becomes a
 * single tau.
 */
public class FunctionNormalisingPass {

	private FunctionNormalisingPass() {}

	public static Function perform(Function f) {
		if (f.isEmpty()) {
			f.addStatements(new TauStatement());
		}
		return f;
	}
}
