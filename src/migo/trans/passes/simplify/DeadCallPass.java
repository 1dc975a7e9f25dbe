package migo.trans.passes.simplify;

import migo.MigoOptions;
import migo.model.Function;
import migo.model.Program;
import migo.model.stmt.Statement;

import java.util.List;
import java.util.logging.Logger;

/**
 * Dead-call removal: a call or spawn of a function missing from the program
 * becomes tau.
 */
public class DeadCallPass implements DeadCallRemoval {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".DeadCallPass");

	@Override
	public void remove(Program program) {
		for (Function f : program.getFunctions()) {
			StatementCallRewriteVisitor rewriter = new StatementCallRewriteVisitor(name -> !program.hasFunction(name));
			List<Statement> statements = rewriter.rewriteAll(f.getStatements());
			if (rewriter.getRewritten() > 0) {
				logger.fine("neutralised " + rewriter.getRewritten() + " dead call(s) in " + f.getName());
				f.setStatements(statements);
			}
		}
	}
}
