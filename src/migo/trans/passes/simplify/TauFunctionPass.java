package migo.trans.passes.simplify;

import migo.MigoOptions;
import migo.model.Function;
import migo.model.Program;
import migo.model.stmt.Statement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Tau-function reduction.
 *
 * A function reduces to tau when each of its statements is tau, a call or
 * spawn of a function that reduces to tau, or a branch whose arms both
 * reduce to tau. An empty function reduces to tau. The set is grown until it
 * no longer changes, so a function that only calls itself is kept.
 */
public class TauFunctionPass implements TauFunctionReduction {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".TauFunctionPass");

	public static Set<String> findTauFunctions(Program program, TauFunctionExclusion exclusion) {
		Set<String> tauFunctions = new LinkedHashSet<>();
		StatementTauEquivalenceVisitor visitor = new StatementTauEquivalenceVisitor(tauFunctions);
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Function f : program.getFunctions()) {
				if (tauFunctions.contains(f.getName()) || exclusion.isExcluded(f)) {
					continue;
				}
				if (visitor.allTau(f.getStatements())) {
					tauFunctions.add(f.getName());
					changed = true;
				}
			}
		}
		return tauFunctions;
	}

	@Override
	public void reduce(Program program, TauFunctionExclusion exclusion) {
		Set<String> tauFunctions = findTauFunctions(program, exclusion);
		if (tauFunctions.isEmpty()) {
			return;
		}
		for (Function f : program.getFunctions()) {
			if (tauFunctions.contains(f.getName())) {
				continue;
			}
			StatementCallRewriteVisitor rewriter = new StatementCallRewriteVisitor(tauFunctions::contains);
			List<Statement> statements = rewriter.rewriteAll(f.getStatements());
			if (rewriter.getRewritten() > 0) {
				logger.fine("rewrote " + rewriter.getRewritten() + " call(s) to tau in " + f.getName());
				f.setStatements(statements);
			}
		}
		for (String name : tauFunctions) {
			logger.fine("removing tau function " + name);
		}
		program.removeFunctions(tauFunctions);
	}
}
