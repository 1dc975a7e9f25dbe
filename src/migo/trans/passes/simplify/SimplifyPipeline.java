package migo.trans.passes.simplify;

import migo.MigoOptions;
import migo.model.Function;
import migo.model.Program;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Shrinks a program before it is emitted.
 *
 * With a root function: tau-function reduction sparing the root, then removal
 * of functions the root cannot reach. Without one: tau-function reduction of
 * every function, and nothing is removed for being unreachable. Dead-call
 * removal always runs last, since the earlier steps delete functions and so
 * leave calls dangling.
 */
public class SimplifyPipeline {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".SimplifyPipeline");

	private final String rootName;
	private final TauFunctionReduction tauFunctionReduction;
	private final UnusedFunctionRemoval unusedFunctionRemoval;
	private final DeadCallRemoval deadCallRemoval;

	public SimplifyPipeline(String rootName, TauFunctionReduction tauFunctionReduction,
	                        UnusedFunctionRemoval unusedFunctionRemoval, DeadCallRemoval deadCallRemoval) {
		this.rootName = rootName;
		this.tauFunctionReduction = tauFunctionReduction;
		this.unusedFunctionRemoval = unusedFunctionRemoval;
		this.deadCallRemoval = deadCallRemoval;
	}

	public static SimplifyPipeline standard(String rootName) {
		return new SimplifyPipeline(rootName, new TauFunctionPass(), new UnusedFunctionPass(), new DeadCallPass());
	}

	public String getRootName() {
		return rootName;
	}

	public Program perform(Program program) {
		Optional<Function> root = program.getFunction(rootName);
		if (root.isPresent()) {
			logger.info("Reducing tau functions except " + rootName);
			tauFunctionReduction.reduce(program, TauFunctionExclusion.except(root.get()));
			logger.info("Removing functions unreachable from " + rootName);
			unusedFunctionRemoval.remove(program, root.get());
		} else {
			logger.info("Reducing tau functions");
			tauFunctionReduction.reduce(program, TauFunctionExclusion.none());
		}
		logger.info("Removing dead calls");
		deadCallRemoval.remove(program);
		return program;
	}
}
