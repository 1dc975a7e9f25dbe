package migo;

import migo.errors.TopLevelIssueContext;
import migo.formatters.MigoFormatter;
import migo.model.Program;
import migo.model.Properties;
import migo.trans.MigoTransException;
import migo.trans.passes.comm.CommunicationReachabilityPass;
import migo.trans.passes.simplify.SimplifyPipeline;

import java.util.ArrayList;
import java.util.logging.Logger;

/**
 * Turns a Program built by an extractor into its textual form: communication
 * analysis from the root, simplification, then rendering.
 */
public class MigoEmitter {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".MigoEmitter");

	private final MigoOptions options;

	public MigoEmitter(MigoOptions options) {
		this.options = options;
		options.configure();
	}

	private void prepare(Program program) {
		program.getFunction(options.getRoot()).ifPresent(root -> {
			logger.info("Analysing communication from " + root.getName());
			CommunicationReachabilityPass.perform(program, root);
		});
		if (options.shouldSimplify()) {
			SimplifyPipeline.standard(options.getRoot()).perform(program);
		}
	}

	private static void checkErrors(TopLevelIssueContext ctx) {
		if (ctx.hasErrors()) {
			String report = ctx.format();
			logger.severe(report);
			throw new MigoTransException(report, new ArrayList<>(ctx.getIssues()));
		}
	}

	public String emit(Program program) {
		prepare(program);
		logger.info("Formatting program");
		return MigoFormatter.format(program);
	}

	/**
	 * Emits the program with annotations interleaved. Every annotation must
	 * land on a rendered function or statement.
	 *
	 * @throws MigoTransException if the root function is missing or some
	 * annotations were not consumed
	 */
	public String emit(Program program, Properties props) {
		prepare(program);
		logger.info("Formatting program with properties");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String formatted = MigoFormatter.formatWithProperties(
				ctx, program, props, options.getRoot(), options.getExcludedPrefixes());
		checkErrors(ctx);
		return formatted;
	}
}
