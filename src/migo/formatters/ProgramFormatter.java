package migo.formatters;

import migo.errors.IssueContext;
import migo.model.Function;
import migo.model.Program;
import migo.model.Properties;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class ProgramFormatter {

	private final FunctionFormatter functionFormatter;

	public ProgramFormatter(IndentingWriter out) {
		this.functionFormatter = new FunctionFormatter(out);
	}

	/**
	 * Renders every non-empty function in registration order.
	 */
	public void format(Program program) throws IOException {
		for (Function f : program.getFunctions()) {
			if (!f.isEmpty()) {
				functionFormatter.format(f);
			}
		}
	}

	private static boolean isExcluded(Function f, List<String> excludedPrefixes) {
		String simpleName = f.getSimpleName();
		for (String prefix : excludedPrefixes) {
			if (simpleName.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * The functions rendered by {@link #formatWithProperties}, in order: the
	 * root function if present, then every other function whose simple name
	 * does not start with one of excludedPrefixes.
	 */
	public static List<Function> annotatedRenderOrder(Program program, String rootName,
	                                                  List<String> excludedPrefixes) {
		List<Function> order = new ArrayList<>();
		program.getFunction(rootName).ifPresent(order::add);
		String rootSimpleName = NameFilter.filter(rootName);
		for (Function f : program.getFunctions()) {
			if (!f.getSimpleName().equals(rootSimpleName) && !isExcluded(f, excludedPrefixes)) {
				order.add(f);
			}
		}
		return order;
	}

	/**
	 * Renders the functions of {@link #annotatedRenderOrder}, interleaving
	 * the annotations in props.
	 *
	 * Annotations left in props afterwards are reported to ctx and removed.
	 */
	public void formatWithProperties(IssueContext ctx, Program program, Properties props, String rootName,
	                                 List<String> excludedPrefixes) throws IOException {
		if (!program.hasFunction(rootName)) {
			ctx.error(new RootFunctionNotFoundIssue(rootName));
		}
		for (Function f : annotatedRenderOrder(program, rootName, excludedPrefixes)) {
			functionFormatter.formatWithProperties(f, props);
		}
		if (!props.isEmpty()) {
			ctx.error(new UnconsumedPropertiesIssue(props.drainRemaining()));
		}
	}
}
