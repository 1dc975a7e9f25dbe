package migo.formatters;

import migo.Unreachable;
import migo.errors.IssueContext;
import migo.model.Function;
import migo.model.Program;
import migo.model.Properties;
import migo.trans.passes.normalising.FunctionNormalisingPass;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Entry points for rendering IR to text.
 *
 * Rendering a single function, or a program with annotations, first
 * normalises the functions involved: an empty function gains a tau statement.
 */
public class MigoFormatter {

	private MigoFormatter() {}

	private interface Rendering {
		void render(IndentingWriter out) throws IOException;
	}

	private static String render(Rendering rendering) {
		StringWriter w = new StringWriter();
		try {
			rendering.render(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public static String format(Function f) {
		FunctionNormalisingPass.perform(f);
		return render(out -> new FunctionFormatter(out).format(f));
	}

	public static String format(Program program) {
		return render(out -> new ProgramFormatter(out).format(program));
	}

	public static String formatWithProperties(IssueContext ctx, Program program, Properties props,
	                                          String rootName, List<String> excludedPrefixes) {
		for (Function f : ProgramFormatter.annotatedRenderOrder(program, rootName, excludedPrefixes)) {
			FunctionNormalisingPass.perform(f);
		}
		return render(out -> new ProgramFormatter(out)
				.formatWithProperties(ctx, program, props, rootName, excludedPrefixes));
	}
}
