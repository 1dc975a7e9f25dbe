package migo.formatters;

import migo.model.Function;
import migo.model.Properties;
import migo.model.stmt.Statement;
import migo.model.stmt.TauStatement;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Renders a function definition. The function is not modified: an empty
 * body is rendered as a single tau.
 */
public class FunctionFormatter {

	private final IndentingWriter out;

	public FunctionFormatter(IndentingWriter out) {
		this.out = out;
	}

	private List<Statement> body(Function f) {
		if (f.isEmpty()) {
			return Collections.singletonList(new TauStatement());
		}
		return f.getStatements();
	}

	private void writeHeader(Function f) throws IOException {
		out.write("def ");
		out.write(f.getSimpleName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, f.getParams(), p -> out.write(p.getCallee().getName()));
		out.write("):");
		out.newLine();
	}

	private void writeStatement(Statement stmt) throws IOException {
		stmt.accept(new StatementFormattingVisitor(out));
		out.write(";");
		out.newLine();
	}

	private void writeProperties(List<String> props) throws IOException {
		for (String prop : props) {
			out.write(prop);
			out.newLine();
		}
	}

	public void format(Function f) throws IOException {
		writeHeader(f);
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Statement stmt : body(f)) {
				writeStatement(stmt);
			}
		}
	}

	/**
	 * Renders the function with the annotations of its own line before the
	 * header and the annotations of each top-level statement's line before
	 * that statement. Rendered annotations are consumed from props.
	 */
	public void formatWithProperties(Function f, Properties props) throws IOException {
		writeProperties(props.getProperties(f.getLocation()));
		writeHeader(f);
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Statement stmt : body(f)) {
				writeProperties(props.getProperties(stmt.getLocation()));
				writeStatement(stmt);
			}
		}
	}
}
