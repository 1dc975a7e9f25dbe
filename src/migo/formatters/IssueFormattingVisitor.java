package migo.formatters;

import migo.errors.IssueVisitor;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(UnconsumedPropertiesIssue unconsumedPropertiesIssue) throws IOException {
		out.write("unable to find target location of properties:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Map.Entry<Integer, List<String>> entry : unconsumedPropertiesIssue.getUnconsumed().entrySet()) {
				for (String prop : entry.getValue()) {
					out.newLine();
					out.write("line ");
					out.write(Integer.toString(entry.getKey()));
					out.write(": ");
					out.write(prop);
				}
			}
		}
		return null;
	}

	@Override
	public Void visit(RootFunctionNotFoundIssue rootFunctionNotFoundIssue) throws IOException {
		out.write("root function ");
		out.write(rootFunctionNotFoundIssue.getRootName());
		out.write(" not found in program");
		return null;
	}
}
