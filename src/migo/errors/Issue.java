package migo.errors;

import migo.Unreachable;
import migo.formatters.IndentingWriter;
import migo.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found by a pass, reported to an {@link IssueContext} rather than
 * thrown, so that a pass can report several before the driver stops.
 */
public abstract class Issue {

	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getMessage();
	}
}
