package migo.model.stmt;

import migo.Unreachable;
import migo.formatters.IndentingWriter;
import migo.formatters.StatementFormattingVisitor;
import migo.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A statement of the calculus.
 *
 * The family is closed: every consumer handles each variant through
 * {@link StatementVisitor}, so a new variant cannot be added without
 * updating all of them.
 */
public abstract class Statement {

	private final SourceLocation location;

	Statement(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new StatementFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
