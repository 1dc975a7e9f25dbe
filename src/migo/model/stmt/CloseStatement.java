package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Closes a channel.
 */
public class CloseStatement extends LabelledStatement {

	public CloseStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
