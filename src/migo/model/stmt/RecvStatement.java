package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Receives from the channel with the given label.
 */
public class RecvStatement extends LabelledStatement {

	public RecvStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
