package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Sends on the channel with the given label.
 */
public class SendStatement extends LabelledStatement {

	public SendStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
