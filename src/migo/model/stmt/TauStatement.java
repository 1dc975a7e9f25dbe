package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Inaction.
 */
public class TauStatement extends Statement {

	public TauStatement() {
		super(SourceLocation.noPosition());
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TauStatement;
	}
}
