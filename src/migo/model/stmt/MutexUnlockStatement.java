package migo.model.stmt;

import migo.util.SourceLocation;

public class MutexUnlockStatement extends LabelledStatement {

	public MutexUnlockStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
