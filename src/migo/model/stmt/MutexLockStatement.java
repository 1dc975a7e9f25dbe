package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Acquires a mutex exclusively.
 */
public class MutexLockStatement extends LabelledStatement {

	public MutexLockStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
