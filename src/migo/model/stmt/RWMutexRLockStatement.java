package migo.model.stmt;

import migo.util.SourceLocation;

/**
 * Acquires a read-write mutex in shared mode.
 */
public class RWMutexRLockStatement extends LabelledStatement {

	public RWMutexRLockStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
