package migo.model.stmt;

import migo.util.SourceLocation;

public class MemWriteStatement extends LabelledStatement {

	public MemWriteStatement(SourceLocation location, String label) {
		super(location, label);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
