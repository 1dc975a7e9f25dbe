package migo.model.stmt;

import migo.model.NamedVar;
import migo.util.SourceLocation;

public class NewMutexStatement extends DeclarationStatement {

	public NewMutexStatement(SourceLocation location, NamedVar name) {
		super(location, name);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
