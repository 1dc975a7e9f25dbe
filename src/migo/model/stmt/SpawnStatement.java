package migo.model.stmt;

import migo.model.Parameter;
import migo.util.SourceLocation;

import java.util.List;

/**
 * Start of a new concurrently running task executing the named function.
 */
public class SpawnStatement extends InvocationStatement {

	public SpawnStatement(SourceLocation location, String name, List<Parameter> params) {
		super(location, name, params);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
