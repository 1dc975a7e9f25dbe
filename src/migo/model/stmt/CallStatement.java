package migo.model.stmt;

import migo.model.Parameter;
import migo.util.SourceLocation;

import java.util.List;

/**
 * Invocation of another function in the calling task.
 */
public class CallStatement extends InvocationStatement {

	public CallStatement(SourceLocation location, String name, List<Parameter> params) {
		super(location, name, params);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
