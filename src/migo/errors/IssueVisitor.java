package migo.errors;

import migo.formatters.RootFunctionNotFoundIssue;
import migo.formatters.UnconsumedPropertiesIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(UnconsumedPropertiesIssue unconsumedPropertiesIssue) throws E;
	public abstract T visit(RootFunctionNotFoundIssue rootFunctionNotFoundIssue) throws E;
}
