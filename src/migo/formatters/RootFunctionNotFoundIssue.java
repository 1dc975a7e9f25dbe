package migo.formatters;

import migo.errors.Issue;
import migo.errors.IssueVisitor;

public class RootFunctionNotFoundIssue extends Issue {

	private final String rootName;

	public RootFunctionNotFoundIssue(String rootName) {
		this.rootName = rootName;
	}

	public String getRootName() {
		return rootName;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
