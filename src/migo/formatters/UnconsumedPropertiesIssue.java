package migo.formatters;

import migo.errors.Issue;
import migo.errors.IssueVisitor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Annotations whose source line matched no function or statement of the
 * rendered program.
 */
public class UnconsumedPropertiesIssue extends Issue {

	private final Map<Integer, List<String>> unconsumed;

	public UnconsumedPropertiesIssue(Map<Integer, List<String>> unconsumed) {
		this.unconsumed = Collections.unmodifiableMap(unconsumed);
	}

	public Map<Integer, List<String>> getUnconsumed() {
		return unconsumed;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
