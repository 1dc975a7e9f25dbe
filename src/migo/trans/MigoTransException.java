package migo.trans;

import migo.MigoException;
import migo.errors.Issue;

import java.util.Collections;
import java.util.List;

/**
 * Issues were found while preparing a program for emission.
 */
public class MigoTransException extends MigoException {

	private static final long serialVersionUID = 6702518829351627309L;
	private static final String prefix = "Emission Error";

	private final transient List<Issue> issues;

	public MigoTransException(String msg, List<Issue> issues) {
		super(prefix, msg);
		this.issues = Collections.unmodifiableList(issues);
	}

	public List<Issue> getIssues() {
		return issues;
	}
}
