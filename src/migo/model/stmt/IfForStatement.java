package migo.model.stmt;

import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One unrolled iteration test of a loop, guarded by the loop-count variable
 * labelled forCond.
 */
public class IfForStatement extends Statement {

	private final String forCond;
	private final List<Statement> then;
	private final List<Statement> otherwise;

	public IfForStatement(String forCond, List<Statement> then, List<Statement> otherwise) {
		super(SourceLocation.noPosition());
		this.forCond = forCond;
		this.then = then != null ? new ArrayList<>(then) : new ArrayList<>();
		this.otherwise = otherwise != null ? new ArrayList<>(otherwise) : new ArrayList<>();
	}

	public String getForCond() {
		return forCond;
	}

	public List<Statement> getThen() {
		return Collections.unmodifiableList(then);
	}

	public List<Statement> getElse() {
		return Collections.unmodifiableList(otherwise);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IfForStatement that = (IfForStatement) o;
		return Objects.equals(forCond, that.forCond) &&
				Objects.equals(then, that.then) &&
				Objects.equals(otherwise, that.otherwise);
	}

	@Override
	public int hashCode() {
		return Objects.hash(forCond, then, otherwise);
	}
}
