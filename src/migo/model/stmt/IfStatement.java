package migo.model.stmt;

import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A binary branch. Both branches are always present; a missing branch is an
 * empty list.
 */
public class IfStatement extends Statement {

	private final List<Statement> then;
	private final List<Statement> otherwise;

	public IfStatement(List<Statement> then, List<Statement> otherwise) {
		super(SourceLocation.noPosition());
		this.then = then != null ? new ArrayList<>(then) : new ArrayList<>();
		this.otherwise = otherwise != null ? new ArrayList<>(otherwise) : new ArrayList<>();
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
		IfStatement that = (IfStatement) o;
		return Objects.equals(then, that.then) &&
				Objects.equals(otherwise, that.otherwise);
	}

	@Override
	public int hashCode() {
		return Objects.hash(then, otherwise);
	}
}
