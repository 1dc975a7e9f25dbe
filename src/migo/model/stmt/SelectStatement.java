package migo.model.stmt;

import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Non-deterministic choice between the statement sequences of its cases.
 */
public class SelectStatement extends Statement {

	private final List<List<Statement>> cases;

	public SelectStatement(SourceLocation location, List<List<Statement>> cases) {
		super(location);
		this.cases = new ArrayList<>();
		for (List<Statement> c : cases) {
			this.cases.add(Collections.unmodifiableList(new ArrayList<>(c)));
		}
	}

	public List<List<Statement>> getCases() {
		return Collections.unmodifiableList(cases);
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SelectStatement select = (SelectStatement) o;
		return Objects.equals(cases, select.cases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cases);
	}
}
