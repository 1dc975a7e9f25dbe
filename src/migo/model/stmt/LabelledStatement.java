package migo.model.stmt;

import migo.util.SourceLocation;

import java.util.Objects;

/**
 * A statement acting on a previously declared channel, memory cell or lock,
 * referenced by its label.
 */
public abstract class LabelledStatement extends Statement {

	private final String label;

	LabelledStatement(SourceLocation location, String label) {
		super(location);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LabelledStatement that = (LabelledStatement) o;
		return Objects.equals(label, that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), label);
	}
}
