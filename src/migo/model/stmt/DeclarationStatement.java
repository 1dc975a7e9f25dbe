package migo.model.stmt;

import migo.model.NamedVar;
import migo.util.SourceLocation;

import java.util.Objects;

/**
 * Introduces a memory cell or lock and binds it to a name.
 */
public abstract class DeclarationStatement extends Statement {

	private final NamedVar name;

	DeclarationStatement(SourceLocation location, NamedVar name) {
		super(location);
		this.name = name;
	}

	public NamedVar getName() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DeclarationStatement that = (DeclarationStatement) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), name);
	}
}
