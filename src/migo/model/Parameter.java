package migo.model;

import java.util.Objects;

/**
 * A translation from the storage identity of an argument in the caller to
 * the fresh local identity it takes in the callee.
 */
public class Parameter {
	private final NamedVar caller;
	private final NamedVar callee;

	public Parameter(NamedVar caller, NamedVar callee) {
		this.caller = caller;
		this.callee = callee;
	}

	public NamedVar getCaller() {
		return caller;
	}

	public NamedVar getCallee() {
		return callee;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Parameter parameter = (Parameter) o;
		return Objects.equals(caller, parameter.caller) &&
				Objects.equals(callee, parameter.callee);
	}

	@Override
	public int hashCode() {
		return Objects.hash(caller, callee);
	}

	@Override
	public String toString() {
		return "[" + caller.getName() + " → " + callee.getName() + "]";
	}
}
