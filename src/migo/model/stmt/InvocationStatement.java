package migo.model.stmt;

import migo.formatters.NameFilter;
import migo.model.Parameter;
import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Common shape of {@link CallStatement} and {@link SpawnStatement}: a target
 * function name plus caller-side parameter bindings.
 */
public abstract class InvocationStatement extends Statement {

	private final String name;
	private final List<Parameter> params;

	InvocationStatement(SourceLocation location, String name, List<Parameter> params) {
		super(location);
		this.name = name;
		this.params = new ArrayList<>(params);
	}

	public String getName() {
		return name;
	}

	public String getSimpleName() {
		return NameFilter.filter(name);
	}

	public List<Parameter> getParams() {
		return Collections.unmodifiableList(params);
	}

	/**
	 * Appends bindings, skipping any binding object already present.
	 */
	public void addParams(Parameter... newParams) {
		addParams(Arrays.asList(newParams));
	}

	public void addParams(List<Parameter> newParams) {
		for (Parameter param : newParams) {
			boolean found = false;
			for (Parameter p : params) {
				if (p == param) {
					found = true;
					break;
				}
			}
			if (!found) {
				params.add(param);
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		InvocationStatement that = (InvocationStatement) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(params, that.params);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), name, params);
	}
}
