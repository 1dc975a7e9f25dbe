package migo.model;

public class ParameterNotFoundException extends MigoModelException {
	private static final long serialVersionUID = -2283620907001474125L;

	private final NamedVar callee;

	public ParameterNotFoundException(String functionName, NamedVar callee) {
		super("parameter " + callee.getName() + " not found in function " + functionName);
		this.callee = callee;
	}

	public NamedVar getCallee() {
		return callee;
	}
}
