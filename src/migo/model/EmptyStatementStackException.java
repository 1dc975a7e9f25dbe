package migo.model;

public class EmptyStatementStackException extends MigoModelException {
	private static final long serialVersionUID = 5848090611396011857L;

	private final String functionName;

	public EmptyStatementStackException(String functionName) {
		super("restore without matching putAway in function " + functionName);
		this.functionName = functionName;
	}

	public String getFunctionName() {
		return functionName;
	}
}
