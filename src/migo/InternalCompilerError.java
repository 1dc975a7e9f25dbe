package migo;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError(String what) {
		super("internal compiler error: " + what);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
