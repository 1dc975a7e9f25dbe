package migo;

public class MigoOptionException extends Exception {

	private static final long serialVersionUID = 2315608426337013914L;

	public MigoOptionException(String msg) {
		super(msg);
	}

	public MigoOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
