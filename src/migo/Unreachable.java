package migo;

/**
 * Thrown from branches that cannot execute, such as IO failures of a StringWriter.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
