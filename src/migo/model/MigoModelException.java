package migo.model;

/**
 * A recoverable error raised while an extractor builds the IR.
 */
public abstract class MigoModelException extends Exception {
	private static final long serialVersionUID = -4021517382912771042L;

	public MigoModelException(String msg) {
		super(msg);
	}
}
