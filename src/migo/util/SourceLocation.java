package migo.util;

/**
 * Position of an IR entity in the program it was extracted from.
 *
 * Only the line is significant to the IR: it anchors annotations. A line of
 * 0 means "no position".
 */
public class SourceLocation {
	private static final SourceLocation NO_POSITION = new SourceLocation(0);

	private final int line;

	public SourceLocation(int line) {
		this.line = line;
	}

	public static SourceLocation at(int line) {
		return new SourceLocation(line);
	}

	public static SourceLocation noPosition() {
		return NO_POSITION;
	}

	public boolean isUnknown() {
		return line == 0;
	}

	public int getLine() {
		return line;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(line);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return line == ((SourceLocation) obj).line;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [line=" + line + "]";
	}
}
