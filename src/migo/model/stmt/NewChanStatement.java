package migo.model.stmt;

import migo.model.NamedVar;
import migo.util.SourceLocation;

import java.util.Objects;

/**
 * Creates a channel with the given buffer capacity and binds it to a name.
 * A capacity of 0 is an unbuffered channel.
 */
public class NewChanStatement extends Statement {

	private final NamedVar name;
	private final String chan;
	private final long size;

	public NewChanStatement(SourceLocation location, NamedVar name, String chan, long size) {
		super(location);
		this.name = name;
		this.chan = chan;
		this.size = size;
	}

	public NamedVar getName() {
		return name;
	}

	public String getChan() {
		return chan;
	}

	public long getSize() {
		return size;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NewChanStatement that = (NewChanStatement) o;
		return size == that.size &&
				Objects.equals(name, that.name) &&
				Objects.equals(chan, that.chan);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, chan, size);
	}
}
