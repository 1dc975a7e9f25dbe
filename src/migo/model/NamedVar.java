package migo.model;

/**
 * A variable, channel, memory cell or lock identified by a stable name.
 *
 * Implementations are used as map and set keys and in parameter bindings, so
 * equals and hashCode must agree with the name.
 */
public interface NamedVar {
	String getName();
}
