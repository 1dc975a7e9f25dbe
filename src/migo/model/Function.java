package migo.model;

import migo.Unreachable;
import migo.formatters.FunctionFormatter;
import migo.formatters.IndentingWriter;
import migo.formatters.NameFilter;
import migo.model.stmt.Statement;
import migo.model.stmt.TauStatement;
import migo.trans.passes.comm.CommunicationClassifier;
import migo.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named block of statements sharing the same parameters.
 *
 * Statements are appended to the sequence under construction, which is the
 * function body unless a nested block has been started with {@link #putAway()}.
 */
public class Function {

	private final String name;
	private final SourceLocation location;
	private final List<Parameter> params;
	private List<Statement> statements;
	private boolean hasComm;

	private final StatementStack stack;

	public Function(String name, SourceLocation location) {
		this.name = name;
		this.location = location;
		this.params = new ArrayList<>();
		this.statements = new ArrayList<>();
		this.stack = new StatementStack();
	}

	public String getName() {
		return name;
	}

	public String getSimpleName() {
		return NameFilter.filter(name);
	}

	public SourceLocation getLocation() {
		return location;
	}

	public List<Parameter> getParams() {
		return Collections.unmodifiableList(params);
	}

	/**
	 * Appends parameter bindings. A binding whose caller or callee side is
	 * already bound is dropped.
	 */
	public void addParams(Parameter... newParams) {
		for (Parameter param : newParams) {
			boolean found = false;
			for (Parameter p : params) {
				if (p.getCallee().equals(param.getCallee()) || p.getCaller().equals(param.getCaller())) {
					found = true;
					break;
				}
			}
			if (!found) {
				params.add(param);
			}
		}
	}

	public Parameter getParamByCalleeValue(NamedVar v) throws ParameterNotFoundException {
		for (Parameter p : params) {
			if (p.getCallee().equals(v)) {
				return p;
			}
		}
		throw new ParameterNotFoundException(name, v);
	}

	public List<Statement> getStatements() {
		return Collections.unmodifiableList(statements);
	}

	/**
	 * Replaces the current statement sequence. Used by passes rewriting the
	 * body; the communication flag is left as it is.
	 */
	public void setStatements(List<Statement> statements) {
		this.statements = new ArrayList<>(statements);
	}

	public void addStatements(Statement... newStatements) {
		addStatements(Arrays.asList(newStatements));
	}

	/**
	 * Appends statements to the sequence under construction.
	 *
	 * Once a sequence of more than one statement ends with tau the appended
	 * statements are not classified, so they cannot set the communication flag.
	 */
	public void addStatements(List<Statement> newStatements) {
		int numStatements = statements.size();
		if (numStatements > 1 && statements.get(numStatements - 1) instanceof TauStatement) {
			statements.addAll(newStatements);
			return;
		}
		if (!hasComm && CommunicationClassifier.isCommunicating(newStatements)) {
			hasComm = true;
		}
		statements.addAll(newStatements);
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	public boolean hasComm() {
		return hasComm;
	}

	// the flag is sticky: nothing resets it
	public void markHasComm() {
		hasComm = true;
	}

	/**
	 * Saves the sequence under construction and starts an empty one for a
	 * nested block.
	 */
	public void putAway() {
		stack.push(statements);
		statements = new ArrayList<>();
	}

	/**
	 * Ends the nested block started by the matching {@link #putAway()}.
	 *
	 * @return the statements of the nested block; the saved enclosing
	 * sequence becomes the sequence under construction again
	 * @throws EmptyStatementStackException if nothing was put away
	 */
	public List<Statement> restore() throws EmptyStatementStackException {
		List<Statement> saved = stack.pop().orElseThrow(() -> new EmptyStatementStackException(name));
		List<Statement> nested = statements;
		statements = saved;
		return nested;
	}

	public int getNestingDepth() {
		return stack.size();
	}

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			new FunctionFormatter(new IndentingWriter(w)).format(this);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
