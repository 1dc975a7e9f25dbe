package migo.model;

import migo.Unreachable;
import migo.formatters.IndentingWriter;
import migo.formatters.ProgramFormatter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of functions of an extracted program, in registration order.
 */
public class Program {

	private final Map<String, Function> functions;

	public Program() {
		this.functions = new LinkedHashMap<>();
	}

	/**
	 * Registers a function. If a function with the same name already exists
	 * this does nothing.
	 */
	public void addFunction(Function f) {
		functions.putIfAbsent(f.getName(), f);
	}

	public Optional<Function> getFunction(String name) {
		return Optional.ofNullable(functions.get(name));
	}

	public boolean hasFunction(String name) {
		return functions.containsKey(name);
	}

	public List<Function> getFunctions() {
		return new ArrayList<>(functions.values());
	}

	public int size() {
		return functions.size();
	}

	public boolean removeFunction(String name) {
		return functions.remove(name) != null;
	}

	public void removeFunctions(Collection<String> names) {
		for (String name : names) {
			functions.remove(name);
		}
	}

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			new ProgramFormatter(new IndentingWriter(w)).format(this);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
