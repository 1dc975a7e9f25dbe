package migo.trans.passes.simplify;

import migo.MigoOptions;
import migo.model.Function;
import migo.model.Program;
import migo.trans.passes.callgraph.CallGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class UnusedFunctionPass implements UnusedFunctionRemoval {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".UnusedFunctionPass");

	@Override
	public void remove(Program program, Function root) {
		Set<String> reachable = CallGraph.build(program).reachableFrom(root.getName());
		List<String> unused = new ArrayList<>();
		for (Function f : program.getFunctions()) {
			if (!reachable.contains(f.getName())) {
				unused.add(f.getName());
			}
		}
		for (String name : unused) {
			logger.fine("removing unused function " + name);
		}
		program.removeFunctions(unused);
	}
}
