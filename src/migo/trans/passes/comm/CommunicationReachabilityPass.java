package migo.trans.passes.comm;

import migo.InternalCompilerError;
import migo.MigoOptions;
import migo.model.Function;
import migo.model.Program;
import migo.trans.passes.callgraph.CallGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Marks every function reachable from a root that communicates, either
 * directly or through something it calls or spawns.
 *
 * Flags only ever go from false to true. The root is always marked, as it is
 * the entry point kept in the output.
 */
public class CommunicationReachabilityPass {

	private static final Logger logger = Logger.getLogger(MigoOptions.LOGGER_NAME + ".CommunicationReachabilityPass");

	private CommunicationReachabilityPass() {}

	public static void perform(Program program, Function root) {
		CallGraph callGraph = CallGraph.build(program);
		Set<String> reachable = callGraph.reachableFrom(root.getName());

		// propagate backwards from the functions already known to communicate
		Deque<Function> worklist = new ArrayDeque<>();
		for (String name : reachable) {
			program.getFunction(name).filter(Function::hasComm).ifPresent(worklist::add);
		}
		while (!worklist.isEmpty()) {
			Function f = worklist.pop();
			for (String callerName : callGraph.getPredecessors(f.getName())) {
				if (!reachable.contains(callerName)) {
					continue;
				}
				Function caller = program.getFunction(callerName).orElseThrow(
						() -> new InternalCompilerError("call graph names unknown function " + callerName));
				if (!caller.hasComm()) {
					logger.fine("function " + callerName + " communicates through " + f.getName());
					caller.markHasComm();
					worklist.push(caller);
				}
			}
		}

		root.markHasComm();
	}
}
