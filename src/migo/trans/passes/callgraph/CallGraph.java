package migo.trans.passes.callgraph;

import migo.model.Function;
import migo.model.Program;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Call and spawn edges between the functions of a program.
 *
 * Targets that do not name a function of the program are not edges.
 */
public class CallGraph {

	private final Map<String, Set<String>> successors;
	private final Map<String, Set<String>> predecessors;

	private CallGraph(Map<String, Set<String>> successors, Map<String, Set<String>> predecessors) {
		this.successors = successors;
		this.predecessors = predecessors;
	}

	public static CallGraph build(Program program) {
		Map<String, Set<String>> successors = new LinkedHashMap<>();
		Map<String, Set<String>> predecessors = new LinkedHashMap<>();
		for (Function f : program.getFunctions()) {
			successors.put(f.getName(), new LinkedHashSet<>());
			predecessors.put(f.getName(), new LinkedHashSet<>());
		}
		for (Function f : program.getFunctions()) {
			Set<String> targets = new LinkedHashSet<>();
			new StatementCallTargetsVisitor(targets).visitAll(f.getStatements());
			for (String target : targets) {
				if (program.hasFunction(target)) {
					successors.get(f.getName()).add(target);
					predecessors.get(target).add(f.getName());
				}
			}
		}
		return new CallGraph(successors, predecessors);
	}

	public Set<String> getSuccessors(String name) {
		return Collections.unmodifiableSet(successors.getOrDefault(name, Collections.emptySet()));
	}

	public Set<String> getPredecessors(String name) {
		return Collections.unmodifiableSet(predecessors.getOrDefault(name, Collections.emptySet()));
	}

	/**
	 * Every function reachable from root, root included, in depth-first
	 * discovery order. Each function is visited at most once, so cycles
	 * terminate.
	 */
	public Set<String> reachableFrom(String root) {
		Set<String> visited = new LinkedHashSet<>();
		if (!successors.containsKey(root)) {
			return visited;
		}
		Deque<String> toVisit = new ArrayDeque<>();
		toVisit.push(root);
		while (!toVisit.isEmpty()) {
			String name = toVisit.pop();
			if (!visited.add(name)) {
				continue;
			}
			for (String next : successors.get(name)) {
				if (!visited.contains(next)) {
					toVisit.push(next);
				}
			}
		}
		return visited;
	}
}
