package migo.model;

import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Annotations attached to source lines, to be interleaved with the rendered
 * program. Each line's annotations can be taken only once.
 */
public class Properties {

	private final Map<Integer, List<String>> properties;

	public Properties() {
		this.properties = new TreeMap<>();
	}

	public void addProperties(List<String> props, int line) {
		properties.computeIfAbsent(line, l -> new ArrayList<>()).addAll(props);
	}

	/**
	 * Takes the annotations of the line of the given position. The line is
	 * removed from the registry.
	 */
	public List<String> getProperties(SourceLocation location) {
		List<String> props = properties.remove(location.getLine());
		return props != null ? props : Collections.emptyList();
	}

	/**
	 * All annotations still present, in line order. Does not consume them.
	 */
	public List<String> values() {
		List<String> vals = new ArrayList<>();
		for (List<String> v : properties.values()) {
			vals.addAll(v);
		}
		return vals;
	}

	/**
	 * Empties the registry, returning what it held by line.
	 */
	public Map<Integer, List<String>> drainRemaining() {
		Map<Integer, List<String>> remaining = new TreeMap<>(properties);
		properties.clear();
		return remaining;
	}

	public boolean isEmpty() {
		return properties.isEmpty();
	}

	public Properties copy() {
		Properties copy = new Properties();
		for (Map.Entry<Integer, List<String>> e : properties.entrySet()) {
			copy.addProperties(e.getValue(), e.getKey());
		}
		return copy;
	}
}
