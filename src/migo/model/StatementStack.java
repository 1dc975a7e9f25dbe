package migo.model;

import migo.model.stmt.Statement;

import java.util.List;
import java.util.Optional;

/**
 * Saved statement sequences of the blocks enclosing the one under construction.
 */
public final class StatementStack {

	private static final class Node {
		final List<Statement> value;
		final Node next;

		Node(List<Statement> value, Node next) {
			this.value = value;
			this.next = next;
		}
	}

	private Node root;
	private int size;

	public StatementStack() {
		this.root = null;
		this.size = 0;
	}

	public Optional<List<Statement>> pop() {
		if (root == null) return Optional.empty();
		List<Statement> value = root.value;
		root = root.next;
		--size;
		return Optional.of(value);
	}

	public void push(List<Statement> value) {
		root = new Node(value, root);
		++size;
	}

	public int size() { return size; }
}
