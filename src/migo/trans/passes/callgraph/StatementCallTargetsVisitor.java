package migo.trans.passes.callgraph;

import migo.model.stmt.*;

import java.util.List;
import java.util.Set;

/**
 * Collects the names of all functions called or spawned by a statement,
 * including those inside nested branches and select cases.
 */
public class StatementCallTargetsVisitor extends StatementVisitor<Void, RuntimeException> {

	private final Set<String> targets;

	public StatementCallTargetsVisitor(Set<String> targets) {
		this.targets = targets;
	}

	public void visitAll(List<Statement> statements) {
		for (Statement stmt : statements) {
			stmt.accept(this);
		}
	}

	@Override
	public Void visit(CallStatement call) {
		targets.add(call.getName());
		return null;
	}

	@Override
	public Void visit(SpawnStatement spawn) {
		targets.add(spawn.getName());
		return null;
	}

	@Override
	public Void visit(NewChanStatement newChan) {
		return null;
	}

	@Override
	public Void visit(SendStatement send) {
		return null;
	}

	@Override
	public Void visit(RecvStatement recv) {
		return null;
	}

	@Override
	public Void visit(CloseStatement close) {
		return null;
	}

	@Override
	public Void visit(SelectStatement select) {
		for (List<Statement> c : select.getCases()) {
			visitAll(c);
		}
		return null;
	}

	@Override
	public Void visit(IfStatement ifStatement) {
		visitAll(ifStatement.getThen());
		visitAll(ifStatement.getElse());
		return null;
	}

	@Override
	public Void visit(IfForStatement ifFor) {
		visitAll(ifFor.getThen());
		visitAll(ifFor.getElse());
		return null;
	}

	@Override
	public Void visit(TauStatement tau) {
		return null;
	}

	@Override
	public Void visit(NewMemStatement newMem) {
		return null;
	}

	@Override
	public Void visit(MemReadStatement memRead) {
		return null;
	}

	@Override
	public Void visit(MemWriteStatement memWrite) {
		return null;
	}

	@Override
	public Void visit(NewMutexStatement newMutex) {
		return null;
	}

	@Override
	public Void visit(MutexLockStatement lock) {
		return null;
	}

	@Override
	public Void visit(MutexUnlockStatement unlock) {
		return null;
	}

	@Override
	public Void visit(NewRWMutexStatement newRWMutex) {
		return null;
	}

	@Override
	public Void visit(RWMutexRLockStatement rlock) {
		return null;
	}

	@Override
	public Void visit(RWMutexRUnlockStatement runlock) {
		return null;
	}
}
