package migo.trans.passes.simplify;

import migo.model.stmt.*;

import java.util.List;
import java.util.Set;

/**
 * Whether a statement is equivalent to tau, given the set of functions
 * already known to be.
 */
public class StatementTauEquivalenceVisitor extends StatementVisitor<Boolean, RuntimeException> {

	private final Set<String> tauFunctions;

	public StatementTauEquivalenceVisitor(Set<String> tauFunctions) {
		this.tauFunctions = tauFunctions;
	}

	public boolean allTau(List<Statement> block) {
		for (Statement stmt : block) {
			if (!stmt.accept(this)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Boolean visit(CallStatement call) {
		return tauFunctions.contains(call.getName());
	}

	@Override
	public Boolean visit(SpawnStatement spawn) {
		return tauFunctions.contains(spawn.getName());
	}

	@Override
	public Boolean visit(NewChanStatement newChan) {
		return false;
	}

	@Override
	public Boolean visit(SendStatement send) {
		return false;
	}

	@Override
	public Boolean visit(RecvStatement recv) {
		return false;
	}

	@Override
	public Boolean visit(CloseStatement close) {
		return false;
	}

	@Override
	public Boolean visit(SelectStatement select) {
		return false;
	}

	@Override
	public Boolean visit(IfStatement ifStatement) {
		return allTau(ifStatement.getThen()) && allTau(ifStatement.getElse());
	}

	@Override
	public Boolean visit(IfForStatement ifFor) {
		return allTau(ifFor.getThen()) && allTau(ifFor.getElse());
	}

	@Override
	public Boolean visit(TauStatement tau) {
		return true;
	}

	@Override
	public Boolean visit(NewMemStatement newMem) {
		return false;
	}

	@Override
	public Boolean visit(MemReadStatement memRead) {
		return false;
	}

	@Override
	public Boolean visit(MemWriteStatement memWrite) {
		return false;
	}

	@Override
	public Boolean visit(NewMutexStatement newMutex) {
		return false;
	}

	@Override
	public Boolean visit(MutexLockStatement lock) {
		return false;
	}

	@Override
	public Boolean visit(MutexUnlockStatement unlock) {
		return false;
	}

	@Override
	public Boolean visit(NewRWMutexStatement newRWMutex) {
		return false;
	}

	@Override
	public Boolean visit(RWMutexRLockStatement rlock) {
		return false;
	}

	@Override
	public Boolean visit(RWMutexRUnlockStatement runlock) {
		return false;
	}
}
