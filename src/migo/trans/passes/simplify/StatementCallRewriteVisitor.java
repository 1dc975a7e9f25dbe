package migo.trans.passes.simplify;

import migo.model.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rewrites every call or spawn whose target matches into tau, at any depth.
 * Statements without a matching call are returned unchanged.
 */
public class StatementCallRewriteVisitor extends StatementVisitor<Statement, RuntimeException> {

	private final Predicate<String> shouldRewrite;
	private int rewritten = 0;

	public StatementCallRewriteVisitor(Predicate<String> shouldRewrite) {
		this.shouldRewrite = shouldRewrite;
	}

	public int getRewritten() {
		return rewritten;
	}

	public List<Statement> rewriteAll(List<Statement> block) {
		List<Statement> result = new ArrayList<>();
		for (Statement stmt : block) {
			result.add(stmt.accept(this));
		}
		return result;
	}

	private Statement rewriteInvocation(InvocationStatement invocation) {
		if (shouldRewrite.test(invocation.getName())) {
			++rewritten;
			return new TauStatement();
		}
		return invocation;
	}

	@Override
	public Statement visit(CallStatement call) {
		return rewriteInvocation(call);
	}

	@Override
	public Statement visit(SpawnStatement spawn) {
		return rewriteInvocation(spawn);
	}

	@Override
	public Statement visit(NewChanStatement newChan) {
		return newChan;
	}

	@Override
	public Statement visit(SendStatement send) {
		return send;
	}

	@Override
	public Statement visit(RecvStatement recv) {
		return recv;
	}

	@Override
	public Statement visit(CloseStatement close) {
		return close;
	}

	@Override
	public Statement visit(SelectStatement select) {
		List<List<Statement>> cases = new ArrayList<>();
		for (List<Statement> c : select.getCases()) {
			cases.add(rewriteAll(c));
		}
		return new SelectStatement(select.getLocation(), cases);
	}

	@Override
	public Statement visit(IfStatement ifStatement) {
		return new IfStatement(rewriteAll(ifStatement.getThen()), rewriteAll(ifStatement.getElse()));
	}

	@Override
	public Statement visit(IfForStatement ifFor) {
		return new IfForStatement(ifFor.getForCond(), rewriteAll(ifFor.getThen()), rewriteAll(ifFor.getElse()));
	}

	@Override
	public Statement visit(TauStatement tau) {
		return tau;
	}

	@Override
	public Statement visit(NewMemStatement newMem) {
		return newMem;
	}

	@Override
	public Statement visit(MemReadStatement memRead) {
		return memRead;
	}

	@Override
	public Statement visit(MemWriteStatement memWrite) {
		return memWrite;
	}

	@Override
	public Statement visit(NewMutexStatement newMutex) {
		return newMutex;
	}

	@Override
	public Statement visit(MutexLockStatement lock) {
		return lock;
	}

	@Override
	public Statement visit(MutexUnlockStatement unlock) {
		return unlock;
	}

	@Override
	public Statement visit(NewRWMutexStatement newRWMutex) {
		return newRWMutex;
	}

	@Override
	public Statement visit(RWMutexRLockStatement rlock) {
		return rlock;
	}

	@Override
	public Statement visit(RWMutexRUnlockStatement runlock) {
		return runlock;
	}
}
