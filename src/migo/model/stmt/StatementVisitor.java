package migo.model.stmt;

public abstract class StatementVisitor<T, E extends Throwable> {

	public abstract T visit(CallStatement call) throws E;
	public abstract T visit(SpawnStatement spawn) throws E;
	public abstract T visit(NewChanStatement newChan) throws E;
	public abstract T visit(SendStatement send) throws E;
	public abstract T visit(RecvStatement recv) throws E;
	public abstract T visit(CloseStatement close) throws E;
	public abstract T visit(SelectStatement select) throws E;
	public abstract T visit(IfStatement ifStatement) throws E;
	public abstract T visit(IfForStatement ifFor) throws E;
	public abstract T visit(TauStatement tau) throws E;
	public abstract T visit(NewMemStatement newMem) throws E;
	public abstract T visit(MemReadStatement memRead) throws E;
	public abstract T visit(MemWriteStatement memWrite) throws E;
	public abstract T visit(NewMutexStatement newMutex) throws E;
	public abstract T visit(MutexLockStatement lock) throws E;
	public abstract T visit(MutexUnlockStatement unlock) throws E;
	public abstract T visit(NewRWMutexStatement newRWMutex) throws E;
	public abstract T visit(RWMutexRLockStatement rlock) throws E;
	public abstract T visit(RWMutexRUnlockStatement runlock) throws E;

}
