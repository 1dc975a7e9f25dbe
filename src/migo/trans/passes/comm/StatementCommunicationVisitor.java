package migo.trans.passes.comm;

import migo.model.stmt.*;

public class StatementCommunicationVisitor
		extends StatementVisitor<StatementCommunicationVisitor.Classification, RuntimeException> {

	public enum Classification {
		COMMUNICATING,
		SILENT,
		// the statement does not settle the batch it belongs to
		UNDECIDED,
	}

	private static Classification of(boolean communicating) {
		return communicating ? Classification.COMMUNICATING : Classification.SILENT;
	}

	// passing parameters counts as synchronisation
	@Override
	public Classification visit(CallStatement call) {
		return of(!call.getParams().isEmpty());
	}

	@Override
	public Classification visit(SpawnStatement spawn) {
		return of(!spawn.getParams().isEmpty());
	}

	@Override
	public Classification visit(NewChanStatement newChan) {
		return Classification.COMMUNICATING;
	}

	@Override
	public Classification visit(SendStatement send) {
		return Classification.COMMUNICATING;
	}

	@Override
	public Classification visit(RecvStatement recv) {
		return Classification.COMMUNICATING;
	}

	@Override
	public Classification visit(CloseStatement close) {
		return Classification.COMMUNICATING;
	}

	@Override
	public Classification visit(SelectStatement select) {
		return Classification.COMMUNICATING;
	}

	@Override
	public Classification visit(IfStatement ifStatement) {
		return of(CommunicationClassifier.isCommunicating(ifStatement.getThen()) ||
				CommunicationClassifier.isCommunicating(ifStatement.getElse()));
	}

	@Override
	public Classification visit(IfForStatement ifFor) {
		return of(CommunicationClassifier.isCommunicating(ifFor.getThen()) ||
				CommunicationClassifier.isCommunicating(ifFor.getElse()));
	}

	@Override
	public Classification visit(TauStatement tau) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(NewMemStatement newMem) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(MemReadStatement memRead) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(MemWriteStatement memWrite) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(NewMutexStatement newMutex) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(MutexLockStatement lock) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(MutexUnlockStatement unlock) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(NewRWMutexStatement newRWMutex) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(RWMutexRLockStatement rlock) {
		return Classification.UNDECIDED;
	}

	@Override
	public Classification visit(RWMutexRUnlockStatement runlock) {
		return Classification.UNDECIDED;
	}
}
