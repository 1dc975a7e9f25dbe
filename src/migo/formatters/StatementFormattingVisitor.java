package migo.formatters;

import migo.model.stmt.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders a statement in the calculus grammar, without the terminating ';'.
 *
 * Select cases start on new lines; they line up with the enclosing function
 * body when the writer is indented to statement level.
 */
public class StatementFormattingVisitor extends StatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public StatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeInvocation(String keyword, InvocationStatement invocation) throws IOException {
		out.write(keyword);
		out.write(" ");
		out.write(invocation.getSimpleName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, invocation.getParams(),
				p -> out.write(p.getCaller().getName()));
		out.write(")");
	}

	private void writeBranches(List<Statement> then, List<Statement> otherwise) throws IOException {
		for (Statement stmt : then) {
			stmt.accept(this);
			out.write("; ");
		}
		out.write("else ");
		for (Statement stmt : otherwise) {
			stmt.accept(this);
			out.write("; ");
		}
		out.write("endif");
	}

	@Override
	public Void visit(CallStatement call) throws IOException {
		writeInvocation("call", call);
		return null;
	}

	@Override
	public Void visit(SpawnStatement spawn) throws IOException {
		writeInvocation("spawn", spawn);
		return null;
	}

	@Override
	public Void visit(NewChanStatement newChan) throws IOException {
		out.write("let ");
		out.write(newChan.getName().getName());
		out.write(" = newchan ");
		out.write(NameFilter.filter(newChan.getChan()));
		out.write(", ");
		out.write(Long.toString(newChan.getSize()));
		return null;
	}

	@Override
	public Void visit(SendStatement send) throws IOException {
		out.write("send ");
		out.write(send.getLabel());
		return null;
	}

	@Override
	public Void visit(RecvStatement recv) throws IOException {
		out.write("recv ");
		out.write(recv.getLabel());
		return null;
	}

	@Override
	public Void visit(CloseStatement close) throws IOException {
		out.write("close ");
		out.write(close.getLabel());
		return null;
	}

	@Override
	public Void visit(SelectStatement select) throws IOException {
		out.write("select");
		for (List<Statement> c : select.getCases()) {
			out.newLine();
			out.write("  case");
			for (Statement stmt : c) {
				out.write(" ");
				stmt.accept(this);
				out.write(";");
			}
		}
		out.newLine();
		out.write("endselect");
		return null;
	}

	@Override
	public Void visit(IfStatement ifStatement) throws IOException {
		out.write("if ");
		writeBranches(ifStatement.getThen(), ifStatement.getElse());
		return null;
	}

	@Override
	public Void visit(IfForStatement ifFor) throws IOException {
		out.write("ifFor (int ");
		out.write(ifFor.getForCond());
		out.write(") then ");
		writeBranches(ifFor.getThen(), ifFor.getElse());
		return null;
	}

	@Override
	public Void visit(TauStatement tau) throws IOException {
		out.write("tau");
		return null;
	}

	@Override
	public Void visit(NewMemStatement newMem) throws IOException {
		out.write("letmem ");
		out.write(newMem.getName().getName());
		return null;
	}

	@Override
	public Void visit(MemReadStatement memRead) throws IOException {
		out.write("read ");
		out.write(NameFilter.filter(memRead.getLabel()));
		return null;
	}

	@Override
	public Void visit(MemWriteStatement memWrite) throws IOException {
		out.write("write ");
		out.write(NameFilter.filter(memWrite.getLabel()));
		return null;
	}

	@Override
	public Void visit(NewMutexStatement newMutex) throws IOException {
		out.write("letsync ");
		out.write(newMutex.getName().getName());
		out.write(" mutex");
		return null;
	}

	@Override
	public Void visit(MutexLockStatement lock) throws IOException {
		out.write("lock ");
		out.write(NameFilter.filter(lock.getLabel()));
		return null;
	}

	@Override
	public Void visit(MutexUnlockStatement unlock) throws IOException {
		out.write("unlock ");
		out.write(NameFilter.filter(unlock.getLabel()));
		return null;
	}

	@Override
	public Void visit(NewRWMutexStatement newRWMutex) throws IOException {
		out.write("letsync ");
		out.write(newRWMutex.getName().getName());
		out.write(" rwmutex");
		return null;
	}

	@Override
	public Void visit(RWMutexRLockStatement rlock) throws IOException {
		out.write("rlock ");
		out.write(NameFilter.filter(rlock.getLabel()));
		return null;
	}

	@Override
	public Void visit(RWMutexRUnlockStatement runlock) throws IOException {
		out.write("runlock ");
		out.write(NameFilter.filter(runlock.getLabel()));
		return null;
	}
}
