package migo.model.stmt;

import migo.model.NamedVar;
import migo.model.Parameter;
import migo.model.Variable;
import migo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class MigoBuilder {
	private MigoBuilder() {}

	public static Variable var(String name) {
		return new Variable(name);
	}

	public static Parameter param(String caller, String callee) {
		return new Parameter(new Variable(caller), new Variable(callee));
	}

	public static List<Statement> stmts(Statement... statements) {
		return new ArrayList<>(Arrays.asList(statements));
	}

	public static CallStatement call(String name, Parameter... params) {
		return call(SourceLocation.noPosition(), name, params);
	}

	public static CallStatement call(SourceLocation location, String name, Parameter... params) {
		return new CallStatement(location, name, Arrays.asList(params));
	}

	public static SpawnStatement spawn(String name, Parameter... params) {
		return spawn(SourceLocation.noPosition(), name, params);
	}

	public static SpawnStatement spawn(SourceLocation location, String name, Parameter... params) {
		return new SpawnStatement(location, name, Arrays.asList(params));
	}

	public static NewChanStatement newChan(String name, String chan, long size) {
		return newChan(SourceLocation.noPosition(), new Variable(name), chan, size);
	}

	public static NewChanStatement newChan(SourceLocation location, NamedVar name, String chan, long size) {
		return new NewChanStatement(location, name, chan, size);
	}

	public static SendStatement send(String chan) {
		return send(SourceLocation.noPosition(), chan);
	}

	public static SendStatement send(SourceLocation location, String chan) {
		return new SendStatement(location, chan);
	}

	public static RecvStatement recv(String chan) {
		return recv(SourceLocation.noPosition(), chan);
	}

	public static RecvStatement recv(SourceLocation location, String chan) {
		return new RecvStatement(location, chan);
	}

	public static CloseStatement close(String chan) {
		return close(SourceLocation.noPosition(), chan);
	}

	public static CloseStatement close(SourceLocation location, String chan) {
		return new CloseStatement(location, chan);
	}

	@SafeVarargs
	public static SelectStatement select(List<Statement>... cases) {
		return new SelectStatement(SourceLocation.noPosition(), Arrays.asList(cases));
	}

	public static SelectStatement select(SourceLocation location, List<List<Statement>> cases) {
		return new SelectStatement(location, cases);
	}

	public static IfStatement ifS(List<Statement> then, List<Statement> otherwise) {
		return new IfStatement(then, otherwise);
	}

	public static IfForStatement ifFor(String forCond, List<Statement> then, List<Statement> otherwise) {
		return new IfForStatement(forCond, then, otherwise);
	}

	public static TauStatement tau() {
		return new TauStatement();
	}

	public static NewMemStatement newMem(String name) {
		return new NewMemStatement(SourceLocation.noPosition(), new Variable(name));
	}

	public static MemReadStatement read(String name) {
		return new MemReadStatement(SourceLocation.noPosition(), name);
	}

	public static MemWriteStatement write(String name) {
		return new MemWriteStatement(SourceLocation.noPosition(), name);
	}

	public static NewMutexStatement newMutex(String name) {
		return new NewMutexStatement(SourceLocation.noPosition(), new Variable(name));
	}

	public static MutexLockStatement lock(String name) {
		return new MutexLockStatement(SourceLocation.noPosition(), name);
	}

	public static MutexUnlockStatement unlock(String name) {
		return new MutexUnlockStatement(SourceLocation.noPosition(), name);
	}

	public static NewRWMutexStatement newRWMutex(String name) {
		return new NewRWMutexStatement(SourceLocation.noPosition(), new Variable(name));
	}

	public static RWMutexRLockStatement rlock(String name) {
		return new RWMutexRLockStatement(SourceLocation.noPosition(), name);
	}

	public static RWMutexRUnlockStatement runlock(String name) {
		return new RWMutexRUnlockStatement(SourceLocation.noPosition(), name);
	}
}
