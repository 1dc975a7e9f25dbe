package migo.trans.passes.simplify;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import migo.model.Function;
import migo.model.Program;
import migo.model.stmt.Statement;
import migo.util.SourceLocation;

import static migo.model.stmt.MigoBuilder.*;

public class UnusedFunctionPassTest {

	private Program program;

	@Before
	public void setup() {
		program = new Program();
	}

	private Function fn(String name, Statement... statements) {
		Function f = new Function(name, SourceLocation.noPosition());
		f.setStatements(Arrays.asList(statements));
		program.addFunction(f);
		return f;
	}

	private List<String> names() {
		List<String> names = new ArrayList<>();
		for (Function f : program.getFunctions()) {
			names.add(f.getName());
		}
		return names;
	}

	@Test
	public void testRemovesFunctionsRootCannotReach() {
		fn("orphan", call("orphanHelper"), call("worker"));
		Function main = fn("main", spawn("worker"));
		fn("worker", ifS(stmts(call("nested")), stmts()));
		fn("nested", send("c"));
		fn("orphanHelper", recv("c"));

		new UnusedFunctionPass().remove(program, main);
		assertThat(names(), is(Arrays.asList("main", "worker", "nested")));
	}

	@Test
	public void testRecursiveRootKeepsItself() {
		Function main = fn("main", call("main"));
		fn("other");

		new UnusedFunctionPass().remove(program, main);
		assertThat(names(), is(Arrays.asList("main")));
	}
}
