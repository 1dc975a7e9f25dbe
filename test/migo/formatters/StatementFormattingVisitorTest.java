package migo.formatters;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import migo.model.stmt.Statement;
import migo.util.SourceLocation;

import static migo.model.stmt.MigoBuilder.*;

@RunWith(Parameterized.class)
public class StatementFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ call("f"), "call f()" },
				{ call("\"main\".worker", param("a", "x"), param("b", "y")), "call main.worker(a, b)" },
				{ spawn("pkg/sub.run-1"), "spawn pkg_sub.run1()" },
				{ spawn("(*T).serve", param("t0", "t")), "spawn T.serve(t0)" },
				{ newChan(SourceLocation.at(4), var("ch"), "main.ch*", 0), "let ch = newchan main.ch, 0" },
				{ newChan("t1", "t1_chan", 5), "let t1 = newchan t1_chan, 5" },
				{ send("c"), "send c" },
				{ recv("c"), "recv c" },
				{ close("c"), "close c" },
				{ ifS(stmts(send("c")), stmts()), "if send c; else endif" },
				{ ifS(stmts(), stmts()), "if else endif" },
				{ ifS(null, stmts(tau())), "if else tau; endif" },
				{
						ifFor("i", stmts(recv("c"), tau()), stmts(tau())),
						"ifFor (int i) then recv c; tau; else tau; endif"
				},
				{ tau(), "tau" },
				{ newMem("x"), "letmem x" },
				{ read("(*x)"), "read x" },
				{ write("a/b"), "write a_b" },
				{ newMutex("mu"), "letsync mu mutex" },
				{ lock("mu"), "lock mu" },
				{ unlock("\"mu\""), "unlock mu" },
				{ newRWMutex("rw"), "letsync rw rwmutex" },
				{ rlock("rw"), "rlock rw" },
				{ runlock("rw"), "runlock rw" },
				{
						select(stmts(send("a")), stmts(recv("b"), tau())),
						"select\n  case send a;\n  case recv b; tau;\nendselect"
				},
				{ select(), "select\nendselect" },
		});
	}

	private final Statement statement;
	private final String expected;

	public StatementFormattingVisitorTest(Statement statement, String expected) {
		this.statement = statement;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertEquals(expected, statement.toString());
	}
}
