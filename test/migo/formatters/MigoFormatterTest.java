package migo.formatters;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import migo.MigoOptions;
import migo.errors.TopLevelIssueContext;
import migo.model.Function;
import migo.model.Program;
import migo.model.Properties;
import migo.util.SourceLocation;

import static migo.model.stmt.MigoBuilder.*;

public class MigoFormatterTest {

	private static final String ROOT = MigoOptions.DEFAULT_ROOT;
	private static final List<String> PREFIXES = MigoOptions.DEFAULT_EXCLUDED_PREFIXES;

	private Program program;
	private Properties props;
	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		program = new Program();
		props = new Properties();
		ctx = new TopLevelIssueContext();
	}

	@Test
	public void testEmptyFunctionIsNormalisedWhenFormatted() {
		Function f = new Function("f", SourceLocation.noPosition());
		assertEquals("def f():\n    tau;\n", MigoFormatter.format(f));
		assertFalse(f.isEmpty());
		assertEquals(Collections.singletonList(tau()), f.getStatements());
	}

	@Test
	public void testToStringDoesNotModifyFunction() {
		Function f = new Function("f", SourceLocation.noPosition());
		assertEquals("def f():\n    tau;\n", f.toString());
		assertTrue(f.isEmpty());
	}

	@Test
	public void testSelectLayoutInsideFunction() {
		Function f = new Function("f", SourceLocation.noPosition());
		f.addStatements(select(stmts(send("c")), stmts(recv("d"), tau())));
		assertEquals("def f():\n    select\n      case send c;\n      case recv d; tau;\n    endselect;\n",
				MigoFormatter.format(f));
	}

	@Test
	public void testPlainProgramSkipsEmptyFunctions() {
		Function a = new Function("a", SourceLocation.noPosition());
		a.addStatements(send("c"));
		Function b = new Function("b", SourceLocation.noPosition());
		Function c = new Function("c", SourceLocation.noPosition());
		c.addParams(param("p", "x"), param("q", "y"));
		c.addStatements(call("a", param("x", "u")));
		program.addFunction(a);
		program.addFunction(b);
		program.addFunction(c);

		assertEquals("def a():\n    send c;\ndef c(x, y):\n    call a(x);\n", MigoFormatter.format(program));
		assertTrue(b.isEmpty());
	}

	@Test
	public void testRenderingIsRepeatable() {
		Function main = new Function(ROOT, SourceLocation.at(1));
		main.addStatements(newChan(SourceLocation.at(2), var("ch"), "ch", 1), spawn("worker", param("ch", "c")));
		Function worker = new Function("worker", SourceLocation.at(5));
		worker.addParams(param("ch", "c"));
		worker.addStatements(recv(SourceLocation.at(6), "c"));
		program.addFunction(main);
		program.addFunction(worker);

		assertEquals(MigoFormatter.format(program), MigoFormatter.format(program));
		String first = MigoFormatter.formatWithProperties(ctx, program, new Properties(), ROOT, PREFIXES);
		String second = MigoFormatter.formatWithProperties(ctx, program, new Properties(), ROOT, PREFIXES);
		assertEquals(first, second);
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testStatementAnnotation() {
		Function main = new Function(ROOT, SourceLocation.at(1));
		main.addStatements(newChan(SourceLocation.at(9), var("ch"), "ch", 0), send(SourceLocation.at(10), "ch"));
		program.addFunction(main);
		props.addProperties(Collections.singletonList("// reviewed"), 10);

		String out = MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertEquals("def main.main():\n    let ch = newchan ch, 0;\n    // reviewed\n    send ch;\n", out);
		assertTrue(props.isEmpty());
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testFunctionAnnotationPrecedesHeader() {
		Function main = new Function(ROOT, SourceLocation.at(20));
		main.addStatements(close(SourceLocation.at(21), "c"));
		program.addFunction(main);
		props.addProperties(Arrays.asList("// entry", "// second"), 20);

		String out = MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertEquals("// entry\n// second\ndef main.main():\n    close c;\n", out);
		assertTrue(props.isEmpty());
	}

	@Test
	public void testRootFirstAndExcludedPrefixesSkipped() {
		Function exit = new Function("os.Exit", SourceLocation.noPosition());
		exit.addStatements(tau());
		Function worker = new Function("worker", SourceLocation.noPosition());
		worker.addStatements(send("c"));
		Function main = new Function(ROOT, SourceLocation.noPosition());
		main.addStatements(spawn("worker"));
		Function poll = new Function("internal/poll.wait", SourceLocation.noPosition());
		poll.addStatements(recv("p"));
		Function once = new Function("sync.once", SourceLocation.noPosition());
		program.addFunction(exit);
		program.addFunction(worker);
		program.addFunction(main);
		program.addFunction(poll);
		program.addFunction(once);

		String out = MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertEquals("def main.main():\n    spawn worker();\ndef worker():\n    send c;\n", out);
		assertTrue(once.isEmpty());
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testEmptyRootIsNormalisedByAnnotatedRender() {
		Function main = new Function(ROOT, SourceLocation.noPosition());
		program.addFunction(main);

		String out = MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertEquals("def main.main():\n    tau;\n", out);
		assertFalse(main.isEmpty());
	}

	@Test
	public void testUnconsumedPropertiesReported() {
		Function main = new Function(ROOT, SourceLocation.at(1));
		main.addStatements(send(SourceLocation.at(2), "c"));
		program.addFunction(main);
		props.addProperties(Collections.singletonList("// lost"), 99);

		MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(UnconsumedPropertiesIssue.class));
		UnconsumedPropertiesIssue issue = (UnconsumedPropertiesIssue) ctx.getIssues().get(0);
		assertThat(issue.getUnconsumed().get(99), is(Collections.singletonList("// lost")));
		assertEquals("unable to find target location of properties:\n    line 99: // lost", issue.getMessage());
		assertTrue(props.isEmpty());
	}

	@Test
	public void testMissingRootReported() {
		Function worker = new Function("worker", SourceLocation.noPosition());
		worker.addStatements(send("c"));
		program.addFunction(worker);

		String out = MigoFormatter.formatWithProperties(ctx, program, props, ROOT, PREFIXES);
		assertEquals("def worker():\n    send c;\n", out);
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(RootFunctionNotFoundIssue.class));
		assertEquals("root function \"main\".main not found in program", ctx.getIssues().get(0).getMessage());
	}
}
