package migo.errors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.List;

import org.junit.Test;

import migo.formatters.RootFunctionNotFoundIssue;
import migo.formatters.UnconsumedPropertiesIssue;

public class TopLevelIssueContextTest {

	@Test
	public void testNoIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		assertEquals("Detected 0 issue(s):", ctx.format());
	}

	@Test
	public void testIssuesAreListedInReportOrder() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Map<Integer, List<String>> unconsumed = new TreeMap<>();
		unconsumed.put(3, Arrays.asList("// a", "// b"));
		ctx.error(new RootFunctionNotFoundIssue("main"));
		ctx.error(new UnconsumedPropertiesIssue(unconsumed));

		assertTrue(ctx.hasErrors());
		assertEquals(2, ctx.getIssues().size());
		assertEquals("Detected 2 issue(s):\n" +
				"root function main not found in program\n" +
				"unable to find target location of properties:\n" +
				"    line 3: // a\n" +
				"    line 3: // b", ctx.format());
	}
}
