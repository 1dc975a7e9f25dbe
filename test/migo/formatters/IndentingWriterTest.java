package migo.formatters;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

import migo.InternalCompilerError;

public class IndentingWriterTest {

	@Test
	public void testIndentAppliesToStartedLines() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("a");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.write("b\nc");
			out.newLine();
		}
		out.write("d");
		assertEquals("a\n    b\n    c\nd", w.toString());
	}

	@Test
	public void testIndentIsNotWrittenOnEmptyTrailingLine() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w, 2);
		out.write("top\n");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.write("x\n");
		}
		assertEquals("top\n  x\n", w.toString());
	}

	@Test(expected = InternalCompilerError.class)
	public void testUnindentBelowZero() {
		new IndentingWriter(new StringWriter()).unindent(1);
	}
}
