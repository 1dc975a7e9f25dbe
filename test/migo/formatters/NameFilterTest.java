package migo.formatters;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class NameFilterTest {

	@Test
	public void testStripsForbiddenCharacters() {
		assertEquals("main.main", NameFilter.filter("\"main\".main"));
		assertEquals("sync.Mutex.Lock", NameFilter.filter("(*sync.Mutex).Lock"));
		assertEquals("abc", NameFilter.filter("a-b-c"));
	}

	@Test
	public void testPathSeparatorBecomesUnderscore() {
		assertEquals("internal_poll.runtime_pollWait", NameFilter.filter("internal/poll.runtime_pollWait"));
	}

	@Test
	public void testPlainNameUnchanged() {
		assertEquals("worker$1", NameFilter.filter("worker$1"));
		assertEquals("", NameFilter.filter(""));
	}
}
