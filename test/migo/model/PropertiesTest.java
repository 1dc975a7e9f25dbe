package migo.model;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import migo.util.SourceLocation;

public class PropertiesTest {

	private Properties props;

	@Before
	public void setup() {
		props = new Properties();
		props.addProperties(Arrays.asList("// a", "// b"), 10);
		props.addProperties(Collections.singletonList("// c"), 4);
	}

	@Test
	public void testGetPropertiesConsumesLine() {
		assertThat(props.getProperties(SourceLocation.at(10)), is(Arrays.asList("// a", "// b")));
		assertThat(props.getProperties(SourceLocation.at(10)), is(Collections.<String>emptyList()));
		assertFalse(props.isEmpty());
		props.getProperties(SourceLocation.at(4));
		assertTrue(props.isEmpty());
	}

	@Test
	public void testAddPropertiesAppends() {
		props.addProperties(Collections.singletonList("// d"), 10);
		assertThat(props.getProperties(SourceLocation.at(10)), is(Arrays.asList("// a", "// b", "// d")));
	}

	@Test
	public void testValuesDoesNotConsume() {
		assertThat(props.values(), is(Arrays.asList("// c", "// a", "// b")));
		assertThat(props.values(), is(Arrays.asList("// c", "// a", "// b")));
	}

	@Test
	public void testDrainRemaining() {
		props.getProperties(SourceLocation.at(4));
		Map<Integer, List<String>> remaining = props.drainRemaining();
		assertThat(remaining.keySet().iterator().next(), is(10));
		assertEquals(1, remaining.size());
		assertTrue(props.isEmpty());
	}

	@Test
	public void testCopyIsIndependent() {
		Properties copy = props.copy();
		props.getProperties(SourceLocation.at(10));
		assertThat(copy.getProperties(SourceLocation.at(10)), is(Arrays.asList("// a", "// b")));
	}
}
