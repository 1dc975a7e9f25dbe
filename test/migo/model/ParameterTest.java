package migo.model;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import static migo.model.stmt.MigoBuilder.*;

public class ParameterTest {

	@Test
	public void testToString() {
		assertThat(param("t0", "ch").toString(), is("[t0 → ch]"));
	}

	@Test
	public void testEqualityBySides() {
		assertThat(param("a", "b"), is(new Parameter(new Variable("a"), new Variable("b"))));
		assertThat(param("a", "b"), not(param("b", "a")));
	}
}
