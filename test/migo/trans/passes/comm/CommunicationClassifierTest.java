package migo.trans.passes.comm;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import static migo.model.stmt.MigoBuilder.*;

public class CommunicationClassifierTest {

	@Test
	public void testEmptyBatchIsSilent() {
		assertFalse(CommunicationClassifier.isCommunicating(stmts()));
	}

	@Test
	public void testChannelOperationsCommunicate() {
		assertTrue(CommunicationClassifier.isCommunicating(stmts(send("c"))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(recv("c"))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(close("c"))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(newChan("c", "c", 0))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(select())));
	}

	@Test
	public void testUndecidedStatementsAreSkipped() {
		assertTrue(CommunicationClassifier.isCommunicating(stmts(tau(), newMem("m"), lock("mu"), send("c"))));
		assertFalse(CommunicationClassifier.isCommunicating(stmts(tau(), read("m"), newRWMutex("rw"))));
	}

	@Test
	public void testInvocationDecidesByParameters() {
		assertTrue(CommunicationClassifier.isCommunicating(stmts(call("f", param("a", "b")))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(spawn("f", param("a", "b")))));
		// a call without arguments settles the batch as silent
		assertFalse(CommunicationClassifier.isCommunicating(stmts(call("f"), send("c"))));
	}

	@Test
	public void testBranchesCommunicateIfEitherArmDoes() {
		assertTrue(CommunicationClassifier.isCommunicating(stmts(ifS(stmts(tau()), stmts(recv("c"))))));
		assertTrue(CommunicationClassifier.isCommunicating(stmts(ifFor("i", stmts(send("c")), stmts()))));
		assertFalse(CommunicationClassifier.isCommunicating(stmts(ifS(stmts(tau()), stmts()), send("c"))));
	}
}
