package migo.trans.passes.comm;

import migo.model.stmt.Statement;

import java.util.List;

/**
 * Decides whether a batch of statements, taken on its own, communicates.
 *
 * The batch is scanned in order and the first statement that is not
 * {@link StatementCommunicationVisitor.Classification#UNDECIDED} settles
 * the answer; the remaining statements are not looked at.
 */
public class CommunicationClassifier {

	private static final StatementCommunicationVisitor VISITOR = new StatementCommunicationVisitor();

	private CommunicationClassifier() {}

	public static boolean isCommunicating(List<Statement> statements) {
		for (Statement stmt : statements) {
			StatementCommunicationVisitor.Classification classification = stmt.accept(VISITOR);
			if (classification != StatementCommunicationVisitor.Classification.UNDECIDED) {
				return classification == StatementCommunicationVisitor.Classification.COMMUNICATING;
			}
		}
		return false;
	}
}
