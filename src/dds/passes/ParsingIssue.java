package dds.passes;

import dds.errors.Issue;
import dds.errors.IssueVisitor;
import dds.parser.DDSParseException;

public class ParsingIssue extends Issue {
	private final DDSParseException error;

	public ParsingIssue(DDSParseException error) {
		initCause(error);
		this.error = error;
	}

	public DDSParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
