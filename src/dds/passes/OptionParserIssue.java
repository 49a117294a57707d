package dds.passes;

import dds.errors.Issue;
import dds.errors.IssueVisitor;

public class OptionParserIssue extends Issue {

	private final String reason;

	public OptionParserIssue(String reason) {
		super(reason);
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
