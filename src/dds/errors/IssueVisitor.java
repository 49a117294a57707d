package dds.errors;

import dds.passes.IOErrorIssue;
import dds.passes.OptionParserIssue;
import dds.passes.ParsingIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
}
