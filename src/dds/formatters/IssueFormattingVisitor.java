package dds.formatters;

import dds.errors.IssueVisitor;
import dds.errors.IssueWithContext;
import dds.passes.IOErrorIssue;
import dds.passes.OptionParserIssue;
import dds.passes.ParsingIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing DDS: ");
		out.write(parsingIssue.getError().getMessage());
		return null;
	}

}
