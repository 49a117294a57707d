package dds.errors;

import dds.DDSException;
import dds.Unreachable;
import dds.formatters.IndentingWriter;
import dds.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends DDSException {
	private static final String prefix = "Issue";

	public Issue() {
		super(prefix, "");
	}

	public Issue(String msg) {
		super(prefix, msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
