package dds.formatters;

import dds.errors.ContextVisitor;
import dds.passes.WhileReadingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileReadingFile whileReadingFile) throws IOException {
		out.write("while reading file ");
		out.write(whileReadingFile.getFile().toString());
		return null;
	}

}
