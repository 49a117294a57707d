package dds.formatters;

import dds.model.DDSArrayDimension;
import dds.model.DDSDeclaration;
import dds.model.DDSNodeVisitor;

import java.io.IOException;

public class DDSNodeFormattingVisitor extends DDSNodeVisitor<Void, IOException> {

	public static final int DEFAULT_INDENT = 4;

	IndentingWriter out;

	public DDSNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(DDSDeclaration declaration) throws IOException {
		declaration.accept(DDSDeclarationFormattingVisitor.pretty(out, DEFAULT_INDENT));
		return null;
	}

	@Override
	public Void visit(DDSArrayDimension dimension) throws IOException {
		out.write("[");
		if(!dimension.getName().isEmpty()) {
			out.write(dimension.getName());
			out.write(" = ");
		}
		out.write(Integer.toString(dimension.getSize()));
		out.write("]");
		return null;
	}

}
