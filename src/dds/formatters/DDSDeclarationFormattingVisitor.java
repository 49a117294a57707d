package dds.formatters;

import dds.model.DDSArrayDimension;
import dds.model.DDSComposite;
import dds.model.DDSDeclaration;
import dds.model.DDSDeclarationVisitor;
import dds.model.DDSGrid;
import dds.model.DDSStructureKind;
import dds.model.DDSVariable;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes declarations back out as DDS text, either on a single line (compact) or with one
 * declaration per line (pretty). Both forms re-parse to an equal tree.
 */
public class DDSDeclarationFormattingVisitor extends DDSDeclarationVisitor<Void, IOException> {

	private static final String COMPACT_SEPARATOR = "  ";

	private final IndentingWriter out;
	private final boolean pretty;
	private final int indent;

	private DDSDeclarationFormattingVisitor(IndentingWriter out, boolean pretty, int indent) {
		this.out = out;
		this.pretty = pretty;
		this.indent = indent;
	}

	public static DDSDeclarationFormattingVisitor compact(IndentingWriter out) {
		return new DDSDeclarationFormattingVisitor(out, false, 0);
	}

	public static DDSDeclarationFormattingVisitor pretty(IndentingWriter out, int indent) {
		if(indent < 0) {
			throw new IllegalArgumentException("indent must not be negative: " + indent);
		}
		return new DDSDeclarationFormattingVisitor(out, true, indent);
	}

	// the empty variable has no text form, so it takes no line or separator either
	private static <D extends DDSDeclaration> List<D> printable(List<D> declarations) {
		return declarations.stream()
				.filter(d -> !(d instanceof DDSVariable && ((DDSVariable) d).isEmpty()))
				.collect(Collectors.toList());
	}

	private void writeTrailer(DDSDeclaration declaration) throws IOException {
		out.write("} ");
		out.write(declaration.getName());
		out.write(";");
	}

	@Override
	public Void visit(DDSVariable variable) throws IOException {
		if(variable.isEmpty()) {
			return null;
		}
		out.write(variable.getBaseType().getDDSName());
		out.write(" ");
		out.write(variable.getName());
		DDSNodeFormattingVisitor dimensionFormatter = new DDSNodeFormattingVisitor(out);
		for(DDSArrayDimension dimension : variable.getDimensions()) {
			dimension.accept(dimensionFormatter);
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(DDSComposite composite) throws IOException {
		out.write(composite.getKind().getDDSName());
		out.write(" {");
		if(pretty) {
			try(IndentingWriter.Indent ignored = out.indent(indent)) {
				for(DDSDeclaration child : printable(composite.getChildren())) {
					out.newLine();
					child.accept(this);
				}
			}
			out.newLine();
		} else {
			out.write(" ");
			FormattingTools.writeSeparated(out, printable(composite.getChildren()), COMPACT_SEPARATOR, child -> child.accept(this));
			out.write(" ");
		}
		writeTrailer(composite);
		return null;
	}

	@Override
	public Void visit(DDSGrid grid) throws IOException {
		out.write(DDSStructureKind.GRID.getDDSName());
		out.write(" {");
		if(pretty) {
			out.newLine();
			out.write(" ARRAY:");
			try(IndentingWriter.Indent ignored = out.indent(indent)) {
				out.newLine();
				grid.getArray().accept(this);
			}
			out.newLine();
			out.write(" MAPS:");
			try(IndentingWriter.Indent ignored = out.indent(indent)) {
				for(DDSVariable map : printable(grid.getMaps())) {
					out.newLine();
					map.accept(this);
				}
			}
			out.newLine();
		} else {
			out.write(" ARRAY:");
			grid.getArray().accept(this);
			out.write(" MAPS:");
			FormattingTools.writeSeparated(out, printable(grid.getMaps()), COMPACT_SEPARATOR, map -> map.accept(this));
			out.write(" ");
		}
		writeTrailer(grid);
		return null;
	}

}
