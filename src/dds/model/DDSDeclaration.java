package dds.model;

import dds.formatters.DDSDeclarationFormattingVisitor;
import dds.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A single declaration in a DDS declaration sequence: a variable, a composite (Dataset,
 * Structure, Sequence) or a grid. The set of subclasses is closed, so
 * {@link DDSDeclarationVisitor} covers every case.
 */
public abstract class DDSDeclaration extends DDSNode {

	private final String name;

	DDSDeclaration(String name) {
		this.name = name == null ? "" : name;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the single-line form of this declaration, suitable for re-parsing
	 */
	public String toCompactString() {
		StringWriter w = new StringWriter();
		format(DDSDeclarationFormattingVisitor.compact(new IndentingWriter(w)));
		return w.toString();
	}

	/**
	 * @param indent number of spaces each nesting level is indented by
	 * @return the multi-line form of this declaration, one child declaration per line
	 */
	public String toPrettyString(int indent) {
		StringWriter w = new StringWriter();
		format(DDSDeclarationFormattingVisitor.pretty(new IndentingWriter(w), indent));
		return w.toString();
	}

	private void format(DDSDeclarationFormattingVisitor visitor) {
		try {
			accept(visitor);
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
	}

	@Override
	public abstract DDSDeclaration copy();

	@Override
	public <T, E extends Throwable> T accept(DDSNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(DDSDeclarationVisitor<T, E> v) throws E;

}
