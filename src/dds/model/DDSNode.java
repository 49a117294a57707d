package dds.model;

import dds.formatters.DDSNodeFormattingVisitor;
import dds.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for any node of a DDS tree. Nodes are immutable once constructed,
 * compare structurally and print themselves in the canonical pretty form.
 *
 */
public abstract class DDSNode {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new DDSNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract DDSNode copy();

	public abstract <T, E extends Throwable> T accept(DDSNodeVisitor<T, E> v) throws E;

}
