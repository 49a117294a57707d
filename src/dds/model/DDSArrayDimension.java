package dds.model;

import java.util.Objects;

/**
 *
 * One bracketed {@code [name = size]} clause attached to a variable. The name is empty for the
 * value-only form {@code [size]}.
 *
 */
public class DDSArrayDimension extends DDSNode {

	private static final DDSArrayDimension EMPTY = new DDSArrayDimension("", 0);

	private final String name;
	private final int size;

	public DDSArrayDimension(String name, int size) {
		if(size < 0) {
			throw new DDSModelException("array dimension " + name + " has negative size " + size);
		}
		this.name = name == null ? "" : name;
		this.size = size;
	}

	/**
	 * @return the value produced when a dimension clause fails to parse
	 */
	public static DDSArrayDimension empty() {
		return EMPTY;
	}

	public String getName() {
		return name;
	}

	public int getSize() {
		return size;
	}

	@Override
	public DDSArrayDimension copy() {
		return new DDSArrayDimension(name, size);
	}

	@Override
	public <T, E extends Throwable> T accept(DDSNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, size);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DDSArrayDimension other = (DDSArrayDimension) obj;
		return size == other.size && name.equals(other.name);
	}

}
