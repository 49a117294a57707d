package dds.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 *
 * A leaf declaration: a base type, a name and zero or more array dimensions. A variable without
 * dimensions is a scalar.
 *
 */
public class DDSVariable extends DDSDeclaration {

	private static final DDSVariable EMPTY = new DDSVariable();

	private final DDSBaseType baseType;
	private final List<DDSArrayDimension> dimensions;

	private DDSVariable() {
		super("");
		this.baseType = null;
		this.dimensions = Collections.emptyList();
	}

	public DDSVariable(String name, DDSBaseType baseType, List<DDSArrayDimension> dimensions) {
		super(name);
		if(baseType == null) {
			throw new DDSModelException("variable " + name + " has no base type");
		}
		this.baseType = baseType;
		this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
	}

	/**
	 * @throws InvalidBaseTypeException if baseTypeName is not a DDS base type
	 */
	public DDSVariable(String name, String baseTypeName, List<DDSArrayDimension> dimensions) {
		this(name, DDSBaseType.fromName(baseTypeName), dimensions);
	}

	/**
	 * The default variable, with no name, no base type and no dimensions. Variable-line parsing
	 * returns this instead of failing, so callers can compare against it.
	 */
	public static DDSVariable empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return equals(EMPTY);
	}

	public DDSBaseType getBaseType() {
		return baseType;
	}

	public List<DDSArrayDimension> getDimensions() {
		return dimensions;
	}

	public boolean isScalar() {
		return dimensions.isEmpty();
	}

	@Override
	public DDSVariable copy() {
		if(isEmpty()) {
			return EMPTY;
		}
		return new DDSVariable(getName(), baseType,
				dimensions.stream().map(DDSArrayDimension::copy).collect(Collectors.toList()));
	}

	@Override
	public <T, E extends Throwable> T accept(DDSDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), baseType, dimensions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DDSVariable other = (DDSVariable) obj;
		return getName().equals(other.getName()) && baseType == other.baseType &&
				dimensions.equals(other.dimensions);
	}

}
