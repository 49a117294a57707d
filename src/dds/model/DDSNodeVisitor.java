package dds.model;

public abstract class DDSNodeVisitor<T, E extends Throwable> {
	public abstract T visit(DDSDeclaration declaration) throws E;
	public abstract T visit(DDSArrayDimension dimension) throws E;
}
