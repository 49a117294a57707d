package dds.model;

public abstract class DDSDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(DDSVariable variable) throws E;
	public abstract T visit(DDSComposite composite) throws E;
	public abstract T visit(DDSGrid grid) throws E;
}
