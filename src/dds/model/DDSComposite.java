package dds.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 *
 * A brace-delimited group of declarations: a Structure, a Sequence or a Dataset. Grids have
 * their own body grammar and are represented by {@link DDSGrid}; datasets by {@link DDSDataset}.
 *
 */
public class DDSComposite extends DDSDeclaration {

	private final DDSStructureKind kind;
	private final List<DDSDeclaration> children;

	public DDSComposite(String name, DDSStructureKind kind, List<DDSDeclaration> children) {
		this(name, kind, children, false);
	}

	/**
	 * @throws InvalidStructureKindException if kindName is not a DDS structure kind
	 */
	public DDSComposite(String name, String kindName, List<DDSDeclaration> children) {
		this(name, DDSStructureKind.fromName(kindName), children);
	}

	DDSComposite(String name, DDSStructureKind kind, List<DDSDeclaration> children, boolean isDataset) {
		super(name);
		if(kind == null) {
			throw new DDSModelException("composite " + name + " has no structure kind");
		}
		if(kind == DDSStructureKind.GRID) {
			throw new DDSModelException("grid " + name + " must be constructed as a DDSGrid");
		}
		if(kind == DDSStructureKind.DATASET && !isDataset) {
			throw new DDSModelException("dataset " + name + " must be constructed as a DDSDataset");
		}
		this.kind = kind;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public DDSStructureKind getKind() {
		return kind;
	}

	public List<DDSDeclaration> getChildren() {
		return children;
	}

	/**
	 * @return the first child declared with the given name, if any
	 */
	public Optional<DDSDeclaration> getDeclaration(String name) {
		return children.stream().filter(c -> c.getName().equals(name)).findFirst();
	}

	public boolean contains(String name) {
		return getDeclaration(name).isPresent();
	}

	public List<String> getNames() {
		return children.stream().map(DDSDeclaration::getName).collect(Collectors.toList());
	}

	protected List<DDSDeclaration> copyChildren() {
		return children.stream().map(DDSDeclaration::copy).collect(Collectors.toList());
	}

	@Override
	public DDSComposite copy() {
		return new DDSComposite(getName(), kind, copyChildren());
	}

	@Override
	public <T, E extends Throwable> T accept(DDSDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), kind, children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DDSComposite other = (DDSComposite) obj;
		return getName().equals(other.getName()) && kind == other.kind && children.equals(other.children);
	}

}
