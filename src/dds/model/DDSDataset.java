package dds.model;

import java.util.List;

/**
 * The root of a DDS tree.
 */
public class DDSDataset extends DDSComposite {

	public DDSDataset(String name, List<DDSDeclaration> children) {
		super(name, DDSStructureKind.DATASET, children, true);
	}

	@Override
	public DDSDataset copy() {
		return new DDSDataset(getName(), copyChildren());
	}

}
