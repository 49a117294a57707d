package dds.model;

import java.util.Optional;

/**
 * Classifies a composite DDS declaration. Dataset is, by convention, only used at the root
 * of a tree.
 */
public enum DDSStructureKind {
	DATASET("Dataset"),
	STRUCTURE("Structure"),
	SEQUENCE("Sequence"),
	GRID("Grid");

	private final String ddsName;

	DDSStructureKind(String ddsName) {
		this.ddsName = ddsName;
	}

	public String getDDSName() {
		return ddsName;
	}

	/**
	 * @param name a DDS spelling, case-sensitive
	 * @return the matching constant, or empty if there is none
	 */
	public static Optional<DDSStructureKind> lookup(String name) {
		for(DDSStructureKind v : values()) {
			if(v.ddsName.equals(name)) {
				return Optional.of(v);
			}
		}
		return Optional.empty();
	}

	/**
	 * @throws InvalidStructureKindException if name is not a valid spelling
	 */
	public static DDSStructureKind fromName(String name) {
		return lookup(name).orElseThrow(() -> new InvalidStructureKindException(name));
	}
}
