package dds.model;

import java.util.Optional;

/**
 * The scalar element type of a DDS variable.
 */
public enum DDSBaseType {
	BYTE("Byte"),
	INT16("Int16"),
	INT32("Int32"),
	UINT32("UInt32"),
	FLOAT32("Float32"),
	FLOAT64("Float64"),
	STRING("String"),
	URL("Url");

	private final String ddsName;

	DDSBaseType(String ddsName) {
		this.ddsName = ddsName;
	}

	/**
	 * @return the spelling of this type in DDS text, e.g. "Float64"
	 */
	public String getDDSName() {
		return ddsName;
	}

	/**
	 * @param name a DDS spelling, case-sensitive
	 * @return the matching constant, or empty if there is none
	 */
	public static Optional<DDSBaseType> lookup(String name) {
		for(DDSBaseType v : values()) {
			if(v.ddsName.equals(name)) {
				return Optional.of(v);
			}
		}
		return Optional.empty();
	}

	/**
	 * @throws InvalidBaseTypeException if name is not a valid spelling
	 */
	public static DDSBaseType fromName(String name) {
		return lookup(name).orElseThrow(() -> new InvalidBaseTypeException(name));
	}
}
