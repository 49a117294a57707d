package dds.model;

public class InvalidStructureKindException extends DDSModelException {

	private static final long serialVersionUID = 7529144862301359710L;

	private final String name;

	public InvalidStructureKindException(String name) {
		super("'" + name + "' is not a DDS structure kind");
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
