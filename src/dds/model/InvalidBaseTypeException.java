package dds.model;

public class InvalidBaseTypeException extends DDSModelException {

	private static final long serialVersionUID = -2958216406931840154L;

	private final String name;

	public InvalidBaseTypeException(String name) {
		super("'" + name + "' is not a DDS base type");
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
