package dds.parser;

@SuppressWarnings("serial")
public class MalformedGridException extends DDSParseException {

	private final String gridName;

	public MalformedGridException(String gridName, String reason) {
		super("grid " + gridName + ": " + reason);
		this.gridName = gridName;
	}

	public String getGridName() {
		return gridName;
	}

}
