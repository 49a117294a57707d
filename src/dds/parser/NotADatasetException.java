package dds.parser;

@SuppressWarnings("serial")
public class NotADatasetException extends DDSParseException {

	public NotADatasetException(String text) {
		super("given text is not a Dataset definition: " + excerpt(text));
	}

}
