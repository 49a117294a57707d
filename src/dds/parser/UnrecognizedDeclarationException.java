package dds.parser;

@SuppressWarnings("serial")
public class UnrecognizedDeclarationException extends DDSParseException {

	private final String text;

	public UnrecognizedDeclarationException(String text) {
		super("no base type or structure kind starts the declaration " + excerpt(text));
		this.text = text;
	}

	/**
	 * @return the remaining text, starting at the unrecognized declaration
	 */
	public String getText() {
		return text;
	}

}
