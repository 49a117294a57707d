package dds.parser;

@SuppressWarnings("serial")
public class MalformedDeclarationException extends DDSParseException {

	public MalformedDeclarationException(String reason, String text) {
		super(reason + " in " + excerpt(text));
	}

}
