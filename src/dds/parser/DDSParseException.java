package dds.parser;

/**
 * A hard failure while parsing DDS text. No partial tree is produced; callers should treat
 * the schema of the dataset as unavailable.
 */
@SuppressWarnings("serial")
public class DDSParseException extends Exception {

	public DDSParseException(String message) {
		super(message);
	}

	/**
	 * Shortens text quoted in error messages to its first line, at most 40 characters.
	 */
	static String excerpt(String text) {
		String trimmed = text.trim();
		int lineEnd = trimmed.indexOf('\n');
		if(lineEnd != -1) {
			trimmed = trimmed.substring(0, lineEnd).trim();
		}
		if(trimmed.length() > 40) {
			trimmed = trimmed.substring(0, 40) + "...";
		}
		return "\"" + trimmed + "\"";
	}

}
