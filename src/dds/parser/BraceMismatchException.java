package dds.parser;

@SuppressWarnings("serial")
public class BraceMismatchException extends DDSParseException {

	public enum Excess {
		LEFT("left"),
		RIGHT("right");

		private final String side;

		Excess(String side) {
			this.side = side;
		}
	}

	private final Excess excess;
	private final int count;

	public BraceMismatchException(Excess excess, int count) {
		super("braces do not match: too many " + excess.side + " braces: " + count + " more.");
		this.excess = excess;
		this.count = count;
	}

	public Excess getExcess() {
		return excess;
	}

	/**
	 * @return for LEFT the number of unclosed braces at the end of the text, for RIGHT the depth
	 * of the first point where more braces were closed than opened
	 */
	public int getCount() {
		return count;
	}

}
