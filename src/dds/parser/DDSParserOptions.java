package dds.parser;

/**
 * Immutable settings for a {@link DDSParser}.
 */
public class DDSParserOptions {

	public static final DDSParserOptions DEFAULT = new DDSParserOptions(false);

	private final boolean trace;

	public DDSParserOptions(boolean trace) {
		this.trace = trace;
	}

	/**
	 * @return whether the parser logs each step at level FINE
	 */
	public boolean isTrace() {
		return trace;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return trace == ((DDSParserOptions) obj).trace;
	}

	@Override
	public int hashCode() {
		return Boolean.hashCode(trace);
	}

	@Override
	public String toString() {
		return "DDSParserOptions [trace=" + trace + "]";
	}
}
