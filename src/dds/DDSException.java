package dds;

/**
 * A DDS exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class DDSException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public DDSException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
