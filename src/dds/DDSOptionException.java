package dds;

@SuppressWarnings("serial")
public class DDSOptionException extends Exception {

	public DDSOptionException(String message) {
		super(message);
	}

}
