package dds.model;

import dds.DDSException;

/**
 * Raised when a DDS tree node is constructed directly from values that do not
 * describe a valid node.
 *
 */
public class DDSModelException extends DDSException {

	private static final long serialVersionUID = 4181906532278711385L;
	private static final String prefix = "Model Error";

	public DDSModelException(String msg) {
		super(prefix, msg);
	}

}
