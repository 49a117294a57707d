package dds.parser;

import dds.model.DDSDeclaration;

/**
 * A declaration taken off the front of some text, together with the text that follows it.
 */
public class Popped<D extends DDSDeclaration> {
	private final D declaration;
	private final String rest;

	public Popped(D declaration, String rest) {
		this.declaration = declaration;
		this.rest = rest;
	}

	public D getDeclaration() {
		return declaration;
	}

	public String getRest() {
		return rest;
	}
}
