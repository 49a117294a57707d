package dds.errors;

import dds.passes.WhileReadingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileReadingFile whileReadingFile) throws E;

}
