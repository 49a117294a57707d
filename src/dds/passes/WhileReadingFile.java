package dds.passes;

import dds.errors.Context;
import dds.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileReadingFile extends Context {

	private final Path file;

	public WhileReadingFile(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
