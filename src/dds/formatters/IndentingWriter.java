package dds.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a line break with the current indentation. DDS text
 * always uses "\n" as its line separator, whatever the platform.
 */
public class IndentingWriter extends Writer {

	public static final String LINE_SEPARATOR = "\n";

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	int defaultIndent = 4;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(LINE_SEPARATOR);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent) {
				for(int i = 0; i < indent; ++i) {
					out.write(" ");
				}
				shouldIndent = false;
			}
			int next = data.indexOf(LINE_SEPARATOR, start);
			if(next == -1) {
				out.write(data.substring(start));
				break;
			}
			out.write(data.substring(start, next + LINE_SEPARATOR.length()));
			start = next + LINE_SEPARATOR.length();
			shouldIndent = true;
		}
	}

}
