package dds.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T>{
		void format(T param) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, List<T> items, String separator, Formatter<T> writer) throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(separator);
			}
			isFirst = false;
			writer.format(item);
		}
	}

}
