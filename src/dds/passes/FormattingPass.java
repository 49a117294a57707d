package dds.passes;

import dds.DDSOptions;
import dds.Unreachable;
import dds.formatters.DDSJsonFormattingVisitor;
import dds.formatters.IndentingWriter;
import dds.model.DDSDataset;

import java.io.IOException;
import java.io.Writer;

public class FormattingPass {
	private FormattingPass() {}

	public static void perform(DDSOptions.OutputFormat format, int indent, DDSDataset dataset, Writer output)
			throws IOException {
		switch (format) {
			case PRETTY:
				output.write(dataset.toPrettyString(indent));
				break;
			case COMPACT:
				output.write(dataset.toCompactString());
				break;
			case JSON:
				output.write(DDSJsonFormattingVisitor.toJSON(dataset).toString(indent));
				break;
			default:
				throw new Unreachable();
		}
		output.write(IndentingWriter.LINE_SEPARATOR);
	}
}
