package dds.passes;

import dds.errors.IssueContext;
import dds.model.DDSDataset;
import dds.parser.DDSParseException;
import dds.parser.DDSParser;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

public class DDSParsingPass {
	private DDSParsingPass() {}

	/**
	 * Reads and parses one DDS file. Failures are reported to ctx, in the context of the file,
	 * and give an empty result so that the caller can go on with other files.
	 */
	public static Optional<DDSDataset> perform(IssueContext ctx, DDSParser parser, Path inputFilePath) {
		IssueContext fileCtx = ctx.withContext(new WhileReadingFile(inputFilePath));
		String text;
		try {
			text = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			fileCtx.error(new IOErrorIssue(e));
			return Optional.empty();
		}
		try {
			return Optional.of(parser.parseDataset(text));
		} catch (DDSParseException e) {
			fileCtx.error(new ParsingIssue(e));
			return Optional.empty();
		}
	}
}
