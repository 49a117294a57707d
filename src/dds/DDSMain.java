package dds;

import dds.errors.TopLevelIssueContext;
import dds.model.DDSDataset;
import dds.parser.DDSParser;
import dds.passes.DDSParsingPass;
import dds.passes.FormattingPass;
import dds.passes.IOErrorIssue;
import dds.passes.OptionParsingPass;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Command line front end: parses local DDS files and prints each as canonical DDS text or JSON.
 * A file that cannot be read or parsed is reported and skipped.
 */
public class DDSMain {
	private final String[] cmdArgs;
	private final Writer output;
	private static Logger logger;

	public DDSMain(String[] args, Writer output) {
		cmdArgs = args;
		this.output = output;
		// Get the top Logger instance
		logger = Logger.getLogger("DDSMain");
	}

	// Creates a DDSMain instance writing to standard output, and initiates run() below.
	public static void main(String[] args) {
		Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
		if (new DDSMain(args, out).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		DDSOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}

		DDSParser parser = new DDSParser(opts.getParserOptions());
		int parsed = 0;
		try {
			for (String inputFile : opts.inputFilePaths) {
				Path inputFilePath = Paths.get(inputFile);
				logger.info("Parsing " + inputFilePath);
				Optional<DDSDataset> dataset = DDSParsingPass.perform(ctx, parser, inputFilePath);
				if (dataset.isPresent()) {
					logger.fine("Writing dataset " + dataset.get().getName());
					FormattingPass.perform(opts.outputFormat, opts.outputIndent, dataset.get(), output);
					++parsed;
				}
			}
			output.flush();
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		}
		logger.info("Parsed " + parsed + " of " + opts.inputFilePaths.size() + " file(s)");

		if (ctx.hasErrors()) {
			logger.severe("found issues");
			System.err.println(ctx.format());
			return false;
		}
		return true;
	}
}
