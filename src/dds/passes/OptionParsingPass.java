package dds.passes;

import dds.DDSOptionException;
import dds.DDSOptions;
import dds.errors.IssueContext;
import dds.parser.DDSParser;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static DDSOptions perform(IssueContext ctx, Logger logger, String[] args) {
		DDSOptions opts = new DDSOptions(args);
		try {
			opts.parse();
		} catch (DDSOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose || opts.isParserTrace()) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		Logger.getLogger(DDSParser.LOGGER_NAME).setLevel(level);
		if (level == Level.FINE) {
			// the default console handler drops anything below INFO
			for (Handler handler : Logger.getLogger("").getHandlers()) {
				handler.setLevel(level);
			}
		}
		return opts;
	}
}
