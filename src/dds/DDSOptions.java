package dds;

import dds.parser.DDSParserOptions;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class DDSOptions {
	public static final String VERSION = "0.1.0";

	public enum OutputFormat {
		PRETTY("pretty"),
		COMPACT("compact"),
		JSON("json");

		private final String optionName;

		OutputFormat(String optionName) {
			this.optionName = optionName;
		}

		public String getOptionName() {
			return optionName;
		}

		static OutputFormat fromOptionName(String name) throws DDSOptionException {
			for (OutputFormat f : values()) {
				if (f.optionName.equals(name)) {
					return f;
				}
			}
			throw new DDSOptionException("Unknown output format \"" + name + "\", expected pretty, compact or json");
		}
	}

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-t Log every parsing step (implies -v)", aliases = { "-trace" })
	public boolean trace = false;

	@Option(value = "-f Output format: pretty, compact or json", aliases = { "-format" })
	public String format;

	@Option(value = "-i Number of spaces per nesting level in pretty and json output", aliases = { "-indent" })
	public Integer indent;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public List<String> inputFilePaths;

	// resolved from the command line, falling back on the configuration file
	public OutputFormat outputFormat = OutputFormat.PRETTY;
	public int outputIndent = 4;
	private boolean parserTrace = false;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public DDSOptions(String[] args) {
		plumeOptions = new Options("ddsparse [options] file...", this);
		// prints usage on a bad argument
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void parse() throws DDSOptionException {
		if (version) {
			System.out.println("ddsparse version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		parserTrace = trace;

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;

			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new DDSOptionException("Error reading configuration file: " + ex.getMessage());
			}

			JSONObject config;

			try {
				config = new JSONObject(s);
			} catch (JSONException e) {
				throw new DDSOptionException(configFilePath + ": parsing error: " + e.getMessage());
			}

			try {
				JSONObject formatConfig = config.optJSONObject("format");
				if (formatConfig != null) {
					if (formatConfig.has("style")) {
						outputFormat = OutputFormat.fromOptionName(formatConfig.getString("style"));
					}
					if (formatConfig.has("indent")) {
						outputIndent = formatConfig.getInt("indent");
					}
				}
				JSONObject parserConfig = config.optJSONObject("parser");
				if (parserConfig != null && parserConfig.has("trace")) {
					parserTrace = parserTrace || parserConfig.getBoolean("trace");
				}
			} catch (JSONException e) {
				throw new DDSOptionException(configFilePath + ": " + e.getMessage());
			}
		}

		// the command line wins over the configuration file
		if (format != null) {
			outputFormat = OutputFormat.fromOptionName(format);
		}
		if (indent != null) {
			outputIndent = indent;
		}
		if (outputIndent < 0) {
			throw new DDSOptionException("Indentation must not be negative, got " + outputIndent);
		}

		if (remainingArgs.length == 0) {
			throw new DDSOptionException("At least one DDS file is required");
		}
		inputFilePaths = Arrays.asList(remainingArgs);
	}

	public boolean isParserTrace() {
		return parserTrace;
	}

	public DDSParserOptions getParserOptions() {
		return new DDSParserOptions(parserTrace);
	}
}
