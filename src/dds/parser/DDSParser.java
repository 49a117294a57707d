package dds.parser;

import dds.Unreachable;
import dds.model.DDSArrayDimension;
import dds.model.DDSBaseType;
import dds.model.DDSComposite;
import dds.model.DDSDataset;
import dds.model.DDSDeclaration;
import dds.model.DDSGrid;
import dds.model.DDSStructureKind;
import dds.model.DDSVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recursive-descent parser for OPeNDAP Dataset Descriptor Structure text.
 *
 * <pre>
 * dataset      := "Dataset" "{" declarations "}" name ";"
 * declarations := declaration*
 * declaration  := variable | composite | grid
 * composite    := ("Dataset" | "Structure" | "Sequence") "{" declarations "}" name ";"
 * grid         := "Grid" "{" "ARRAY:" variable "MAPS:" variable+ "}" name ";"
 * variable     := basetype name dimension* ";"
 * dimension    := "[" name "=" integer "]" | "[" integer "]"
 * </pre>
 *
 * A parser holds no mutable state; one instance may be shared between threads.
 */
public class DDSParser {

	public static final String LOGGER_NAME = "DDS Parser";

	private static final Logger logger = Logger.getLogger(LOGGER_NAME);

	// \w covers non-ASCII letters and digits in the patterns compiled with UNICODE_CHARACTER_CLASS
	static final String IDENTIFIER = "[\\w.\\-]+";

	static final Pattern DATASET = Pattern.compile(
			"\\s*Dataset\\s+\\{(.*)\\}\\s*(\\S+);\\s*", Pattern.DOTALL);
	static final Pattern GRID_BODY = Pattern.compile(
			"\\s*ARRAY\\s*:(.*?)MAPS\\s*:(.*)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	static final Pattern DIMENSION = Pattern.compile(
			"\\[\\s*(?:(" + IDENTIFIER + ")\\s*=\\s*)?(\\d{1,18})\\s*\\]",
			Pattern.UNICODE_CHARACTER_CLASS);
	static final Pattern VARIABLE = Pattern.compile(
			"\\s*(\\w+)\\s+(" + IDENTIFIER + ")((?:\\s*" + DIMENSION.pattern() + ")*)\\s*;\\s*",
			Pattern.UNICODE_CHARACTER_CLASS);
	static final Pattern WHITESPACE = Pattern.compile("\\s");

	private static final DDSParser DEFAULT = new DDSParser();

	private final DDSParserOptions options;

	public DDSParser() {
		this(DDSParserOptions.DEFAULT);
	}

	public DDSParser(DDSParserOptions options) {
		this.options = options;
	}

	public DDSParserOptions getOptions() {
		return options;
	}

	private void trace(String step, String text) {
		if(options.isTrace()) {
			logger.fine(step + ": text=\"" + text + "\"");
		}
	}

	/**
	 * Checks that every '{' in text is closed by a later '}'. Says nothing about the grammar
	 * beyond brace nesting.
	 *
	 * @throws BraceMismatchException with excess RIGHT at the first point where a '}' has no
	 * matching '{', or with excess LEFT and the number of unclosed braces at the end of the text
	 */
	public static void checkBracesMatching(CharSequence text) throws BraceMismatchException {
		int count = 0;
		for(int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			if(c == '{') {
				++count;
			} else if(c == '}') {
				--count;
			}
			if(count < 0) {
				throw new BraceMismatchException(BraceMismatchException.Excess.RIGHT, -count);
			}
		}
		if(count > 0) {
			throw new BraceMismatchException(BraceMismatchException.Excess.LEFT, count);
		}
	}

	/**
	 * Parses a complete DDS document with a shared parser using the default options.
	 *
	 * @see #parseDataset(String)
	 */
	public static DDSDataset parse(String text) throws DDSParseException {
		return DEFAULT.parseDataset(text);
	}

	/**
	 * Parses a complete DDS document, {@code Dataset { ... } name;}.
	 */
	public DDSDataset parseDataset(String text) throws DDSParseException {
		trace("parseDataset", text);
		checkBracesMatching(text);
		// greedy body: the last '}' before the name closes the dataset
		Matcher m = DATASET.matcher(text);
		if(!m.matches()) {
			throw new NotADatasetException(text);
		}
		return new DDSDataset(m.group(2), parseDeclarations(m.group(1)));
	}

	/**
	 * Parses a run of sibling declarations, in order. Blank text gives an empty list.
	 */
	public List<DDSDeclaration> parseDeclarations(String text) throws DDSParseException {
		List<DDSDeclaration> declarations = new ArrayList<>();
		String rest = text.trim();
		while(!rest.isEmpty()) {
			trace("parseDeclarations", rest);
			Optional<DeclarationCategory> category = DeclarationClassifier.classify(rest);
			if(!category.isPresent()) {
				throw new UnrecognizedDeclarationException(rest);
			}
			Popped<? extends DDSDeclaration> popped;
			switch(category.get()) {
				case GRID:
				case STRUCT:
					popped = popStruct(rest);
					break;
				case BASE:
					popped = popVariable(rest);
					break;
				default:
					throw new Unreachable();
			}
			declarations.add(popped.getDeclaration());
			rest = popped.getRest().trim();
		}
		return declarations;
	}

	/**
	 * Takes one Dataset, Structure, Sequence or Grid declaration off the front of text.
	 *
	 * @return the declaration and the text after its terminating ';', without leading whitespace
	 */
	public Popped<DDSDeclaration> popStruct(String text) throws DDSParseException {
		trace("popStruct", text);
		int left = text.indexOf('{');
		if(left == -1) {
			throw new MalformedDeclarationException("expected '{'", text);
		}
		String head = text.substring(0, left).trim();
		DDSStructureKind kind = DDSStructureKind.lookup(head).orElseThrow(
				() -> new MalformedDeclarationException("expected a structure kind before '{'", text));

		int depth = 0;
		int right = -1;
		for(int i = left; i < text.length(); ++i) {
			char c = text.charAt(i);
			if(c == '{') {
				++depth;
			} else if(c == '}') {
				--depth;
				if(depth == 0) {
					right = i;
					break;
				}
			}
		}
		if(right == -1) {
			throw new MalformedDeclarationException("unclosed '{'", text);
		}
		int terminator = text.indexOf(';', right);
		if(terminator == -1) {
			throw new MalformedDeclarationException("expected ';' after " + kind.getDDSName(), text);
		}
		String name = text.substring(right + 1, terminator).trim();
		if(name.isEmpty() || WHITESPACE.matcher(name).find()) {
			throw new MalformedDeclarationException("expected a single name after '}'", text);
		}
		String body = text.substring(left + 1, right);

		DDSDeclaration declaration;
		switch(kind) {
			case GRID:
				declaration = parseGridBody(name, body);
				break;
			case DATASET:
				declaration = new DDSDataset(name, parseDeclarations(body));
				break;
			case STRUCTURE:
			case SEQUENCE:
				declaration = new DDSComposite(name, kind, parseDeclarations(body));
				break;
			default:
				throw new Unreachable();
		}
		return new Popped<>(declaration, trimLeading(text.substring(terminator + 1)));
	}

	/**
	 * Takes one variable declaration, up to and including the next ';', off the front of text.
	 * The variable itself is parsed with {@link #parseVariable(String)}, so a line that does not
	 * look like a variable gives {@link DDSVariable#empty()} rather than an exception.
	 */
	public Popped<DDSVariable> popVariable(String text) throws DDSParseException {
		trace("popVariable", text);
		int terminator = text.indexOf(';');
		if(terminator == -1) {
			throw new MalformedDeclarationException("expected ';' after variable", text);
		}
		DDSVariable variable = parseVariable(text.substring(0, terminator + 1));
		return new Popped<>(variable, trimLeading(text.substring(terminator + 1)));
	}

	/**
	 * Parses the body of a Grid, between its braces.
	 *
	 * @throws MalformedGridException unless the body is ARRAY: followed by exactly one variable,
	 * then MAPS: followed by one or more variables
	 */
	public DDSGrid parseGridBody(String name, String body) throws DDSParseException {
		trace("parseGridBody", body);
		Matcher m = GRID_BODY.matcher(body);
		if(!m.matches()) {
			throw new MalformedGridException(name, "expected ARRAY: and MAPS: sections");
		}
		DDSVariable array = parseVariable(m.group(1));
		if(array.isEmpty()) {
			throw new MalformedGridException(name, "ARRAY: must hold exactly one variable");
		}
		List<DDSVariable> maps = new ArrayList<>();
		for(DDSDeclaration declaration : parseDeclarations(m.group(2))) {
			if(!(declaration instanceof DDSVariable) || ((DDSVariable) declaration).isEmpty()) {
				throw new MalformedGridException(name, "MAPS: may only hold variables");
			}
			maps.add((DDSVariable) declaration);
		}
		if(maps.isEmpty()) {
			throw new MalformedGridException(name, "MAPS: must hold at least one variable");
		}
		return new DDSGrid(name, array, maps);
	}

	/**
	 * Parses a single variable line such as {@code Float64 time_bnds[time = 8412][bnds = 2];}.
	 *
	 * @return the variable, or {@link DDSVariable#empty()} if the line is not a variable
	 */
	public DDSVariable parseVariable(String line) {
		trace("parseVariable", line);
		Matcher m = VARIABLE.matcher(line);
		if(!m.matches()) {
			return DDSVariable.empty();
		}
		Optional<DDSBaseType> baseType = DDSBaseType.lookup(m.group(1));
		if(!baseType.isPresent()) {
			return DDSVariable.empty();
		}
		Optional<List<DDSArrayDimension>> dimensions = readDimensions(m.group(3));
		if(!dimensions.isPresent()) {
			return DDSVariable.empty();
		}
		return new DDSVariable(m.group(2), baseType.get(), dimensions.get());
	}

	/**
	 * Finds every {@code [name = size]} or {@code [size]} clause in text, in order.
	 *
	 * @return the dimensions; empty if text has none
	 */
	public List<DDSArrayDimension> parseArrayDimensions(String text) {
		return readDimensions(text).orElse(new ArrayList<>());
	}

	// empty if any of the sizes does not fit in an int
	private static Optional<List<DDSArrayDimension>> readDimensions(String text) {
		List<DDSArrayDimension> dimensions = new ArrayList<>();
		Matcher m = DIMENSION.matcher(text);
		while(m.find()) {
			Optional<DDSArrayDimension> dimension = toDimension(m);
			if(!dimension.isPresent()) {
				return Optional.empty();
			}
			dimensions.add(dimension.get());
		}
		return Optional.of(dimensions);
	}

	/**
	 * Parses a single dimension clause at the start of text.
	 *
	 * @return the dimension, or {@link DDSArrayDimension#empty()} if text does not start with one
	 */
	public DDSArrayDimension parseArrayDimension(String text) {
		Matcher m = DIMENSION.matcher(text.trim());
		if(!m.lookingAt()) {
			return DDSArrayDimension.empty();
		}
		return toDimension(m).orElse(DDSArrayDimension.empty());
	}

	private static Optional<DDSArrayDimension> toDimension(Matcher m) {
		String name = m.group(1) == null ? "" : m.group(1);
		long size = Long.parseLong(m.group(2));
		if(size > Integer.MAX_VALUE) {
			return Optional.empty();
		}
		return Optional.of(new DDSArrayDimension(name, (int) size));
	}

	private static String trimLeading(String text) {
		int start = 0;
		while(start < text.length() && Character.isWhitespace(text.charAt(start))) {
			++start;
		}
		return text.substring(start);
	}

}
