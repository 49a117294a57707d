package dds.parser;

import dds.model.DDSBaseType;
import dds.model.DDSStructureKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what kind of declaration starts a piece of DDS text by looking at its head token.
 *
 * The token must be the first word of the text (after leading whitespace) and must be a whole
 * word, so a name such as {@code Gridded} or {@code Float64x} is never taken for a type keyword.
 */
public class DeclarationClassifier {

	private DeclarationClassifier() {}

	static final Pattern HEAD;

	static {
		List<String> keywords = new ArrayList<>();
		for(DDSBaseType t : DDSBaseType.values()) {
			keywords.add(Pattern.quote(t.getDDSName()));
		}
		for(DDSStructureKind k : DDSStructureKind.values()) {
			keywords.add(Pattern.quote(k.getDDSName()));
		}
		HEAD = Pattern.compile("\\s*(" + String.join("|", keywords) + ")(?![\\w.\\-])",
				Pattern.UNICODE_CHARACTER_CLASS);
	}

	public static Optional<DeclarationCategory> classify(CharSequence text) {
		Matcher m = HEAD.matcher(text);
		if(!m.lookingAt()) {
			return Optional.empty();
		}
		String keyword = m.group(1);
		if(keyword.equals(DDSStructureKind.GRID.getDDSName())) {
			return Optional.of(DeclarationCategory.GRID);
		}
		if(DDSStructureKind.lookup(keyword).isPresent()) {
			return Optional.of(DeclarationCategory.STRUCT);
		}
		return Optional.of(DeclarationCategory.BASE);
	}

}
