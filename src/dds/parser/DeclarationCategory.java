package dds.parser;

/**
 * What kind of declaration starts a piece of DDS text, as decided by {@link DeclarationClassifier}.
 */
public enum DeclarationCategory {
	/** a Grid, which has its own ARRAY/MAPS body grammar */
	GRID,
	/** a Dataset, Structure or Sequence */
	STRUCT,
	/** a variable of one of the base types */
	BASE,
}
