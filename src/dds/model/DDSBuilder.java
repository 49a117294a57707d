package dds.model;

import java.util.Arrays;
import java.util.List;

public class DDSBuilder {
	private DDSBuilder() {}

	public static DDSArrayDimension dim(String name, int size) {
		return new DDSArrayDimension(name, size);
	}

	public static DDSArrayDimension dim(int size) {
		return new DDSArrayDimension("", size);
	}

	public static List<DDSArrayDimension> dims(DDSArrayDimension... dims) {
		return Arrays.asList(dims);
	}

	public static DDSVariable var(String name, DDSBaseType type, DDSArrayDimension... dims) {
		return new DDSVariable(name, type, Arrays.asList(dims));
	}

	public static DDSVariable var(String name, String typeName, DDSArrayDimension... dims) {
		return new DDSVariable(name, typeName, Arrays.asList(dims));
	}

	public static List<DDSDeclaration> decls(DDSDeclaration... decls) {
		return Arrays.asList(decls);
	}

	public static DDSComposite structure(String name, DDSDeclaration... children) {
		return new DDSComposite(name, DDSStructureKind.STRUCTURE, Arrays.asList(children));
	}

	public static DDSComposite sequence(String name, DDSDeclaration... children) {
		return new DDSComposite(name, DDSStructureKind.SEQUENCE, Arrays.asList(children));
	}

	public static DDSGrid grid(String name, DDSVariable array, DDSVariable... maps) {
		return new DDSGrid(name, array, Arrays.asList(maps));
	}

	public static DDSDataset dataset(String name, DDSDeclaration... children) {
		return new DDSDataset(name, Arrays.asList(children));
	}
}
