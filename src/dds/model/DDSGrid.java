package dds.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 *
 * A Grid declaration: one array variable plus the map variables giving the coordinates along
 * each of its dimensions.
 *
 * A grid produced by the parser always has at least one map. A grid built directly is not
 * checked for this.
 *
 */
public class DDSGrid extends DDSDeclaration {

	private final DDSVariable array;
	private final List<DDSVariable> maps;

	public DDSGrid(String name, DDSVariable array, List<DDSVariable> maps) {
		super(name);
		if(array == null) {
			throw new DDSModelException("grid " + name + " has no array");
		}
		this.array = array;
		this.maps = Collections.unmodifiableList(new ArrayList<>(maps));
	}

	public DDSStructureKind getKind() {
		return DDSStructureKind.GRID;
	}

	public DDSVariable getArray() {
		return array;
	}

	public List<DDSVariable> getMaps() {
		return maps;
	}

	/**
	 * Looks the name up in the array first, then in the maps.
	 */
	public Optional<DDSVariable> getDeclaration(String name) {
		if(array.getName().equals(name)) {
			return Optional.of(array);
		}
		return maps.stream().filter(m -> m.getName().equals(name)).findFirst();
	}

	public boolean contains(String name) {
		return getDeclaration(name).isPresent();
	}

	public List<String> getNames() {
		List<String> names = new ArrayList<>();
		names.add(array.getName());
		for(DDSVariable map : maps) {
			names.add(map.getName());
		}
		return names;
	}

	@Override
	public DDSGrid copy() {
		return new DDSGrid(getName(), array.copy(), maps.stream().map(DDSVariable::copy).collect(Collectors.toList()));
	}

	@Override
	public <T, E extends Throwable> T accept(DDSDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), array, maps);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DDSGrid other = (DDSGrid) obj;
		return getName().equals(other.getName()) && array.equals(other.array) && maps.equals(other.maps);
	}

}
