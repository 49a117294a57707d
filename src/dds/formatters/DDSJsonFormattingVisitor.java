package dds.formatters;

import dds.model.DDSArrayDimension;
import dds.model.DDSComposite;
import dds.model.DDSDeclaration;
import dds.model.DDSDeclarationVisitor;
import dds.model.DDSGrid;
import dds.model.DDSStructureKind;
import dds.model.DDSVariable;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders a DDS tree as JSON, for consumers that want the schema without re-parsing DDS text.
 *
 * Variables become {@code {"name", "type", "dimensions": [{"name", "size"}]}}, composites
 * {@code {"name", "kind", "children"}} and grids {@code {"name", "kind", "array", "maps"}}.
 */
public class DDSJsonFormattingVisitor extends DDSDeclarationVisitor<JSONObject, RuntimeException> {

	public static final String NAME = "name";
	public static final String TYPE = "type";
	public static final String KIND = "kind";
	public static final String DIMENSIONS = "dimensions";
	public static final String SIZE = "size";
	public static final String CHILDREN = "children";
	public static final String ARRAY = "array";
	public static final String MAPS = "maps";

	public static JSONObject toJSON(DDSDeclaration declaration) {
		return declaration.accept(new DDSJsonFormattingVisitor());
	}

	@Override
	public JSONObject visit(DDSVariable variable) {
		JSONObject result = new JSONObject();
		result.put(NAME, variable.getName());
		result.put(TYPE, variable.getBaseType() == null ? JSONObject.NULL : variable.getBaseType().getDDSName());
		JSONArray dimensions = new JSONArray();
		for(DDSArrayDimension dimension : variable.getDimensions()) {
			JSONObject d = new JSONObject();
			d.put(NAME, dimension.getName());
			d.put(SIZE, dimension.getSize());
			dimensions.put(d);
		}
		result.put(DIMENSIONS, dimensions);
		return result;
	}

	@Override
	public JSONObject visit(DDSComposite composite) {
		JSONObject result = new JSONObject();
		result.put(NAME, composite.getName());
		result.put(KIND, composite.getKind().getDDSName());
		JSONArray children = new JSONArray();
		for(DDSDeclaration child : composite.getChildren()) {
			children.put(child.accept(this));
		}
		result.put(CHILDREN, children);
		return result;
	}

	@Override
	public JSONObject visit(DDSGrid grid) {
		JSONObject result = new JSONObject();
		result.put(NAME, grid.getName());
		result.put(KIND, DDSStructureKind.GRID.getDDSName());
		result.put(ARRAY, grid.getArray().accept(this));
		JSONArray maps = new JSONArray();
		for(DDSVariable map : grid.getMaps()) {
			maps.put(map.accept(this));
		}
		result.put(MAPS, maps);
		return result;
	}

}
