package dds.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import static dds.model.DDSBuilder.*;

public class DDSModelTest {

	private static DDSDataset station() {
		return dataset("data",
				var("catalog_number", DDSBaseType.INT32),
				sequence("station",
						var("experimenter", DDSBaseType.STRING),
						structure("location",
								var("latitude", DDSBaseType.FLOAT64),
								var("longitude", DDSBaseType.FLOAT64))));
	}

	@Test
	public void testEqualityIsStructural() {
		DDSDataset a = station();
		DDSDataset b = station();
		assertThat(a, is(a));
		assertThat(a, is(b));
		assertThat(b, is(a));
		assertThat(a.hashCode(), is(b.hashCode()));
	}

	@Test
	public void testEqualityIsOrderSensitive() {
		DDSComposite ab = structure("s", var("a", DDSBaseType.INT32), var("b", DDSBaseType.INT32));
		DDSComposite ba = structure("s", var("b", DDSBaseType.INT32), var("a", DDSBaseType.INT32));
		assertThat(ab, not(ba));
		assertThat(var("v", DDSBaseType.INT32, dim("x", 1), dim("y", 2)),
				not(var("v", DDSBaseType.INT32, dim("y", 2), dim("x", 1))));
	}

	@Test
	public void testEqualityDistinguishesKinds() {
		assertThat(structure("s", var("a", DDSBaseType.INT32)), not(sequence("s", var("a", DDSBaseType.INT32))));
		assertThat((DDSComposite) dataset("s", var("a", DDSBaseType.INT32)),
				not(new DDSComposite("s", DDSStructureKind.STRUCTURE, decls(var("a", DDSBaseType.INT32)))));
		assertThat(var("a", DDSBaseType.INT32), not(var("a", DDSBaseType.UINT32)));
		assertThat(dim("x", 1), not(dim(1)));
	}

	@Test
	public void testCopy() {
		DDSDataset original = station();
		DDSDataset copy = original.copy();
		assertThat(copy, is(original));
		assertNotSame(copy, original);
		assertNotSame(copy.getChildren().get(1), original.getChildren().get(1));
		DDSGrid g = grid("g", var("g", DDSBaseType.FLOAT32, dim("x", 2)), var("x", DDSBaseType.FLOAT64, dim("x", 2)));
		assertThat(g.copy(), is(g));
		assertSame(DDSVariable.empty().copy(), DDSVariable.empty());
	}

	@Test
	public void testChildrenAreImmutable() {
		DDSDataset ds = station();
		try {
			ds.getChildren().add(var("x", DDSBaseType.BYTE));
			fail("children should not be modifiable");
		} catch (UnsupportedOperationException e) {
			assertThat(ds.getChildren().size(), is(2));
		}
	}

	@Test
	public void testNamedLookup() {
		DDSDataset ds = station();
		assertThat(ds.getNames(), is(Arrays.asList("catalog_number", "station")));
		assertTrue(ds.contains("station"));
		assertFalse(ds.contains("location"));
		DDSComposite st = (DDSComposite) ds.getDeclaration("station").get();
		DDSComposite loc = (DDSComposite) st.getDeclaration("location").get();
		assertThat(loc.getDeclaration("latitude").get(), is(var("latitude", DDSBaseType.FLOAT64)));
		assertFalse(ds.getDeclaration("missing").isPresent());
	}

	@Test
	public void testGridLookup() {
		DDSGrid g = grid("tas",
				var("tas", DDSBaseType.FLOAT32, dim("lat", 2)),
				var("lat", DDSBaseType.FLOAT64, dim("lat", 2)));
		assertThat(g.getKind(), is(DDSStructureKind.GRID));
		assertThat(g.getNames(), is(Arrays.asList("tas", "lat")));
		assertThat(g.getDeclaration("tas").get(), is(g.getArray()));
		assertThat(g.getDeclaration("lat").get(), is(g.getMaps().get(0)));
		assertFalse(g.contains("lon"));
	}

	@Test
	public void testVariableProperties() {
		assertTrue(var("h", DDSBaseType.FLOAT64).isScalar());
		assertFalse(var("d", DDSBaseType.FLOAT64, dim(500)).isScalar());
		assertTrue(DDSVariable.empty().isEmpty());
		assertFalse(var("h", DDSBaseType.FLOAT64).isEmpty());
		assertThat(DDSVariable.empty().getName(), is(""));
		assertThat(DDSVariable.empty().getBaseType(), is(nullValue()));
	}

	@Test
	public void testSpellings() {
		assertThat(DDSBaseType.fromName("UInt32"), is(DDSBaseType.UINT32));
		assertThat(DDSBaseType.FLOAT64.getDDSName(), is("Float64"));
		assertFalse(DDSBaseType.lookup("float64").isPresent());
		assertThat(DDSStructureKind.fromName("Sequence"), is(DDSStructureKind.SEQUENCE));
		assertFalse(DDSStructureKind.lookup("Array").isPresent());
		assertThat(var("x", "Int16"), is(var("x", DDSBaseType.INT16)));
		assertThat(new DDSComposite("s", "Structure", Collections.<DDSDeclaration>emptyList()), is(structure("s")));
	}

	@Test
	public void testInvalidBaseTypeName() {
		try {
			var("x", "Complex");
			fail("expected InvalidBaseTypeException");
		} catch (InvalidBaseTypeException e) {
			assertThat(e.getName(), is("Complex"));
			assertThat(e.getPrefix(), is("Model Error"));
			assertThat(e.getMsg(), is("'Complex' is not a DDS base type"));
			assertThat(e.getMessage(), is("Model Error: 'Complex' is not a DDS base type"));
		}
	}

	@Test(expected = InvalidStructureKindException.class)
	public void testInvalidStructureKindName() {
		new DDSComposite("s", "Record", Collections.<DDSDeclaration>emptyList());
	}

	@Test(expected = DDSModelException.class)
	public void testNullBaseType() {
		new DDSVariable("x", (DDSBaseType) null, Collections.<DDSArrayDimension>emptyList());
	}

	@Test(expected = DDSModelException.class)
	public void testNegativeDimension() {
		dim("x", -1);
	}

	@Test(expected = DDSModelException.class)
	public void testCompositeCannotBeGrid() {
		new DDSComposite("g", DDSStructureKind.GRID, Collections.<DDSDeclaration>emptyList());
	}

	@Test(expected = DDSModelException.class)
	public void testCompositeCannotBeDataset() {
		new DDSComposite("d", DDSStructureKind.DATASET, Collections.<DDSDeclaration>emptyList());
	}

	@Test(expected = DDSModelException.class)
	public void testGridNeedsArray() {
		grid("g", null, var("x", DDSBaseType.FLOAT64));
	}

}
