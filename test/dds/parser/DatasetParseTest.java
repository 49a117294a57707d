package dds.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Test;

import dds.model.DDSBaseType;
import dds.model.DDSComposite;
import dds.model.DDSDataset;
import dds.model.DDSGrid;
import dds.model.DDSStructureKind;
import dds.model.DDSVariable;

import static dds.model.DDSBuilder.*;

public class DatasetParseTest {

	static final String SAMPLE1_NAME =
			"CMIP6.CMIP.MRI.MRI-ESM2-0.piControl.r1i1p1f1.Amon.tas.gn.tas.20190222.aggregation.1";

	static String readSample(String name) throws IOException {
		return FileUtils.readFileToString(new File("test/samples", name), StandardCharsets.UTF_8);
	}

	static DDSGrid tasGrid() {
		return grid("tas",
				var("tas", DDSBaseType.FLOAT32, dim("time", 8412), dim("lat", 160), dim("lon", 320)),
				var("time", DDSBaseType.FLOAT64, dim("time", 8412)),
				var("lat", DDSBaseType.FLOAT64, dim("lat", 160)),
				var("lon", DDSBaseType.FLOAT64, dim("lon", 320)));
	}

	static DDSDataset sample1() {
		return dataset(SAMPLE1_NAME,
				var("lat", DDSBaseType.FLOAT64, dim("lat", 160)),
				var("lat_bnds", DDSBaseType.FLOAT64, dim("lat", 160), dim("bnds", 2)),
				var("lon", DDSBaseType.FLOAT64, dim("lon", 320)),
				var("lon_bnds", DDSBaseType.FLOAT64, dim("lon", 320), dim("bnds", 2)),
				var("height", DDSBaseType.FLOAT64),
				var("time", DDSBaseType.FLOAT64, dim("time", 8412)),
				var("time_bnds", DDSBaseType.FLOAT64, dim("time", 8412), dim("bnds", 2)),
				tasGrid());
	}

	static DDSDataset sample2() {
		return dataset("data",
				var("catalog_number", DDSBaseType.INT32),
				sequence("station",
						var("experimenter", DDSBaseType.STRING),
						var("time", DDSBaseType.INT32),
						structure("location",
								var("latitude", DDSBaseType.FLOAT64),
								var("longitude", DDSBaseType.FLOAT64)),
						sequence("cast",
								var("depth", DDSBaseType.FLOAT64),
								var("salinity", DDSBaseType.FLOAT64),
								var("oxygen", DDSBaseType.FLOAT64),
								var("temperature", DDSBaseType.FLOAT64))));
	}

	static DDSDataset sample3() {
		return dataset("xbt-station",
				structure("location",
						var("lat", DDSBaseType.FLOAT64),
						var("lon", DDSBaseType.FLOAT64)),
				structure("time",
						var("minutes", DDSBaseType.INT32),
						var("day", DDSBaseType.INT32),
						var("year", DDSBaseType.INT32)),
				var("depth", DDSBaseType.FLOAT64, dim(500)),
				var("temperature", DDSBaseType.FLOAT64, dim(500)));
	}

	private final DDSParser parser = new DDSParser();

	@Test
	public void testOneLineGrid() throws DDSParseException {
		String text = "Dataset {\n"
				+ "    Float64 lat[lat = 160];\n"
				+ "    Float64 height;\n"
				+ "    Grid { ARRAY: Float32 tas[time = 8412][lat = 160][lon = 320];\n"
				+ "           MAPS: Float64 time[time = 8412]; Float64 lat[lat = 160]; Float64 lon[lon = 320]; } tas;\n"
				+ "} " + SAMPLE1_NAME + ";\n";
		DDSDataset actual = parser.parseDataset(text);
		assertThat(actual.getName(), is(SAMPLE1_NAME));
		assertThat(actual.getKind(), is(DDSStructureKind.DATASET));
		assertThat(actual, is(dataset(SAMPLE1_NAME,
				var("lat", DDSBaseType.FLOAT64, dim("lat", 160)),
				var("height", DDSBaseType.FLOAT64),
				tasGrid())));
	}

	@Test
	public void testSample1() throws IOException, DDSParseException {
		DDSDataset actual = parser.parseDataset(readSample("sample1.dds"));
		assertThat(actual, is(sample1()));
		DDSGrid tas = (DDSGrid) actual.getDeclaration("tas").get();
		assertThat(tas.getArray().getDimensions().size(), is(3));
		assertThat(tas.getMaps().size(), is(3));
	}

	@Test
	public void testSample2() throws IOException, DDSParseException {
		DDSDataset actual = parser.parseDataset(readSample("sample2.dds"));
		assertThat(actual, is(sample2()));
		DDSComposite station = (DDSComposite) actual.getDeclaration("station").get();
		assertThat(station.getKind(), is(DDSStructureKind.SEQUENCE));
		assertThat(((DDSComposite) station.getDeclaration("location").get()).getKind(), is(DDSStructureKind.STRUCTURE));
		assertThat(((DDSComposite) station.getDeclaration("cast").get()).getKind(), is(DDSStructureKind.SEQUENCE));
	}

	@Test
	public void testSample3() throws IOException, DDSParseException {
		DDSDataset actual = parser.parseDataset(readSample("sample3.dds"));
		assertThat(actual, is(sample3()));
		DDSVariable depth = (DDSVariable) actual.getDeclaration("depth").get();
		assertThat(depth.getDimensions().get(0).getName(), is(""));
		assertThat(depth.getDimensions().get(0).getSize(), is(500));
	}

	@Test
	public void testEmptyDataset() throws DDSParseException {
		assertThat(DDSParser.parse("Dataset { } nothing;"), is(dataset("nothing")));
	}

	@Test
	public void testNonAsciiNames() throws DDSParseException {
		assertThat(parser.parseDataset("Dataset { Float64 température; Int32 jour[année = 12]; } d;"),
				is(dataset("d",
						var("température", DDSBaseType.FLOAT64),
						var("jour", DDSBaseType.INT32, dim("année", 12)))));
	}

	@Test
	public void testTracingParserGivesSameTree() throws IOException, DDSParseException {
		DDSParser tracing = new DDSParser(new DDSParserOptions(true));
		assertTrue(tracing.getOptions().isTrace());
		assertThat(tracing.parseDataset(readSample("sample2.dds")), is(sample2()));
	}

	@Test
	public void testMissingDatasetWrapper() throws IOException {
		try {
			parser.parseDataset(readSample("not_a_dataset.dds"));
			fail("expected NotADatasetException");
		} catch (DDSParseException e) {
			assertThat(e, is(instanceOf(NotADatasetException.class)));
			assertThat(e.getMessage(), startsWith("given text is not a Dataset definition: "));
		}
	}

	@Test(expected = NotADatasetException.class)
	public void testMissingDatasetName() throws DDSParseException {
		parser.parseDataset("Dataset { Int32 a; };");
	}

	@Test(expected = NotADatasetException.class)
	public void testTrailingGarbage() throws DDSParseException {
		parser.parseDataset("Dataset { Int32 a; } d; Int32 b");
	}

	// braces are checked before the dataset template
	@Test
	public void testUnbalancedBraces() throws IOException {
		try {
			parser.parseDataset(readSample("unbalanced.dds"));
			fail("expected BraceMismatchException");
		} catch (DDSParseException e) {
			assertThat(e, is(instanceOf(BraceMismatchException.class)));
			assertThat(((BraceMismatchException) e).getExcess(), is(BraceMismatchException.Excess.LEFT));
			assertThat(((BraceMismatchException) e).getCount(), is(1));
		}
	}

	@Test(expected = UnrecognizedDeclarationException.class)
	public void testUnknownTypeInDataset() throws DDSParseException {
		parser.parseDataset("Dataset { Int32 a; Complex64 z; } d;");
	}

	@Test
	public void testParserIsReusable() throws IOException, DDSParseException {
		DDSParser shared = new DDSParser();
		assertThat(shared.parseDataset(readSample("sample3.dds")), is(sample3()));
		assertThat(shared.parseDataset(readSample("sample3.dds")), is(sample3()));
		assertThat(shared.parseDataset(readSample("sample2.dds")), is(sample2()));
	}

}
