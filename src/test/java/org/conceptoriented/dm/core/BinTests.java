package org.conceptoriented.dm.core;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

public class BinTests {

    Snapshot root;

    @Before
    public void setUp() throws DmError {
    	List<Double> values = new ArrayList<Double>();
    	for(int i=0; i<100; i++) values.add((double) i);

    	List<String> parity = new ArrayList<String>();
    	for(int i=0; i<100; i++) parity.add(i % 2 == 0 ? "even" : "odd");

    	root = DataAdapter.fromColumns("Numbers",
    			Arrays.asList(parity, values),
    			Arrays.asList(ColumnDefinition.dimension("Parity"), ColumnDefinition.measure("Value"))
    			);
    }

    private static Object label(Snapshot snapshot, int row) {
    	return snapshot.getFieldSpace().getColumn("Value_binned").getValue(row);
    }

    @Test
    public void binCountTest() throws DmError
    {
    	Snapshot binned = root.bin("Value", BinConfig.binCount(5));

    	assertEquals("80-100", label(binned, 99)); // Maximum is in the last bucket
    	assertEquals("0-20", label(binned, 0));
    	assertEquals("20-40", label(binned, 20));
    	assertEquals("0-20", label(binned, 19));

    	Column column = binned.getFieldSpace().getColumn("Value_binned");
    	assertEquals(DmColumnKind.MEASURE, column.getKind());
    	assertEquals(DmColumnSubtype.DISCRETE, column.getSubtype());
    	assertEquals(Arrays.asList(0.0, 20.0, 40.0, 60.0, 80.0, 100.0), column.getBins().getRange());
    	assertEquals(Arrays.asList(10.0, 30.0, 50.0, 70.0, 90.0), column.getBins().getMid());

    	// Rows are shared and one field is added
    	assertEquals(root.getRowSelector(), binned.getRowSelector());
    	assertEquals(Arrays.asList("Parity", "Value", "Value_binned"), binned.getColumnNames());
    	assertFalse(root.getFieldSpace().hasColumn("Value_binned"));

    	Derivation.Bin derivation = (Derivation.Bin) binned.getDerivations().get(0);
    	assertEquals("Value", derivation.getMeasureName());
    	assertEquals("Value_binned", derivation.getBinFieldName());
    }

    @Test
    public void binCountWithStartTest() throws DmError
    {
    	// Bin size comes from the whole domain: (99 + 1 - 0) / 5
    	Snapshot binned = root.bin("Value", new BinConfig().setStart(10.0).setBinCount(5));

    	assertEquals(Arrays.asList(0.0, 10.0, 30.0, 50.0, 70.0, 90.0, 110.0), binned.getFieldSpace().getColumn("Value_binned").getBins().getRange());
    	assertEquals("0-10", label(binned, 5)); // Below start
    	assertEquals("10-30", label(binned, 10));
    	assertEquals("90-110", label(binned, 99));
    }

    @Test
    public void binSizeTest() throws DmError
    {
    	Snapshot even = root.bin("Value", BinConfig.binSize(25).setName("Quarter"));
    	assertEquals("75-100", even.getFieldSpace().getColumn("Quarter").getValue(99));
    	assertEquals(Arrays.asList(0.0, 25.0, 50.0, 75.0, 100.0), even.getFieldSpace().getColumn("Quarter").getBins().getRange());

    	// The span is extended to the next multiple of the bin size
    	Snapshot uneven = root.bin("Value", BinConfig.binSize(30));
    	assertEquals("90-120", label(uneven, 99));
    	assertEquals("60-90", label(uneven, 60));
    	assertEquals(Arrays.asList(0.0, 30.0, 60.0, 90.0, 120.0), uneven.getFieldSpace().getColumn("Value_binned").getBins().getRange());
    }

    @Test
    public void bucketsTest() throws DmError
    {
    	Snapshot binned = root.bin("Value", BinConfig.buckets(10.0, Arrays.asList(30.0, 60.0)));

    	assertEquals("0-10", label(binned, 5)); // Below start
    	assertEquals("10-30", label(binned, 10));
    	assertEquals("30-60", label(binned, 45));
    	assertEquals("60-99", label(binned, 60)); // At or above the last stop
    	assertEquals("60-99", label(binned, 99));

    	Column.Bins bins = binned.getFieldSpace().getColumn("Value_binned").getBins();
    	assertEquals(Arrays.asList(0.0, 10.0, 30.0, 60.0, 99.0), bins.getRange());
    	assertEquals(bins.getRange().size() - 1, bins.getMid().size());
    	for(int i=1; i<bins.getRange().size(); i++) {
    		assertTrue(bins.getRange().get(i) > bins.getRange().get(i-1));
    	}

    	// Fractional bounds
    	Snapshot fractional = root.bin("Value", BinConfig.buckets(null, Arrays.asList(2.5, 50.0)));
    	assertEquals("0-2.5", label(fractional, 1));
    	assertEquals("2.5-50", label(fractional, 3));
    }

    @Test
    public void filteredDomainTest() throws DmError
    {
    	// Buckets are computed from all values, not the visible ones
    	Snapshot small = root.select((row, index) -> row.getDouble("Value") < 50);
    	Snapshot binned = small.bin("Value", BinConfig.binCount(5));

    	assertEquals("40-60", label(binned, 45));
    	assertNull(label(binned, 70)); // Not visible
    	assertEquals(6, binned.getFieldSpace().getColumn("Value_binned").getBins().getRange().size());
    }

    @Test
    public void binnedGroupingTest() throws DmError
    {
    	Snapshot grouped = root.bin("Value", BinConfig.binCount(5))
    			.groupBy(Arrays.asList("Value_binned"), Collections.singletonMap("Value", ReducerRegistry.COUNT));

    	assertEquals(5, grouped.getRowCount());
    	assertEquals(20.0, (Double) grouped.getFieldSpace().getColumn("Value").getValue(0), 0.0);
    	assertNotNull(grouped.getFieldSpace().getColumn("Value_binned").getBins()); // Metadata is kept for keys
    }

    @Test
    public void errorsTest() throws DmError
    {
    	try {
    		root.bin("Size", BinConfig.binCount(5));
    		fail("Unknown field");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.UNKNOWN_COLUMN, e.code);
    	}

    	try {
    		root.bin("Parity", BinConfig.binCount(5));
    		fail("Not a measure");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.INVALID_COLUMN_KIND, e.code);
    	}

    	Snapshot binned = root.bin("Value", BinConfig.binCount(5));
    	try {
    		binned.bin("Value", BinConfig.binCount(2));
    		fail("Duplicate bin field");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.DUPLICATE_COLUMN, e.code);
    	}

    	try {
    		root.bin("Value", BinConfig.binCount(0));
    		fail("Wrong count");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.INVALID_BIN_CONFIG, e.code);
    	}

    	try {
    		root.bin("Value", BinConfig.buckets(null, Arrays.asList(50.0, 20.0)));
    		fail("Stops are not ascending");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.INVALID_BIN_CONFIG, e.code);
    	}

    	try {
    		root.bin("Value", new BinConfig().setStart(200.0).setBinSize(10.0));
    		fail("Start above maximum");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.INVALID_BIN_CONFIG, e.code);
    	}

    	assertEquals(1, root.getChildren().size());
    }

    @Test
    public void configJsonTest() throws DmError
    {
    	BinConfig config = BinConfig.fromJson("{ \"name\": \"B\", \"buckets\": { \"start\": 10, \"stops\": [30, 60] } }");
    	assertTrue(config.hasBuckets());
    	assertEquals(10.0, config.getStart(), 0.0);
    	assertEquals("B", config.getBinFieldName("Value"));

    	JSONObject json = new JSONObject(BinConfig.binCount(4).toJson());
    	assertEquals(4, json.getInt("binCount"));
    	assertEquals(4, (int) BinConfig.fromJson(json.toString()).getBinCount());
    }
}
