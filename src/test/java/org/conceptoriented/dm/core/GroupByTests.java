package org.conceptoriented.dm.core;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

public class GroupByTests {

    Snapshot root;

    @Before
    public void setUp() throws DmError {
    	root = CarsData.create();
    }

    @Test
    public void maxByOriginTest() throws DmError
    {
    	Snapshot cars = DataAdapter.fromColumns("Cars",
    			Arrays.asList(Arrays.asList("USA", "USA", "EU"), Arrays.asList(130, 95, 110)),
    			Arrays.asList(ColumnDefinition.dimension("Origin"), ColumnDefinition.measure("HP"))
    			);

    	Map<String, String> reducers = new HashMap<String, String>();
    	reducers.put("HP", ReducerRegistry.MAX);
    	Snapshot grouped = cars.groupBy(Arrays.asList("Origin"), reducers);

    	List<List<Object>> data = grouped.getData().getData();
    	assertEquals(2, data.size());
    	assertEquals(Arrays.asList("USA", 130.0), data.get(0));
    	assertEquals(Arrays.asList("EU", 110.0), data.get(1));

    	// New field space with all rows visible
    	assertNotSame(cars.getFieldSpace(), grouped.getFieldSpace());
    	assertEquals(RowSelector.all(2), grouped.getRowSelector());
    	assertSame(cars, grouped.getParent());
    }

    @Test
    public void defaultReducersTest() throws DmError
    {
    	Snapshot grouped = root.groupBy(Arrays.asList("Origin"));

    	// Dimensions which are not keys are dropped
    	assertEquals(Arrays.asList("Origin", "HP", "Weight"), grouped.getColumnNames());

    	Column hp = grouped.getFieldSpace().getColumn("HP");
    	assertEquals(112.5, (Double) hp.getValue(0), 1e-9); // USA
    	assertEquals(130.0, (Double) hp.getValue(1), 1e-9); // EU
    	assertEquals(92.5, (Double) hp.getValue(2), 1e-9); // Japan

    	// Domain is recomputed from reduced values
    	assertEquals(92.5, hp.getNumericDomain().getLeft(), 1e-9);
    	assertEquals(130.0, hp.getNumericDomain().getRight(), 1e-9);

    	// Column default reducer
    	Snapshot cars = DataAdapter.fromColumns("Cars",
    			Arrays.asList(CarsData.ORIGINS, CarsData.HP),
    			Arrays.asList(ColumnDefinition.dimension("Origin"), ColumnDefinition.measure("HP").setDefaultReducer(ReducerRegistry.SUM))
    			);
    	Snapshot summed = cars.groupBy(Arrays.asList("Origin"));
    	assertEquals(225.0, (Double) summed.getFieldSpace().getColumn("HP").getValue(0), 1e-9);

    	// Registry default
    	ReducerRegistry registry = new ReducerRegistry();
    	registry.setDefaultReducer(ReducerRegistry.MIN);
    	Snapshot minimal = CarsData.create(registry, new PropagationContext()).groupBy(Arrays.asList("Origin"));
    	assertEquals(95.0, (Double) minimal.getFieldSpace().getColumn("HP").getValue(0), 1e-9);
    }

    @Test
    public void customReducerTest() throws DmError
    {
    	ReducerRegistry registry = new ReducerRegistry();
    	registry.register("range", values -> ReducerRegistry.max(values) - ReducerRegistry.min(values));

    	Snapshot grouped = root.groupBy(Arrays.asList("Origin"), Collections.singletonMap("HP", "range"), registry);
    	assertEquals(35.0, (Double) grouped.getFieldSpace().getColumn("HP").getValue(0), 1e-9);

    	Derivation.GroupBy derivation = (Derivation.GroupBy) grouped.getDerivations().get(0);
    	assertEquals("Origin", derivation.getGroupByString());
    	assertEquals("range", derivation.getReducers().get("HP"));
    	assertEquals(ReducerRegistry.AVG, derivation.getDefaultReducer());
    }

    @Test
    public void replayKeepsReducersTest() throws DmError
    {
    	ReducerRegistry registry = new ReducerRegistry();
    	Snapshot cars = CarsData.create(registry, new PropagationContext());
    	Snapshot grouped = cars.groupBy(Arrays.asList("Origin"));
    	assertEquals(112.5, (Double) grouped.getFieldSpace().getColumn("HP").getValue(0), 1e-9);

    	Derivation.GroupBy derivation = (Derivation.GroupBy) grouped.getDerivations().get(0);
    	assertEquals(ReducerRegistry.AVG, derivation.getResolvedReducers().get("HP"));
    	assertEquals(ReducerRegistry.AVG, derivation.getResolvedReducers().get("Weight"));

    	// Changing the default later does not change the replayed grouping
    	registry.setDefaultReducer(ReducerRegistry.MAX);
    	Snapshot replayed = derivation.replay(cars);
    	assertEquals(112.5, (Double) replayed.getFieldSpace().getColumn("HP").getValue(0), 1e-9);
    	assertEquals(ReducerRegistry.AVG, derivation.getDefaultReducer());

    	// New groupings use the new default
    	assertEquals(130.0, (Double) cars.groupBy(Arrays.asList("Origin")).getFieldSpace().getColumn("HP").getValue(0), 1e-9);
    }

    @Test
    public void multipleKeysTest() throws DmError
    {
    	Snapshot grouped = root
    			.calculateVariable(ColumnDefinition.dimension("Heavy"), Arrays.asList("Weight"), (values, row) -> ((Double) values[0]) >= 3000 ? "yes" : "no")
    			.groupBy(Arrays.asList("Origin", "Heavy"), Collections.singletonMap("HP", ReducerRegistry.COUNT));

    	List<List<Object>> data = grouped.project(Arrays.asList("Origin", "Heavy", "HP")).getData().getData();
    	assertEquals(4, data.size());
    	assertEquals(Arrays.asList("USA", "yes", 1.0), data.get(0));
    	assertEquals(Arrays.asList("USA", "no", 1.0), data.get(1));
    	assertEquals(Arrays.asList("EU", "yes", 2.0), data.get(2));
    	assertEquals(Arrays.asList("Japan", "no", 2.0), data.get(3));

    	assertEquals("Origin,Heavy", ((Derivation.GroupBy) grouped.getDerivations().get(0)).getGroupByString());
    }

    @Test
    public void filteredGroupingTest() throws DmError
    {
    	Snapshot grouped = root.select(CarsData.hpAbove(100)).groupBy(Arrays.asList("Origin"), Collections.singletonMap("HP", ReducerRegistry.SUM));

    	List<List<Object>> data = grouped.project(Arrays.asList("Origin", "HP")).getData().getData();
    	assertEquals(2, data.size());
    	assertEquals(Arrays.asList("USA", 130.0), data.get(0));
    	assertEquals(Arrays.asList("EU", 260.0), data.get(1));
    }

    @Test
    public void regroupTest() throws DmError
    {
    	Map<String, String> reducers = Collections.singletonMap("HP", ReducerRegistry.MAX);

    	Snapshot first = root.groupBy(Arrays.asList("Origin"), reducers);
    	Snapshot second = first.groupBy(Arrays.asList("Origin"), reducers);

    	assertEquals(first.getRowCount(), second.getRowCount());
    	assertEquals(first.getData().getData(), second.getData().getData());

    	// Also with the default mean
    	Snapshot averaged = root.groupBy(Arrays.asList("Origin"));
    	assertEquals(averaged.getData().getData(), averaged.groupBy(Arrays.asList("Origin")).getData().getData());
    }

    @Test
    public void errorsTest() throws DmError
    {
    	try {
    		root.groupBy(Arrays.asList("Country"));
    		fail("Unknown key");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.UNKNOWN_COLUMN, e.code);
    	}

    	try {
    		root.project(Arrays.asList("HP")).groupBy(Arrays.asList("Origin"));
    		fail("Key is not visible");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.UNKNOWN_COLUMN, e.code);
    	}

    	try {
    		root.groupBy(Arrays.asList("Origin"), Collections.singletonMap("HP", "median"));
    		fail("Unknown reducer");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.UNKNOWN_REDUCER, e.code);
    	}

    	try {
    		root.groupBy(Arrays.asList("Origin", "Origin"));
    		fail("Duplicate key");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.DUPLICATE_COLUMN, e.code);
    	}

    	assertEquals(1, root.getChildren().size()); // Only the projection
    }

    @Test
    public void reducersTest() throws DmError
    {
    	List<Double> values = Arrays.asList(2.0, null, 4.0, Double.NaN, 6.0);

    	assertEquals(12.0, ReducerRegistry.sum(values), 1e-9);
    	assertEquals(4.0, ReducerRegistry.avg(values), 1e-9);
    	assertEquals(2.0, ReducerRegistry.min(values), 1e-9);
    	assertEquals(6.0, ReducerRegistry.max(values), 1e-9);
    	assertEquals(2.0, ReducerRegistry.first(values), 1e-9);
    	assertEquals(6.0, ReducerRegistry.last(values), 1e-9);
    	assertEquals(3.0, ReducerRegistry.count(values), 1e-9);
    	assertEquals(Math.sqrt(8.0 / 3), ReducerRegistry.std(values), 1e-9);

    	List<Double> nulls = Arrays.asList((Double) null, null);
    	assertNull(ReducerRegistry.sum(nulls));
    	assertNull(ReducerRegistry.avg(nulls));
    	assertEquals(0.0, ReducerRegistry.count(nulls), 0.0);

    	ReducerRegistry registry = new ReducerRegistry();
    	assertEquals(ReducerRegistry.AVG, registry.getDefaultReducerName());
    	assertEquals(3.0, registry.defaultReducer().reduce(Arrays.asList(2.0, 4.0)), 1e-9);
    	try {
    		registry.setDefaultReducer("median");
    		fail("Unknown reducer");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.UNKNOWN_REDUCER, e.code);
    	}
    	registry.unregister(ReducerRegistry.STD);
    	assertFalse(registry.has(ReducerRegistry.STD));
    }
}
