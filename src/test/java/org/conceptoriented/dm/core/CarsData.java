package org.conceptoriented.dm.core;

import java.util.Arrays;
import java.util.List;

/**
 * Small data set used by the tests.
 */
class CarsData {

	static final List<String> NAMES = Arrays.asList("chevrolet", "ford", "audi", "bmw", "toyota", "honda");
	static final List<String> ORIGINS = Arrays.asList("USA", "USA", "EU", "EU", "Japan", "Japan");
	static final List<Double> HP = Arrays.asList(130.0, 95.0, 110.0, 150.0, 88.0, 97.0);
	static final List<Double> WEIGHT = Arrays.asList(3504.0, 2800.0, 3000.0, 3200.0, 2100.0, 2200.0);

	static List<ColumnDefinition> schema() {
		return Arrays.asList(
				ColumnDefinition.dimension("Name"),
				ColumnDefinition.dimension("Origin"),
				ColumnDefinition.measure("HP"),
				ColumnDefinition.measure("Weight")
				);
	}

	static Snapshot create() throws DmError {
		return DataAdapter.fromColumns("Cars", Arrays.asList(NAMES, ORIGINS, HP, WEIGHT), schema());
	}

	static Snapshot create(ReducerRegistry registry, PropagationContext context) throws DmError {
		return DataAdapter.fromColumns("Cars", Arrays.asList(NAMES, ORIGINS, HP, WEIGHT), schema(), registry, context);
	}

	static RowPredicate hpAbove(double hp) {
		return (row, index) -> row.getDouble("HP") > hp;
	}
}
