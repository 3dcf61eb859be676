package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;

/**
 * Group-by with reduction of measures.
 *
 * Rows visible in the input snapshot are partitioned by the tuple of their key field values.
 * Every continuous measure which is not a key is reduced within each partition. Other fields which are not keys are dropped.
 * Output rows follow the order in which the keys are first seen.
 */
public class GroupEngine {
	private static final Logger logger = LoggerFactory.getLogger(GroupEngine.class);

	public static final String KEY_SEPARATOR = ",";

	private final ReducerRegistry registry;

	/**
	 * Stable string form of the key fields which identifies the grouping.
	 */
	public static String groupByString(List<String> dimensionNames) {
		return Joiner.on(KEY_SEPARATOR).join(dimensionNames);
	}

	/**
	 * Choose the reducer name for each measure: explicitly requested, column default or registry default.
	 */
	public Map<String, String> resolveReducers(Snapshot input, List<String> dimensionNames, Map<String, String> reducers) throws DmError {
		FieldSpace space = input.getFieldSpace();
		Map<String, String> resolved = new LinkedHashMap<String, String>();
		for(String name : input.getColumnNames()) {
			Column column = space.getColumn(name);
			if(!column.isMeasure() || dimensionNames.contains(name)) continue;
			if(column.getSubtype() != DmColumnSubtype.CONTINUOUS) continue; // Bin labels are not reduced

			String reducerName = reducers.get(name);
			if(reducerName == null) reducerName = column.getDefinition().getDefaultReducer();
			if(reducerName == null) reducerName = this.registry.getDefaultReducerName();

			if(!this.registry.has(reducerName)) {
				logger.warn("Unknown reducer '{}' for measure {}", reducerName, name);
				throw new DmError(DmErrorCode.UNKNOWN_REDUCER, "Error grouping. ", "Reducer '" + reducerName + "' for measure " + name + " is not registered. ");
			}
			resolved.put(name, reducerName);
		}

		for(String name : reducers.keySet()) { // Reducers for fields which will not be reduced
			if(!resolved.containsKey(name) && !this.registry.has(reducers.get(name))) {
				throw new DmError(DmErrorCode.UNKNOWN_REDUCER, "Error grouping. ", "Reducer '" + reducers.get(name) + "' for field " + name + " is not registered. ");
			}
		}
		return resolved;
	}

	/**
	 * Build the field space of the grouped result: key fields followed by the reduced measures.
	 */
	public FieldSpace groupBy(Snapshot input, List<String> dimensionNames, Map<String, String> reducers) throws DmError {

		FieldSpace space = input.getFieldSpace();

		//
		// Validate
		//
		List<Column> keyColumns = new ArrayList<Column>();
		for(String name : dimensionNames) {
			if(!input.getColumnNames().contains(name)) {
				logger.warn("Group-by field {} is not visible in {}", name, input);
				throw new DmError(DmErrorCode.UNKNOWN_COLUMN, "Error grouping. ", "Field " + name + " does not exist. ");
			}
			if(keyColumns.contains(space.getColumn(name))) {
				throw new DmError(DmErrorCode.DUPLICATE_COLUMN, "Error grouping. ", "Field " + name + " is listed twice. ");
			}
			keyColumns.add(space.getColumn(name));
		}
		for(String name : reducers.keySet()) {
			if(!input.getColumnNames().contains(name)) {
				throw new DmError(DmErrorCode.UNKNOWN_COLUMN, "Error grouping. ", "Reduced field " + name + " does not exist. ");
			}
		}

		Map<String, String> reducerNames = this.resolveReducers(input, dimensionNames, reducers);
		List<Column> measureColumns = new ArrayList<Column>();
		reducerNames.keySet().forEach(x -> measureColumns.add(space.getColumn(x)));

		//
		// Partition rows by key. The map preserves first-seen order
		//
		Map<List<Object>, List<Integer>> groups = new LinkedHashMap<List<Object>, List<Integer>>();
		input.getRowSelector().forEachRow(row -> {
			List<Object> key = new ArrayList<Object>(keyColumns.size());
			for(Column keyColumn : keyColumns) {
				key.add(keyColumn.getValue(row));
			}
			groups.computeIfAbsent(key, k -> new ArrayList<Integer>()).add(row);
		});

		//
		// Key columns
		//
		List<Column> result = new ArrayList<Column>();
		for(int k=0; k<keyColumns.size(); k++) {
			List<Object> values = new ArrayList<Object>(groups.size());
			for(List<Object> key : groups.keySet()) {
				values.add(key.get(k));
			}
			Column keyColumn = keyColumns.get(k);
			result.add(new Column(keyColumn.getDefinition(), values, keyColumn.getBins()));
		}

		//
		// Reduced columns
		//
		for(Column measure : measureColumns) {
			Reducer reducer = this.registry.lookup(reducerNames.get(measure.getName()));
			List<Object> values = new ArrayList<Object>(groups.size());
			for(List<Integer> rows : groups.values()) {
				List<Double> groupValues = new ArrayList<Double>(rows.size());
				for(Integer row : rows) {
					groupValues.add(Column.toDouble(measure.getValue(row)));
				}
				values.add(reducer.reduce(groupValues));
			}
			result.add(new Column(measure.getDefinition(), values));
		}

		logger.debug("Grouped {} rows by [{}] into {} rows", input.getRowCount(), groupByString(dimensionNames), groups.size());

		return new FieldSpace(space.getName() + "-" + groupByString(dimensionNames), result);
	}

	public ReducerRegistry getRegistry() {
		return this.registry;
	}

	public GroupEngine(ReducerRegistry registry) {
		this.registry = registry;
	}
}
