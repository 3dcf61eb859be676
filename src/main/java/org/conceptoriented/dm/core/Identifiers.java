package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;

/**
 * Rows an interaction was applied to, described by the values of some fields rather than by row indexes.
 *
 * Values are independent of a concrete snapshot so they can be matched against the rows of any snapshot in a lineage.
 * This is how rows of a grouped view are translated back to the raw rows of its root.
 */
public class Identifiers {

	private final List<String> fields;
	public List<String> getFields() {
		return this.fields;
	}

	private final List<List<Object>> rows;
	public List<List<Object>> getRows() {
		return this.rows;
	}

	public boolean isEmpty() {
		return this.rows.isEmpty();
	}

	/**
	 * The same rows described only by the specified fields. Duplicate tuples are removed.
	 */
	public Identifiers restrictTo(Collection<String> names) {
		List<String> keptFields = new ArrayList<String>();
		List<Integer> positions = new ArrayList<Integer>();
		for(int i=0; i<this.fields.size(); i++) {
			if(names.contains(this.fields.get(i))) {
				keptFields.add(this.fields.get(i));
				positions.add(i);
			}
		}

		Set<List<Object>> keptRows = new LinkedHashSet<List<Object>>();
		for(List<Object> row : this.rows) {
			List<Object> tuple = new ArrayList<Object>(positions.size());
			for(Integer pos : positions) {
				tuple.add(row.get(pos));
			}
			keptRows.add(tuple);
		}
		if(keptFields.isEmpty()) keptRows.clear(); // Nothing left to match on

		return new Identifiers(keptFields, new ArrayList<List<Object>>(keptRows));
	}

	/**
	 * Predicate which is true for rows whose values of the identifier fields are equal to one of the tuples.
	 * Numbers are compared by their double values.
	 */
	public RowPredicate toPredicate() {
		Set<List<Object>> tuples = new HashSet<List<Object>>();
		for(List<Object> row : this.rows) {
			tuples.add(normalize(row));
		}
		if(this.fields.isEmpty()) {
			return (row, index) -> false;
		}
		return (row, index) -> {
			List<Object> tuple = new ArrayList<Object>(this.fields.size());
			for(String field : this.fields) {
				tuple.add(row.has(field) ? row.get(field) : null);
			}
			return tuples.contains(normalize(tuple));
		};
	}

	private static List<Object> normalize(List<Object> tuple) {
		List<Object> ret = new ArrayList<Object>(tuple.size());
		for(Object value : tuple) {
			ret.add(value instanceof Number ? (Object) ((Number) value).doubleValue() : value);
		}
		return ret;
	}

	/**
	 * Stable string which is equal for equal identifier sets.
	 */
	public String getKey() {
		List<String> rowKeys = new ArrayList<String>();
		for(List<Object> row : this.rows) {
			rowKeys.add(Joiner.on(',').useForNull("null").join(normalize(row)));
		}
		return Joiner.on(',').join(this.fields) + ":" + Joiner.on(';').join(rowKeys);
	}

	//
	// Construction
	//

	public static Identifiers of(List<String> fields, List<List<Object>> rows) {
		return new Identifiers(fields, rows);
	}

	/**
	 * Describe rows of a snapshot by the values of all its visible fields.
	 */
	public static Identifiers fromRows(Snapshot snapshot, RowSelector rows) {
		List<String> fields = snapshot.getColumnNames();
		List<Column> columns = new ArrayList<Column>();
		fields.forEach(x -> columns.add(snapshot.getFieldSpace().getColumn(x)));

		List<List<Object>> tuples = new ArrayList<List<Object>>();
		rows.forEachRow(row -> {
			List<Object> tuple = new ArrayList<Object>(columns.size());
			for(Column column : columns) {
				tuple.add(column.getValue(row));
			}
			tuples.add(tuple);
		});
		return new Identifiers(fields, tuples);
	}

	@Override
	public String toString() {
		return "[" + this.getKey() + "]";
	}

	public Identifiers(List<String> fields, List<List<Object>> rows) {
		this.fields = Collections.unmodifiableList(new ArrayList<String>(fields));
		List<List<Object>> copy = new ArrayList<List<Object>>();
		for(List<Object> row : rows) {
			if(row.size() != fields.size()) {
				throw new IllegalArgumentException("Identifier row " + row + " does not match fields " + fields);
			}
			copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
		}
		this.rows = Collections.unmodifiableList(copy);
	}
}
