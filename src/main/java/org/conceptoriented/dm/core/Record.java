package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View of one row of a snapshot passed to predicates and resolvers.
 * Values are read from the shared columns on access.
 */
public class Record {

	private final Map<String, Column> columns;

	private final int row;
	public int getRow() {
		return this.row;
	}

	public List<String> getNames() {
		return Collections.unmodifiableList(new ArrayList<String>(this.columns.keySet()));
	}
	public boolean has(String name) {
		return this.columns.containsKey(name);
	}

	/**
	 * Stored value of the field. For temporal dimensions it is the epoch milliseconds.
	 */
	public Object get(String name) {
		Column column = this.columns.get(name);
		if(column == null) {
			throw new IllegalArgumentException("Field " + name + " is not visible in this row.");
		}
		return column.getValue(this.row);
	}

	/**
	 * Numeric value of a field or null if it is not a number.
	 */
	public Double getDouble(String name) {
		return Column.toDouble(this.get(name));
	}

	/**
	 * Presentation value of the field (formatted for temporal dimensions, otherwise the stored value).
	 */
	public Object getLabel(String name) {
		Column column = this.columns.get(name);
		if(column == null) {
			throw new IllegalArgumentException("Field " + name + " is not visible in this row.");
		}
		return column.getLabel(this.row);
	}

	@Override
	public String toString() {
		Map<String, Object> values = new LinkedHashMap<String, Object>();
		this.columns.forEach((name, column) -> values.put(name, column.getValue(this.row)));
		return "#" + this.row + " " + values;
	}

	Record(Map<String, Column> columns, int row) {
		this.columns = columns;
		this.row = row;
	}
}
