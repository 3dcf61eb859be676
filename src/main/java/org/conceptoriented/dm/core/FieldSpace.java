package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Field space stores the columns of one data set and is shared by all snapshots derived from it.
 *
 * Adding or replacing a column is only allowed on a private copy: an operator first calls {@link #cloneSpace()} and then modifies the clone.
 * The clone is a new list of mostly the same column objects so that no column data is ever copied.
 */
public class FieldSpace {

	private final UUID id;
	public UUID getId() {
		return id;
	}

	private String name;
	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}

	//
	// Columns
	//

	private final List<Column> columns;
	public List<Column> getColumns() {
		return Collections.unmodifiableList(this.columns);
	}
	public List<String> getColumnNames() {
		return this.columns.stream().map(x -> x.getName()).collect(Collectors.<String>toList());
	}
	public Column getColumn(String name) {
		Column ret = this.columns.stream().filter(x -> x.getName().equals(name)).findAny().orElse(null);
		return ret;
	}
	public boolean hasColumn(String name) {
		return this.getColumn(name) != null;
	}

	public Map<String, Column> getMeasures() {
		Map<String, Column> ret = new LinkedHashMap<String, Column>();
		this.columns.stream().filter(x -> x.isMeasure()).forEach(x -> ret.put(x.getName(), x));
		return ret;
	}
	public Map<String, Column> getDimensions() {
		Map<String, Column> ret = new LinkedHashMap<String, Column>();
		this.columns.stream().filter(x -> x.isDimension()).forEach(x -> ret.put(x.getName(), x));
		return ret;
	}

	/**
	 * Number of stored rows. All columns have the same length.
	 */
	public int getRowCount() {
		if(this.columns.isEmpty()) return 0;
		return this.columns.get(0).getLength();
	}

	/**
	 * Replace a column with the same name or append it.
	 * It must be called only on a field space which is not shared, that is, a new one or a clone.
	 */
	public void addOrReplace(Column column) {
		if(!this.columns.isEmpty() && column.getLength() != this.getRowCount()) {
			throw new IllegalArgumentException("Column " + column.getName() + " has " + column.getLength() + " values but the field space has " + this.getRowCount() + " rows.");
		}
		for(int i=0; i<this.columns.size(); i++) {
			if(this.columns.get(i).getName().equals(column.getName())) {
				this.columns.set(i, column);
				return;
			}
		}
		this.columns.add(column);
	}

	/**
	 * New field space with the same column objects.
	 */
	public FieldSpace cloneSpace() {
		return new FieldSpace(this.name, this.columns);
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	public FieldSpace(String name, List<Column> columns) {
		this.id = UUID.randomUUID();
		this.name = name != null ? name : this.id.toString();
		this.columns = new ArrayList<Column>();
		for(Column column : columns) {
			if(this.hasColumn(column.getName())) {
				throw new IllegalArgumentException("Column names must be unique: " + column.getName());
			}
			this.addOrReplace(column);
		}
	}
	public FieldSpace(String name) {
		this(name, Collections.<Column>emptyList());
	}
}
