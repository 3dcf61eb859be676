package org.conceptoriented.dm.core;

import java.util.Comparator;

import org.apache.commons.lang3.builder.CompareToBuilder;

/**
 * One level of sorting: a field and either a direction or a custom comparator of values.
 * Nulls are placed after all other values in ascending order.
 */
public class SortSpec {

	public enum Direction {
		ASC,
		DESC,
	}

	private final String columnName;
	public String getColumnName() {
		return columnName;
	}

	private final Direction direction;
	public Direction getDirection() {
		return direction;
	}

	private final Comparator<Object> comparator;
	public Comparator<Object> getComparator() {
		return comparator;
	}

	public int compare(Object a, Object b) {
		int ret;
		if(this.comparator != null) {
			ret = this.comparator.compare(a, b);
		}
		else if(a == null || b == null) {
			ret = a == null ? (b == null ? 0 : 1) : -1;
		}
		else if(a instanceof Number && b instanceof Number) {
			ret = Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
		}
		else if(a instanceof Comparable && a.getClass().isInstance(b)) {
			ret = new CompareToBuilder().append(a, b).toComparison();
		}
		else {
			ret = a.toString().compareTo(b.toString()); // Values of different types
		}
		return this.direction == Direction.DESC ? -ret : ret;
	}

	@Override
	public String toString() {
		return this.columnName + " " + this.direction;
	}

	public static SortSpec asc(String columnName) {
		return new SortSpec(columnName, Direction.ASC, null);
	}
	public static SortSpec desc(String columnName) {
		return new SortSpec(columnName, Direction.DESC, null);
	}

	public SortSpec(String columnName, Direction direction, Comparator<Object> comparator) {
		this.columnName = columnName;
		this.direction = direction != null ? direction : Direction.ASC;
		this.comparator = comparator;
	}
	public SortSpec(String columnName, Comparator<Object> comparator) {
		this(columnName, Direction.ASC, comparator);
	}
}
