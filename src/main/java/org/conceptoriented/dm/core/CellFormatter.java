package org.conceptoriented.dm.core;

/**
 * Converts a stored value into the value returned by export.
 */
@FunctionalInterface
public interface CellFormatter {
	public Object format(Object value, int uid, ColumnDefinition definition);
}
