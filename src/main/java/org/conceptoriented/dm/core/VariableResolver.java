package org.conceptoriented.dm.core;

/**
 * Computes the value of a calculated field from the values of its dependencies in one row.
 * The values are passed in the order in which the dependencies were listed.
 */
@FunctionalInterface
public interface VariableResolver {
	public Object resolve(Object[] values, int row);
}
