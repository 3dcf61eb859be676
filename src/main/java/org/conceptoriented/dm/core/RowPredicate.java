package org.conceptoriented.dm.core;

/**
 * Selection criterion evaluated for every visible row.
 */
@FunctionalInterface
public interface RowPredicate {
	public boolean test(Record row, int index);

	public default RowPredicate negate() {
		return (row, index) -> !this.test(row, index);
	}
}
