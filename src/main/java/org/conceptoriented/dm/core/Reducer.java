package org.conceptoriented.dm.core;

import java.util.List;

/**
 * Aggregation of the measure values of one group into a single value.
 * Implementations must not modify the list. The list may contain nulls.
 */
@FunctionalInterface
public interface Reducer {
	public Double reduce(List<Double> values);
}
