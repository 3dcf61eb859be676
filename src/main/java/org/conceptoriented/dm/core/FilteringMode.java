package org.conceptoriented.dm.core;

/**
 * Which part of a selection or projection is kept in the result.
 */
public enum FilteringMode {
	NORMAL, // Matched rows or columns
	INVERSE, // Not matched rows or columns
	ALL, // Both parts as two named partitions. Not valid for composed operators
}
