package org.conceptoriented.dm.core;

/**
 * Operator as a value which can be applied to a snapshot later or composed with other operators.
 */
@FunctionalInterface
public interface Operator {
	public Snapshot apply(Snapshot input) throws DmError;
}
