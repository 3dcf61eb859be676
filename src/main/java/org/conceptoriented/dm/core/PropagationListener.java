package org.conceptoriented.dm.core;

/**
 * Callback registered for the propagation event of a snapshot.
 * Exceptions thrown by a listener are not caught by the engine.
 */
@FunctionalInterface
public interface PropagationListener {
	public void onPropagation(Snapshot target, PropagationEvent event);
}
