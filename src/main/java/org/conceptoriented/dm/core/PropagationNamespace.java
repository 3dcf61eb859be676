package org.conceptoriented.dm.core;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Interaction state of one lineage tree (identified by its root snapshot).
 *
 * Active interactions are stored per action and source so that a new interaction of the same source replaces the previous one.
 */
public class PropagationNamespace {

	private final Snapshot root;
	public Snapshot getRoot() {
		return this.root;
	}

	//
	// Active interactions keyed by action-sourceId
	//

	private final Map<String, Identifiers> mutableActions = new LinkedHashMap<String, Identifiers>();
	public Map<String, Identifiers> getMutableActions() {
		return Collections.unmodifiableMap(this.mutableActions);
	}
	public boolean hasMutableActions() {
		return !this.mutableActions.isEmpty();
	}

	private final Map<String, Identifiers> immutableActions = new LinkedHashMap<String, Identifiers>();
	public Map<String, Identifiers> getImmutableActions() {
		return Collections.unmodifiableMap(this.immutableActions);
	}

	/**
	 * Store the identifiers of an action or remove the action if identifiers are null.
	 */
	public void setAction(String actionKey, Identifiers identifiers, boolean mutable) {
		Map<String, Identifiers> actions = mutable ? this.mutableActions : this.immutableActions;
		if(identifiers == null) {
			actions.remove(actionKey);
		}
		else {
			actions.put(actionKey, identifiers);
		}
	}

	//
	// Re-entrance guard
	//

	private final Set<String> activeSources = new HashSet<String>();
	public boolean isActive(String sourceId) {
		return this.activeSources.contains(sourceId);
	}
	void enter(String sourceId) {
		this.activeSources.add(sourceId);
	}
	void exit(String sourceId) {
		this.activeSources.remove(sourceId);
	}

	//
	// Mutable actions applied in a tick
	//

	// Keys of the actions applied in the current tick. Older ticks are forgotten
	private long appliedTick = -1;
	private final Set<String> appliedInTick = new HashSet<String>();
	Set<String> getAppliedInTick() {
		return Collections.unmodifiableSet(this.appliedInTick);
	}

	/**
	 * Remember that the action with these identifiers has been applied in the tick.
	 * Returns false if the same action with the same identifiers has already been applied in this tick.
	 */
	boolean markApplied(String actionKey, String identifiersKey, long tick) {
		if(tick != this.appliedTick) {
			this.appliedInTick.clear();
			this.appliedTick = tick;
		}
		return this.appliedInTick.add(actionKey + "|" + identifiersKey);
	}

	@Override
	public String toString() {
		return "[" + this.root.getName() + "]: mutable " + this.mutableActions.keySet() + ", immutable " + this.immutableActions.keySet();
	}

	public PropagationNamespace(Snapshot root) {
		this.root = root;
	}
}
