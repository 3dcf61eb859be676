package org.conceptoriented.dm.core;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Propagation state shared by snapshots of one engine instance.
 *
 * It holds one namespace per lineage root and counts interaction ticks.
 * A tick is either opened explicitly by the caller or opened implicitly by an outermost propagation call.
 */
public class PropagationContext {

	private final Map<UUID, PropagationNamespace> namespaces = new HashMap<UUID, PropagationNamespace>();

	/**
	 * Namespace of the lineage tree with this root. It is created on first use.
	 */
	public PropagationNamespace getNamespace(Snapshot root) {
		return this.namespaces.computeIfAbsent(root.getId(), k -> new PropagationNamespace(root));
	}
	public boolean hasNamespace(Snapshot root) {
		return this.namespaces.containsKey(root.getId());
	}
	public void removeNamespace(Snapshot root) {
		this.namespaces.remove(root.getId());
	}

	//
	// Ticks
	//

	private long tick = 0;
	public long getTick() {
		return this.tick;
	}

	private boolean explicitTick = false;
	private int depth = 0;

	/**
	 * Start a tick which groups all following propagation calls until {@link #endTick()}.
	 */
	public void beginTick() {
		this.tick++;
		this.explicitTick = true;
	}
	public void endTick() {
		this.explicitTick = false;
	}
	public boolean isInTick() {
		return this.explicitTick || this.depth > 0;
	}

	void enterPropagation() {
		if(this.depth == 0 && !this.explicitTick) this.tick++; // Outermost call outside of an explicit tick
		this.depth++;
	}
	void exitPropagation() {
		this.depth--;
	}

	public PropagationContext() {
	}
}
