package org.conceptoriented.dm.core;

/**
 * What a propagation listener gets: the interacted identifiers and the view of the target snapshot restricted to them.
 */
public class PropagationEvent {

	private final Identifiers identifiers;
	public Identifiers getIdentifiers() {
		return identifiers;
	}

	// The listener's snapshot re-derived from the root rows matching the identifiers
	private final Snapshot propagatedView;
	public Snapshot getPropagatedView() {
		return propagatedView;
	}

	private final Object payload;
	public Object getPayload() {
		return payload;
	}

	private final String sourceId;
	public String getSourceId() {
		return sourceId;
	}

	private final boolean mutable;
	public boolean isMutable() {
		return mutable;
	}

	@Override
	public String toString() {
		return "[" + this.sourceId + "]: " + this.identifiers + (this.mutable ? " (mutable)" : "");
	}

	public PropagationEvent(Identifiers identifiers, Snapshot propagatedView, Object payload, String sourceId, boolean mutable) {
		this.identifiers = identifiers;
		this.propagatedView = propagatedView;
		this.payload = payload;
		this.sourceId = sourceId;
		this.mutable = mutable;
	}
}
