package org.conceptoriented.dm.core;

/**
 * Parameters of one propagation call.
 */
public class PropagationConfig {

	// Identifies the view (or component) which originated the interaction
	private String sourceId;
	public String getSourceId() {
		return sourceId;
	}
	public PropagationConfig setSourceId(String sourceId) {
		this.sourceId = sourceId;
		return this;
	}

	private String action = "select";
	public String getAction() {
		return action;
	}
	public PropagationConfig setAction(String action) {
		this.action = action;
		return this;
	}

	// Mutable actions (like filtering) are re-derived on all linked snapshots rather than only announced
	private boolean mutableAction = false;
	public boolean isMutableAction() {
		return mutableAction;
	}
	public PropagationConfig setMutableAction(boolean mutableAction) {
		this.mutableAction = mutableAction;
		return this;
	}

	// Whether listeners of the originating snapshot are also notified
	private boolean applyOnSource = false;
	public boolean isApplyOnSource() {
		return applyOnSource;
	}
	public PropagationConfig setApplyOnSource(boolean applyOnSource) {
		this.applyOnSource = applyOnSource;
		return this;
	}

	private Object payload;
	public Object getPayload() {
		return payload;
	}
	public PropagationConfig setPayload(Object payload) {
		this.payload = payload;
		return this;
	}

	public PropagationConfig() {
	}
	public PropagationConfig(String sourceId) {
		this.sourceId = sourceId;
	}
}
