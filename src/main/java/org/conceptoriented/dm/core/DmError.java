package org.conceptoriented.dm.core;

import org.json.JSONObject;

/**
 * Configuration error raised by an operator before it produces any result.
 * It always means a wrong call (unknown column, duplicate name, unknown reducer etc.) and is never retried.
 */
public class DmError extends Exception {
	public DmErrorCode code;
	public String message;
	public String description;
	
	public String toJson() {
		JSONObject obj = new JSONObject();
		obj.put("code", this.code.getValue());
		obj.put("message", this.message != null ? this.message : JSONObject.NULL);
		obj.put("description", this.description != null ? this.description : JSONObject.NULL);
		return obj.toString();
	}

	@Override
	public String getMessage() {
		if(this.description == null || this.description.isEmpty()) return this.message;
		return this.message + " " + this.description;
	}

	@Override
	public String toString() {
		return "[" + this.code + "]: " + this.getMessage();
	}
	
	public DmError(DmErrorCode code, String message, String description) {
		super(message);
		this.code = code;
		this.message = message;
		this.description = description;
	}
}
