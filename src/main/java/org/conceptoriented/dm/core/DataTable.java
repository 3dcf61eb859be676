package org.conceptoriented.dm.core;

import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Exported data with its schema and (optionally) the identifiers of exported rows.
 */
public class DataTable {

	private final List<List<Object>> data;
	public List<List<Object>> getData() {
		return data;
	}

	private final List<ColumnDefinition> schema;
	public List<ColumnDefinition> getSchema() {
		return schema;
	}

	private final List<Integer> uids;
	public List<Integer> getUids() {
		return uids;
	}

	public String toJson() {
		JSONObject obj = new JSONObject();

		JSONArray jdata = new JSONArray();
		for(List<Object> values : this.data) {
			JSONArray jvalues = new JSONArray();
			values.forEach(x -> jvalues.put(x == null ? JSONObject.NULL : x));
			jdata.put(jvalues);
		}
		obj.put("data", jdata);

		JSONArray jschema = new JSONArray();
		this.schema.forEach(x -> jschema.put(x.toJsonObject()));
		obj.put("schema", jschema);

		if(this.uids != null) obj.put("uids", new JSONArray(this.uids));

		return obj.toString();
	}

	@Override
	public String toString() {
		return this.toJson();
	}

	public DataTable(List<List<Object>> data, List<ColumnDefinition> schema, List<Integer> uids) {
		this.data = Collections.unmodifiableList(data);
		this.schema = Collections.unmodifiableList(schema);
		this.uids = uids != null ? Collections.unmodifiableList(uids) : null;
	}
}
