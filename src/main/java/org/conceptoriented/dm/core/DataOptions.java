package org.conceptoriented.dm.core;

import java.util.HashMap;
import java.util.Map;

import org.json.JSONObject;

/**
 * Options of data export.
 */
public class DataOptions {

	public enum Order {
		ROW, // List of rows
		COLUMN, // List of columns
	}

	private Order order = Order.ROW;
	public Order getOrder() {
		return order;
	}
	public DataOptions setOrder(Order order) {
		this.order = order;
		return this;
	}

	private boolean withUid = false;
	public boolean isWithUid() {
		return withUid;
	}
	public DataOptions setWithUid(boolean withUid) {
		this.withUid = withUid;
		return this;
	}

	// Export all fields of the field space rather than only visible ones
	private boolean allFields = false;
	public boolean isAllFields() {
		return allFields;
	}
	public DataOptions setAllFields(boolean allFields) {
		this.allFields = allFields;
		return this;
	}

	private final Map<String, CellFormatter> formatters = new HashMap<String, CellFormatter>();
	public CellFormatter getFormatter(String columnName) {
		return this.formatters.get(columnName);
	}
	public DataOptions setFormatter(String columnName, CellFormatter formatter) {
		this.formatters.put(columnName, formatter);
		return this;
	}

	public Object format(Column column, int uid) {
		CellFormatter formatter = this.formatters.get(column.getName());
		Object value = column.getValue(uid);
		if(formatter == null) return value;
		return formatter.format(value, uid, column.getDefinition());
	}

	public static DataOptions fromJson(String json) {
		JSONObject obj = new JSONObject(json);
		DataOptions options = new DataOptions();
		if(obj.has("order")) options.order = Order.valueOf(obj.getString("order").toUpperCase());
		if(obj.has("withUid")) options.withUid = obj.getBoolean("withUid");
		if(obj.has("allFields")) options.allFields = obj.getBoolean("allFields");
		return options;
	}

	public DataOptions() {
	}
}
