package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Schema entry of one column: its name, kind, subtype and optional presentation and aggregation settings.
 * It is what an ingestion adapter supplies together with the column values and what is exported along with the data.
 */
public class ColumnDefinition {

	private String name;
	public String getName() {
		return name;
	}

	private DmColumnKind kind;
	public DmColumnKind getKind() {
		return kind;
	}

	private DmColumnSubtype subtype;
	public DmColumnSubtype getSubtype() {
		return subtype;
	}
	public ColumnDefinition setSubtype(DmColumnSubtype subtype) {
		this.subtype = subtype;
		return this;
	}

	// Date pattern (java.time) used to label temporal dimensions
	private String format;
	public String getFormat() {
		return format;
	}
	public ColumnDefinition setFormat(String format) {
		this.format = format;
		return this;
	}

	// Reducer name used by group-by when no reducer is requested explicitly
	private String defaultReducer;
	public String getDefaultReducer() {
		return defaultReducer;
	}
	public ColumnDefinition setDefaultReducer(String defaultReducer) {
		this.defaultReducer = defaultReducer;
		return this;
	}

	public boolean isMeasure() {
		return this.kind == DmColumnKind.MEASURE;
	}
	public boolean isDimension() {
		return this.kind == DmColumnKind.DIMENSION;
	}

	//
	// Serialization and construction
	//

	public JSONObject toJsonObject() {
		JSONObject obj = new JSONObject();
		obj.put("name", this.name);
		obj.put("type", this.kind.name().toLowerCase());
		obj.put("subtype", this.subtype.name().toLowerCase());
		if(this.format != null) obj.put("format", this.format);
		if(this.defaultReducer != null) obj.put("defAggFn", this.defaultReducer);
		return obj;
	}
	public String toJson() {
		return this.toJsonObject().toString();
	}

	public static ColumnDefinition fromJson(String json) throws DmError {
		return fromJsonObject(new JSONObject(json));
	}
	public static ColumnDefinition fromJsonObject(JSONObject obj) throws DmError {
		String name = obj.optString("name", null);
		if(StringUtils.isBlank(name)) {
			throw new DmError(DmErrorCode.INGESTION_ERROR, "Error reading schema. ", "Column name is missing. ");
		}

		DmColumnKind kind = DmColumnKind.fromString(obj.optString("type", "dimension"));
		if(kind == null) {
			throw new DmError(DmErrorCode.INVALID_COLUMN_KIND, "Error reading schema. ", "Unknown column type '" + obj.optString("type") + "' of column " + name + ". ");
		}

		ColumnDefinition def = new ColumnDefinition(name, kind);

		if(obj.has("subtype") && !obj.isNull("subtype")) {
			DmColumnSubtype subtype = DmColumnSubtype.fromString(obj.getString("subtype"));
			if(subtype == null || subtype.getKind() != kind) {
				throw new DmError(DmErrorCode.INVALID_COLUMN_KIND, "Error reading schema. ", "Subtype '" + obj.getString("subtype") + "' is not valid for column " + name + ". ");
			}
			def.subtype = subtype;
		}

		def.format = obj.has("format") && !obj.isNull("format") ? obj.getString("format") : null;
		def.defaultReducer = obj.has("defAggFn") && !obj.isNull("defAggFn") ? obj.getString("defAggFn") : null;

		return def;
	}
	public static List<ColumnDefinition> fromJsonList(String json) throws DmError {
		JSONArray arr = new JSONArray(json);
		List<ColumnDefinition> defs = new ArrayList<ColumnDefinition>();
		for (int i = 0 ; i < arr.length(); i++) {
			defs.add(ColumnDefinition.fromJsonObject(arr.getJSONObject(i)));
		}
		return defs;
	}

	public static ColumnDefinition dimension(String name) {
		return new ColumnDefinition(name, DmColumnKind.DIMENSION);
	}
	public static ColumnDefinition measure(String name) {
		return new ColumnDefinition(name, DmColumnKind.MEASURE);
	}

	@Override
	public String toString() {
		return "[" + this.name + "]: " + this.kind + "/" + this.subtype;
	}

	public ColumnDefinition(String name, DmColumnKind kind, DmColumnSubtype subtype) {
		this.name = name;
		this.kind = kind;
		this.subtype = subtype != null ? subtype : DmColumnSubtype.defaultFor(kind);
	}
	public ColumnDefinition(String name, DmColumnKind kind) {
		this(name, kind, null);
	}
}
