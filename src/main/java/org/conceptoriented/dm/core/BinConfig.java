package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Parameters of binning. Exactly one way of defining buckets is used: explicit buckets, bin size or bin count (in this priority).
 */
public class BinConfig {

	// Name of the new field. By default it is the measure name with the suffix
	private String name;
	public String getName() {
		return name;
	}
	public BinConfig setName(String name) {
		this.name = name;
		return this;
	}

	private Double start;
	public Double getStart() {
		return start;
	}
	public BinConfig setStart(Double start) {
		this.start = start;
		return this;
	}

	// Explicit ascending bucket boundaries
	private List<Double> stops;
	public List<Double> getStops() {
		return stops;
	}
	public BinConfig setBuckets(Double start, List<Double> stops) {
		this.start = start;
		this.stops = stops != null ? Collections.unmodifiableList(new ArrayList<Double>(stops)) : null;
		return this;
	}
	public boolean hasBuckets() {
		return this.stops != null;
	}

	private Double binSize;
	public Double getBinSize() {
		return binSize;
	}
	public BinConfig setBinSize(Double binSize) {
		this.binSize = binSize;
		return this;
	}

	// Bin size is (max + 1 - min) / binCount. A start other than min shifts the buckets and the last one is extended to cover the maximum
	private Integer binCount;
	public Integer getBinCount() {
		return binCount;
	}
	public BinConfig setBinCount(Integer binCount) {
		this.binCount = binCount;
		return this;
	}

	public String getBinFieldName(String measureName) {
		return this.name != null ? this.name : measureName + "_binned";
	}

	public void validate() throws DmError {
		if(this.stops != null) {
			if(this.stops.isEmpty()) {
				throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bucket stops are empty. ");
			}
			for(int i=1; i<this.stops.size(); i++) {
				if(this.stops.get(i) <= this.stops.get(i-1)) {
					throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bucket stops must be strictly ascending. ");
				}
			}
			if(this.start != null && this.start >= this.stops.get(0)) {
				throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bucket start must be less than the first stop. ");
			}
		}
		else if(this.binSize != null) {
			if(this.binSize.isNaN() || this.binSize <= 0) {
				throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bin size must be positive. ");
			}
		}
		else if(this.binCount != null) {
			if(this.binCount <= 0) {
				throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bin count must be positive. ");
			}
		}
		else {
			throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Either buckets, bin size or bin count has to be specified. ");
		}
	}

	//
	// Serialization and construction
	//

	public String toJson() {
		JSONObject obj = new JSONObject();
		if(this.name != null) obj.put("name", this.name);
		if(this.start != null) obj.put("start", this.start);
		if(this.stops != null) obj.put("stops", new JSONArray(this.stops));
		if(this.binSize != null) obj.put("binSize", this.binSize);
		if(this.binCount != null) obj.put("binCount", this.binCount);
		return obj.toString();
	}

	public static BinConfig fromJson(String json) {
		JSONObject obj = new JSONObject(json);
		BinConfig config = new BinConfig();

		config.name = obj.has("name") && !obj.isNull("name") ? obj.getString("name") : null;
		config.start = obj.has("start") && !obj.isNull("start") ? obj.getDouble("start") : null;

		if(obj.has("buckets") && !obj.isNull("buckets")) {
			JSONObject jbuckets = obj.getJSONObject("buckets");
			if(jbuckets.has("start") && !jbuckets.isNull("start")) config.start = jbuckets.getDouble("start");
			JSONArray jstops = jbuckets.getJSONArray("stops");
			List<Double> stops = new ArrayList<Double>();
			for (int i = 0 ; i < jstops.length(); i++) {
				stops.add(jstops.getDouble(i));
			}
			config.setBuckets(config.start, stops);
		}

		config.binSize = obj.has("binSize") && !obj.isNull("binSize") ? obj.getDouble("binSize") : null;
		config.binCount = obj.has("binCount") && !obj.isNull("binCount") ? obj.getInt("binCount") : null;

		return config;
	}

	@Override
	public String toString() {
		return this.toJson();
	}

	public static BinConfig buckets(Double start, List<Double> stops) {
		return new BinConfig().setBuckets(start, stops);
	}
	public static BinConfig binSize(double binSize) {
		return new BinConfig().setBinSize(binSize);
	}
	public static BinConfig binCount(int binCount) {
		return new BinConfig().setBinCount(binCount);
	}

	public BinConfig() {
	}
}
