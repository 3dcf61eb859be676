package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named reducers consulted by group-by.
 *
 * Each root snapshot gets one registry which is then inherited by all its derived snapshots.
 * The registry is an ordinary object so independent engines (and tests) do not share reducers.
 */
public class ReducerRegistry {
	private static final Logger logger = LoggerFactory.getLogger(ReducerRegistry.class);

	public static final String SUM = "sum";
	public static final String AVG = "avg";
	public static final String MIN = "min";
	public static final String MAX = "max";
	public static final String FIRST = "first";
	public static final String LAST = "last";
	public static final String COUNT = "count";
	public static final String STD = "std";

	private final Map<String, Reducer> reducers = new LinkedHashMap<String, Reducer>();

	private String defaultReducer = AVG;
	public String getDefaultReducerName() {
		return this.defaultReducer;
	}
	public Reducer defaultReducer() {
		return this.reducers.get(this.defaultReducer);
	}
	public void setDefaultReducer(String name) throws DmError {
		if(!this.reducers.containsKey(name)) {
			throw new DmError(DmErrorCode.UNKNOWN_REDUCER, "Error setting default reducer. ", "Reducer '" + name + "' is not registered. ");
		}
		this.defaultReducer = name;
	}

	public Reducer lookup(String name) {
		return this.reducers.get(name);
	}
	public boolean has(String name) {
		return this.reducers.containsKey(name);
	}
	public List<String> getNames() {
		return new ArrayList<String>(this.reducers.keySet());
	}

	public ReducerRegistry register(String name, Reducer reducer) {
		if(this.reducers.containsKey(name)) {
			logger.debug("Reducer '{}' is replaced", name);
		}
		this.reducers.put(name, reducer);
		return this;
	}
	public ReducerRegistry unregister(String name) {
		this.reducers.remove(name);
		if(name.equals(this.defaultReducer)) {
			this.defaultReducer = AVG; // Built-in fallback
			if(!this.reducers.containsKey(AVG)) this.reducers.put(AVG, ReducerRegistry::avg);
		}
		return this;
	}

	//
	// Built-in reducers. Nulls and NaN are ignored and a group without numbers produces null.
	//

	private static List<Double> numbers(List<Double> values) {
		return values.stream().filter(x -> x != null && !x.isNaN()).collect(Collectors.<Double>toList());
	}

	public static Double sum(List<Double> values) {
		List<Double> nums = numbers(values);
		if(nums.isEmpty()) return null;
		double ret = 0.0;
		for(Double d : nums) ret += d;
		return ret;
	}
	public static Double avg(List<Double> values) {
		List<Double> nums = numbers(values);
		if(nums.isEmpty()) return null;
		return sum(nums) / nums.size();
	}
	public static Double min(List<Double> values) {
		return numbers(values).stream().min(Double::compare).orElse(null);
	}
	public static Double max(List<Double> values) {
		return numbers(values).stream().max(Double::compare).orElse(null);
	}
	public static Double first(List<Double> values) {
		List<Double> nums = numbers(values);
		return nums.isEmpty() ? null : nums.get(0);
	}
	public static Double last(List<Double> values) {
		List<Double> nums = numbers(values);
		return nums.isEmpty() ? null : nums.get(nums.size()-1);
	}
	public static Double count(List<Double> values) {
		return (double) numbers(values).size();
	}
	public static Double std(List<Double> values) {
		List<Double> nums = numbers(values);
		if(nums.isEmpty()) return null;
		double mean = avg(nums);
		double sq = 0.0;
		for(Double d : nums) sq += (d - mean) * (d - mean);
		return Math.sqrt(sq / nums.size());
	}

	public ReducerRegistry() {
		this.register(SUM, ReducerRegistry::sum);
		this.register(AVG, ReducerRegistry::avg);
		this.register(MIN, ReducerRegistry::min);
		this.register(MAX, ReducerRegistry::max);
		this.register(FIRST, ReducerRegistry::first);
		this.register(LAST, ReducerRegistry::last);
		this.register(COUNT, ReducerRegistry::count);
		this.register(STD, ReducerRegistry::std);
	}
}
