package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;

/**
 * Record of the operation and its parameters which produced a snapshot from its parent.
 *
 * A record has enough information to apply the same operation again to another input, which is how interactions are re-derived on linked views.
 * Replaying does not register the result as a child of its input.
 */
public abstract class Derivation {

	public enum Kind {
		SELECT,
		PROJECT,
		GROUP_BY,
		BIN,
		CALCULATED_FIELD,
	}

	public abstract Kind getKind();

	public abstract Snapshot replay(Snapshot input) throws DmError;

	protected abstract JSONObject paramsToJson();

	public String toJson() {
		JSONObject obj = new JSONObject();
		obj.put("op", this.getKind().name());
		obj.put("params", this.paramsToJson());
		return obj.toString();
	}

	@Override
	public String toString() {
		return this.getKind() + " " + this.paramsToJson();
	}

	//
	// Select
	//

	public static class Select extends Derivation {
		private final RowPredicate predicate;
		public RowPredicate getPredicate() {
			return predicate;
		}

		private final FilteringMode mode;
		public FilteringMode getMode() {
			return mode;
		}

		@Override
		public Kind getKind() {
			return Kind.SELECT;
		}

		@Override
		public Snapshot replay(Snapshot input) throws DmError {
			return input.select(this.predicate, this.mode, false);
		}

		@Override
		protected JSONObject paramsToJson() {
			JSONObject obj = new JSONObject();
			obj.put("mode", this.mode.name());
			return obj;
		}

		public Select(RowPredicate predicate, FilteringMode mode) {
			this.predicate = predicate;
			this.mode = mode;
		}
	}

	//
	// Project
	//

	public static class Project extends Derivation {
		private final List<String> patterns;
		public List<String> getPatterns() {
			return patterns;
		}

		private final FilteringMode mode;
		public FilteringMode getMode() {
			return mode;
		}

		@Override
		public Kind getKind() {
			return Kind.PROJECT;
		}

		@Override
		public Snapshot replay(Snapshot input) throws DmError {
			return input.project(this.patterns, this.mode, false);
		}

		@Override
		protected JSONObject paramsToJson() {
			JSONObject obj = new JSONObject();
			obj.put("fields", this.patterns);
			obj.put("mode", this.mode.name());
			return obj;
		}

		public Project(List<String> patterns, FilteringMode mode) {
			this.patterns = Collections.unmodifiableList(new ArrayList<String>(patterns));
			this.mode = mode;
		}
	}

	//
	// Group by
	//

	public static class GroupBy extends Derivation {
		private final List<String> dimensionNames;
		public List<String> getDimensionNames() {
			return dimensionNames;
		}

		private final String groupByString;
		public String getGroupByString() {
			return groupByString;
		}

		// As requested by the caller
		private final Map<String, String> reducers;
		public Map<String, String> getReducers() {
			return reducers;
		}

		// Reducer of each reduced measure after applying column and registry defaults
		private final Map<String, String> resolvedReducers;
		public Map<String, String> getResolvedReducers() {
			return resolvedReducers;
		}

		private final String defaultReducer;
		public String getDefaultReducer() {
			return defaultReducer;
		}

		private final ReducerRegistry registry;
		public ReducerRegistry getRegistry() {
			return registry;
		}

		@Override
		public Kind getKind() {
			return Kind.GROUP_BY;
		}

		@Override
		public Snapshot replay(Snapshot input) throws DmError {
			return input.groupBy(this.dimensionNames, this.resolvedReducers, this.registry, false);
		}

		@Override
		protected JSONObject paramsToJson() {
			JSONObject obj = new JSONObject();
			obj.put("fields", this.dimensionNames);
			obj.put("groupByString", this.groupByString);
			obj.put("reducers", this.reducers);
			obj.put("resolvedReducers", this.resolvedReducers);
			obj.put("defaultReducer", this.defaultReducer);
			return obj;
		}

		public GroupBy(List<String> dimensionNames, Map<String, String> reducers, Map<String, String> resolvedReducers, ReducerRegistry registry) {
			this.dimensionNames = Collections.unmodifiableList(new ArrayList<String>(dimensionNames));
			this.groupByString = GroupEngine.groupByString(dimensionNames);
			this.reducers = Collections.unmodifiableMap(new LinkedHashMap<String, String>(reducers));
			this.resolvedReducers = Collections.unmodifiableMap(new LinkedHashMap<String, String>(resolvedReducers));
			this.registry = registry;
			this.defaultReducer = registry.getDefaultReducerName();
		}
	}

	//
	// Bin
	//

	public static class Bin extends Derivation {
		private final String measureName;
		public String getMeasureName() {
			return measureName;
		}

		private final BinConfig config;
		public BinConfig getConfig() {
			return config;
		}

		private final String binFieldName;
		public String getBinFieldName() {
			return binFieldName;
		}

		@Override
		public Kind getKind() {
			return Kind.BIN;
		}

		@Override
		public Snapshot replay(Snapshot input) throws DmError {
			return input.bin(this.measureName, this.config, false);
		}

		@Override
		protected JSONObject paramsToJson() {
			JSONObject obj = new JSONObject();
			obj.put("measureName", this.measureName);
			obj.put("config", new JSONObject(this.config.toJson()));
			obj.put("binFieldName", this.binFieldName);
			return obj;
		}

		public Bin(String measureName, BinConfig config, String binFieldName) {
			this.measureName = measureName;
			this.config = config;
			this.binFieldName = binFieldName;
		}
	}

	//
	// Calculated field
	//

	public static class CalculatedField extends Derivation {
		private final ColumnDefinition definition;
		public ColumnDefinition getDefinition() {
			return definition;
		}

		private final List<String> dependencies;
		public List<String> getDependencies() {
			return dependencies;
		}

		private final VariableResolver resolver;
		public VariableResolver getResolver() {
			return resolver;
		}

		private final boolean replaceVar;
		public boolean isReplaceVar() {
			return replaceVar;
		}

		@Override
		public Kind getKind() {
			return Kind.CALCULATED_FIELD;
		}

		@Override
		public Snapshot replay(Snapshot input) throws DmError {
			return input.calculateVariable(this.definition, this.dependencies, this.resolver, this.replaceVar, false);
		}

		@Override
		protected JSONObject paramsToJson() {
			JSONObject obj = new JSONObject();
			obj.put("config", this.definition.toJsonObject());
			obj.put("fields", this.dependencies);
			if(this.resolver instanceof FormulaResolver) obj.put("formula", ((FormulaResolver) this.resolver).getFormula());
			return obj;
		}

		public CalculatedField(ColumnDefinition definition, List<String> dependencies, VariableResolver resolver, boolean replaceVar) {
			this.definition = definition;
			this.dependencies = Collections.unmodifiableList(new ArrayList<String>(dependencies));
			this.resolver = resolver;
			this.replaceVar = replaceVar;
		}
	}
}
