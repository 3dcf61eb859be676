package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable view of a data set: shared field space, visible rows and visible columns in their order.
 *
 * Operators never change a snapshot. They return a new snapshot which is registered as a child of its input and stores the derivation which produced it.
 * A snapshot and its descendants form a lineage tree used to propagate interactions between views of the same data.
 */
public class Snapshot {
	private static final Logger logger = LoggerFactory.getLogger(Snapshot.class);

	public static final String PROPAGATION = "propagation";

	public static final String SELECTION = "selection";
	public static final String REJECTION = "rejection";

	private final UUID id;
	public UUID getId() {
		return id;
	}

	private String name;
	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}

	//
	// Data
	//

	private FieldSpace fieldSpace;
	public FieldSpace getFieldSpace() {
		return this.fieldSpace;
	}

	private RowSelector rowSelector;
	public RowSelector getRowSelector() {
		return this.rowSelector;
	}
	public int getRowCount() {
		return this.rowSelector.size();
	}

	private List<String> columnOrder;
	public List<String> getColumnNames() {
		return Collections.unmodifiableList(this.columnOrder);
	}
	public Column getColumn(String name) {
		if(!this.columnOrder.contains(name)) return null;
		return this.fieldSpace.getColumn(name);
	}
	public List<Column> getColumns() {
		List<Column> ret = new ArrayList<Column>();
		this.columnOrder.forEach(x -> ret.add(this.fieldSpace.getColumn(x)));
		return ret;
	}

	protected Map<String, Column> getVisibleColumns() {
		Map<String, Column> ret = new LinkedHashMap<String, Column>();
		this.columnOrder.forEach(x -> ret.put(x, this.fieldSpace.getColumn(x)));
		return ret;
	}

	public Record getRecord(int row) {
		return new Record(this.getVisibleColumns(), row);
	}
	public List<Record> getRecords() {
		Map<String, Column> columns = this.getVisibleColumns();
		List<Record> ret = new ArrayList<Record>();
		this.rowSelector.forEachRow(row -> ret.add(new Record(columns, row)));
		return ret;
	}

	private final ReducerRegistry reducerRegistry;
	public ReducerRegistry getReducerRegistry() {
		return this.reducerRegistry;
	}

	private final PropagationContext propagationContext;
	public PropagationContext getPropagationContext() {
		return this.propagationContext;
	}

	//
	// Lineage
	//

	private Snapshot parent;
	public Snapshot getParent() {
		return this.parent;
	}

	private List<Derivation> derivations = new ArrayList<Derivation>();
	public List<Derivation> getDerivations() {
		return Collections.unmodifiableList(this.derivations);
	}

	private List<Snapshot> children = new ArrayList<Snapshot>();
	public List<Snapshot> getChildren() {
		return Collections.unmodifiableList(this.children);
	}

	private boolean disposed = false;
	public boolean isDisposed() {
		return this.disposed;
	}

	/**
	 * Make this snapshot a child of the parent with the specified derivations. Derivations stored before are replaced.
	 */
	public void addParent(Snapshot parent, List<Derivation> derivations) {
		if(this.parent != null && this.parent != parent) {
			this.parent.children.remove(this);
		}
		this.parent = parent;
		if(parent != null && !parent.children.contains(this)) {
			parent.children.add(this);
		}
		this.derivations = new ArrayList<Derivation>(derivations);
	}

	/**
	 * Detach this snapshot from the lineage tree. Columns are not touched because they are shared with other snapshots.
	 */
	public void dispose() {
		if(this.disposed) return;

		if(this.parent != null) {
			this.parent.children.remove(this);
			this.parent = null;
		}
		for(Snapshot child : this.children) {
			if(child.parent == this) child.parent = null;
		}
		this.children.clear();
		this.listeners.clear();
		this.partitions.clear();
		this.interactionView = null;
		if(this.propagationContext.hasNamespace(this)) {
			this.propagationContext.removeNamespace(this);
		}

		this.disposed = true;
		logger.debug("Disposed {}", this);
	}

	private Snapshot derive(FieldSpace space, RowSelector rows, List<String> columns, Derivation derivation, boolean saveChild) {
		Snapshot child = new Snapshot(space, rows, columns, this.reducerRegistry, this.propagationContext);
		child.parent = this;
		child.derivations.add(derivation);
		if(saveChild) {
			this.children.add(child);
		}
		return child;
	}

	/**
	 * New root snapshot with the same field space, rows and columns.
	 */
	public Snapshot cloneSnapshot() {
		Snapshot clone = new Snapshot(this.fieldSpace, this.rowSelector, this.columnOrder, this.reducerRegistry, this.propagationContext);
		clone.setName(this.name);
		return clone;
	}

	//
	// Partitions of the operators with ALL filtering mode
	//

	private final Map<String, Snapshot> partitions = new LinkedHashMap<String, Snapshot>();
	public Snapshot getPartition(String name) {
		return this.partitions.get(name);
	}
	public boolean hasPartitions() {
		return !this.partitions.isEmpty();
	}

	//
	// Selection
	//

	public Snapshot select(RowPredicate predicate) throws DmError {
		return this.select(predicate, FilteringMode.NORMAL, true);
	}
	public Snapshot select(RowPredicate predicate, FilteringMode mode) throws DmError {
		return this.select(predicate, mode, true);
	}

	Snapshot select(RowPredicate predicate, FilteringMode mode, boolean saveChild) throws DmError {
		if(mode == null) mode = FilteringMode.NORMAL;

		Map<String, Column> columns = this.getVisibleColumns();
		RowSelector.Builder selection = new RowSelector.Builder();
		RowSelector.Builder rejection = new RowSelector.Builder();
		this.rowSelector.forEachRow(row -> {
			if(predicate.test(new Record(columns, row), row)) {
				selection.add(row);
			}
			else {
				rejection.add(row);
			}
		});
		RowSelector selected = selection.build();
		RowSelector rejected = rejection.build();

		logger.debug("Select {} on {}: {} selected, {} rejected", mode, this, selected.size(), rejected.size());

		switch(mode) {
		case NORMAL:
			return this.derive(this.fieldSpace, selected, this.columnOrder, new Derivation.Select(predicate, mode), saveChild);
		case INVERSE:
			return this.derive(this.fieldSpace, rejected, this.columnOrder, new Derivation.Select(predicate, mode), saveChild);
		default:
			Snapshot result = this.derive(this.fieldSpace, this.rowSelector, this.columnOrder, new Derivation.Select(predicate, mode), saveChild);
			result.partitions.put(SELECTION, this.derive(this.fieldSpace, selected, this.columnOrder, new Derivation.Select(predicate, FilteringMode.NORMAL), false));
			result.partitions.put(REJECTION, this.derive(this.fieldSpace, rejected, this.columnOrder, new Derivation.Select(predicate, FilteringMode.INVERSE), false));
			return result;
		}
	}

	//
	// Projection
	//

	public Snapshot project(List<String> patterns) throws DmError {
		return this.project(patterns, FilteringMode.NORMAL, true);
	}
	public Snapshot project(List<String> patterns, FilteringMode mode) throws DmError {
		return this.project(patterns, mode, true);
	}

	Snapshot project(List<String> patterns, FilteringMode mode, boolean saveChild) throws DmError {
		if(mode == null) mode = FilteringMode.NORMAL;

		// Matched columns in the order of patterns
		List<String> selected = new ArrayList<String>();
		for(String pattern : patterns) {
			Pattern regex = null;
			try {
				regex = Pattern.compile(pattern);
			}
			catch(PatternSyntaxException e) {
				regex = null; // Literal name only
			}
			for(String name : this.columnOrder) {
				if(selected.contains(name)) continue;
				if(name.equals(pattern) || (regex != null && regex.matcher(name).matches())) {
					selected.add(name);
				}
			}
		}
		List<String> rejected = new ArrayList<String>(this.columnOrder);
		rejected.removeAll(selected);

		logger.debug("Project {} on {}: {} selected, {} rejected", mode, this, selected.size(), rejected.size());

		switch(mode) {
		case NORMAL:
			return this.derive(this.fieldSpace, this.rowSelector, selected, new Derivation.Project(patterns, mode), saveChild);
		case INVERSE:
			return this.derive(this.fieldSpace, this.rowSelector, rejected, new Derivation.Project(patterns, mode), saveChild);
		default:
			Snapshot result = this.derive(this.fieldSpace, this.rowSelector, this.columnOrder, new Derivation.Project(patterns, mode), saveChild);
			result.partitions.put(SELECTION, this.derive(this.fieldSpace, this.rowSelector, selected, new Derivation.Project(patterns, FilteringMode.NORMAL), false));
			result.partitions.put(REJECTION, this.derive(this.fieldSpace, this.rowSelector, rejected, new Derivation.Project(patterns, FilteringMode.INVERSE), false));
			return result;
		}
	}

	//
	// Grouping
	//

	public Snapshot groupBy(List<String> dimensionNames) throws DmError {
		return this.groupBy(dimensionNames, Collections.<String, String>emptyMap(), this.reducerRegistry, true);
	}
	public Snapshot groupBy(List<String> dimensionNames, Map<String, String> reducers) throws DmError {
		return this.groupBy(dimensionNames, reducers, this.reducerRegistry, true);
	}
	public Snapshot groupBy(List<String> dimensionNames, Map<String, String> reducers, ReducerRegistry registry) throws DmError {
		return this.groupBy(dimensionNames, reducers, registry, true);
	}

	Snapshot groupBy(List<String> dimensionNames, Map<String, String> reducers, ReducerRegistry registry, boolean saveChild) throws DmError {
		if(reducers == null) reducers = Collections.<String, String>emptyMap();
		if(registry == null) registry = this.reducerRegistry;

		GroupEngine engine = new GroupEngine(registry);
		FieldSpace space = engine.groupBy(this, dimensionNames, reducers);

		// Reducers actually used so that replaying does not depend on later changes of defaults
		Map<String, String> resolved = engine.resolveReducers(this, dimensionNames, reducers);

		Derivation derivation = new Derivation.GroupBy(dimensionNames, reducers, resolved, registry);
		return this.derive(space, RowSelector.all(space.getRowCount()), space.getColumnNames(), derivation, saveChild);
	}

	//
	// Binning
	//

	public Snapshot bin(String measureName, BinConfig config) throws DmError {
		return this.bin(measureName, config, true);
	}

	Snapshot bin(String measureName, BinConfig config, boolean saveChild) throws DmError {
		Column measure = this.fieldSpace.getColumn(measureName);
		if(measure == null) {
			logger.warn("Bin field {} does not exist in {}", measureName, this);
			throw new DmError(DmErrorCode.UNKNOWN_COLUMN, "Error binning. ", "Field " + measureName + " does not exist. ");
		}
		if(!measure.isMeasure()) {
			logger.warn("Bin field {} is not a measure", measureName);
			throw new DmError(DmErrorCode.INVALID_COLUMN_KIND, "Error binning. ", "Field " + measureName + " is not a measure. ");
		}
		String binFieldName = config.getBinFieldName(measureName);
		if(this.fieldSpace.hasColumn(binFieldName)) {
			logger.warn("Bin field name {} already exists", binFieldName);
			throw new DmError(DmErrorCode.DUPLICATE_COLUMN, "Error binning. ", "Field " + binFieldName + " already exists. ");
		}

		Binner.Binned binned = Binner.createBinnedFieldData(measure, this.rowSelector, config);

		ColumnDefinition definition = new ColumnDefinition(binFieldName, DmColumnKind.MEASURE, DmColumnSubtype.DISCRETE);
		Column column = new Column(definition, binned.getLabels(), new Column.Bins(binned.getRange(), binned.getMid()));

		FieldSpace space = this.fieldSpace.cloneSpace();
		space.addOrReplace(column);
		List<String> columns = new ArrayList<String>(this.columnOrder);
		columns.add(binFieldName);

		return this.derive(space, this.rowSelector, columns, new Derivation.Bin(measureName, config, binFieldName), saveChild);
	}

	//
	// Calculated fields
	//

	public Snapshot calculateVariable(ColumnDefinition definition, String formula) throws DmError {
		FormulaResolver resolver = new FormulaResolver(formula);
		return this.calculateVariable(definition, resolver.getDependencies(), resolver, false, true);
	}
	public Snapshot calculateVariable(ColumnDefinition definition, List<String> dependencies, VariableResolver resolver) throws DmError {
		return this.calculateVariable(definition, dependencies, resolver, false, true);
	}
	public Snapshot calculateVariable(ColumnDefinition definition, List<String> dependencies, VariableResolver resolver, boolean replaceVar) throws DmError {
		return this.calculateVariable(definition, dependencies, resolver, replaceVar, true);
	}

	Snapshot calculateVariable(ColumnDefinition definition, List<String> dependencies, VariableResolver resolver, boolean replaceVar, boolean saveChild) throws DmError {
		String fieldName = definition.getName();
		if(this.fieldSpace.hasColumn(fieldName) && !replaceVar) {
			logger.warn("Calculated field {} already exists in {}", fieldName, this);
			throw new DmError(DmErrorCode.DUPLICATE_COLUMN, "Error calculating field. ", "Field " + fieldName + " already exists. ");
		}

		List<Column> inputs = new ArrayList<Column>();
		for(String name : dependencies) {
			Column column = this.fieldSpace.getColumn(name);
			if(column == null) {
				logger.warn("Dependency {} of calculated field {} does not exist", name, fieldName);
				throw new DmError(DmErrorCode.UNKNOWN_COLUMN, "Error calculating field. ", "Field " + name + " does not exist. ");
			}
			inputs.add(column);
		}

		Object[] values = new Object[this.fieldSpace.getRowCount()];
		this.rowSelector.forEachRow(row -> {
			Object[] args = new Object[inputs.size()];
			for(int i=0; i<args.length; i++) {
				args[i] = inputs.get(i).getValue(row);
			}
			values[row] = resolver.resolve(args, row);
		});

		FieldSpace space = this.fieldSpace.cloneSpace();
		space.addOrReplace(new Column(definition, Arrays.asList(values)));
		List<String> columns = new ArrayList<String>(this.columnOrder);
		if(!columns.contains(fieldName)) columns.add(fieldName);

		logger.debug("Calculated field {} from {} on {}", fieldName, dependencies, this);

		return this.derive(space, this.rowSelector, columns, new Derivation.CalculatedField(definition, dependencies, resolver, replaceVar), saveChild);
	}

	/**
	 * Clone of this snapshot with the column appended or replaced. This snapshot and its field space are not changed.
	 */
	public Snapshot addField(Column column) throws DmError {
		if(this.fieldSpace.getRowCount() != column.getLength() && !this.fieldSpace.getColumns().isEmpty()) {
			throw new DmError(DmErrorCode.GENERAL, "Error adding field. ", "Field " + column.getName() + " has " + column.getLength() + " values instead of " + this.fieldSpace.getRowCount() + ". ");
		}
		FieldSpace space = this.fieldSpace.cloneSpace();
		space.addOrReplace(column);

		Snapshot clone = this.cloneSnapshot();
		clone.fieldSpace = space;
		if(!clone.columnOrder.contains(column.getName())) clone.columnOrder.add(column.getName());
		return clone;
	}

	//
	// Sorting
	//

	/**
	 * New root snapshot with the visible rows and columns materialized in the sort order.
	 */
	public Snapshot sort(List<SortSpec> specs) throws DmError {
		List<Comparator<Integer>> comparators = new ArrayList<Comparator<Integer>>();
		for(SortSpec spec : specs) {
			Column column = this.getColumn(spec.getColumnName());
			if(column == null) {
				logger.warn("Sort field {} is not visible in {}", spec.getColumnName(), this);
				throw new DmError(DmErrorCode.UNKNOWN_COLUMN, "Error sorting. ", "Field " + spec.getColumnName() + " does not exist. ");
			}
			comparators.add((a, b) -> spec.compare(column.getValue(a), column.getValue(b)));
		}

		List<Integer> rows = new ArrayList<Integer>(this.getRowCount());
		this.rowSelector.forEach(rows::add);
		rows.sort((a, b) -> {
			for(Comparator<Integer> c : comparators) {
				int ret = c.compare(a, b);
				if(ret != 0) return ret;
			}
			return 0;
		});

		List<Column> columns = new ArrayList<Column>();
		for(Column column : this.getColumns()) {
			List<Object> values = new ArrayList<Object>(rows.size());
			rows.forEach(x -> values.add(column.getValue(x)));
			columns.add(new Column(column.getDefinition(), values, column.getBins()));
		}

		Snapshot sorted = new Snapshot(new FieldSpace(this.fieldSpace.getName(), columns), this.reducerRegistry, this.propagationContext);
		sorted.setName(this.name);
		return sorted;
	}

	//
	// Export
	//

	public DataTable getData() {
		return this.getData(new DataOptions());
	}
	public DataTable getData(DataOptions options) {
		List<Column> columns = options.isAllFields() ? this.fieldSpace.getColumns() : this.getColumns();

		List<ColumnDefinition> schema = new ArrayList<ColumnDefinition>();
		columns.forEach(x -> schema.add(x.getDefinition()));

		List<Integer> uids = new ArrayList<Integer>(this.getRowCount());
		this.rowSelector.forEach(uids::add);

		List<List<Object>> data = new ArrayList<List<Object>>();
		if(options.getOrder() == DataOptions.Order.COLUMN) {
			for(Column column : columns) {
				List<Object> values = new ArrayList<Object>(uids.size());
				uids.forEach(x -> values.add(options.format(column, x)));
				data.add(values);
			}
		}
		else {
			for(Integer uid : uids) {
				List<Object> values = new ArrayList<Object>(columns.size());
				columns.forEach(x -> values.add(options.format(x, uid)));
				data.add(values);
			}
		}

		return new DataTable(data, schema, options.isWithUid() ? uids : null);
	}

	//
	// Events and propagation
	//

	private final Map<String, List<PropagationListener>> listeners = new LinkedHashMap<String, List<PropagationListener>>();

	/**
	 * Register a listener for the event. Only the propagation event is raised, other names are accepted but never raised.
	 */
	public Snapshot on(String eventName, PropagationListener listener) {
		if(!PROPAGATION.equals(eventName)) {
			logger.debug("Event {} is never raised by {}", eventName, this);
		}
		this.listeners.computeIfAbsent(eventName, k -> new ArrayList<PropagationListener>()).add(listener);
		return this;
	}
	public Snapshot unsubscribe(String eventName) {
		this.listeners.remove(eventName);
		return this;
	}
	public boolean hasListeners(String eventName) {
		List<PropagationListener> list = this.listeners.get(eventName);
		return list != null && !list.isEmpty();
	}

	public void handlePropagation(PropagationEvent event) {
		List<PropagationListener> list = this.listeners.get(PROPAGATION);
		if(list == null) return;
		for(PropagationListener listener : new ArrayList<PropagationListener>(list)) {
			listener.onPropagation(this, event);
		}
	}

	// Result of re-deriving this snapshot from the root filtered by the active mutable interactions
	private Snapshot interactionView;
	public Snapshot getInteractionView() {
		return this.interactionView != null ? this.interactionView : this;
	}
	public boolean hasInteractionView() {
		return this.interactionView != null;
	}
	void setInteractionView(Snapshot interactionView) {
		this.interactionView = interactionView;
	}

	public void propagate(Identifiers identifiers, PropagationConfig config) throws DmError {
		PropagationGraph.propagate(this, identifiers, config);
	}

	@Override
	public String toString() {
		return "[" + this.name + "]: " + this.getRowCount() + " rows, " + this.columnOrder;
	}

	public Snapshot(FieldSpace fieldSpace) {
		this(fieldSpace, new ReducerRegistry(), new PropagationContext());
	}
	public Snapshot(FieldSpace fieldSpace, ReducerRegistry reducerRegistry, PropagationContext propagationContext) {
		this(fieldSpace, RowSelector.all(fieldSpace.getRowCount()), fieldSpace.getColumnNames(), reducerRegistry, propagationContext);
	}
	protected Snapshot(FieldSpace fieldSpace, RowSelector rowSelector, List<String> columnOrder, ReducerRegistry reducerRegistry, PropagationContext propagationContext) {
		this.id = UUID.randomUUID();
		this.name = fieldSpace.getName();
		this.fieldSpace = fieldSpace;
		this.rowSelector = rowSelector;
		this.columnOrder = new ArrayList<String>(columnOrder);
		this.reducerRegistry = reducerRegistry;
		this.propagationContext = propagationContext;
	}
}
