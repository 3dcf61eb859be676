package org.conceptoriented.dm.core;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Values of one field for all rows of a field space together with its schema.
 *
 * Column objects are never changed after creation. They are shared by reference between all field spaces and snapshots derived from one data set.
 * Operators which produce new values (calculated fields, group-by, binning) create new column objects.
 */
public class Column {

	private final UUID id;
	public UUID getId() {
		return this.id;
	}

	private final ColumnDefinition definition;
	public ColumnDefinition getDefinition() {
		return this.definition;
	}
	public String getName() {
		return this.definition.getName();
	}
	public DmColumnKind getKind() {
		return this.definition.getKind();
	}
	public DmColumnSubtype getSubtype() {
		return this.definition.getSubtype();
	}
	public boolean isMeasure() {
		return this.definition.isMeasure();
	}
	public boolean isDimension() {
		return this.definition.isDimension();
	}

	//
	// Data
	//

	private final List<Object> values;
	public List<Object> getValues() {
		return this.values;
	}
	public Object getValue(int row) {
		return this.values.get(row);
	}
	public int getLength() {
		return this.values.size();
	}

	/**
	 * Presentation form of the value. Temporal dimensions with a format render their epoch milliseconds with this format.
	 */
	public Object getLabel(int row) {
		Object value = this.values.get(row);
		if(value == null) return null;
		if(this.getSubtype() == DmColumnSubtype.TEMPORAL && this.definition.getFormat() != null && value instanceof Number) {
			DateTimeFormatter formatter = DateTimeFormatter.ofPattern(this.definition.getFormat()).withZone(ZoneOffset.UTC);
			return formatter.format(Instant.ofEpochMilli(((Number) value).longValue()));
		}
		return value;
	}

	//
	// Bins (only for binned measures)
	//

	private final Bins bins;
	public Bins getBins() {
		return this.bins;
	}

	//
	// Domain. Computed over all stored values rather than the rows of some snapshot so that it is the same for all views of one data set.
	//

	private Pair<Double, Double> numericDomain;
	private boolean numericDomainDone = false;
	public Pair<Double, Double> getNumericDomain() {
		if(!this.numericDomainDone) {
			double min = Double.POSITIVE_INFINITY;
			double max = Double.NEGATIVE_INFINITY;
			for(Object value : this.values) {
				Double d = toDouble(value);
				if(d == null || d.isNaN()) continue;
				if(d < min) min = d;
				if(d > max) max = d;
			}
			this.numericDomain = min <= max ? Pair.of(min, max) : null; // No numbers at all
			this.numericDomainDone = true;
		}
		return this.numericDomain;
	}

	private List<Object> distinctValues;
	public List<Object> getDistinctValues() {
		if(this.distinctValues == null) {
			Set<Object> set = new LinkedHashSet<Object>(this.values);
			set.remove(null);
			this.distinctValues = Collections.unmodifiableList(new ArrayList<Object>(set));
		}
		return this.distinctValues;
	}

	/**
	 * Min-max pair for continuous measures and the list of distinct values for dimensions and discrete measures.
	 */
	public Object getDomain() {
		if(this.getSubtype() == DmColumnSubtype.CONTINUOUS) {
			return this.getNumericDomain();
		}
		return this.getDistinctValues();
	}

	public static Double toDouble(Object value) {
		if(value == null) return null;
		if(value instanceof Number) return ((Number) value).doubleValue();
		if(value instanceof String) {
			String str = ((String) value).trim();
			if(str.isEmpty()) return null;
			try {
				return Double.valueOf(str);
			}
			catch(NumberFormatException e) {
				return null; // Not a number
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return "[" + getName() + "]: " + getKind() + ", " + getLength() + " values";
	}

	public Column(ColumnDefinition definition, List<?> values, Bins bins) {
		this.id = UUID.randomUUID();
		this.definition = definition;
		this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
		this.bins = bins;
	}
	public Column(ColumnDefinition definition, List<?> values) {
		this(definition, values, null);
	}

	/**
	 * Range and mid points of the buckets of a binned measure.
	 */
	public static class Bins {
		private final List<Double> range;
		public List<Double> getRange() {
			return range;
		}

		private final List<Double> mid;
		public List<Double> getMid() {
			return mid;
		}

		public Bins(List<Double> range, List<Double> mid) {
			this.range = Collections.unmodifiableList(new ArrayList<Double>(range));
			this.mid = Collections.unmodifiableList(new ArrayList<Double>(mid));
		}
	}
}
