package org.conceptoriented.dm.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns each value of a measure to a bucket and labels it with the bucket bounds.
 *
 * Boundaries are derived from the domain of the whole column (not the visible rows) so that all views of one data set get the same buckets.
 * Bucket membership is [lower, upper). Values below the start fall into [min, start) and values at or above the last stop fall into [lastStop, max].
 */
public class Binner {
	private static final Logger logger = LoggerFactory.getLogger(Binner.class);

	// Relative tolerance for the remainder of the span divided by the bin size
	private static final double EPSILON = 1e-9;

	/**
	 * Compute bucket stops for configurations without explicit buckets.
	 * With a bin count the bin size is derived from the whole domain [min, max+1] even if the buckets start elsewhere.
	 */
	public static List<Double> computeStops(double min, double max, double start, BinConfig config) {
		double end = max + 1; // Maximum must be inside the last bucket [lower, upper)

		if(config.getBinSize() != null) {
			return stepStops(start, end, config.getBinSize());
		}

		int count = config.getBinCount();
		double binSize = (end - min) / count;
		if(start != min) {
			return stepStops(start, end, binSize);
		}

		List<Double> stops = new ArrayList<Double>();
		for(int i=1; i<count; i++) {
			stops.add(start + i * binSize);
		}
		stops.add(end); // Exact last stop
		return stops;
	}

	// Stops from start by bin size. The last one is extended to the next multiple of bin size which covers the end
	private static List<Double> stepStops(double start, double end, double binSize) {
		double extra = (end - start) % binSize;
		if(extra > binSize * EPSILON && binSize - extra > binSize * EPSILON) {
			end = end + binSize - extra;
		}
		List<Double> stops = new ArrayList<Double>();
		long count = Math.round((end - start) / binSize);
		for(long i=1; i<=count; i++) {
			stops.add(start + i * binSize);
		}
		return stops;
	}

	public static Binned createBinnedFieldData(Column field, RowSelector rows, BinConfig config) throws DmError {
		config.validate();

		Pair<Double, Double> domain = field.getNumericDomain();
		if(domain == null) {
			throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Field " + field.getName() + " has no numeric values. ");
		}
		double min = domain.getLeft();
		double oriMax = domain.getRight();

		//
		// Buckets
		//
		double start;
		List<Double> stops;
		if(config.hasBuckets()) {
			start = config.getStart() != null ? config.getStart() : min;
			stops = new ArrayList<Double>(config.getStops());
		}
		else {
			start = config.getStart() != null ? config.getStart() : min;
			if(start > oriMax) {
				throw new DmError(DmErrorCode.INVALID_BIN_CONFIG, "Error binning. ", "Bin start " + start + " is greater than the maximum " + oriMax + ". ");
			}
			stops = computeStops(min, oriMax, start, config);
		}
		double lastStop = stops.get(stops.size()-1);

		//
		// Label visible rows
		//
		Object[] labels = new Object[field.getLength()];
		final double bucketStart = start;
		final List<Double> bucketStops = stops;
		rows.forEachRow(row -> {
			Double value = Column.toDouble(field.getValue(row));
			if(value == null || value.isNaN()) return;

			if(value < bucketStart) {
				labels[row] = label(min, bucketStart);
			}
			else if(value >= lastStop) {
				labels[row] = label(lastStop, oriMax);
			}
			else {
				double prev = bucketStart;
				for(Double stop : bucketStops) {
					if(value >= prev && value < stop) {
						labels[row] = label(prev, stop);
						break;
					}
					prev = stop;
				}
			}
		});

		//
		// Range and mid points
		//
		TreeSet<Double> marks = new TreeSet<Double>(stops);
		marks.add(start);
		if(min < start) marks.add(min);
		if(oriMax > lastStop) marks.add(oriMax);

		List<Double> range = new ArrayList<Double>(marks);
		List<Double> mid = new ArrayList<Double>();
		for(int i=1; i<range.size(); i++) {
			mid.add((range.get(i-1) + range.get(i)) / 2);
		}

		logger.debug("Binned {} into {} buckets from {} to {}", field.getName(), stops.size(), start, lastStop);

		return new Binned(Arrays.asList(labels), range, mid);
	}

	public static String label(double lower, double upper) {
		return format(lower) + "-" + format(upper);
	}
	public static String format(double value) {
		if(value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	/**
	 * Labels for all rows of the column (null for rows which are not visible) plus bucket metadata.
	 */
	public static class Binned {
		private final List<Object> labels;
		public List<Object> getLabels() {
			return labels;
		}

		private final List<Double> range;
		public List<Double> getRange() {
			return range;
		}

		private final List<Double> mid;
		public List<Double> getMid() {
			return mid;
		}

		public Binned(List<Object> labels, List<Double> range, List<Double> mid) {
			this.labels = labels;
			this.range = range;
			this.mid = mid;
		}
	}
}
