package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntConsumer;

/**
 * Rows of a field space which are visible in one snapshot.
 *
 * The rows are stored as sorted, disjoint and non-adjacent runs so that a filtered snapshot costs the number of runs rather than the length of the columns.
 * Iteration is restartable and produces row indexes in ascending order without visiting rows outside of the runs.
 * Instances are immutable. Every operator builds a new selector.
 */
public class RowSelector implements Iterable<Integer> {

	private static final RowSelector EMPTY = new RowSelector(Collections.<Range>emptyList());

	private final List<Range> runs;
	public List<Range> getRuns() {
		return this.runs;
	}

	private final int size;
	public int size() {
		return this.size;
	}
	public boolean isEmpty() {
		return this.size == 0;
	}

	// Index which is greater than all rows in this selector
	public int getUpperBound() {
		if(this.runs.isEmpty()) return 0;
		return this.runs.get(this.runs.size()-1).end;
	}

	public boolean contains(int row) {
		int lo = 0;
		int hi = this.runs.size() - 1;
		while(lo <= hi) { // Binary search on run starts
			int mid = (lo + hi) >>> 1;
			Range run = this.runs.get(mid);
			if(row < run.start) {
				hi = mid - 1;
			}
			else if(row >= run.end) {
				lo = mid + 1;
			}
			else {
				return true;
			}
		}
		return false;
	}

	//
	// Iteration
	//

	@Override
	public Iterator<Integer> iterator() {
		return new Iterator<Integer>() {
			int runNo = 0;
			int next = runs.isEmpty() ? 0 : runs.get(0).start;

			@Override
			public boolean hasNext() {
				return runNo < runs.size();
			}

			@Override
			public Integer next() {
				if(!hasNext()) throw new NoSuchElementException();
				int row = next++;
				if(next >= runs.get(runNo).end) { // Jump to the next run
					runNo++;
					if(runNo < runs.size()) next = runs.get(runNo).start;
				}
				return row;
			}
		};
	}

	public void forEachRow(IntConsumer action) {
		for(Range run : this.runs) {
			for(int i=run.start; i<run.end; i++) {
				action.accept(i);
			}
		}
	}

	public int[] toArray() {
		int[] rows = new int[this.size];
		int pos = 0;
		for(Range run : this.runs) {
			for(int i=run.start; i<run.end; i++) {
				rows[pos++] = i;
			}
		}
		return rows;
	}

	//
	// Set operations
	//

	public RowSelector union(RowSelector other) {
		List<Range> all = new ArrayList<Range>(this.runs.size() + other.runs.size());
		int i = 0, j = 0;
		while(i < this.runs.size() || j < other.runs.size()) { // Merge by run start
			if(j >= other.runs.size() || (i < this.runs.size() && this.runs.get(i).start <= other.runs.get(j).start)) {
				all.add(this.runs.get(i++));
			}
			else {
				all.add(other.runs.get(j++));
			}
		}

		List<Range> merged = new ArrayList<Range>();
		for(Range run : all) {
			Range last = merged.isEmpty() ? null : merged.get(merged.size()-1);
			if(last != null && run.start <= last.end) {
				merged.set(merged.size()-1, new Range(last.start, Math.max(last.end, run.end)));
			}
			else {
				merged.add(run);
			}
		}
		return new RowSelector(merged);
	}

	public RowSelector intersect(RowSelector other) {
		List<Range> result = new ArrayList<Range>();
		int i = 0, j = 0;
		while(i < this.runs.size() && j < other.runs.size()) {
			Range a = this.runs.get(i);
			Range b = other.runs.get(j);
			int start = Math.max(a.start, b.start);
			int end = Math.min(a.end, b.end);
			if(start < end) result.add(new Range(start, end));

			if(a.end < b.end) i++; // Advance the run which ends first
			else j++;
		}
		return new RowSelector(result);
	}

	//
	// Construction
	//

	public static RowSelector empty() {
		return EMPTY;
	}

	/**
	 * All rows from 0 (inclusive) to length (exclusive).
	 */
	public static RowSelector all(int length) {
		if(length <= 0) return EMPTY;
		return new RowSelector(Collections.singletonList(new Range(0, length)));
	}

	/**
	 * Compact a strictly increasing sequence of rows into runs.
	 */
	public static RowSelector of(int... rows) {
		Builder builder = new Builder();
		for(int row : rows) {
			builder.add(row);
		}
		return builder.build();
	}
	public static RowSelector of(Iterable<Integer> rows) {
		Builder builder = new Builder();
		for(Integer row : rows) {
			builder.add(row);
		}
		return builder.build();
	}

	@Override
	public boolean equals(Object aThat) {
		if (this == aThat) return true;
		if ( !(aThat instanceof RowSelector) ) return false;
		return this.runs.equals(((RowSelector)aThat).runs);
	}

	@Override
	public int hashCode() {
		return this.runs.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		for(Range run : this.runs) {
			if(buf.length() > 0) buf.append(",");
			buf.append(run.start);
			if(run.getLength() > 1) buf.append("-").append(run.end-1);
		}
		return "{" + buf + "}";
	}

	private RowSelector(List<Range> runs) {
		this.runs = Collections.unmodifiableList(runs);
		int count = 0;
		for(Range run : runs) {
			count += run.getLength();
		}
		this.size = count;
	}

	/**
	 * Accumulates rows in ascending order and closes a run whenever a gap is found.
	 */
	public static class Builder {
		private final List<Range> runs = new ArrayList<Range>();
		private int runStart = -1;
		private int runEnd = -1;

		public Builder add(int row) {
			if(row < 0) {
				throw new IllegalArgumentException("Row index must be non-negative: " + row);
			}
			if(this.runStart < 0) { // First row
				this.runStart = row;
				this.runEnd = row + 1;
			}
			else if(row == this.runEnd) { // Continues the current run
				this.runEnd++;
			}
			else if(row > this.runEnd) { // Gap
				this.runs.add(new Range(this.runStart, this.runEnd));
				this.runStart = row;
				this.runEnd = row + 1;
			}
			else {
				throw new IllegalArgumentException("Rows must be strictly increasing: " + row + " after " + (this.runEnd-1));
			}
			return this;
		}

		public RowSelector build() {
			List<Range> result = new ArrayList<Range>(this.runs);
			if(this.runStart >= 0) result.add(new Range(this.runStart, this.runEnd));
			if(result.isEmpty()) return EMPTY;
			return new RowSelector(result);
		}
	}
}
