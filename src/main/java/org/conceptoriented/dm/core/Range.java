package org.conceptoriented.dm.core;

/**
 * Contiguous run of row indexes [start, end).
 */
public class Range {

    public final int start;
    public final int end;

	public int getLength() {
		return end - start;
	}

	public boolean contains(int row) {
		return row >= start && row < end;
	}

	public boolean isEmpty() {
		return end <= start;
	}

	@Override
    public String toString() {
      return String.format("[%s, %s)", start, end);
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        }

        if (!(other instanceof Range)){
            return false;
        }

        Range other_ = (Range)other;

        return other_.start == this.start && other_.end == this.end;
    }

    @Override
    public int hashCode() {
    	return Integer.hashCode(start) ^ Integer.hashCode(end);
    }

    public Range(int start, int end) {
        if(start < 0 || end < start) {
        	throw new IllegalArgumentException("Invalid range " + start + ", " + end);
        }
        this.start = start;
        this.end = end;
    }
}
