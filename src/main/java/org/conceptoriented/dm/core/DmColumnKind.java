package org.conceptoriented.dm.core;

public enum DmColumnKind {
	DIMENSION(10), // Categorical values. Used as grouping keys
	MEASURE(20), // Numeric values. Reduced when grouped
	;

	private int value;

	public int getValue() {
		return value;
	}

	public static DmColumnKind fromString(String name) {
	    for (DmColumnKind kind : DmColumnKind.values()) {
	        if (kind.name().equalsIgnoreCase(name)) {
	            return kind;
	        }
	    }
	    return null;
	 }

	private DmColumnKind(int value) {
		this.value = value;
	}
}
