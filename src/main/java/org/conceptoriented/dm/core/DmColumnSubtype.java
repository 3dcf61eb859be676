package org.conceptoriented.dm.core;

public enum DmColumnSubtype {
	CATEGORICAL(DmColumnKind.DIMENSION),
	TEMPORAL(DmColumnKind.DIMENSION),
	CONTINUOUS(DmColumnKind.MEASURE),
	DISCRETE(DmColumnKind.MEASURE), // Binned measures
	;

	private DmColumnKind kind;

	public DmColumnKind getKind() {
		return kind;
	}

	public static DmColumnSubtype defaultFor(DmColumnKind kind) {
		return kind == DmColumnKind.MEASURE ? CONTINUOUS : CATEGORICAL;
	}

	public static DmColumnSubtype fromString(String name) {
	    for (DmColumnSubtype subtype : DmColumnSubtype.values()) {
	        if (subtype.name().equalsIgnoreCase(name)) {
	            return subtype;
	        }
	    }
	    return null;
	 }

	private DmColumnSubtype(DmColumnKind kind) {
		this.kind = kind;
	}
}
