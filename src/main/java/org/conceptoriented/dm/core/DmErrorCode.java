package org.conceptoriented.dm.core;

public enum DmErrorCode {
	NONE(0), 
	GENERAL(1), 
	UNKNOWN_COLUMN(21), DUPLICATE_COLUMN(22), INVALID_COLUMN_KIND(23),
	UNKNOWN_REDUCER(31),
	INVALID_FILTERING_MODE(41), INVALID_BIN_CONFIG(42),
	INGESTION_ERROR(51), FORMULA_ERROR(52),
	;

	private int value;

	public int getValue() {
		return value;
	}

	private DmErrorCode(int value) {
		this.value = value;
	}
}
