package org.conceptoriented.dm.core;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds root snapshots from external data.
 *
 * Values of measures are converted to doubles (null if not a number).
 * Values of temporal dimensions are converted to epoch milliseconds using the format of the field.
 */
public class DataAdapter {
	private static final Logger logger = LoggerFactory.getLogger(DataAdapter.class);

	//
	// Columns
	//

	public static Snapshot fromColumns(String name, List<? extends List<?>> columns, List<ColumnDefinition> schema) throws DmError {
		return fromColumns(name, columns, schema, new ReducerRegistry(), new PropagationContext());
	}

	/**
	 * Create a root snapshot from columns of values. Column i has the schema i.
	 */
	public static Snapshot fromColumns(String name, List<? extends List<?>> columns, List<ColumnDefinition> schema, ReducerRegistry registry, PropagationContext context) throws DmError {
		if(columns.size() != schema.size()) {
			throw ingestionError("Number of columns " + columns.size() + " does not match the number of fields in schema " + schema.size() + ". ");
		}

		Set<String> names = new HashSet<String>();
		int length = -1;
		List<Column> result = new ArrayList<Column>();
		for(int i=0; i<schema.size(); i++) {
			ColumnDefinition definition = schema.get(i);
			if(StringUtils.isBlank(definition.getName())) {
				throw ingestionError("Field name is empty. ");
			}
			if(!names.add(definition.getName())) {
				throw ingestionError("Field " + definition.getName() + " is defined twice. ");
			}
			List<?> values = columns.get(i);
			if(length >= 0 && values.size() != length) {
				throw ingestionError("Field " + definition.getName() + " has " + values.size() + " values instead of " + length + ". ");
			}
			length = values.size();

			List<Object> converted = new ArrayList<Object>(values.size());
			for(Object value : values) {
				converted.add(convert(value, definition));
			}
			result.add(new Column(definition, converted));
		}

		FieldSpace space = new FieldSpace(name, result);
		logger.debug("Loaded {} fields with {} rows into {}", result.size(), space.getRowCount(), name);
		return new Snapshot(space, registry, context);
	}

	//
	// Records
	//

	/**
	 * Create a root snapshot from records. Only fields listed in the schema are loaded. A field which is absent in a record gets null.
	 */
	public static Snapshot fromRecords(String name, List<Map<String, Object>> records, List<ColumnDefinition> schema) throws DmError {
		List<List<Object>> columns = new ArrayList<List<Object>>();
		for(ColumnDefinition definition : schema) {
			List<Object> values = new ArrayList<Object>(records.size());
			records.forEach(x -> values.add(x.get(definition.getName())));
			columns.add(values);
		}
		return fromColumns(name, columns, schema);
	}

	//
	// CSV
	//

	/**
	 * Create a root snapshot from CSV text with a header line. Every field of the schema must exist in the header.
	 */
	public static Snapshot fromCsv(String name, String csv, List<ColumnDefinition> schema) throws DmError {
		CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setTrim(true).setIgnoreEmptyLines(true).build();

		List<List<Object>> columns = new ArrayList<List<Object>>();
		schema.forEach(x -> columns.add(new ArrayList<Object>()));

		try (CSVParser parser = CSVParser.parse(csv, format)) {
			Map<String, Integer> header = parser.getHeaderMap();
			for(ColumnDefinition definition : schema) {
				if(!header.containsKey(definition.getName())) {
					throw ingestionError("Field " + definition.getName() + " is not found in the CSV header. ");
				}
			}
			for(CSVRecord record : parser) {
				for(int i=0; i<schema.size(); i++) {
					String value = record.isSet(schema.get(i).getName()) ? record.get(schema.get(i).getName()) : null;
					columns.get(i).add(StringUtils.isEmpty(value) ? null : value);
				}
			}
		}
		catch(IOException | IllegalArgumentException | IllegalStateException e) {
			throw ingestionError("Cannot parse CSV: " + e.getMessage());
		}

		return fromColumns(name, columns, schema);
	}

	//
	// JSON
	//

	/**
	 * Create a root snapshot from a JSON array of flat objects.
	 */
	public static Snapshot fromJson(String name, String json, List<ColumnDefinition> schema) throws DmError {
		List<List<Object>> columns = new ArrayList<List<Object>>();
		schema.forEach(x -> columns.add(new ArrayList<Object>()));

		try {
			Object token = new JSONTokener(json).nextValue();
			JSONArray arr;
			if(token instanceof JSONArray) {
				arr = (JSONArray) token;
			}
			else if(token instanceof JSONObject && ((JSONObject) token).optJSONArray("data") != null) {
				arr = ((JSONObject) token).getJSONArray("data");
			}
			else {
				throw ingestionError("Expected an array of records. ");
			}

			for (int i = 0 ; i < arr.length(); i++) {
				JSONObject jrec = arr.getJSONObject(i);
				for(int j=0; j<schema.size(); j++) {
					Object value = jrec.opt(schema.get(j).getName());
					columns.get(j).add(value == null || JSONObject.NULL.equals(value) ? null : value);
				}
			}
		}
		catch(JSONException e) {
			throw ingestionError("Cannot parse JSON: " + e.getMessage());
		}

		return fromColumns(name, columns, schema);
	}

	//
	// Conversion
	//

	protected static Object convert(Object value, ColumnDefinition definition) {
		if(value == null) return null;

		if(definition.isMeasure()) {
			return Column.toDouble(value);
		}
		if(definition.getSubtype() == DmColumnSubtype.TEMPORAL) {
			return toEpochMillis(value, definition.getFormat());
		}
		return value;
	}

	protected static Long toEpochMillis(Object value, String format) {
		if(value instanceof Number) return ((Number) value).longValue();

		String str = value.toString().trim();
		if(format == null) {
			Double d = Column.toDouble(str);
			return d != null ? d.longValue() : null;
		}

		DateTimeFormatter formatter = DateTimeFormatter.ofPattern(format);
		try {
			return LocalDateTime.parse(str, formatter).toInstant(ZoneOffset.UTC).toEpochMilli();
		}
		catch(DateTimeParseException e) {
			try {
				return LocalDate.parse(str, formatter).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
			}
			catch(DateTimeParseException e2) {
				logger.debug("Cannot parse '{}' with format {}", str, format);
				return null;
			}
		}
	}

	private static DmError ingestionError(String description) {
		logger.warn("Ingestion failed: {}", description);
		return new DmError(DmErrorCode.INGESTION_ERROR, "Error loading data. ", description);
	}
}
