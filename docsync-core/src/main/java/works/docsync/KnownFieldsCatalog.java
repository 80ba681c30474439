package works.docsync;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.storage.ColumnDefinition;
import works.docsync.storage.StorageEngine;

/**
 * The persistent record of fields discovered in documents beyond those declared
 * on their {@link TypeDefinition}, kept in the storage table {@value #TABLE}.
 * <p>
 * The catalog is append-only, and holds at most one entry per (type, fieldname):
 * {@link #append} skips fields that are already recorded.
 * The check and the insert are separate storage operations, so two registries
 * extending the same type at the same moment can still both record a field.
 */
public class KnownFieldsCatalog {
	public static final String TABLE = "json_type_registry";
	public static final String TYPE = "type";
	public static final String FIELDNAME = "fieldname";
	public static final String COLUMN_NAME = "column_name";
	public static final String DB_TYPE = "db_type";

	private final StorageEngine storage;

	public KnownFieldsCatalog(StorageEngine storage) {
		this.storage = storage;
	}

	/**
	 * Creates the catalog table if it doesn't exist.
	 */
	public void ensureTable() {
		if (!storage.hasTable(TABLE)) {
			LOGGER.debug("Creating catalog table {}", TABLE);
			storage.defineTable(TABLE, List.of(
				new ColumnDefinition(TYPE, FieldType.STRING, true),
				new ColumnDefinition(FIELDNAME, FieldType.STRING, true),
				new ColumnDefinition(COLUMN_NAME, FieldType.STRING, false),
				new ColumnDefinition(DB_TYPE, FieldType.STRING, true)
			));
		}
	}

	/**
	 * @return the recorded fields of the named type, in the order they were discovered
	 */
	public List<CatalogEntry> entriesFor(String typeName) {
		ensureTable();
		List<CatalogEntry> result = new ArrayList<>();
		for (Row row: storage.query(TABLE, Map.of(TYPE, typeName))) {
			result.add(new CatalogEntry(
				(String) row.get(TYPE),
				(String) row.get(FIELDNAME),
				(String) row.get(COLUMN_NAME),
				FieldType.parse((String) row.get(DB_TYPE))));
		}
		return result;
	}

	/**
	 * Records <code>newFields</code> for the named type, except those already recorded.
	 * Each field's column is named after the field.
	 *
	 * @return the entries actually added
	 */
	public List<CatalogEntry> append(String typeName, Map<String, FieldType> newFields) {
		Set<String> existing = entriesFor(typeName).stream()
			.map(CatalogEntry::fieldname)
			.collect(Collectors.toSet());
		List<CatalogEntry> added = new ArrayList<>();
		List<Map<String, Object>> rows = new ArrayList<>();
		newFields.forEach((fieldname, dbType) -> {
			if (existing.contains(fieldname)) {
				LOGGER.debug("Catalog already has {}.{}", typeName, fieldname);
			} else {
				CatalogEntry entry = new CatalogEntry(typeName, fieldname, fieldname, dbType);
				added.add(entry);
				rows.add(toRow(entry));
			}
		});
		if (!rows.isEmpty()) {
			LOGGER.debug("Recording {} new field(s) of {}: {}", rows.size(), typeName, added);
			storage.bulkInsertRows(TABLE, rows);
		}
		return added;
	}

	private static Map<String, Object> toRow(CatalogEntry entry) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put(TYPE, entry.typeName());
		row.put(FIELDNAME, entry.fieldname());
		row.put(COLUMN_NAME, entry.columnName());
		row.put(DB_TYPE, entry.dbType().toString());
		return row;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(KnownFieldsCatalog.class);
}
