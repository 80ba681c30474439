package works.docsync;

import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.exceptions.DefinitionException;
import works.docsync.exceptions.TemporalParseException;
import works.docsync.exceptions.UnknownTypeException;
import works.docsync.logging.MappedDiagnosticContext.MDCScope;
import works.docsync.storage.StorageEngine;
import works.docsync.temporal.TemporalValues;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static works.docsync.logging.MappedDiagnosticContext.setupMDC;

/**
 * A named document schema: an ordered list of declared {@link FieldDescriptor fields},
 * the table its documents are stored in, and the {@link TypeSettings settings}
 * governing updates.
 * <p>
 * This is also where documents get synchronized. {@link #sync} and {@link #bulkSync}
 * discover fields that aren't known yet and extend the schema to hold them,
 * resolve references by syncing nested documents first, then update each row
 * if it exists and insert it otherwise.
 * <p>
 * Created by {@link TypeRegistry#defineType}.
 */
public final class TypeDefinition {
	private final TypeRegistry registry;
	private final String name;
	private final TypeSettings settings;
	private final List<FieldDescriptor> fields;
	private final Map<String, FieldDescriptor> fieldsByName;

	TypeDefinition(TypeRegistry registry, String name, TypeSettings settings, List<FieldDescriptor> fields) {
		if (name == null || name.isEmpty()) {
			throw new DefinitionException("Type name can't be empty");
		}
		this.registry = requireNonNull(registry);
		this.name = name;
		this.settings = requireNonNull(settings);
		this.fields = unmodifiableList(new ArrayList<>(fields));
		this.fieldsByName = new LinkedHashMap<>();
		String keyColumn = settings.keyStrategy().keyColumn();
		Set<String> columnNames = new HashSet<>();
		for (FieldDescriptor field: this.fields) {
			if (fieldsByName.put(field.fieldname(), field) != null) {
				throw new DefinitionException("Type \"" + name + "\" has more than one field named \"" + field.fieldname() + "\"");
			}
			if (!columnNames.add(field.columnName())) {
				throw new DefinitionException("Type \"" + name + "\" has more than one field in column \"" + field.columnName() + "\"");
			}
			if (field.columnName().equals(keyColumn)) {
				throw new DefinitionException("Type \"" + name + "\" can't declare a field in its key column \"" + keyColumn + "\"");
			}
		}
	}

	public TypeRegistry registry() {
		return registry;
	}

	public String name() {
		return name;
	}

	public String tableName() {
		String tableName = settings.tableName();
		return (tableName == null) ? name : tableName;
	}

	public TypeSettings settings() {
		return settings;
	}

	public boolean removeMissingFields() {
		return settings.removeMissingFields();
	}

	public KeyStrategy keyStrategy() {
		return settings.keyStrategy();
	}

	/**
	 * @return the declared fields, in declaration order
	 */
	public List<FieldDescriptor> fields() {
		return fields;
	}

	public Optional<FieldDescriptor> field(String fieldname) {
		return Optional.ofNullable(fieldsByName.get(fieldname));
	}

	public Row sync(Map<String, ?> document) {
		return sync(document, false);
	}

	/**
	 * Stores one document, updating its row if one with the same key exists
	 * and inserting it otherwise.
	 *
	 * @param partial if true, declared fields absent from <code>document</code>
	 *                are left as they are in storage; otherwise they are set to null
	 * @return the row as stored, including its key
	 * @throws TemporalParseException if a temporal field can't be parsed
	 * @throws UnknownTypeException if a reference names a type that isn't defined
	 */
	public Row sync(Map<String, ?> document, boolean partial) {
		return sync(TraversalContext.forDocument(this, copyOf(document), partial));
	}

	public List<Row> bulkSync(List<? extends Map<String, ?>> documents) {
		return bulkSync(documents, false);
	}

	/**
	 * Stores several documents with a single schema extension for the whole batch.
	 * Existing rows are updated one by one, and all new rows are inserted together
	 * at the end.
	 *
	 * @return the rows as stored, including their keys, in the same order as <code>documents</code>
	 * @see #sync(Map, boolean)
	 */
	public List<Row> bulkSync(List<? extends Map<String, ?>> documents, boolean partial) {
		List<Map<String, Object>> batch = new ArrayList<>(documents.size());
		documents.forEach(d -> batch.add(copyOf(d)));
		return bulkSync(TraversalContext.forBatch(this, batch, partial));
	}

	Row sync(TraversalContext context) {
		try (MDCScope __ = setupMDC(registry.name(), registry.instanceID(), name)) {
			Map<String, Object> document = requireNonNull(context.document());
			LOGGER.debug("sync({}) partial={}", name, context.partial());
			Map<String, Set<ValueKind>> discovered = new LinkedHashMap<>();
			discoverExtraFields(registry.knownFields(this), document, discovered);
			prepareSchema(discovered);

			Row row = buildRow(context);
			if (!upsertRow(row, context.partial())) {
				long id = storage().insertRow(tableName(), insertionValues(row));
				LOGGER.debug("Inserted {} row {}", name, id);
				row.put(keyStrategy().keyColumn(), id);
			}
			LOGGER.trace("Synced {}: {}", name, row);
			return row;
		}
	}

	List<Row> bulkSync(TraversalContext context) {
		try (MDCScope __ = setupMDC(registry.name(), registry.instanceID(), name)) {
			List<Map<String, Object>> batch = requireNonNull(context.batch());
			LOGGER.debug("bulkSync({}) of {} document(s) partial={}", name, batch.size(), context.partial());
			Map<String, FieldDescriptor> knownFields = registry.knownFields(this);
			Map<String, Set<ValueKind>> discovered = new LinkedHashMap<>();
			for (Map<String, Object> document: batch) {
				discoverExtraFields(knownFields, document, discovered);
			}
			prepareSchema(discovered);

			List<Row> result = new ArrayList<>(batch.size());
			List<Row> toInsert = new ArrayList<>();
			for (int i = 0; i < batch.size(); i++) {
				context.moveTo(i);
				Row row = buildRow(context);
				result.add(row);
				if (!upsertRow(row, context.partial())) {
					toInsert.add(row);
				}
			}
			if (!toInsert.isEmpty()) {
				List<Map<String, Object>> insertions = new ArrayList<>(toInsert.size());
				toInsert.forEach(r -> insertions.add(insertionValues(r)));
				List<Long> ids = storage().bulkInsertRows(tableName(), insertions);
				LOGGER.debug("Inserted {} {} row(s)", ids.size(), name);
				for (int i = 0; i < toInsert.size(); i++) {
					toInsert.get(i).put(keyStrategy().keyColumn(), ids.get(i));
				}
			}
			return result;
		}
	}

	/**
	 * Adds to <code>accumulator</code> the kinds of value found under each top-level key
	 * of <code>document</code> that isn't in <code>knownFields</code>.
	 * The key column and null values are ignored.
	 */
	void discoverExtraFields(Map<String, FieldDescriptor> knownFields, Map<String, Object> document, Map<String, Set<ValueKind>> accumulator) {
		String keyColumn = keyStrategy().keyColumn();
		document.forEach((fieldname, value) -> {
			if (knownFields.containsKey(fieldname) || keyColumn.equals(fieldname) || value == null) {
				return;
			}
			accumulator.computeIfAbsent(fieldname, k -> new HashSet<>()).add(ValueKind.of(value));
		});
	}

	/**
	 * Extends the schema with any discovered fields,
	 * and makes sure the table exists even if there are none.
	 */
	private void prepareSchema(Map<String, Set<ValueKind>> discovered) {
		if (discovered.isEmpty()) {
			if (!storage().hasTable(tableName())) {
				registry.applySchema(this);
			}
			return;
		}
		Map<String, FieldType> newFields = new LinkedHashMap<>();
		discovered.forEach((fieldname, kinds) -> newFields.put(fieldname, FieldTypeInference.infer(kinds)));
		LOGGER.debug("Discovered new field(s) in {}: {}", name, newFields);
		registry.extendFields(this, newFields);
	}

	/**
	 * Turns the current document of <code>context</code> into a row, syncing any
	 * nested documents it references along the way.
	 */
	Row buildRow(TraversalContext context) {
		Map<String, Object> document = requireNonNull(context.document());
		Row row = new Row();
		Set<String> tableColumns = null;
		for (Map.Entry<String, Object> entry: document.entrySet()) {
			String key = entry.getKey();
			if (fieldsByName.containsKey(key)) {
				continue;
			}
			if (entry.getValue() == null) {
				// Store an explicit null only if there's a column to store it in
				if (tableColumns == null) {
					tableColumns = storage().columns(tableName());
				}
				if (!tableColumns.contains(key)) {
					continue;
				}
			}
			row.put(key, entry.getValue());
		}

		for (FieldDescriptor field: fields) {
			ComputedField compute = field.compute();
			if (compute != null) {
				row.put(field.columnName(), compute.compute(row, context));
				continue;
			}
			if (context.partial() && !document.containsKey(field.fieldname())) {
				continue;
			}
			Object value = document.get(field.fieldname());
			if (value != null) {
				FieldType type = field.type();
				if (type.isTemporal()) {
					value = temporalValue(field, value);
				} else if (type.isReference()) {
					value = resolveReference(context, field, value);
				} else if (type.isListReference()) {
					value = resolveListReference(context, field, value);
				}
			}
			row.put(field.columnName(), value);
		}

		KeyStrategy keys = keyStrategy();
		Object key = row.get(keys.keyColumn());
		if (keys.isIdentifier(key)) {
			row.put(keys.keyColumn(), keys.toIdentifier(key));
		}
		return row;
	}

	/**
	 * @return the row's values, without the key column if it's null
	 */
	private Map<String, Object> insertionValues(Row row) {
		String keyColumn = keyStrategy().keyColumn();
		if (row.containsColumn(keyColumn) && row.get(keyColumn) == null) {
			Map<String, Object> result = new LinkedHashMap<>(row.asMap());
			result.remove(keyColumn);
			return result;
		}
		return row.asMap();
	}

	private Object temporalValue(FieldDescriptor field, Object value) {
		TemporalAccessor parsed;
		if (value instanceof TemporalAccessor) {
			parsed = (TemporalAccessor) value;
		} else if (value instanceof String) {
			try {
				parsed = field.temporalParser().parse((String) value);
			} catch (DateTimeParseException e) {
				LOGGER.error("Error parsing {}.{} value \"{}\"", name, field.fieldname(), value);
				throw new TemporalParseException(name, field.fieldname(), value, e.getMessage(), e);
			}
		} else {
			LOGGER.error("Error parsing {}.{} value {} of type {}", name, field.fieldname(), value, value.getClass().getSimpleName());
			throw new TemporalParseException(name, field.fieldname(), value, "expected a string");
		}
		return TemporalValues.toFieldValue(parsed, field.type().kind(), field.parseOptions().zone());
	}

	private long resolveReference(TraversalContext context, FieldDescriptor field, Object value) {
		TypeDefinition target = registry.type(requireNonNull(field.type().target()));
		KeyStrategy targetKeys = target.keyStrategy();
		if (targetKeys.isIdentifier(value)) {
			return targetKeys.toIdentifier(value);
		}
		LOGGER.debug("Resolving {}.{} as a {}", name, field.fieldname(), target.name());
		Row child = target.sync(context.childForDocument(target, asDocument(field, value)));
		return targetKeys.toIdentifier(child.get(targetKeys.keyColumn()));
	}

	private List<Long> resolveListReference(TraversalContext context, FieldDescriptor field, Object value) {
		TypeDefinition target = registry.type(requireNonNull(field.type().target()));
		KeyStrategy targetKeys = target.keyStrategy();
		List<?> elements;
		if (value instanceof List) {
			elements = (List<?>) value;
		} else if (value instanceof Collection) {
			elements = new ArrayList<>((Collection<?>) value);
		} else if (value instanceof Object[]) {
			elements = Arrays.asList((Object[]) value);
		} else {
			elements = List.of(value);
		}

		List<Long> ids = new ArrayList<>(elements.size());
		List<Map<String, Object>> nested = new ArrayList<>();
		List<Integer> nestedPositions = new ArrayList<>();
		for (int i = 0; i < elements.size(); i++) {
			Object element = elements.get(i);
			if (targetKeys.isIdentifier(element)) {
				ids.add(targetKeys.toIdentifier(element));
			} else {
				ids.add(null);
				nested.add(asDocument(field, element));
				nestedPositions.add(i);
			}
		}
		if (!nested.isEmpty()) {
			LOGGER.debug("Resolving {} element(s) of {}.{} as {}", nested.size(), name, field.fieldname(), target.name());
			List<Row> children = target.bulkSync(context.childForBatch(target, nested));
			for (int i = 0; i < children.size(); i++) {
				Object childKey = children.get(i).get(targetKeys.keyColumn());
				ids.set(nestedPositions.get(i), targetKeys.toIdentifier(childKey));
			}
		}
		return ids;
	}

	/**
	 * Updates the stored row with the same key as <code>row</code>, if there is one.
	 * With {@link TypeSettings#removeMissingFields()}, unless <code>partial</code>,
	 * stored columns that <code>row</code> doesn't mention are set to null.
	 *
	 * @return false if <code>row</code> has no key or there's no stored row with its key,
	 * in which case nothing has been written
	 */
	boolean upsertRow(Row row, boolean partial) {
		KeyStrategy keys = keyStrategy();
		Long id = keys.keyOf(row);
		if (id == null) {
			return false;
		}
		Optional<Row> existing = storage().lookupRow(tableName(), id);
		if (existing.isEmpty()) {
			LOGGER.trace("No {} row {}", name, id);
			return false;
		}
		Map<String, Object> update = new LinkedHashMap<>(row.asMap());
		update.remove(keys.keyColumn());
		if (settings.removeMissingFields() && !partial) {
			for (String column: existing.get().columns()) {
				if (!row.containsColumn(column)) {
					update.put(column, null);
				}
			}
		}
		LOGGER.debug("Updating {} row {}", name, id);
		return storage().updateRow(tableName(), id, update);
	}

	private StorageEngine storage() {
		return registry.storage();
	}

	private Map<String, Object> asDocument(FieldDescriptor field, Object value) {
		if (value instanceof Map) {
			return copyOf((Map<?, ?>) value);
		}
		throw new IllegalArgumentException("Field " + name + "." + field.fieldname()
			+ " expects a document or an identifier; got " + value);
	}

	private static Map<String, Object> copyOf(Map<?, ?> document) {
		Map<String, Object> result = new LinkedHashMap<>();
		document.forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}

	@Override
	public String toString() {
		return "TypeDefinition{" +
			"name='" + name + '\'' +
			", tableName='" + tableName() + '\'' +
			", fields=" + fields +
			", settings=" + settings +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeDefinition.class);
}
