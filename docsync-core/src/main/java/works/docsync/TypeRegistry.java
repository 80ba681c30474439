package works.docsync;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.exceptions.DefinitionException;
import works.docsync.exceptions.UnknownTypeException;
import works.docsync.storage.ColumnDefinition;
import works.docsync.storage.StorageEngine;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Owns the {@link TypeDefinition}s of one application and the {@link KnownFieldsCatalog}
 * of fields discovered for them, and applies their schemas to a {@link StorageEngine}.
 * <p>
 * Schema changes after startup go through {@link #extendFields} and nowhere else.
 * <p>
 * Typical use:
 * <pre>
 * TypeRegistry registry = new TypeRegistry("orders", storage);
 * TypeDefinition customer = registry.defineType("Customer", FieldDescriptor.of("name"));
 * TypeDefinition order = registry.defineType("Order",
 *     FieldDescriptor.of("customer", "reference Customer"),
 *     FieldDescriptor.of("placed", "datetime"));
 * registry.applyAllSchemas();
 * order.sync(document);
 * </pre>
 */
public class TypeRegistry {
	private final String name;
	private final String instanceID = UUID.randomUUID().toString();
	private final StorageEngine storage;
	private final KnownFieldsCatalog catalog;
	private final Map<String, TypeDefinition> typesByName = new LinkedHashMap<>();

	/**
	 * @param name identifies this registry in logs
	 */
	public TypeRegistry(String name, StorageEngine storage) {
		this.name = requireNonNull(name);
		this.storage = requireNonNull(storage);
		this.catalog = new KnownFieldsCatalog(storage);
	}

	public TypeRegistry(StorageEngine storage) {
		this("docsync", storage);
	}

	public String name() {
		return name;
	}

	/**
	 * @return a string unique to this registry object, for distinguishing
	 * registries with the same {@link #name()} in logs
	 */
	public String instanceID() {
		return instanceID;
	}

	public StorageEngine storage() {
		return storage;
	}

	public KnownFieldsCatalog catalog() {
		return catalog;
	}

	public TypeDefinition defineType(String typeName, FieldDescriptor... fields) {
		return defineType(typeName, TypeSettings.defaults(), Arrays.asList(fields));
	}

	public TypeDefinition defineType(String typeName, TypeSettings settings, FieldDescriptor... fields) {
		return defineType(typeName, settings, Arrays.asList(fields));
	}

	/**
	 * Fields may refer to types not defined yet; references are resolved when they are used.
	 *
	 * @throws DefinitionException if a type named <code>typeName</code> is already defined,
	 * or the fields are inconsistent
	 */
	public synchronized TypeDefinition defineType(String typeName, TypeSettings settings, List<FieldDescriptor> fields) {
		if (typesByName.containsKey(typeName)) {
			throw new DefinitionException("Type \"" + typeName + "\" is already defined");
		}
		TypeDefinition result = new TypeDefinition(this, typeName, settings, fields);
		typesByName.put(typeName, result);
		LOGGER.debug("Defined {}", result);
		return result;
	}

	/**
	 * @throws UnknownTypeException if there's no such type
	 */
	public TypeDefinition type(String typeName) {
		return findType(typeName).orElseThrow(() -> new UnknownTypeException(typeName));
	}

	public synchronized Optional<TypeDefinition> findType(String typeName) {
		return Optional.ofNullable(typesByName.get(typeName));
	}

	/**
	 * @return all types in the order they were defined
	 */
	public synchronized List<TypeDefinition> types() {
		return unmodifiableList(new ArrayList<>(typesByName.values()));
	}

	/**
	 * @return fieldname to descriptor: the type's declared fields, in order,
	 * followed by catalog entries for fields that aren't declared
	 */
	public Map<String, FieldDescriptor> knownFields(TypeDefinition type) {
		checkOwnership(type);
		Map<String, FieldDescriptor> result = new LinkedHashMap<>();
		type.fields().forEach(f -> result.put(f.fieldname(), f));
		for (CatalogEntry entry: catalog.entriesFor(type.name())) {
			result.putIfAbsent(entry.fieldname(), entry.toFieldDescriptor());
		}
		return unmodifiableMap(result);
	}

	/**
	 * Brings the storage table of <code>type</code> up to date with its {@link #knownFields known fields}.
	 * Creates the table if necessary; otherwise only adds columns.
	 *
	 * @throws UnknownTypeException if a reference field names a type that isn't defined
	 */
	public void applySchema(TypeDefinition type) {
		checkOwnership(type);
		List<ColumnDefinition> columns = new ArrayList<>();
		for (FieldDescriptor field: knownFields(type).values()) {
			FieldType columnType = field.type();
			if (columnType.target() != null) {
				columnType = columnType.withTarget(type(columnType.target()).tableName());
			}
			columns.add(new ColumnDefinition(field.columnName(), columnType, field.notNull()));
		}
		if (storage.hasTable(type.tableName())) {
			LOGGER.debug("Redefining table {} for {}", type.tableName(), type.name());
			storage.redefineTable(type.tableName(), columns);
		} else {
			LOGGER.debug("Defining table {} for {}", type.tableName(), type.name());
			storage.defineTable(type.tableName(), columns);
		}
	}

	public void applyAllSchemas() {
		catalog.ensureTable();
		for (TypeDefinition type: types()) {
			applySchema(type);
		}
	}

	/**
	 * Records <code>newFields</code> in the catalog and adds their columns to the table.
	 * Does nothing if <code>newFields</code> is empty.
	 *
	 * @param newFields fieldname to storage type
	 */
	public void extendFields(TypeDefinition type, Map<String, FieldType> newFields) {
		if (newFields.isEmpty()) {
			return;
		}
		checkOwnership(type);
		LOGGER.debug("Extending {} with {}", type.name(), newFields);
		catalog.append(type.name(), newFields);
		applySchema(type);
	}

	private void checkOwnership(TypeDefinition type) {
		if (type.registry() != this) {
			throw new IllegalArgumentException("Type \"" + type.name() + "\" belongs to a different registry");
		}
	}

	@Override
	public String toString() {
		return "TypeRegistry{" +
			"name='" + name + '\'' +
			", instanceID=" + instanceID +
			", storage=" + storage +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
