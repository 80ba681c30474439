package works.docsync;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One dynamically discovered field of a type, as recorded in the {@link KnownFieldsCatalog}.
 *
 * @param columnName null means the column is named after the field
 */
public record CatalogEntry(String typeName, String fieldname, @Nullable String columnName, FieldType dbType) {
	public CatalogEntry {
		requireNonNull(typeName);
		requireNonNull(fieldname);
		requireNonNull(dbType);
	}

	public FieldDescriptor toFieldDescriptor() {
		return FieldDescriptor.builder(fieldname)
			.type(dbType)
			.columnName(columnName)
			.build();
	}
}
