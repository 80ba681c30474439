package works.docsync.storage;

import works.docsync.FieldType;

import static java.util.Objects.requireNonNull;

/**
 * One column of a storage table. For reference types, {@link FieldType#target()}
 * is the name of the referenced <em>table</em>.
 */
public record ColumnDefinition(String name, FieldType type, boolean notNull) {
	public ColumnDefinition {
		requireNonNull(name);
		requireNonNull(type);
	}

	public static ColumnDefinition of(String name, FieldType type) {
		return new ColumnDefinition(name, type, false);
	}
}
