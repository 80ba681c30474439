package works.docsync;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.docsync.exceptions.DefinitionException;
import works.docsync.temporal.TemporalParseOptions;
import works.docsync.temporal.TemporalParser;

import static java.util.Objects.requireNonNull;

/**
 * Describes one logical attribute of a document: the key it has in the JSON,
 * the column it lands in, and its storage {@link FieldType}.
 * <p>
 * A descriptor can also carry a {@link ComputedField} (the value is derived,
 * never read from the document), and, for temporal fields, either a
 * {@link #dateFormat() pattern} or {@link TemporalParseOptions} for the flexible parser.
 * <p>
 * Construction validates the type eagerly, so a misspelled type fails
 * when the descriptor is declared rather than on the first sync.
 */
public final class FieldDescriptor {
	private final String fieldname;
	private final String columnName;
	private final FieldType type;
	private final @Nullable ComputedField compute;
	private final @Nullable String dateFormat;
	private final TemporalParseOptions parseOptions;
	private final boolean notNull;
	private final TemporalParser temporalParser;

	private FieldDescriptor(Builder b) {
		this.fieldname = b.fieldname;
		this.columnName = (b.columnName == null) ? b.fieldname : b.columnName;
		this.type = b.type;
		this.compute = b.compute;
		this.dateFormat = b.dateFormat;
		this.parseOptions = b.parseOptions;
		this.notNull = b.notNull;
		if (dateFormat == null) {
			this.temporalParser = TemporalParser.flexible(parseOptions);
		} else {
			try {
				this.temporalParser = TemporalParser.ofPattern(dateFormat);
			} catch (IllegalArgumentException e) {
				throw new DefinitionException("Invalid date format for field \"" + fieldname + "\": " + dateFormat, e);
			}
		}
	}

	/**
	 * @return a {@code string} field stored under its own name
	 */
	public static FieldDescriptor of(String fieldname) {
		return builder(fieldname).build();
	}

	/**
	 * @throws DefinitionException if <code>type</code> is not a valid type string
	 */
	public static FieldDescriptor of(String fieldname, String type) {
		return builder(fieldname, type).build();
	}

	public static FieldDescriptor of(String fieldname, FieldType type) {
		return builder(fieldname).type(type).build();
	}

	public static Builder builder(String fieldname) {
		return new Builder(fieldname);
	}

	public static Builder builder(String fieldname, String type) {
		return new Builder(fieldname).type(type);
	}

	public String fieldname() {
		return fieldname;
	}

	public String columnName() {
		return columnName;
	}

	public FieldType type() {
		return type;
	}

	public @Nullable ComputedField compute() {
		return compute;
	}

	public boolean isComputed() {
		return compute != null;
	}

	public @Nullable String dateFormat() {
		return dateFormat;
	}

	public TemporalParseOptions parseOptions() {
		return parseOptions;
	}

	public boolean notNull() {
		return notNull;
	}

	TemporalParser temporalParser() {
		return temporalParser;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		FieldDescriptor that = (FieldDescriptor) o;
		return notNull == that.notNull
			&& fieldname.equals(that.fieldname)
			&& columnName.equals(that.columnName)
			&& type.equals(that.type)
			&& Objects.equals(compute, that.compute)
			&& Objects.equals(dateFormat, that.dateFormat)
			&& parseOptions.equals(that.parseOptions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fieldname, columnName, type);
	}

	@Override
	public String toString() {
		if (columnName.equals(fieldname)) {
			return "FieldDescriptor(" + fieldname + ": " + type + ")";
		} else {
			return "FieldDescriptor(" + fieldname + " -> " + columnName + ": " + type + ")";
		}
	}

	public static final class Builder {
		private final String fieldname;
		private String columnName;
		private FieldType type = FieldType.STRING;
		private ComputedField compute;
		private String dateFormat;
		private TemporalParseOptions parseOptions = TemporalParseOptions.defaults();
		private boolean notNull = false;

		Builder(String fieldname) {
			if (fieldname == null || fieldname.isEmpty()) {
				throw new DefinitionException("Field name can't be empty");
			}
			this.fieldname = fieldname;
		}

		public Builder type(String type) {
			this.type = FieldType.parse(type);
			return this;
		}

		public Builder type(FieldType type) {
			this.type = requireNonNull(type);
			return this;
		}

		public Builder columnName(String columnName) {
			if (columnName != null && columnName.isEmpty()) {
				throw new DefinitionException("Column name for field \"" + fieldname + "\" can't be empty");
			}
			this.columnName = columnName;
			return this;
		}

		public Builder compute(ComputedField compute) {
			this.compute = compute;
			return this;
		}

		public Builder dateFormat(String dateFormat) {
			this.dateFormat = dateFormat;
			return this;
		}

		public Builder parseOptions(TemporalParseOptions parseOptions) {
			this.parseOptions = requireNonNull(parseOptions);
			return this;
		}

		public Builder notNull(boolean notNull) {
			this.notNull = notNull;
			return this;
		}

		public FieldDescriptor build() {
			if (dateFormat != null && !type.isTemporal()) {
				throw new DefinitionException("Field \"" + fieldname + "\" has a date format but its type is " + type);
			}
			return new FieldDescriptor(this);
		}
	}
}
